package com.quantbacktest.factorbacktester.domain;

import com.quantbacktest.factorbacktester.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskConfigTest {

    @Test
    void testValidate_DefaultsAccepted() {
        assertDoesNotThrow(() -> TaskConfig.defaults().validate());
    }

    @Test
    void testValidate_BoundaryValuesAccepted() {
        TaskConfig config = TaskConfig.builder()
                .buyThreshold(1.0)
                .sellThreshold(-1.0)
                .minStrength(0.0)
                .maxPositionSize(1.0)
                .maxPositionRatio(1.0)
                .stopLossRatio(0.99)
                .build();

        assertDoesNotThrow(config::validate);
    }

    @Test
    void testValidate_StopLossBounds() {
        assertThrows(ValidationException.class, () -> TaskConfig.builder().stopLossRatio(0.0).build().validate());
        assertThrows(ValidationException.class, () -> TaskConfig.builder().stopLossRatio(1.0).build().validate());
        assertThrows(ValidationException.class, () -> TaskConfig.builder().stopLossRatio(-0.5).build().validate());
    }

    @Test
    void testValidate_PositionBounds() {
        assertThrows(ValidationException.class, () -> TaskConfig.builder().maxPositionSize(0.0).build().validate());
        assertThrows(ValidationException.class, () -> TaskConfig.builder().maxPositionSize(1.01).build().validate());
        assertThrows(ValidationException.class, () -> TaskConfig.builder().maxPositionRatio(3.0).build().validate());
    }

    @Test
    void testValidate_NaNRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> TaskConfig.builder().buyThreshold(Double.NaN).build().validate());

        assertTrue(e.getMessage().startsWith("buyThreshold"));
    }

    @Test
    void testValidate_UnknownVersionRejected() {
        assertThrows(ValidationException.class, () -> TaskConfig.builder().version(99).build().validate());
        assertThrows(ValidationException.class, () -> TaskConfig.builder().version(0).build().validate());
    }

    @Test
    void testValidate_MissingModeRejected() {
        assertThrows(ValidationException.class, () -> TaskConfig.builder().backtestMode(null).build().validate());
    }
}
