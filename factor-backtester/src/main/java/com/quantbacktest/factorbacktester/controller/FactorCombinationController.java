package com.quantbacktest.factorbacktester.controller;

import com.quantbacktest.factorbacktester.controller.dto.FactorCombinationRequest;
import com.quantbacktest.factorbacktester.controller.dto.FactorCombinationResponse;
import com.quantbacktest.factorbacktester.service.FactorCombinationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/factor-combinations")
@RequiredArgsConstructor
@Slf4j
public class FactorCombinationController {

    private final FactorCombinationService combinationService;

    @PostMapping
    public ResponseEntity<FactorCombinationResponse> createCombination(
            @Valid @RequestBody FactorCombinationRequest request) {

        log.info("POST /factor-combinations - Name: {}, Factors: {}",
                request.getName(), request.getFactors().size());

        FactorCombinationResponse response = FactorCombinationResponse.from(
                combinationService.createCombination(request));

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<FactorCombinationResponse>> listCombinations() {
        return ResponseEntity.ok(combinationService.listCombinations().stream()
                .map(FactorCombinationResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<FactorCombinationResponse> getCombination(@PathVariable Long id) {
        return ResponseEntity.ok(FactorCombinationResponse.from(combinationService.getCombination(id)));
    }
}
