package com.quantbacktest.factorbacktester.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Generates {@code bt_yyyyMMdd_HHmmss_xxxxxxxx} task ids and {@code batch_...} batch ids.
 */
public final class TaskIds {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private TaskIds() {
    }

    public static String newTaskId() {
        return "bt_" + stamp();
    }

    public static String newBatchId() {
        return "batch_" + stamp();
    }

    private static String stamp() {
        return LocalDateTime.now().format(STAMP) + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
