package com.quantbacktest.factorbacktester.exception;

public class ResourceNotFoundException extends BacktestException {

    public ResourceNotFoundException(String resource, Object id) {
        super("NOT_FOUND", resource + " not found: " + id);
    }
}
