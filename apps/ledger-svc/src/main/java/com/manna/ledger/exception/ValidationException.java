package com.manna.ledger.exception;

public class ValidationException extends LedgerException {

    private final String field;

    public ValidationException(String field, String message) {
        super("VALIDATION_ERROR", message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
