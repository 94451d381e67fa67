package com.manna.ledger.exception;

/**
 * Base type for failures of a categorization or ledger operation. The code is stable and
 * is surfaced to API callers so they can decide whether a retry makes sense.
 */
public abstract class LedgerException extends RuntimeException {

    private final String code;

    protected LedgerException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
