package com.manna.ledger.exception;

/**
 * A referenced tax category or ledger account exists but cannot be used: it is inactive,
 * outside its effective window, or owned by another user.
 */
public class InvalidReferenceException extends LedgerException {

    public InvalidReferenceException(String message) {
        super("INVALID_REFERENCE", message);
    }

    protected InvalidReferenceException(String code, String message) {
        super(code, message);
    }
}
