package com.manna.ledger.exception;

public class DuplicateCodeException extends LedgerException {

    private final String duplicateCode;

    public DuplicateCodeException(String duplicateCode, String message) {
        super("DUPLICATE_CODE", message);
        this.duplicateCode = duplicateCode;
    }

    public String getDuplicateCode() {
        return duplicateCode;
    }
}
