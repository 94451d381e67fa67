package com.manna.ledger.exception;

public class SystemAccountProtectedException extends LedgerException {

    private final String accountCode;

    public SystemAccountProtectedException(String accountCode, String message) {
        super("SYSTEM_ACCOUNT_PROTECTED", message);
        this.accountCode = accountCode;
    }

    public String getAccountCode() {
        return accountCode;
    }
}
