package com.manna.ledger.model;

/**
 * Ledger account classes. Contra accounts carry the opposite normal balance of the class they offset.
 */
public enum AccountType {
    ASSET(NormalBalance.DEBIT, null),
    LIABILITY(NormalBalance.CREDIT, null),
    EQUITY(NormalBalance.CREDIT, null),
    REVENUE(NormalBalance.CREDIT, null),
    EXPENSE(NormalBalance.DEBIT, null),
    CONTRA_ASSET(NormalBalance.CREDIT, ASSET),
    CONTRA_LIABILITY(NormalBalance.DEBIT, LIABILITY),
    CONTRA_EQUITY(NormalBalance.DEBIT, EQUITY);

    private final NormalBalance normalBalance;
    private final AccountType baseType;

    AccountType(NormalBalance normalBalance, AccountType baseType) {
        this.normalBalance = normalBalance;
        this.baseType = baseType;
    }

    public NormalBalance normalBalance() {
        return normalBalance;
    }

    public boolean isContra() {
        return baseType != null;
    }

    /**
     * The statement class the account reports under: the offset class for contra accounts, itself otherwise.
     */
    public AccountType reportingType() {
        return baseType != null ? baseType : this;
    }
}
