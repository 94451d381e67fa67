package com.manna.ledger.model;

public enum NormalBalance {
    DEBIT,
    CREDIT;

    public NormalBalance opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
