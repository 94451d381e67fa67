package com.manna.ledger.model;

public enum TransactionType {
    DEBIT,
    CREDIT
}
