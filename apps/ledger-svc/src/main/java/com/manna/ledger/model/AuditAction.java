package com.manna.ledger.model;

public enum AuditAction {
    TAX_CATEGORIZE,
    BULK_TAX_CATEGORIZE
}
