package com.manna.ledger.model;

import java.util.UUID;

/**
 * Patch of a chart-of-accounts entry. Only the fields named here can change; null leaves a field as is.
 * Code, type and normal balance are structural and are refused for system accounts.
 */
public record AccountUpdate(
        String accountName,
        String description,
        String taxCategory,
        String taxLineMapping,
        Boolean requires1099,
        Boolean active,
        UUID parentAccountId,
        String accountCode,
        AccountType accountType,
        NormalBalance normalBalance
) {
    public boolean touchesStructure() {
        return accountCode != null || accountType != null || normalBalance != null;
    }
}
