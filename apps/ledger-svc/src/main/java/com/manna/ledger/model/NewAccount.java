package com.manna.ledger.model;

import java.util.UUID;

/**
 * Fields of a chart-of-accounts entry at creation. A null normal balance is derived from the account type.
 */
public record NewAccount(
        String accountCode,
        String accountName,
        AccountType accountType,
        NormalBalance normalBalance,
        UUID parentAccountId,
        String description,
        String taxCategory,
        String taxLineMapping,
        boolean requires1099,
        boolean systemAccount
) {
}
