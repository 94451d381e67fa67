package com.manna.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record ChartAccount(
        UUID id,
        UUID userId,
        String accountCode,
        String accountName,
        AccountType accountType,
        NormalBalance normalBalance,
        UUID parentAccountId,
        String description,
        boolean active,
        boolean systemAccount,
        BigDecimal currentBalance,
        String taxCategory,
        String taxLineMapping,
        boolean requires1099,
        Instant createdAt,
        Instant updatedAt
) {
}
