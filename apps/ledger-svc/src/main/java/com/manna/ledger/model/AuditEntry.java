package com.manna.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record AuditEntry(
        UUID id,
        UUID transactionId,
        AuditAction action,
        UUID oldTaxCategoryId,
        UUID newTaxCategoryId,
        UUID oldChartAccountId,
        UUID newChartAccountId,
        String reason,
        BigDecimal confidenceBefore,
        BigDecimal confidenceAfter,
        boolean automated,
        Instant createdAt
) {
}
