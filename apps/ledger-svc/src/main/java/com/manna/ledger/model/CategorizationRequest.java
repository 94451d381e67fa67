package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input of a single categorization. Null ids are filled by auto-detection; a null business
 * percentage means "use the mapping default, or 100".
 */
public record CategorizationRequest(
        UUID transactionId,
        UUID userId,
        UUID taxCategoryId,
        UUID chartAccountId,
        BigDecimal businessPercentage,
        String businessPurpose,
        boolean overrideAutomated
) {
    public CategorizationRequest forTransaction(UUID otherTransactionId) {
        return new CategorizationRequest(
                otherTransactionId,
                userId,
                taxCategoryId,
                chartAccountId,
                businessPercentage,
                businessPurpose,
                overrideAutomated
        );
    }
}
