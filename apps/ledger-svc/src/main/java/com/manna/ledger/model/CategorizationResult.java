package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.UUID;

public record CategorizationResult(
        boolean success,
        UUID transactionId,
        UUID taxCategoryId,
        String taxCategory,
        UUID chartAccountId,
        String chartAccount,
        BigDecimal businessAmount,
        BigDecimal deductibleAmount,
        String scheduleCLine,
        boolean requiresSubstantiation,
        boolean substantiationComplete,
        CategorizationSource source,
        BigDecimal confidence
) {
}
