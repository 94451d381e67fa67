package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of auto-detection for one transaction. Either id may be null when nothing matched.
 */
public record AutoDetection(
        UUID taxCategoryId,
        UUID chartAccountId,
        BigDecimal confidence,
        CategorizationSource source,
        BigDecimal businessPercentageDefault,
        boolean alwaysRequireReceipt
) {
    public static AutoDetection noMatch() {
        return new AutoDetection(null, null, BigDecimal.ZERO, CategorizationSource.NO_MATCH, null, false);
    }

    public boolean matched() {
        return source != CategorizationSource.NO_MATCH;
    }
}
