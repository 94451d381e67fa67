package com.manna.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record CategoryMapping(
        UUID id,
        UUID userId,
        UUID sourceCategoryId,
        UUID chartAccountId,
        UUID taxCategoryId,
        BigDecimal confidenceScore,
        boolean userDefined,
        boolean active,
        LocalDate effectiveDate,
        LocalDate expirationDate,
        BigDecimal businessPercentageDefault,
        boolean alwaysRequireReceipt,
        String notes
) {
}
