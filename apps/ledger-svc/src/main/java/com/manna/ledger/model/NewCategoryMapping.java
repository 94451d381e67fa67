package com.manna.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record NewCategoryMapping(
        UUID sourceCategoryId,
        UUID chartAccountId,
        UUID taxCategoryId,
        BigDecimal confidenceScore,
        Boolean userDefined,
        LocalDate effectiveDate,
        LocalDate expirationDate,
        BigDecimal businessPercentageDefault,
        boolean alwaysRequireReceipt,
        String notes
) {
}
