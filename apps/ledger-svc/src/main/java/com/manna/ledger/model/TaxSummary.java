package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.List;

public record TaxSummary(
        int taxYear,
        BigDecimal totalDeductions,
        List<CategoryTotal> categories,
        int transactionCount
) {
    public record CategoryTotal(
            String categoryCode,
            String categoryName,
            String taxForm,
            String taxLine,
            BigDecimal totalAmount,
            int transactionCount,
            int pendingSubstantiation
    ) {
    }
}
