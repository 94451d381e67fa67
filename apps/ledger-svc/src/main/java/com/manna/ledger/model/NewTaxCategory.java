package com.manna.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record NewTaxCategory(
        String code,
        String name,
        String taxForm,
        String taxLine,
        String description,
        String deductionType,
        BigDecimal percentageLimit,
        BigDecimal dollarLimit,
        boolean documentationRequired,
        LocalDate effectiveDate,
        LocalDate expirationDate,
        String irsReference,
        List<String> keywords,
        List<String> exclusions,
        Map<String, String> specialRules
) {
}
