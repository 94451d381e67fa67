package com.manna.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of an IRS tax category as published by the catalog.
 */
public record TaxCategory(
        UUID id,
        String code,
        String name,
        String taxForm,
        String taxLine,
        String description,
        String deductionType,
        BigDecimal percentageLimit,
        BigDecimal dollarLimit,
        boolean documentationRequired,
        boolean businessExpense,
        boolean active,
        LocalDate effectiveDate,
        LocalDate expirationDate,
        String irsReference,
        List<String> keywords,
        List<String> exclusions,
        Map<String, String> specialRules
) {
    public static final String SCHEDULE_C = "Schedule C";

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    public TaxCategory {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        specialRules = specialRules == null ? Map.of() : Map.copyOf(specialRules);
    }

    /**
     * Active and inside the inclusive [effectiveDate, expirationDate] window.
     */
    public boolean isEffectiveOn(LocalDate date) {
        if (!active) {
            return false;
        }
        if (effectiveDate != null && effectiveDate.isAfter(date)) {
            return false;
        }
        return expirationDate == null || !expirationDate.isBefore(date);
    }

    /**
     * Applies the percentage limit to the business portion of an expense. The annual dollar limit
     * needs a year-to-date aggregate and is not applied here.
     */
    public BigDecimal calculateDeductible(BigDecimal businessAmount) {
        BigDecimal deductible = businessAmount;
        if (percentageLimit != null) {
            deductible = businessAmount.multiply(percentageLimit).divide(ONE_HUNDRED);
        }
        return deductible.setScale(2, RoundingMode.HALF_UP);
    }

    public boolean isScheduleC() {
        return SCHEDULE_C.equals(taxForm);
    }

    public boolean requires1099() {
        return Boolean.parseBoolean(specialRules.getOrDefault("requires_1099", "false"));
    }
}
