package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public record ExpenseSubstantiation(
        UUID id,
        UUID transactionId,
        String businessPurpose,
        BigDecimal businessPercentage,
        boolean receiptRequired,
        boolean receiptAttached,
        String receiptUrl,
        String mileageStartLocation,
        String mileageEndLocation,
        BigDecimal milesDriven,
        Map<String, String> vehicleInfo,
        String depreciationMethod,
        Integer depreciationYears,
        boolean section179Eligible,
        String substantiationNotes,
        boolean substantiationComplete
) {
    public ExpenseSubstantiation {
        vehicleInfo = vehicleInfo == null ? Map.of() : Map.copyOf(vehicleInfo);
    }
}
