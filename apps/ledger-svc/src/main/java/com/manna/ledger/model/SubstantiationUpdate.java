package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Patch of the substantiation record of a transaction; null leaves a field unchanged.
 */
public record SubstantiationUpdate(
        String businessPurpose,
        Boolean receiptAttached,
        String receiptUrl,
        String mileageStartLocation,
        String mileageEndLocation,
        BigDecimal milesDriven,
        Map<String, String> vehicleInfo,
        String depreciationMethod,
        Integer depreciationYears,
        Boolean section179Eligible,
        String substantiationNotes
) {
}
