package com.manna.ledger.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.Map;

public record SubstantiationUpdateRequestDto(
        @Size(max = 1000) String businessPurpose,
        Boolean receiptAttached,
        @Size(max = 500) String receiptUrl,
        String mileageStartLocation,
        String mileageEndLocation,
        @DecimalMin("0") BigDecimal milesDriven,
        Map<String, String> vehicleInfo,
        @Size(max = 50) String depreciationMethod,
        @Min(1) Integer depreciationYears,
        Boolean section179Eligible,
        String substantiationNotes
) {
}
