package com.manna.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record TaxCategoryCreateRequestDto(
        @NotBlank @Size(max = 20) String code,
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Size(max = 50) String taxForm,
        @Size(max = 20) String taxLine,
        String description,
        @Size(max = 50) String deductionType,
        @DecimalMin("0") @DecimalMax("100") BigDecimal percentageLimit,
        @DecimalMin("0") BigDecimal dollarLimit,
        Boolean documentationRequired,
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate effectiveDate,
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate expirationDate,
        @Size(max = 100) String irsReference,
        List<String> keywords,
        List<String> exclusions,
        Map<String, String> specialRules
) {
}
