package com.manna.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record CategoryMappingCreateRequestDto(
        @NotNull UUID sourceCategoryId,
        @NotNull UUID chartAccountId,
        UUID taxCategoryId,
        @DecimalMin("0") @DecimalMax("1") BigDecimal confidenceScore,
        Boolean userDefined,
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate effectiveDate,
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate expirationDate,
        @DecimalMin("0") @DecimalMax("100") BigDecimal businessPercentageDefault,
        Boolean alwaysRequireReceipt,
        String notes
) {
}
