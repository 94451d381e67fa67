package com.manna.ledger.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.UUID;

public record CategorizeRequestDto(
        @NotNull UUID transactionId,
        UUID taxCategoryId,
        UUID chartAccountId,
        @DecimalMin("0") @DecimalMax("100") BigDecimal businessPercentage,
        @Size(max = 1000) String businessPurpose,
        Boolean overrideAutomated
) {
    public boolean overrideAutomatedFlag() {
        return overrideAutomated != null && overrideAutomated;
    }
}
