package com.manna.ledger.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record BulkCategorizeRequestDto(
        @NotEmpty @Size(max = 1000) List<UUID> transactionIds,
        UUID taxCategoryId,
        UUID chartAccountId,
        @DecimalMin("0") @DecimalMax("100") BigDecimal businessPercentage
) {
}
