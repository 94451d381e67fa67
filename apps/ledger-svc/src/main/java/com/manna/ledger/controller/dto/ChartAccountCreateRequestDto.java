package com.manna.ledger.controller.dto;

import com.manna.ledger.model.AccountType;
import com.manna.ledger.model.NormalBalance;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record ChartAccountCreateRequestDto(
        @NotBlank @Size(max = 20) String accountCode,
        @NotBlank @Size(max = 100) String accountName,
        @NotNull AccountType accountType,
        NormalBalance normalBalance,
        UUID parentAccountId,
        String description,
        @Size(max = 100) String taxCategory,
        @Size(max = 50) String taxLineMapping,
        Boolean requires1099
) {
}
