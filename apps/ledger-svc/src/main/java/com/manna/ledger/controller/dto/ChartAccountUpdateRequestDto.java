package com.manna.ledger.controller.dto;

import com.manna.ledger.model.AccountType;
import com.manna.ledger.model.NormalBalance;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record ChartAccountUpdateRequestDto(
        @Size(min = 1, max = 100) String accountName,
        String description,
        @Size(max = 100) String taxCategory,
        @Size(max = 50) String taxLineMapping,
        Boolean requires1099,
        Boolean active,
        UUID parentAccountId,
        @Size(min = 1, max = 20) String accountCode,
        AccountType accountType,
        NormalBalance normalBalance
) {
}
