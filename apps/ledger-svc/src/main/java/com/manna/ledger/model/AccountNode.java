package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record AccountNode(
        UUID id,
        String accountCode,
        String accountName,
        AccountType accountType,
        NormalBalance normalBalance,
        BigDecimal currentBalance,
        String taxCategory,
        String taxLineMapping,
        boolean systemAccount,
        List<AccountNode> children
) {
}
