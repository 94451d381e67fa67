package com.manna.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Per-account balances split into debit and credit columns.
 * <p>
 * Every transaction posts to a single ledger account, so {@code balanced} is a health check on the
 * books and not a guarantee that each posting was matched by an offsetting entry.
 */
public record TrialBalance(
        LocalDate asOfDate,
        List<Row> accounts,
        BigDecimal totalDebits,
        BigDecimal totalCredits,
        boolean balanced
) {
    public record Row(
            UUID accountId,
            String accountCode,
            String accountName,
            AccountType accountType,
            NormalBalance normalBalance,
            BigDecimal balance,
            BigDecimal debitBalance,
            BigDecimal creditBalance
    ) {
    }
}
