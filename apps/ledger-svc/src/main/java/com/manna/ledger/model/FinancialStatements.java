package com.manna.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record FinancialStatements(
        LocalDate asOfDate,
        BalanceSheet balanceSheet,
        IncomeStatement incomeStatement
) {
    public record Section(List<TrialBalance.Row> accounts, BigDecimal total) {
    }

    public record EquitySection(List<TrialBalance.Row> accounts, BigDecimal total, BigDecimal totalWithIncome) {
    }

    public record BalanceSheet(
            Section assets,
            Section liabilities,
            EquitySection equity,
            BigDecimal totalLiabilitiesAndEquity
    ) {
    }

    public record IncomeStatement(Section revenue, Section expenses, BigDecimal netIncome) {
    }
}
