package com.manna.ledger.ledger;

import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.model.AccountType;
import com.manna.ledger.model.FinancialStatements;
import com.manna.ledger.model.NormalBalance;
import com.manna.ledger.model.TrialBalance;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trial balance and basic financial statements, recomputed from transactions on every call.
 */
@Service
public class LedgerReportService {

    private static final Logger log = LoggerFactory.getLogger(LedgerReportService.class);

    private final ChartOfAccountsService chartOfAccountsService;
    private final RlsGuard rlsGuard;

    public LedgerReportService(ChartOfAccountsService chartOfAccountsService, RlsGuard rlsGuard) {
        this.chartOfAccountsService = chartOfAccountsService;
        this.rlsGuard = rlsGuard;
    }

    /**
     * A balance on the wrong side of its normal balance is listed in the opposite column, so both
     * column totals stay non-negative.
     */
    @Transactional
    public TrialBalance getTrialBalance(UUID userId, LocalDate asOfDate) {
        rlsGuard.setAppsecUser(userId);
        List<TrialBalance.Row> rows = new ArrayList<>();
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (ChartOfAccountEntity account : chartOfAccountsService.activeAccounts(userId)) {
            BigDecimal balance = chartOfAccountsService.refreshBalance(account, asOfDate);
            boolean onNormalSide = balance.signum() >= 0;
            boolean debitColumn = (account.getNormalBalance() == NormalBalance.DEBIT) == onNormalSide;
            BigDecimal debit = debitColumn ? balance.abs() : BigDecimal.ZERO;
            BigDecimal credit = debitColumn ? BigDecimal.ZERO : balance.abs();
            totalDebits = totalDebits.add(debit);
            totalCredits = totalCredits.add(credit);
            rows.add(new TrialBalance.Row(
                    account.getId(),
                    account.getAccountCode(),
                    account.getAccountName(),
                    account.getAccountType(),
                    account.getNormalBalance(),
                    balance,
                    debit,
                    credit
            ));
        }
        boolean balanced = totalDebits.compareTo(totalCredits) == 0;
        if (!balanced) {
            log.debug("trial_balance unbalanced userId={} debits={} credits={}", userId, totalDebits, totalCredits);
        }
        return new TrialBalance(asOfDate, rows, totalDebits, totalCredits, balanced);
    }

    /**
     * Balance sheet totals are net of contra accounts. Net income is folded into equity without
     * posting a closing entry.
     */
    @Transactional
    public FinancialStatements generateFinancialStatements(UUID userId, LocalDate asOfDate) {
        TrialBalance trialBalance = getTrialBalance(userId, asOfDate);
        List<TrialBalance.Row> rows = trialBalance.accounts();

        FinancialStatements.Section assets = netSection(rows, AccountType.ASSET);
        FinancialStatements.Section liabilities = netSection(rows, AccountType.LIABILITY);
        FinancialStatements.Section equityBase = netSection(rows, AccountType.EQUITY);
        FinancialStatements.Section revenue = section(rows, row -> row.accountType() == AccountType.REVENUE);
        FinancialStatements.Section expenses = section(rows, row -> row.accountType() == AccountType.EXPENSE);

        BigDecimal netIncome = revenue.total().subtract(expenses.total());
        FinancialStatements.EquitySection equity = new FinancialStatements.EquitySection(
                equityBase.accounts(), equityBase.total(), equityBase.total().add(netIncome));
        FinancialStatements.BalanceSheet balanceSheet = new FinancialStatements.BalanceSheet(
                assets,
                liabilities,
                equity,
                liabilities.total().add(equity.totalWithIncome())
        );
        return new FinancialStatements(
                asOfDate,
                balanceSheet,
                new FinancialStatements.IncomeStatement(revenue, expenses, netIncome)
        );
    }

    /**
     * Accounts reporting under {@code base}, with contra balances netted against the class total.
     */
    private static FinancialStatements.Section netSection(List<TrialBalance.Row> rows, AccountType base) {
        List<TrialBalance.Row> accounts = rows.stream()
                .filter(row -> row.accountType().reportingType() == base)
                .toList();
        BigDecimal total = BigDecimal.ZERO;
        for (TrialBalance.Row row : accounts) {
            total = row.accountType().isContra() ? total.subtract(row.balance()) : total.add(row.balance());
        }
        return new FinancialStatements.Section(accounts, total);
    }

    private static FinancialStatements.Section section(List<TrialBalance.Row> rows, Predicate<TrialBalance.Row> filter) {
        List<TrialBalance.Row> accounts = rows.stream().filter(filter).toList();
        BigDecimal total = accounts.stream().map(TrialBalance.Row::balance).reduce(BigDecimal.ZERO, BigDecimal::add);
        return new FinancialStatements.Section(accounts, total);
    }
}
