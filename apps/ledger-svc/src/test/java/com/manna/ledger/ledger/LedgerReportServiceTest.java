package com.manna.ledger.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.model.AccountType;
import com.manna.ledger.model.FinancialStatements;
import com.manna.ledger.model.TrialBalance;
import com.manna.ledger.repository.JpaCategoryMappingRepository;
import com.manna.ledger.repository.JpaChartOfAccountRepository;
import com.manna.ledger.repository.JpaTransactionRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LedgerReportServiceTest {

    @Mock
    JpaChartOfAccountRepository accountRepository;
    @Mock
    JpaTransactionRepository transactionRepository;
    @Mock
    JpaCategoryMappingRepository mappingRepository;
    @Mock
    RlsGuard rlsGuard;

    LedgerReportService service;

    private final UUID userId = UUID.randomUUID();
    private final List<ChartOfAccountEntity> accounts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ChartOfAccountsService chartOfAccountsService = new ChartOfAccountsService(
                accountRepository, transactionRepository, mappingRepository, rlsGuard, Clock.systemUTC());
        service = new LedgerReportService(chartOfAccountsService, rlsGuard);
        when(accountRepository.findByUserIdAndActiveTrueOrderByAccountCodeAsc(userId)).thenReturn(accounts);
        when(accountRepository.save(any(ChartOfAccountEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void trialBalanceOfDoubleEntryBookIsBalanced() {
        standardBook();

        TrialBalance trialBalance = service.getTrialBalance(userId, null);

        assertThat(trialBalance.accounts()).hasSize(6);
        assertThat(trialBalance.totalDebits()).isEqualByComparingTo("950.00");
        assertThat(trialBalance.totalCredits()).isEqualByComparingTo("950.00");
        assertThat(trialBalance.balanced()).isTrue();
        TrialBalance.Row accumulatedDepreciation = trialBalance.accounts().get(1);
        assertThat(accumulatedDepreciation.creditBalance()).isEqualByComparingTo("100.00");
        assertThat(accumulatedDepreciation.debitBalance()).isEqualByComparingTo("0");
        assertThat(accounts.get(0).getCurrentBalance()).isEqualByComparingTo("700.00");
    }

    @Test
    void balanceAgainstNormalSideMovesToOppositeColumn() {
        account("5300", AccountType.EXPENSE, "0", "40.00");

        TrialBalance trialBalance = service.getTrialBalance(userId, null);

        TrialBalance.Row refund = trialBalance.accounts().get(0);
        assertThat(refund.balance()).isEqualByComparingTo("-40.00");
        assertThat(refund.debitBalance()).isEqualByComparingTo("0");
        assertThat(refund.creditBalance()).isEqualByComparingTo("40.00");
        assertThat(trialBalance.balanced()).isFalse();
    }

    @Test
    void statementsNetContraAccountsAndFoldNetIncomeIntoEquity() {
        standardBook();

        FinancialStatements statements = service.generateFinancialStatements(userId, null);

        FinancialStatements.BalanceSheet balanceSheet = statements.balanceSheet();
        assertThat(balanceSheet.assets().total()).isEqualByComparingTo("600.00");
        assertThat(balanceSheet.assets().accounts()).hasSize(2);
        assertThat(balanceSheet.liabilities().total()).isEqualByComparingTo("200.00");
        assertThat(balanceSheet.equity().total()).isEqualByComparingTo("500.00");
        assertThat(statements.incomeStatement().revenue().total()).isEqualByComparingTo("150.00");
        assertThat(statements.incomeStatement().expenses().total()).isEqualByComparingTo("250.00");
        assertThat(statements.incomeStatement().netIncome()).isEqualByComparingTo("-100.00");
        assertThat(balanceSheet.equity().totalWithIncome()).isEqualByComparingTo("400.00");
        assertThat(balanceSheet.totalLiabilitiesAndEquity()).isEqualByComparingTo(balanceSheet.assets().total());
    }

    private void standardBook() {
        account("1000", AccountType.ASSET, "1000.00", "300.00");
        account("1500", AccountType.CONTRA_ASSET, "0", "100.00");
        account("2000", AccountType.LIABILITY, "0", "200.00");
        account("3000", AccountType.EQUITY, "0", "500.00");
        account("4000", AccountType.REVENUE, "0", "150.00");
        account("5000", AccountType.EXPENSE, "250.00", "0");
    }

    private void account(String code, AccountType type, String debits, String credits) {
        ChartOfAccountEntity account = new ChartOfAccountEntity();
        account.setId(UUID.randomUUID());
        account.setUserId(userId);
        account.setAccountCode(code);
        account.setAccountName("Account " + code);
        account.setAccountType(type);
        account.setNormalBalance(type.normalBalance());
        account.setActive(true);
        accounts.add(account);
        when(transactionRepository.debitCreditTotals(account.getId(), userId))
                .thenReturn(Collections.singletonList(new Object[]{new BigDecimal(debits), new BigDecimal(credits)}));
    }
}
