package com.manna.ledger.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.manna.ledger.entity.TransactionEntity;
import com.manna.ledger.model.ScheduleCExport;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.model.TaxSummary;
import com.manna.ledger.model.TransactionType;
import com.manna.ledger.repository.JpaTransactionRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaxReportServiceTest {

    @Mock
    JpaTransactionRepository transactionRepository;
    @Mock
    TaxCategoryCatalog catalog;
    @Mock
    RlsGuard rlsGuard;

    TaxReportService service;

    private final UUID userId = UUID.randomUUID();
    private final TaxCategory car = category("SCHED_C_9", "Car and truck expenses", TaxCategory.SCHEDULE_C, "Line 9");
    private final TaxCategory office = category("SCHED_C_18", "Office expense", TaxCategory.SCHEDULE_C, "Line 18");
    private final TaxCategory travel = category("SCHED_C_24A", "Travel", TaxCategory.SCHEDULE_C, "Line 24a");
    private final TaxCategory meals = category("SCHED_C_24B", "Meals", TaxCategory.SCHEDULE_C, "Line 24b");
    private final TaxCategory homeOffice = category("FORM_8829", "Business use of home", "Form 8829", "Line 30");

    @BeforeEach
    void setUp() {
        service = new TaxReportService(transactionRepository, catalog, rlsGuard);
        for (TaxCategory category : List.of(car, office, travel, meals, homeOffice)) {
            lenient().when(catalog.findById(category.id())).thenReturn(Optional.of(category));
        }
        List<TransactionEntity> transactions = new ArrayList<>();
        transactions.add(deductible(meals, "42.50", true, false));
        transactions.add(deductible(travel, "300.00", true, true));
        transactions.add(deductible(office, "25.00", false, false));
        transactions.add(deductible(office, "25.00", false, false));
        transactions.add(deductible(car, "60.00", true, false));
        transactions.add(deductible(homeOffice, "100.00", false, false));
        lenient().when(transactionRepository.findDeductibleByUserIdAndTaxYear(userId, 2025)).thenReturn(transactions);
    }

    @Test
    void summaryGroupsDeductionsByCategoryCode() {
        TaxSummary summary = service.getTaxSummary(userId, 2025);

        assertThat(summary.taxYear()).isEqualTo(2025);
        assertThat(summary.totalDeductions()).isEqualByComparingTo("552.50");
        assertThat(summary.transactionCount()).isEqualTo(6);
        assertThat(summary.categories())
                .extracting(TaxSummary.CategoryTotal::categoryCode, TaxSummary.CategoryTotal::transactionCount,
                        TaxSummary.CategoryTotal::pendingSubstantiation)
                .containsExactly(
                        tuple("FORM_8829", 1, 0),
                        tuple("SCHED_C_18", 2, 0),
                        tuple("SCHED_C_24A", 1, 0),
                        tuple("SCHED_C_24B", 1, 1),
                        tuple("SCHED_C_9", 1, 1));
        assertThat(summary.categories().get(1).totalAmount()).isEqualByComparingTo("50.00");
    }

    @Test
    void scheduleCMergesSubLinesAndSkipsOtherForms() {
        ScheduleCExport export = service.exportScheduleC(userId, 2025);

        assertThat(export.lines()).extracting(ScheduleCExport.Line::lineNumber).containsExactly("9", "18", "24");
        ScheduleCExport.Line line24 = export.lines().get(2);
        assertThat(line24.amount()).isEqualByComparingTo("342.50");
        assertThat(line24.transactionCount()).isEqualTo(2);
        assertThat(export.totalExpenses()).isEqualByComparingTo("452.50");
    }

    @Test
    void normalizeLineStripsPrefixAndSubLineLetter() {
        assertThat(TaxReportService.normalizeLine("Line 16a")).isEqualTo("16");
        assertThat(TaxReportService.normalizeLine("Line 16b")).isEqualTo("16");
        assertThat(TaxReportService.normalizeLine("line 27A")).isEqualTo("27");
        assertThat(TaxReportService.normalizeLine("9")).isEqualTo("9");
    }

    private TransactionEntity deductible(TaxCategory category, String amount, boolean requiresSubstantiation,
                                         boolean substantiationComplete) {
        TransactionEntity tx = new TransactionEntity(UUID.randomUUID(), userId, null, category.name(), null, null,
                new BigDecimal(amount), TransactionType.DEBIT, LocalDate.of(2025, 5, 1), null);
        tx.setTaxCategoryId(category.id());
        tx.setDeductibleAmount(new BigDecimal(amount));
        tx.setRequiresSubstantiation(requiresSubstantiation);
        tx.setSubstantiationComplete(substantiationComplete);
        tx.setTaxYear(2025);
        tx.setTaxDeductible(true);
        return tx;
    }

    private static TaxCategory category(String code, String name, String form, String line) {
        return new TaxCategory(UUID.randomUUID(), code, name, form, line, null, "business", null, null, false,
                true, true, LocalDate.of(2024, 1, 1), null, null, List.of(), List.of(), Map.of());
    }
}
