package com.manna.ledger.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.manna.ledger.config.LedgerProperties;
import com.manna.ledger.entity.CategoryMappingEntity;
import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.entity.TransactionEntity;
import com.manna.ledger.model.AutoDetection;
import com.manna.ledger.model.CategorizationSource;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.model.TransactionType;
import com.manna.ledger.repository.JpaCategoryMappingRepository;
import com.manna.ledger.repository.JpaChartOfAccountRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaxCategoryDetectorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @Mock
    JpaCategoryMappingRepository mappingRepository;
    @Mock
    JpaChartOfAccountRepository chartOfAccountRepository;
    @Mock
    TaxCategoryCatalog catalog;

    TaxCategoryDetector detector;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        detector = new TaxCategoryDetector(mappingRepository, chartOfAccountRepository, catalog,
                new LedgerProperties(null, null), clock);
    }

    @Test
    void effectiveMappingWinsOverKeywords() {
        UUID sourceCategory = UUID.randomUUID();
        CategoryMappingEntity mapping = new CategoryMappingEntity();
        mapping.setId(UUID.randomUUID());
        mapping.setTaxCategoryId(UUID.randomUUID());
        mapping.setChartAccountId(UUID.randomUUID());
        mapping.setConfidenceScore(new BigDecimal("0.90"));
        mapping.setBusinessPercentageDefault(new BigDecimal("60"));
        mapping.setAlwaysRequireReceipt(true);
        when(mappingRepository.findEffective(userId, sourceCategory, TODAY)).thenReturn(List.of(mapping));

        AutoDetection detection = detector.autoDetect(transaction("Shell", sourceCategory), userId);

        assertThat(detection.source()).isEqualTo(CategorizationSource.MAPPING);
        assertThat(detection.taxCategoryId()).isEqualTo(mapping.getTaxCategoryId());
        assertThat(detection.chartAccountId()).isEqualTo(mapping.getChartAccountId());
        assertThat(detection.confidence()).isEqualByComparingTo("0.90");
        assertThat(detection.businessPercentageDefault()).isEqualByComparingTo("60");
        assertThat(detection.alwaysRequireReceipt()).isTrue();
        verify(catalog, never()).findActive(any());
    }

    @Test
    void keywordMatchPicksBestCategoryAndLabelledAccount() {
        TaxCategory car = category("Car and truck expenses", List.of("gas", "fuel", "vehicle", "car"));
        TaxCategory utilities = category("Utilities", List.of("utilities", "electricity", "gas", "water", "phone", "internet", "cell phone"));
        when(catalog.findActive(TODAY)).thenReturn(List.of(utilities, car));
        ChartOfAccountEntity vehicleAccount = new ChartOfAccountEntity();
        vehicleAccount.setId(UUID.randomUUID());
        when(chartOfAccountRepository.findActiveByTaxCategoryLabel(userId, "Car and truck expenses"))
                .thenReturn(List.of(vehicleAccount));

        AutoDetection detection = detector.autoDetect(transaction("gas station fuel shell", null), userId);

        assertThat(detection.source()).isEqualTo(CategorizationSource.KEYWORD);
        assertThat(detection.taxCategoryId()).isEqualTo(car.id());
        assertThat(detection.chartAccountId()).isEqualTo(vehicleAccount.getId());
        assertThat(detection.confidence()).isEqualByComparingTo("0.5");
    }

    @Test
    void keywordMatchWithoutLabelledAccountLeavesAccountEmpty() {
        TaxCategory car = category("Car and truck expenses", List.of("gas", "fuel", "vehicle", "car"));
        when(catalog.findActive(TODAY)).thenReturn(List.of(car));
        when(chartOfAccountRepository.findActiveByTaxCategoryLabel(eq(userId), any())).thenReturn(List.of());

        AutoDetection detection = detector.autoDetect(transaction("gas station fuel shell", null), userId);

        assertThat(detection.taxCategoryId()).isEqualTo(car.id());
        assertThat(detection.chartAccountId()).isNull();
    }

    @Test
    void scoreAtMinimumConfidenceIsRejected() {
        TaxCategory broad = category("Other expenses",
                List.of("a1", "a2", "a3", "k4", "k5", "k6", "k7", "k8", "k9", "k10"));
        when(catalog.findActive(TODAY)).thenReturn(List.of(broad));

        AutoDetection detection = detector.autoDetect(transaction("a1 a2 a3", null), userId);

        assertThat(detection.matched()).isFalse();
        assertThat(detection.source()).isEqualTo(CategorizationSource.NO_MATCH);
        assertThat(detection.confidence()).isEqualByComparingTo("0");
    }

    @Test
    void firstCategoryWinsExactTies() {
        TaxCategory first = category("Supplies", List.of("paper", "ink"));
        TaxCategory second = category("Office expense", List.of("paper", "toner"));
        when(catalog.findActive(TODAY)).thenReturn(List.of(first, second));
        when(chartOfAccountRepository.findActiveByTaxCategoryLabel(eq(userId), any())).thenReturn(List.of());

        AutoDetection detection = detector.autoDetect(transaction("paper", null), userId);

        assertThat(detection.taxCategoryId()).isEqualTo(first.id());
    }

    @Test
    void sourceCategoryWithoutMappingFallsBackToKeywords() {
        UUID sourceCategory = UUID.randomUUID();
        when(mappingRepository.findEffective(userId, sourceCategory, TODAY)).thenReturn(List.of());
        when(catalog.findActive(TODAY)).thenReturn(List.of());

        AutoDetection detection = detector.autoDetect(transaction("unknown merchant", sourceCategory), userId);

        assertThat(detection.source()).isEqualTo(CategorizationSource.NO_MATCH);
    }

    private static TransactionEntity transaction(String name, UUID sourceCategory) {
        return new TransactionEntity(UUID.randomUUID(), UUID.randomUUID(), null, name, null, null,
                new BigDecimal("40.00"), TransactionType.DEBIT, TODAY, sourceCategory);
    }

    private static TaxCategory category(String name, List<String> keywords) {
        return new TaxCategory(UUID.randomUUID(), name.toUpperCase(), name, TaxCategory.SCHEDULE_C, "Line 9", null,
                "business", null, null, false, true, true, LocalDate.of(2024, 1, 1), null, null,
                keywords, List.of(), Map.of());
    }
}
