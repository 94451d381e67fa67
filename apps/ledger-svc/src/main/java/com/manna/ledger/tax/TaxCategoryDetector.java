package com.manna.ledger.tax;

import com.manna.ledger.config.LedgerProperties;
import com.manna.ledger.entity.CategoryMappingEntity;
import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.entity.TransactionEntity;
import com.manna.ledger.model.AutoDetection;
import com.manna.ledger.model.CategorizationSource;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.repository.JpaCategoryMappingRepository;
import com.manna.ledger.repository.JpaChartOfAccountRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Suggests a tax category and ledger account for a transaction: first from the user's category
 * mappings, then by keyword scoring against the catalog.
 */
@Component
public class TaxCategoryDetector {

    private static final Logger log = LoggerFactory.getLogger(TaxCategoryDetector.class);

    private final JpaCategoryMappingRepository mappingRepository;
    private final JpaChartOfAccountRepository chartOfAccountRepository;
    private final TaxCategoryCatalog catalog;
    private final double minimumConfidence;
    private final Clock clock;

    public TaxCategoryDetector(JpaCategoryMappingRepository mappingRepository,
                               JpaChartOfAccountRepository chartOfAccountRepository,
                               TaxCategoryCatalog catalog,
                               LedgerProperties properties,
                               Clock clock) {
        this.mappingRepository = mappingRepository;
        this.chartOfAccountRepository = chartOfAccountRepository;
        this.catalog = catalog;
        this.minimumConfidence = properties.tax().minimumConfidence();
        this.clock = clock;
    }

    public AutoDetection autoDetect(TransactionEntity transaction, UUID userId) {
        LocalDate today = LocalDate.now(clock);
        if (transaction.getCategoryId() != null) {
            List<CategoryMappingEntity> mappings =
                    mappingRepository.findEffective(userId, transaction.getCategoryId(), today);
            if (!mappings.isEmpty()) {
                CategoryMappingEntity mapping = mappings.get(0);
                log.debug("tax_detect mapping transactionId={} mappingId={}", transaction.getId(), mapping.getId());
                return new AutoDetection(
                        mapping.getTaxCategoryId(),
                        mapping.getChartAccountId(),
                        mapping.getConfidenceScore(),
                        CategorizationSource.MAPPING,
                        mapping.getBusinessPercentageDefault(),
                        mapping.isAlwaysRequireReceipt()
                );
            }
        }

        String haystack = transaction.searchText();
        TaxCategory best = null;
        double bestScore = 0.0;
        for (TaxCategory category : catalog.findActive(today)) {
            double score = KeywordScorer.score(haystack, category);
            // strict comparison keeps the first category on ties
            if (score > bestScore) {
                best = category;
                bestScore = score;
            }
        }
        if (best == null || bestScore <= minimumConfidence) {
            log.debug("tax_detect no_match transactionId={} bestScore={}", transaction.getId(), bestScore);
            return AutoDetection.noMatch();
        }

        UUID chartAccountId = chartOfAccountRepository.findActiveByTaxCategoryLabel(userId, best.name()).stream()
                .findFirst()
                .map(ChartOfAccountEntity::getId)
                .orElse(null);
        log.debug("tax_detect keyword transactionId={} category={} score={}", transaction.getId(), best.code(), bestScore);
        return new AutoDetection(
                best.id(),
                chartAccountId,
                BigDecimal.valueOf(bestScore).setScale(4, RoundingMode.HALF_UP),
                CategorizationSource.KEYWORD,
                null,
                false
        );
    }
}
