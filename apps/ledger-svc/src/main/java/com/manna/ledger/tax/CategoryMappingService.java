package com.manna.ledger.tax;

import com.manna.ledger.entity.CategoryMappingEntity;
import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.exception.InvalidReferenceException;
import com.manna.ledger.exception.NotFoundException;
import com.manna.ledger.exception.ValidationException;
import com.manna.ledger.model.CategoryMapping;
import com.manna.ledger.model.NewCategoryMapping;
import com.manna.ledger.repository.JpaCategoryMappingRepository;
import com.manna.ledger.repository.JpaChartOfAccountRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * User shortcuts from an existing transaction category to a tax category and ledger account.
 */
@Service
public class CategoryMappingService {

    private static final Logger log = LoggerFactory.getLogger(CategoryMappingService.class);
    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final BigDecimal DEFAULT_CONFIDENCE = BigDecimal.ONE;

    private final JpaCategoryMappingRepository mappingRepository;
    private final JpaChartOfAccountRepository chartOfAccountRepository;
    private final TaxCategoryCatalog catalog;
    private final RlsGuard rlsGuard;
    private final Clock clock;

    public CategoryMappingService(JpaCategoryMappingRepository mappingRepository,
                                  JpaChartOfAccountRepository chartOfAccountRepository,
                                  TaxCategoryCatalog catalog,
                                  RlsGuard rlsGuard,
                                  Clock clock) {
        this.mappingRepository = mappingRepository;
        this.chartOfAccountRepository = chartOfAccountRepository;
        this.catalog = catalog;
        this.rlsGuard = rlsGuard;
        this.clock = clock;
    }

    @Transactional
    public CategoryMapping createMapping(UUID userId, NewCategoryMapping request) {
        rlsGuard.setAppsecUser(userId);
        if (request.sourceCategoryId() == null) {
            throw new ValidationException("sourceCategoryId", "sourceCategoryId is required");
        }
        if (request.chartAccountId() == null) {
            throw new ValidationException("chartAccountId", "chartAccountId is required");
        }
        BigDecimal confidence = request.confidenceScore() != null ? request.confidenceScore() : DEFAULT_CONFIDENCE;
        if (confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("confidenceScore", "confidenceScore must be between 0 and 1");
        }
        BigDecimal percentage = request.businessPercentageDefault();
        if (percentage != null && (percentage.signum() < 0 || percentage.compareTo(ONE_HUNDRED) > 0)) {
            throw new ValidationException("businessPercentageDefault", "businessPercentageDefault must be between 0 and 100");
        }
        LocalDate effectiveDate = request.effectiveDate() != null ? request.effectiveDate() : LocalDate.now(clock);
        if (request.expirationDate() != null && request.expirationDate().isBefore(effectiveDate)) {
            throw new ValidationException("expirationDate", "expirationDate must not precede effectiveDate");
        }
        if (request.taxCategoryId() != null && catalog.findById(request.taxCategoryId()).isEmpty()) {
            throw new NotFoundException("Tax category", request.taxCategoryId());
        }
        ChartOfAccountEntity account = chartOfAccountRepository.findByIdAndUserId(request.chartAccountId(), userId)
                .orElseThrow(() -> new NotFoundException("Chart account", request.chartAccountId()));
        if (!account.isActive()) {
            throw new InvalidReferenceException("Chart account " + account.getAccountCode() + " is inactive");
        }
        if (mappingRepository.existsByUserIdAndSourceCategoryIdAndEffectiveDateAndActiveTrue(
                userId, request.sourceCategoryId(), effectiveDate)) {
            throw new ValidationException("sourceCategoryId",
                    "An active mapping for this category already starts on " + effectiveDate);
        }

        CategoryMappingEntity entity = new CategoryMappingEntity();
        entity.setId(UUID.randomUUID());
        entity.setUserId(userId);
        entity.setSourceCategoryId(request.sourceCategoryId());
        entity.setChartAccountId(request.chartAccountId());
        entity.setTaxCategoryId(request.taxCategoryId());
        entity.setConfidenceScore(confidence);
        entity.setUserDefined(request.userDefined() == null || request.userDefined());
        entity.setEffectiveDate(effectiveDate);
        entity.setExpirationDate(request.expirationDate());
        entity.setBusinessPercentageDefault(percentage);
        entity.setAlwaysRequireReceipt(request.alwaysRequireReceipt());
        entity.setNotes(request.notes());
        entity.setCreatedAt(Instant.now(clock));
        CategoryMappingEntity saved;
        try {
            saved = mappingRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException ex) {
            log.warn("category_mapping_conflict userId={} sourceCategoryId={} effectiveDate={}",
                    userId, request.sourceCategoryId(), effectiveDate);
            throw new ValidationException("sourceCategoryId",
                    "An active mapping for this category already starts on " + effectiveDate);
        }
        log.info("category_mapping_created userId={} mappingId={} sourceCategoryId={} chartAccountId={}",
                userId, saved.getId(), saved.getSourceCategoryId(), saved.getChartAccountId());
        return toModel(saved);
    }

    @Transactional(readOnly = true)
    public List<CategoryMapping> listMappings(UUID userId, boolean activeOnly) {
        rlsGuard.setAppsecUser(userId);
        List<CategoryMappingEntity> mappings = activeOnly
                ? mappingRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId)
                : mappingRepository.findByUserIdOrderByCreatedAtAsc(userId);
        return mappings.stream().map(CategoryMappingService::toModel).toList();
    }

    @Transactional
    public CategoryMapping deactivateMapping(UUID userId, UUID mappingId) {
        rlsGuard.setAppsecUser(userId);
        CategoryMappingEntity entity = mappingRepository.findByIdAndUserId(mappingId, userId)
                .orElseThrow(() -> new NotFoundException("Category mapping", mappingId));
        entity.setActive(false);
        log.info("category_mapping_deactivated userId={} mappingId={}", userId, mappingId);
        return toModel(mappingRepository.save(entity));
    }

    private static CategoryMapping toModel(CategoryMappingEntity entity) {
        return new CategoryMapping(
                entity.getId(),
                entity.getUserId(),
                entity.getSourceCategoryId(),
                entity.getChartAccountId(),
                entity.getTaxCategoryId(),
                entity.getConfidenceScore(),
                entity.isUserDefined(),
                entity.isActive(),
                entity.getEffectiveDate(),
                entity.getExpirationDate(),
                entity.getBusinessPercentageDefault(),
                entity.isAlwaysRequireReceipt(),
                entity.getNotes()
        );
    }
}
