package com.manna.ledger.tax;

import com.manna.ledger.entity.BusinessExpenseTrackingEntity;
import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.entity.TransactionEntity;
import com.manna.ledger.exception.InvalidReferenceException;
import com.manna.ledger.exception.LedgerException;
import com.manna.ledger.exception.NotFoundException;
import com.manna.ledger.exception.ValidationException;
import com.manna.ledger.model.AuditAction;
import com.manna.ledger.model.AutoDetection;
import com.manna.ledger.model.BulkCategorizationResult;
import com.manna.ledger.model.CategorizationRequest;
import com.manna.ledger.model.CategorizationResult;
import com.manna.ledger.model.CategorizationSource;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.repository.JpaBusinessExpenseTrackingRepository;
import com.manna.ledger.repository.JpaChartOfAccountRepository;
import com.manna.ledger.repository.JpaTransactionRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Assigns tax categories and ledger accounts to transactions, computes the deductible portion and
 * keeps the substantiation tracker and audit trail in step.
 * <p>
 * Each single categorization runs in its own database transaction. A bulk request is a sequence of
 * independent single categorizations, so one bad id never rolls back the others.
 */
@Service
public class TaxCategorizationService {

    private static final Logger log = LoggerFactory.getLogger(TaxCategorizationService.class);
    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final JpaTransactionRepository transactionRepository;
    private final JpaChartOfAccountRepository chartOfAccountRepository;
    private final JpaBusinessExpenseTrackingRepository trackingRepository;
    private final TaxCategoryCatalog catalog;
    private final TaxCategoryDetector detector;
    private final SubstantiationPolicy substantiationPolicy;
    private final CategorizationAuditService auditService;
    private final RlsGuard rlsGuard;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    public TaxCategorizationService(
            JpaTransactionRepository transactionRepository,
            JpaChartOfAccountRepository chartOfAccountRepository,
            JpaBusinessExpenseTrackingRepository trackingRepository,
            TaxCategoryCatalog catalog,
            TaxCategoryDetector detector,
            SubstantiationPolicy substantiationPolicy,
            CategorizationAuditService auditService,
            RlsGuard rlsGuard,
            TransactionOperations transactionOperations,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.chartOfAccountRepository = chartOfAccountRepository;
        this.trackingRepository = trackingRepository;
        this.catalog = catalog;
        this.detector = detector;
        this.substantiationPolicy = substantiationPolicy;
        this.auditService = auditService;
        this.rlsGuard = rlsGuard;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
    }

    public CategorizationResult categorize(CategorizationRequest request) {
        return categorizeAtomically(request, AuditAction.TAX_CATEGORIZE);
    }

    /**
     * Categorizes every id independently with the same target values. Per-item failures are
     * collected, never thrown.
     */
    public BulkCategorizationResult bulkCategorize(List<UUID> transactionIds,
                                                   UUID userId,
                                                   UUID taxCategoryId,
                                                   UUID chartAccountId,
                                                   BigDecimal businessPercentage) {
        CategorizationRequest template = new CategorizationRequest(
                null, userId, taxCategoryId, chartAccountId, businessPercentage, null, true);
        List<CategorizationResult> results = new ArrayList<>();
        List<BulkCategorizationResult.ItemError> errors = new ArrayList<>();
        for (UUID transactionId : transactionIds) {
            try {
                results.add(categorizeAtomically(template.forTransaction(transactionId), AuditAction.BULK_TAX_CATEGORIZE));
            } catch (LedgerException ex) {
                log.warn("bulk_tax_categorize item_failed transactionId={} code={} message={}",
                        transactionId, ex.getCode(), ex.getMessage());
                errors.add(new BulkCategorizationResult.ItemError(transactionId, ex.getCode(), ex.getMessage()));
            } catch (RuntimeException ex) {
                log.warn("bulk_tax_categorize item_failed transactionId={}", transactionId, ex);
                errors.add(new BulkCategorizationResult.ItemError(transactionId, "INTERNAL_ERROR", ex.getMessage()));
            }
        }
        log.info("bulk_tax_categorize userId={} requested={} success={} errors={}",
                userId, transactionIds.size(), results.size(), errors.size());
        return new BulkCategorizationResult(results.size(), errors.size(), results, errors);
    }

    private CategorizationResult categorizeAtomically(CategorizationRequest request, AuditAction action) {
        try {
            return transactionOperations.execute(status -> doCategorize(request, action));
        } catch (LedgerException ex) {
            log.warn("tax_categorize rejected transactionId={} code={} message={}",
                    request.transactionId(), ex.getCode(), ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            log.error("tax_categorize rolled_back transactionId={}", request.transactionId(), ex);
            throw ex;
        }
    }

    private CategorizationResult doCategorize(CategorizationRequest request, AuditAction action) {
        UUID userId = request.userId();
        rlsGuard.setAppsecUser(userId);
        TransactionEntity transaction = transactionRepository.findByIdAndUserId(request.transactionId(), userId)
                .orElseThrow(() -> new NotFoundException("Transaction", request.transactionId()));
        validatePercentage(request.businessPercentage());

        UUID taxCategoryId = request.taxCategoryId();
        UUID chartAccountId = request.chartAccountId();
        CategorizationSource source = CategorizationSource.MANUAL;
        BigDecimal confidence = BigDecimal.ONE;
        AutoDetection detection = null;
        if (taxCategoryId == null || chartAccountId == null) {
            detection = detector.autoDetect(transaction, userId);
            if (taxCategoryId == null) {
                taxCategoryId = detection.taxCategoryId();
            }
            if (chartAccountId == null) {
                chartAccountId = detection.chartAccountId();
            }
            if (detection.matched()) {
                source = detection.source();
                confidence = detection.confidence();
            } else if (taxCategoryId == null && chartAccountId == null) {
                source = CategorizationSource.NO_MATCH;
                confidence = BigDecimal.ZERO;
            }
        }

        LocalDate today = LocalDate.now(clock);
        TaxCategory taxCategory = taxCategoryId == null ? null : resolveTaxCategory(taxCategoryId, today);
        ChartOfAccountEntity chartAccount = chartAccountId == null ? null : resolveChartAccount(chartAccountId, userId);

        BigDecimal businessPercentage = request.businessPercentage();
        if (businessPercentage == null) {
            businessPercentage = source == CategorizationSource.MAPPING && detection.businessPercentageDefault() != null
                    ? detection.businessPercentageDefault()
                    : ONE_HUNDRED;
        }
        BigDecimal amount = transaction.getAmount().abs();
        BigDecimal businessAmount = amount.multiply(businessPercentage)
                .divide(ONE_HUNDRED, 2, RoundingMode.HALF_UP);
        BigDecimal deductibleAmount = taxCategory == null ? null : taxCategory.calculateDeductible(businessAmount);
        boolean requiresSubstantiation = substantiationPolicy.requiresSubstantiation(amount, taxCategory);
        boolean alwaysRequireReceipt = detection != null && source == CategorizationSource.MAPPING
                && detection.alwaysRequireReceipt();

        UUID oldTaxCategoryId = transaction.getTaxCategoryId();
        UUID oldChartAccountId = transaction.getChartAccountId();

        transaction.setTaxCategoryId(taxCategory == null ? null : taxCategory.id());
        transaction.setChartAccountId(chartAccount == null ? null : chartAccount.getId());
        transaction.setBusinessUsePercentage(businessPercentage);
        transaction.setDeductibleAmount(deductibleAmount);
        transaction.setScheduleCLine(taxCategory != null && taxCategory.isScheduleC() ? taxCategory.taxLine() : null);
        transaction.setRequiresSubstantiation(requiresSubstantiation);
        transaction.setTaxYear(transaction.getOccurredOn().getYear());
        transaction.setTaxDeductible(deductibleAmount != null && deductibleAmount.signum() > 0);

        BusinessExpenseTrackingEntity tracker = upsertTracker(transaction, userId, businessPercentage,
                request.businessPurpose(), requiresSubstantiation || alwaysRequireReceipt);
        transaction.setSubstantiationComplete(tracker.isSubstantiationComplete());
        transactionRepository.save(transaction);

        auditService.record(
                transaction.getId(),
                userId,
                action,
                oldTaxCategoryId,
                transaction.getTaxCategoryId(),
                oldChartAccountId,
                transaction.getChartAccountId(),
                source.value(),
                confidence,
                !request.overrideAutomated()
        );

        log.info("tax_categorize transactionId={} userId={} taxCategory={} chartAccountId={} source={} deductible={}",
                transaction.getId(), userId, taxCategory == null ? null : taxCategory.code(),
                transaction.getChartAccountId(), source.value(), deductibleAmount);

        return new CategorizationResult(
                true,
                transaction.getId(),
                transaction.getTaxCategoryId(),
                taxCategory == null ? null : taxCategory.name(),
                transaction.getChartAccountId(),
                chartAccount == null ? null : chartAccount.getAccountName(),
                businessAmount,
                deductibleAmount,
                transaction.getScheduleCLine(),
                requiresSubstantiation,
                transaction.isSubstantiationComplete(),
                source,
                confidence
        );
    }

    private TaxCategory resolveTaxCategory(UUID taxCategoryId, LocalDate today) {
        TaxCategory category = catalog.findById(taxCategoryId)
                .orElseThrow(() -> new NotFoundException("Tax category", taxCategoryId));
        if (!category.isEffectiveOn(today)) {
            throw new InvalidReferenceException("Tax category " + category.code() + " is not currently effective");
        }
        return category;
    }

    private ChartOfAccountEntity resolveChartAccount(UUID chartAccountId, UUID userId) {
        ChartOfAccountEntity account = chartOfAccountRepository.findById(chartAccountId)
                .orElseThrow(() -> new NotFoundException("Chart account", chartAccountId));
        if (!userId.equals(account.getUserId())) {
            throw new InvalidReferenceException("Chart account " + chartAccountId + " does not belong to the user");
        }
        if (!account.isActive()) {
            throw new InvalidReferenceException("Chart account " + account.getAccountCode() + " is inactive");
        }
        return account;
    }

    private BusinessExpenseTrackingEntity upsertTracker(TransactionEntity transaction,
                                                        UUID userId,
                                                        BigDecimal businessPercentage,
                                                        String businessPurpose,
                                                        boolean receiptRequired) {
        Instant now = Instant.now(clock);
        BusinessExpenseTrackingEntity tracker = trackingRepository.findByTransactionId(transaction.getId())
                .orElseGet(() -> {
                    BusinessExpenseTrackingEntity created = new BusinessExpenseTrackingEntity();
                    created.setId(UUID.randomUUID());
                    created.setTransactionId(transaction.getId());
                    created.setUserId(userId);
                    created.setCreatedAt(now);
                    return created;
                });
        tracker.setBusinessPercentage(businessPercentage);
        if (businessPurpose != null) {
            tracker.setBusinessPurpose(businessPurpose);
        }
        tracker.setReceiptRequired(receiptRequired);
        tracker.setUpdatedAt(now);
        return trackingRepository.save(tracker);
    }

    private static void validatePercentage(BigDecimal businessPercentage) {
        if (businessPercentage == null) {
            return;
        }
        if (businessPercentage.signum() < 0 || businessPercentage.compareTo(ONE_HUNDRED) > 0) {
            throw new ValidationException("businessPercentage", "businessPercentage must be between 0 and 100");
        }
    }
}
