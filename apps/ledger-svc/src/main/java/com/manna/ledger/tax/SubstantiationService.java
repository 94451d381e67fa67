package com.manna.ledger.tax;

import com.manna.ledger.entity.BusinessExpenseTrackingEntity;
import com.manna.ledger.entity.TransactionEntity;
import com.manna.ledger.exception.NotFoundException;
import com.manna.ledger.exception.ValidationException;
import com.manna.ledger.model.ExpenseSubstantiation;
import com.manna.ledger.model.SubstantiationUpdate;
import com.manna.ledger.repository.JpaBusinessExpenseTrackingRepository;
import com.manna.ledger.repository.JpaTransactionRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SubstantiationService {

    private static final Logger log = LoggerFactory.getLogger(SubstantiationService.class);
    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final JpaTransactionRepository transactionRepository;
    private final JpaBusinessExpenseTrackingRepository trackingRepository;
    private final RlsGuard rlsGuard;
    private final Clock clock;

    public SubstantiationService(JpaTransactionRepository transactionRepository,
                                 JpaBusinessExpenseTrackingRepository trackingRepository,
                                 RlsGuard rlsGuard,
                                 Clock clock) {
        this.transactionRepository = transactionRepository;
        this.trackingRepository = trackingRepository;
        this.rlsGuard = rlsGuard;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ExpenseSubstantiation getSubstantiation(UUID transactionId, UUID userId) {
        rlsGuard.setAppsecUser(userId);
        requireTransaction(transactionId, userId);
        return trackingRepository.findByTransactionId(transactionId)
                .map(SubstantiationService::toModel)
                .orElseThrow(() -> new NotFoundException("Business expense tracking for transaction", transactionId));
    }

    /**
     * Applies the non-null fields of the update and recomputes the transaction's completeness flag.
     */
    @Transactional
    public ExpenseSubstantiation updateSubstantiation(UUID transactionId, UUID userId, SubstantiationUpdate update) {
        rlsGuard.setAppsecUser(userId);
        if (update.milesDriven() != null && update.milesDriven().signum() < 0) {
            throw new ValidationException("milesDriven", "milesDriven must not be negative");
        }
        if (update.depreciationYears() != null && update.depreciationYears() <= 0) {
            throw new ValidationException("depreciationYears", "depreciationYears must be positive");
        }
        TransactionEntity transaction = requireTransaction(transactionId, userId);
        Instant now = Instant.now(clock);
        BusinessExpenseTrackingEntity tracker = trackingRepository.findByTransactionId(transactionId)
                .orElseGet(() -> {
                    BusinessExpenseTrackingEntity created = new BusinessExpenseTrackingEntity();
                    created.setId(UUID.randomUUID());
                    created.setTransactionId(transactionId);
                    created.setUserId(userId);
                    created.setBusinessPercentage(transaction.getBusinessUsePercentage() != null
                            ? transaction.getBusinessUsePercentage()
                            : ONE_HUNDRED);
                    created.setReceiptRequired(transaction.isRequiresSubstantiation());
                    created.setCreatedAt(now);
                    return created;
                });

        if (update.businessPurpose() != null) {
            tracker.setBusinessPurpose(update.businessPurpose());
        }
        if (update.receiptAttached() != null) {
            tracker.setReceiptAttached(update.receiptAttached());
        }
        if (update.receiptUrl() != null) {
            tracker.setReceiptUrl(update.receiptUrl());
        }
        if (update.mileageStartLocation() != null) {
            tracker.setMileageStartLocation(update.mileageStartLocation());
        }
        if (update.mileageEndLocation() != null) {
            tracker.setMileageEndLocation(update.mileageEndLocation());
        }
        if (update.milesDriven() != null) {
            tracker.setMilesDriven(update.milesDriven());
        }
        if (update.vehicleInfo() != null) {
            tracker.setVehicleInfo(new LinkedHashMap<>(update.vehicleInfo()));
        }
        if (update.depreciationMethod() != null) {
            tracker.setDepreciationMethod(update.depreciationMethod());
        }
        if (update.depreciationYears() != null) {
            tracker.setDepreciationYears(update.depreciationYears());
        }
        if (update.section179Eligible() != null) {
            tracker.setSection179Eligible(update.section179Eligible());
        }
        if (update.substantiationNotes() != null) {
            tracker.setSubstantiationNotes(update.substantiationNotes());
        }
        tracker.setUpdatedAt(now);
        BusinessExpenseTrackingEntity saved = trackingRepository.save(tracker);

        transaction.setSubstantiationComplete(saved.isSubstantiationComplete());
        transactionRepository.save(transaction);
        log.info("substantiation_updated transactionId={} complete={}", transactionId, saved.isSubstantiationComplete());
        return toModel(saved);
    }

    private TransactionEntity requireTransaction(UUID transactionId, UUID userId) {
        return transactionRepository.findByIdAndUserId(transactionId, userId)
                .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
    }

    private static ExpenseSubstantiation toModel(BusinessExpenseTrackingEntity entity) {
        return new ExpenseSubstantiation(
                entity.getId(),
                entity.getTransactionId(),
                entity.getBusinessPurpose(),
                entity.getBusinessPercentage(),
                entity.isReceiptRequired(),
                entity.isReceiptAttached(),
                entity.getReceiptUrl(),
                entity.getMileageStartLocation(),
                entity.getMileageEndLocation(),
                entity.getMilesDriven(),
                entity.getVehicleInfo(),
                entity.getDepreciationMethod(),
                entity.getDepreciationYears(),
                entity.isSection179Eligible(),
                entity.getSubstantiationNotes(),
                entity.isSubstantiationComplete()
        );
    }
}
