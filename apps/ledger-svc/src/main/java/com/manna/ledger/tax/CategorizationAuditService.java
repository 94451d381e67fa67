package com.manna.ledger.tax;

import com.manna.ledger.entity.CategorizationAuditEntity;
import com.manna.ledger.model.AuditAction;
import com.manna.ledger.model.AuditEntry;
import com.manna.ledger.repository.JpaCategorizationAuditRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only history of categorization changes.
 */
@Service
public class CategorizationAuditService {

    private final JpaCategorizationAuditRepository auditRepository;
    private final RlsGuard rlsGuard;
    private final Clock clock;

    public CategorizationAuditService(JpaCategorizationAuditRepository auditRepository, RlsGuard rlsGuard, Clock clock) {
        this.auditRepository = auditRepository;
        this.rlsGuard = rlsGuard;
        this.clock = clock;
    }

    /**
     * Appends one entry. The previous entry's confidence becomes this entry's "before" value.
     */
    @Transactional
    public AuditEntry record(UUID transactionId,
                             UUID userId,
                             AuditAction action,
                             UUID oldTaxCategoryId,
                             UUID newTaxCategoryId,
                             UUID oldChartAccountId,
                             UUID newChartAccountId,
                             String reason,
                             BigDecimal confidence,
                             boolean automated) {
        BigDecimal confidenceBefore = auditRepository.findFirstByTransactionIdOrderByCreatedAtDesc(transactionId)
                .map(CategorizationAuditEntity::getConfidenceAfter)
                .orElse(null);
        CategorizationAuditEntity entity = new CategorizationAuditEntity(
                UUID.randomUUID(),
                transactionId,
                userId,
                action,
                oldTaxCategoryId,
                newTaxCategoryId,
                oldChartAccountId,
                newChartAccountId,
                reason,
                confidenceBefore,
                confidence == null ? null : confidence.setScale(4, RoundingMode.HALF_UP),
                automated,
                Instant.now(clock)
        );
        return toModel(auditRepository.save(entity));
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> getAuditTrail(UUID transactionId, UUID userId) {
        rlsGuard.setAppsecUser(userId);
        return auditRepository.findByTransactionIdAndUserIdOrderByCreatedAtAsc(transactionId, userId).stream()
                .map(CategorizationAuditService::toModel)
                .toList();
    }

    private static AuditEntry toModel(CategorizationAuditEntity entity) {
        return new AuditEntry(
                entity.getId(),
                entity.getTransactionId(),
                entity.getAction(),
                entity.getOldTaxCategoryId(),
                entity.getNewTaxCategoryId(),
                entity.getOldChartAccountId(),
                entity.getNewChartAccountId(),
                entity.getReason(),
                entity.getConfidenceBefore(),
                entity.getConfidenceAfter(),
                entity.isAutomated(),
                entity.getCreatedAt()
        );
    }
}
