package com.manna.ledger.repository;

import com.manna.ledger.entity.CategorizationAuditEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCategorizationAuditRepository extends JpaRepository<CategorizationAuditEntity, UUID> {
    List<CategorizationAuditEntity> findByTransactionIdAndUserIdOrderByCreatedAtAsc(UUID transactionId, UUID userId);

    Optional<CategorizationAuditEntity> findFirstByTransactionIdOrderByCreatedAtDesc(UUID transactionId);
}
