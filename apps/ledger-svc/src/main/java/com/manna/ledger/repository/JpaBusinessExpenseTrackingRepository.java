package com.manna.ledger.repository;

import com.manna.ledger.entity.BusinessExpenseTrackingEntity;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaBusinessExpenseTrackingRepository extends JpaRepository<BusinessExpenseTrackingEntity, UUID> {
    Optional<BusinessExpenseTrackingEntity> findByTransactionId(UUID transactionId);
}
