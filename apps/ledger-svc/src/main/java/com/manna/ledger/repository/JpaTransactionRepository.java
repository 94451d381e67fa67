package com.manna.ledger.repository;

import com.manna.ledger.entity.TransactionEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    Optional<TransactionEntity> findByIdAndUserId(UUID id, UUID userId);

    long countByChartAccountId(UUID chartAccountId);

    @Query("""
            SELECT t FROM TransactionEntity t
            WHERE t.userId = :userId AND t.taxYear = :taxYear
              AND t.taxDeductible = true AND t.deductibleAmount IS NOT NULL
              AND t.taxCategoryId IS NOT NULL
            ORDER BY t.occurredOn ASC
            """)
    List<TransactionEntity> findDeductibleByUserIdAndTaxYear(@Param("userId") UUID userId,
                                                             @Param("taxYear") int taxYear);

    @Query("""
            SELECT
              COALESCE(SUM(CASE WHEN t.transactionType = com.manna.ledger.model.TransactionType.DEBIT THEN t.amount ELSE 0 END), 0),
              COALESCE(SUM(CASE WHEN t.transactionType = com.manna.ledger.model.TransactionType.CREDIT THEN t.amount ELSE 0 END), 0)
            FROM TransactionEntity t
            WHERE t.chartAccountId = :accountId AND t.userId = :userId
            """)
    List<Object[]> debitCreditTotals(@Param("accountId") UUID accountId,
                                     @Param("userId") UUID userId);

    @Query("""
            SELECT
              COALESCE(SUM(CASE WHEN t.transactionType = com.manna.ledger.model.TransactionType.DEBIT THEN t.amount ELSE 0 END), 0),
              COALESCE(SUM(CASE WHEN t.transactionType = com.manna.ledger.model.TransactionType.CREDIT THEN t.amount ELSE 0 END), 0)
            FROM TransactionEntity t
            WHERE t.chartAccountId = :accountId AND t.userId = :userId
              AND t.occurredOn <= :asOf
            """)
    List<Object[]> debitCreditTotalsAsOf(@Param("accountId") UUID accountId,
                                         @Param("userId") UUID userId,
                                         @Param("asOf") LocalDate asOf);
}
