package com.manna.ledger.repository;

import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.model.AccountType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaChartOfAccountRepository extends JpaRepository<ChartOfAccountEntity, UUID> {
    Optional<ChartOfAccountEntity> findByIdAndUserId(UUID id, UUID userId);

    boolean existsByUserIdAndAccountCode(UUID userId, String accountCode);

    List<ChartOfAccountEntity> findByUserIdAndActiveTrueOrderByAccountCodeAsc(UUID userId);

    List<ChartOfAccountEntity> findByUserIdAndAccountTypeAndActiveTrueOrderByAccountCodeAsc(UUID userId, AccountType accountType);

    long countByParentAccountId(UUID parentAccountId);

    @Query("""
            SELECT a FROM ChartOfAccountEntity a
            WHERE a.userId = :userId AND a.active = true AND a.taxCategory = :taxCategory
            ORDER BY a.accountCode ASC
            """)
    List<ChartOfAccountEntity> findActiveByTaxCategoryLabel(@Param("userId") UUID userId,
                                                            @Param("taxCategory") String taxCategory);
}
