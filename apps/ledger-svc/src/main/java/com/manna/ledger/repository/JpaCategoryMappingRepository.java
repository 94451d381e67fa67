package com.manna.ledger.repository;

import com.manna.ledger.entity.CategoryMappingEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCategoryMappingRepository extends JpaRepository<CategoryMappingEntity, UUID> {

    /**
     * Active mappings valid on {@code today} whose chart account is still active, most confident first.
     */
    @Query("""
            SELECT m FROM CategoryMappingEntity m
            WHERE m.userId = :userId AND m.sourceCategoryId = :sourceCategoryId
              AND m.active = true
              AND EXISTS (
                  SELECT a.id FROM ChartOfAccountEntity a
                  WHERE a.id = m.chartAccountId AND a.active = true
              )
              AND m.effectiveDate <= :today
              AND (m.expirationDate IS NULL OR m.expirationDate >= :today)
            ORDER BY m.confidenceScore DESC, m.createdAt ASC
            """)
    List<CategoryMappingEntity> findEffective(@Param("userId") UUID userId,
                                              @Param("sourceCategoryId") UUID sourceCategoryId,
                                              @Param("today") LocalDate today);

    boolean existsByUserIdAndSourceCategoryIdAndEffectiveDateAndActiveTrue(UUID userId,
                                                                            UUID sourceCategoryId,
                                                                            LocalDate effectiveDate);

    List<CategoryMappingEntity> findByUserIdOrderByCreatedAtAsc(UUID userId);

    List<CategoryMappingEntity> findByUserIdAndActiveTrueOrderByCreatedAtAsc(UUID userId);

    Optional<CategoryMappingEntity> findByIdAndUserId(UUID id, UUID userId);

    long countByChartAccountId(UUID chartAccountId);

    List<CategoryMappingEntity> findByChartAccountIdAndActiveTrue(UUID chartAccountId);
}
