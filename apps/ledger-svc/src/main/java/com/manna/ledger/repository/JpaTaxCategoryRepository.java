package com.manna.ledger.repository;

import com.manna.ledger.entity.TaxCategoryEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTaxCategoryRepository extends JpaRepository<TaxCategoryEntity, UUID> {
    Optional<TaxCategoryEntity> findByCode(String code);

    boolean existsByCode(String code);

    List<TaxCategoryEntity> findAllByOrderByCodeAsc();

    List<TaxCategoryEntity> findByActiveTrueOrderByCodeAsc();
}
