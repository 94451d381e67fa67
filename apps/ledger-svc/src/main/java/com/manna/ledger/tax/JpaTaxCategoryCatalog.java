package com.manna.ledger.tax;

import com.manna.ledger.entity.TaxCategoryEntity;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.repository.JpaTaxCategoryRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class JpaTaxCategoryCatalog implements TaxCategoryCatalog {

    private final JpaTaxCategoryRepository repository;

    public JpaTaxCategoryCatalog(JpaTaxCategoryRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<TaxCategory> findActive(LocalDate asOf) {
        return repository.findByActiveTrueOrderByCodeAsc().stream()
                .map(TaxCategoryEntity::toModel)
                .filter(category -> category.isEffectiveOn(asOf))
                .toList();
    }

    @Override
    public List<TaxCategory> findAll() {
        return repository.findAllByOrderByCodeAsc().stream()
                .map(TaxCategoryEntity::toModel)
                .toList();
    }

    @Override
    public Optional<TaxCategory> findById(UUID id) {
        return repository.findById(id).map(TaxCategoryEntity::toModel);
    }

    @Override
    public Optional<TaxCategory> findByCode(String code) {
        return repository.findByCode(code).map(TaxCategoryEntity::toModel);
    }
}
