package com.manna.ledger.tax;

import com.manna.ledger.entity.TaxCategoryEntity;
import com.manna.ledger.exception.DuplicateCodeException;
import com.manna.ledger.exception.NotFoundException;
import com.manna.ledger.exception.ValidationException;
import com.manna.ledger.model.NewTaxCategory;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.repository.JpaTaxCategoryRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administration of the tax category catalog. Categories are never deleted, only deactivated.
 */
@Service
public class TaxCategoryService {

    private static final Logger log = LoggerFactory.getLogger(TaxCategoryService.class);
    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final JpaTaxCategoryRepository repository;
    private final TaxCategoryCatalog catalog;
    private final Clock clock;

    public TaxCategoryService(JpaTaxCategoryRepository repository, TaxCategoryCatalog catalog, Clock clock) {
        this.repository = repository;
        this.catalog = catalog;
        this.clock = clock;
    }

    public List<TaxCategory> listCategories(boolean effectiveOnly, String taxForm) {
        List<TaxCategory> categories = effectiveOnly ? catalog.findActive(LocalDate.now(clock)) : catalog.findAll();
        if (taxForm == null || taxForm.isBlank()) {
            return categories;
        }
        return categories.stream().filter(category -> taxForm.equals(category.taxForm())).toList();
    }

    @Transactional
    public TaxCategory createCategory(NewTaxCategory request) {
        if (request.code() == null || request.code().isBlank()) {
            throw new ValidationException("code", "code is required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name", "name is required");
        }
        if (request.taxForm() == null || request.taxForm().isBlank()) {
            throw new ValidationException("taxForm", "taxForm is required");
        }
        if (request.percentageLimit() != null
                && (request.percentageLimit().signum() < 0 || request.percentageLimit().compareTo(ONE_HUNDRED) > 0)) {
            throw new ValidationException("percentageLimit", "percentageLimit must be between 0 and 100");
        }
        if (request.dollarLimit() != null && request.dollarLimit().signum() < 0) {
            throw new ValidationException("dollarLimit", "dollarLimit must not be negative");
        }
        LocalDate effectiveDate = request.effectiveDate() != null ? request.effectiveDate() : LocalDate.now(clock);
        if (request.expirationDate() != null && request.expirationDate().isBefore(effectiveDate)) {
            throw new ValidationException("expirationDate", "expirationDate must not precede effectiveDate");
        }
        if (repository.existsByCode(request.code())) {
            throw new DuplicateCodeException(request.code(), "Tax category code " + request.code() + " already exists");
        }

        TaxCategoryEntity entity = new TaxCategoryEntity();
        entity.setId(UUID.randomUUID());
        entity.setCode(request.code());
        entity.setName(request.name());
        entity.setTaxForm(request.taxForm());
        entity.setTaxLine(request.taxLine());
        entity.setDescription(request.description());
        entity.setDeductionType(request.deductionType());
        entity.setPercentageLimit(request.percentageLimit());
        entity.setDollarLimit(request.dollarLimit());
        entity.setDocumentationRequired(request.documentationRequired());
        entity.setEffectiveDate(effectiveDate);
        entity.setExpirationDate(request.expirationDate());
        entity.setIrsReference(request.irsReference());
        entity.setKeywords(nonBlank(request.keywords()));
        entity.setExclusions(nonBlank(request.exclusions()));
        entity.setSpecialRules(request.specialRules() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.specialRules()));
        entity.setCreatedAt(Instant.now(clock));
        TaxCategoryEntity saved = repository.save(entity);
        log.info("tax_category_created code={} form={} line={}", saved.getCode(), saved.getTaxForm(), saved.getTaxLine());
        return saved.toModel();
    }

    @Transactional
    public TaxCategory deactivateCategory(UUID id) {
        TaxCategoryEntity entity = repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Tax category", id));
        entity.setActive(false);
        log.info("tax_category_deactivated code={}", entity.getCode());
        return repository.save(entity).toModel();
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(values.stream().filter(value -> value != null && !value.isBlank()).toList());
    }
}
