package com.manna.ledger.tax;

import com.manna.ledger.model.TaxCategory;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to the IRS tax category reference data.
 */
public interface TaxCategoryCatalog {

    /**
     * Categories effective on the given date, in stable code order.
     */
    List<TaxCategory> findActive(LocalDate asOf);

    List<TaxCategory> findAll();

    Optional<TaxCategory> findById(UUID id);

    Optional<TaxCategory> findByCode(String code);
}
