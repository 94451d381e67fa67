package com.manna.ledger.tax;

import com.manna.ledger.config.LedgerProperties;
import com.manna.ledger.model.TaxCategory;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides whether an expense needs documentation (receipt, purpose, mileage log).
 */
@Component
public class SubstantiationPolicy {

    private final BigDecimal receiptThreshold;
    private final List<String> substantiationCategories;

    public SubstantiationPolicy(LedgerProperties properties) {
        this.receiptThreshold = properties.tax().receiptThreshold();
        this.substantiationCategories = properties.tax().substantiationCategories();
    }

    /**
     * True at or above the receipt threshold regardless of category, or when the category demands
     * documentation or is one of the listed travel / meals / vehicle categories.
     *
     * @param category may be null when nothing was resolved
     */
    public boolean requiresSubstantiation(BigDecimal amount, TaxCategory category) {
        if (amount != null && amount.abs().compareTo(receiptThreshold) >= 0) {
            return true;
        }
        if (category == null) {
            return false;
        }
        return category.documentationRequired() || substantiationCategories.contains(category.name());
    }
}
