package com.manna.ledger.tax;

import com.manna.ledger.model.TaxCategory;
import java.util.Locale;

/**
 * Scores how well free transaction text matches a tax category's keyword rules.
 */
public final class KeywordScorer {

    private KeywordScorer() {
    }

    /**
     * Fraction of the category keywords found as substrings of the lower-cased haystack, in [0, 1].
     * Any exclusion keyword present forces 0, as does a category without non-blank keywords.
     */
    public static double score(String haystack, TaxCategory category) {
        if (haystack == null || category.keywords().isEmpty()) {
            return 0.0;
        }
        String text = haystack.toLowerCase(Locale.ROOT);
        for (String exclusion : category.exclusions()) {
            if (!exclusion.isBlank() && text.contains(exclusion.toLowerCase(Locale.ROOT))) {
                return 0.0;
            }
        }
        int keywords = 0;
        int matches = 0;
        for (String keyword : category.keywords()) {
            if (keyword.isBlank()) {
                continue;
            }
            keywords++;
            if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
                matches++;
            }
        }
        return keywords == 0 ? 0.0 : (double) matches / keywords;
    }
}
