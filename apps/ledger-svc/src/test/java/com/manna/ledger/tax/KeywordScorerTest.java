package com.manna.ledger.tax;

import static org.assertj.core.api.Assertions.assertThat;

import com.manna.ledger.model.TaxCategory;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class KeywordScorerTest {

    @Test
    void scoresFractionOfMatchedKeywords() {
        TaxCategory car = category(List.of("gas", "fuel", "vehicle", "car"), List.of());

        assertThat(KeywordScorer.score("gas station fuel shell", car)).isEqualTo(0.5);
    }

    @Test
    void exclusionForcesZero() {
        TaxCategory car = category(List.of("gas", "fuel", "vehicle", "car"), List.of("gas"));

        assertThat(KeywordScorer.score("gas station fuel shell", car)).isZero();
    }

    @Test
    void matchingIsCaseInsensitive() {
        TaxCategory travel = category(List.of("Hotel", "airfare"), List.of());

        assertThat(KeywordScorer.score("MARRIOTT HOTEL downtown", travel)).isEqualTo(0.5);
    }

    @Test
    void categoryWithoutKeywordsNeverMatches() {
        assertThat(KeywordScorer.score("anything at all", category(List.of(), List.of()))).isZero();
    }

    @Test
    void blankKeywordsAreIgnored() {
        TaxCategory supplies = category(List.of("", "supplies", " "), List.of());

        assertThat(KeywordScorer.score("netflix subscription", supplies)).isZero();
        assertThat(KeywordScorer.score("office supplies", supplies)).isEqualTo(1.0);
        assertThat(KeywordScorer.score("anything", category(List.of("", "  "), List.of()))).isZero();
    }

    @Test
    void scoreStaysWithinUnitInterval() {
        TaxCategory meals = category(List.of("meal", "restaurant"), List.of("personal"));

        for (String text : List.of("", "restaurant meal", "meal", "personal restaurant meal", "nothing")) {
            assertThat(KeywordScorer.score(text, meals)).isBetween(0.0, 1.0);
        }
    }

    private static TaxCategory category(List<String> keywords, List<String> exclusions) {
        return new TaxCategory(UUID.randomUUID(), "SCHED_C_9", "Car and truck expenses", TaxCategory.SCHEDULE_C,
                "Line 9", null, "business", null, null, true, true, true, LocalDate.of(2024, 1, 1), null, null,
                keywords, exclusions, Map.of());
    }
}
