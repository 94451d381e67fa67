package com.manna.ledger.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LedgerPropertiesTest {

    @Test
    void defaultsApplyWhenSectionsAreMissing() {
        LedgerProperties props = new LedgerProperties(null, null);

        assertThat(props.tax().receiptThreshold()).isEqualByComparingTo("75.00");
        assertThat(props.tax().minimumConfidence()).isEqualTo(0.30);
        assertThat(props.tax().substantiationCategories())
                .containsExactly("Travel", "Meals", "Entertainment", "Car and truck expenses");
        assertThat(props.security().rlsEnabledFlag()).isTrue();
        assertThat(props.security().hasDevJwtSecret()).isFalse();
    }

    @Test
    void rlsFlagRespectsFalse() {
        LedgerProperties props = new LedgerProperties(null, new LedgerProperties.Security("secret", null, false));

        assertThat(props.security().rlsEnabledFlag()).isFalse();
    }

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> new LedgerProperties.Tax(null, 1.5, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeReceiptThreshold() {
        assertThatThrownBy(() -> new LedgerProperties.Tax(new BigDecimal("-1"), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
