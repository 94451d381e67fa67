package com.manna.ledger.config;

import java.math.BigDecimal;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "manna")
public record LedgerProperties(
        Tax tax,
        Security security
) {

    public Tax tax() {
        return tax != null ? tax : new Tax(null, null, null);
    }

    public Security security() {
        return security != null ? security : new Security(null, null, null);
    }

    public record Tax(BigDecimal receiptThreshold, Double minimumConfidence, List<String> substantiationCategories) {
        public Tax {
            if (receiptThreshold == null) {
                receiptThreshold = new BigDecimal("75.00");
            }
            if (receiptThreshold.signum() < 0) {
                throw new IllegalArgumentException("receiptThreshold must not be negative");
            }
            if (minimumConfidence == null) {
                minimumConfidence = 0.30d;
            }
            if (minimumConfidence < 0 || minimumConfidence > 1) {
                throw new IllegalArgumentException("minimumConfidence must be within [0, 1]");
            }
            if (substantiationCategories == null || substantiationCategories.isEmpty()) {
                substantiationCategories = List.of("Travel", "Meals", "Entertainment", "Car and truck expenses");
            } else {
                substantiationCategories = List.copyOf(substantiationCategories);
            }
        }
    }

    public record Security(String devJwtSecret, String issuerUri, Boolean rlsEnabled) {
        public boolean hasDevJwtSecret() {
            return devJwtSecret != null && !devJwtSecret.isBlank();
        }

        public boolean hasIssuerUri() {
            return issuerUri != null && !issuerUri.isBlank();
        }

        public boolean rlsEnabledFlag() {
            return rlsEnabled == null || rlsEnabled;
        }
    }
}
