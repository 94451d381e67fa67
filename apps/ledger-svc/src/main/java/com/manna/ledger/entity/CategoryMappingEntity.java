package com.manna.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "category_mappings")
public class CategoryMappingEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "source_category_id", nullable = false)
    private UUID sourceCategoryId;

    @Column(name = "chart_account_id", nullable = false)
    private UUID chartAccountId;

    @Column(name = "tax_category_id")
    private UUID taxCategoryId;

    @Column(name = "confidence_score", nullable = false, precision = 3, scale = 2)
    private BigDecimal confidenceScore;

    @Column(name = "is_user_defined", nullable = false)
    private boolean userDefined;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "effective_date", nullable = false)
    private LocalDate effectiveDate;

    @Column(name = "expiration_date")
    private LocalDate expirationDate;

    @Column(name = "business_percentage_default", precision = 5, scale = 2)
    private BigDecimal businessPercentageDefault;

    @Column(name = "always_require_receipt", nullable = false)
    private boolean alwaysRequireReceipt;

    @Column(name = "notes")
    private String notes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public CategoryMappingEntity() {}

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public UUID getSourceCategoryId() { return sourceCategoryId; }
    public void setSourceCategoryId(UUID sourceCategoryId) { this.sourceCategoryId = sourceCategoryId; }

    public UUID getChartAccountId() { return chartAccountId; }
    public void setChartAccountId(UUID chartAccountId) { this.chartAccountId = chartAccountId; }

    public UUID getTaxCategoryId() { return taxCategoryId; }
    public void setTaxCategoryId(UUID taxCategoryId) { this.taxCategoryId = taxCategoryId; }

    public BigDecimal getConfidenceScore() { return confidenceScore; }
    public void setConfidenceScore(BigDecimal confidenceScore) { this.confidenceScore = confidenceScore; }

    public boolean isUserDefined() { return userDefined; }
    public void setUserDefined(boolean userDefined) { this.userDefined = userDefined; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public LocalDate getEffectiveDate() { return effectiveDate; }
    public void setEffectiveDate(LocalDate effectiveDate) { this.effectiveDate = effectiveDate; }

    public LocalDate getExpirationDate() { return expirationDate; }
    public void setExpirationDate(LocalDate expirationDate) { this.expirationDate = expirationDate; }

    public BigDecimal getBusinessPercentageDefault() { return businessPercentageDefault; }
    public void setBusinessPercentageDefault(BigDecimal businessPercentageDefault) { this.businessPercentageDefault = businessPercentageDefault; }

    public boolean isAlwaysRequireReceipt() { return alwaysRequireReceipt; }
    public void setAlwaysRequireReceipt(boolean alwaysRequireReceipt) { this.alwaysRequireReceipt = alwaysRequireReceipt; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
