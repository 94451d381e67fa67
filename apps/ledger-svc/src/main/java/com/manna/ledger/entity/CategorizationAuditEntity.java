package com.manna.ledger.entity;

import com.manna.ledger.model.AuditAction;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Append-only categorization history. Rows are inserted once and never updated.
 */
@Entity
@Immutable
@Table(name = "categorization_audit")
public class CategorizationAuditEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "transaction_id", nullable = false)
    private UUID transactionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 50)
    private AuditAction action;

    @Column(name = "old_tax_category_id")
    private UUID oldTaxCategoryId;

    @Column(name = "new_tax_category_id")
    private UUID newTaxCategoryId;

    @Column(name = "old_chart_account_id")
    private UUID oldChartAccountId;

    @Column(name = "new_chart_account_id")
    private UUID newChartAccountId;

    @Column(name = "reason")
    private String reason;

    @Column(name = "confidence_before", precision = 5, scale = 4)
    private BigDecimal confidenceBefore;

    @Column(name = "confidence_after", precision = 5, scale = 4)
    private BigDecimal confidenceAfter;

    @Column(name = "automated", nullable = false)
    private boolean automated;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    protected CategorizationAuditEntity() {}

    public CategorizationAuditEntity(UUID id, UUID transactionId, UUID userId, AuditAction action,
                                     UUID oldTaxCategoryId, UUID newTaxCategoryId,
                                     UUID oldChartAccountId, UUID newChartAccountId,
                                     String reason, BigDecimal confidenceBefore, BigDecimal confidenceAfter,
                                     boolean automated, Instant createdAt) {
        this.id = id;
        this.transactionId = transactionId;
        this.userId = userId;
        this.action = action;
        this.oldTaxCategoryId = oldTaxCategoryId;
        this.newTaxCategoryId = newTaxCategoryId;
        this.oldChartAccountId = oldChartAccountId;
        this.newChartAccountId = newChartAccountId;
        this.reason = reason;
        this.confidenceBefore = confidenceBefore;
        this.confidenceAfter = confidenceAfter;
        this.automated = automated;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public UUID getTransactionId() { return transactionId; }
    public UUID getUserId() { return userId; }
    public AuditAction getAction() { return action; }
    public UUID getOldTaxCategoryId() { return oldTaxCategoryId; }
    public UUID getNewTaxCategoryId() { return newTaxCategoryId; }
    public UUID getOldChartAccountId() { return oldChartAccountId; }
    public UUID getNewChartAccountId() { return newChartAccountId; }
    public String getReason() { return reason; }
    public BigDecimal getConfidenceBefore() { return confidenceBefore; }
    public BigDecimal getConfidenceAfter() { return confidenceAfter; }
    public boolean isAutomated() { return automated; }
    public Instant getCreatedAt() { return createdAt; }
}
