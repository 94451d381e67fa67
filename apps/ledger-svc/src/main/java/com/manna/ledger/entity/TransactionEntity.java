package com.manna.ledger.entity;

import com.manna.ledger.model.TransactionType;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * Ingested transaction. Only the categorization columns are written by this service.
 */
@Entity
@Table(name = "transactions")
public class TransactionEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "account_id")
    private UUID accountId;

    @Column(name = "name")
    private String name;

    @Column(name = "merchant_name")
    private String merchantName;

    @Column(name = "description")
    private String description;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 10)
    private TransactionType transactionType;

    @Column(name = "occurred_on", nullable = false)
    private LocalDate occurredOn;

    @Column(name = "category_id")
    private UUID categoryId;

    @Column(name = "tax_category_id")
    private UUID taxCategoryId;

    @Column(name = "chart_account_id")
    private UUID chartAccountId;

    @Column(name = "business_use_percentage", precision = 5, scale = 2)
    private BigDecimal businessUsePercentage;

    @Column(name = "deductible_amount", precision = 12, scale = 2)
    private BigDecimal deductibleAmount;

    @Column(name = "schedule_c_line", length = 20)
    private String scheduleCLine;

    @Column(name = "requires_substantiation", nullable = false)
    private boolean requiresSubstantiation;

    @Column(name = "substantiation_complete", nullable = false)
    private boolean substantiationComplete;

    @Column(name = "tax_year")
    private Integer taxYear;

    @Column(name = "is_tax_deductible", nullable = false)
    private boolean taxDeductible;

    // Default constructor for JPA
    public TransactionEntity() {}

    public TransactionEntity(UUID id, UUID userId, UUID accountId, String name, String merchantName,
                             String description, BigDecimal amount, TransactionType transactionType,
                             LocalDate occurredOn, UUID categoryId) {
        this.id = id;
        this.userId = userId;
        this.accountId = accountId;
        this.name = name;
        this.merchantName = merchantName;
        this.description = description;
        this.amount = amount;
        this.transactionType = transactionType;
        this.occurredOn = occurredOn;
        this.categoryId = categoryId;
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public UUID getAccountId() { return accountId; }
    public void setAccountId(UUID accountId) { this.accountId = accountId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getMerchantName() { return merchantName; }
    public void setMerchantName(String merchantName) { this.merchantName = merchantName; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public TransactionType getTransactionType() { return transactionType; }
    public void setTransactionType(TransactionType transactionType) { this.transactionType = transactionType; }

    public LocalDate getOccurredOn() { return occurredOn; }
    public void setOccurredOn(LocalDate occurredOn) { this.occurredOn = occurredOn; }

    public UUID getCategoryId() { return categoryId; }
    public void setCategoryId(UUID categoryId) { this.categoryId = categoryId; }

    public UUID getTaxCategoryId() { return taxCategoryId; }
    public void setTaxCategoryId(UUID taxCategoryId) { this.taxCategoryId = taxCategoryId; }

    public UUID getChartAccountId() { return chartAccountId; }
    public void setChartAccountId(UUID chartAccountId) { this.chartAccountId = chartAccountId; }

    public BigDecimal getBusinessUsePercentage() { return businessUsePercentage; }
    public void setBusinessUsePercentage(BigDecimal businessUsePercentage) { this.businessUsePercentage = businessUsePercentage; }

    public BigDecimal getDeductibleAmount() { return deductibleAmount; }
    public void setDeductibleAmount(BigDecimal deductibleAmount) { this.deductibleAmount = deductibleAmount; }

    public String getScheduleCLine() { return scheduleCLine; }
    public void setScheduleCLine(String scheduleCLine) { this.scheduleCLine = scheduleCLine; }

    public boolean isRequiresSubstantiation() { return requiresSubstantiation; }
    public void setRequiresSubstantiation(boolean requiresSubstantiation) { this.requiresSubstantiation = requiresSubstantiation; }

    public boolean isSubstantiationComplete() { return substantiationComplete; }
    public void setSubstantiationComplete(boolean substantiationComplete) { this.substantiationComplete = substantiationComplete; }

    public Integer getTaxYear() { return taxYear; }
    public void setTaxYear(Integer taxYear) { this.taxYear = taxYear; }

    public boolean isTaxDeductible() { return taxDeductible; }
    public void setTaxDeductible(boolean taxDeductible) { this.taxDeductible = taxDeductible; }

    /**
     * Lower-cased name, merchant and description joined by spaces; used for keyword matching.
     */
    public String searchText() {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[] {name, merchantName, description}) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
