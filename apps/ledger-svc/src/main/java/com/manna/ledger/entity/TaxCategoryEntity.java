package com.manna.ledger.entity;

import com.manna.ledger.model.TaxCategory;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "tax_categories")
public class TaxCategoryEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "code", nullable = false, unique = true, length = 20)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "tax_form", nullable = false, length = 50)
    private String taxForm;

    @Column(name = "tax_line", length = 20)
    private String taxLine;

    @Column(name = "description")
    private String description;

    @Column(name = "deduction_type", length = 50)
    private String deductionType;

    @Column(name = "percentage_limit", precision = 5, scale = 2)
    private BigDecimal percentageLimit;

    @Column(name = "dollar_limit", precision = 12, scale = 2)
    private BigDecimal dollarLimit;

    @Column(name = "documentation_required", nullable = false)
    private boolean documentationRequired;

    @Column(name = "is_business_expense", nullable = false)
    private boolean businessExpense = true;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "effective_date", nullable = false)
    private LocalDate effectiveDate;

    @Column(name = "expiration_date")
    private LocalDate expirationDate;

    @Column(name = "irs_reference", length = 100)
    private String irsReference;

    @Convert(converter = JsonStringListConverter.class)
    @Column(name = "keywords", length = 4000)
    private List<String> keywords = new ArrayList<>();

    @Convert(converter = JsonStringListConverter.class)
    @Column(name = "exclusions", length = 4000)
    private List<String> exclusions = new ArrayList<>();

    @Convert(converter = JsonStringMapConverter.class)
    @Column(name = "special_rules", length = 4000)
    private Map<String, String> specialRules = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public TaxCategoryEntity() {}

    public TaxCategory toModel() {
        return new TaxCategory(
                id,
                code,
                name,
                taxForm,
                taxLine,
                description,
                deductionType,
                percentageLimit,
                dollarLimit,
                documentationRequired,
                businessExpense,
                active,
                effectiveDate,
                expirationDate,
                irsReference,
                keywords,
                exclusions,
                specialRules
        );
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getTaxForm() { return taxForm; }
    public void setTaxForm(String taxForm) { this.taxForm = taxForm; }

    public String getTaxLine() { return taxLine; }
    public void setTaxLine(String taxLine) { this.taxLine = taxLine; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getDeductionType() { return deductionType; }
    public void setDeductionType(String deductionType) { this.deductionType = deductionType; }

    public BigDecimal getPercentageLimit() { return percentageLimit; }
    public void setPercentageLimit(BigDecimal percentageLimit) { this.percentageLimit = percentageLimit; }

    public BigDecimal getDollarLimit() { return dollarLimit; }
    public void setDollarLimit(BigDecimal dollarLimit) { this.dollarLimit = dollarLimit; }

    public boolean isDocumentationRequired() { return documentationRequired; }
    public void setDocumentationRequired(boolean documentationRequired) { this.documentationRequired = documentationRequired; }

    public boolean isBusinessExpense() { return businessExpense; }
    public void setBusinessExpense(boolean businessExpense) { this.businessExpense = businessExpense; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public LocalDate getEffectiveDate() { return effectiveDate; }
    public void setEffectiveDate(LocalDate effectiveDate) { this.effectiveDate = effectiveDate; }

    public LocalDate getExpirationDate() { return expirationDate; }
    public void setExpirationDate(LocalDate expirationDate) { this.expirationDate = expirationDate; }

    public String getIrsReference() { return irsReference; }
    public void setIrsReference(String irsReference) { this.irsReference = irsReference; }

    public List<String> getKeywords() { return keywords; }
    public void setKeywords(List<String> keywords) { this.keywords = keywords; }

    public List<String> getExclusions() { return exclusions; }
    public void setExclusions(List<String> exclusions) { this.exclusions = exclusions; }

    public Map<String, String> getSpecialRules() { return specialRules; }
    public void setSpecialRules(Map<String, String> specialRules) { this.specialRules = specialRules; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
