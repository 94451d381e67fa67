package com.manna.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Substantiation record of a business expense, one per transaction.
 */
@Entity
@Table(name = "business_expense_tracking")
public class BusinessExpenseTrackingEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "transaction_id", nullable = false, unique = true)
    private UUID transactionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "business_purpose")
    private String businessPurpose;

    @Column(name = "business_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal businessPercentage;

    @Column(name = "receipt_required", nullable = false)
    private boolean receiptRequired;

    @Column(name = "receipt_attached", nullable = false)
    private boolean receiptAttached;

    @Column(name = "receipt_url", length = 500)
    private String receiptUrl;

    @Column(name = "mileage_start_location")
    private String mileageStartLocation;

    @Column(name = "mileage_end_location")
    private String mileageEndLocation;

    @Column(name = "miles_driven", precision = 8, scale = 2)
    private BigDecimal milesDriven;

    @Convert(converter = JsonStringMapConverter.class)
    @Column(name = "vehicle_info", length = 4000)
    private Map<String, String> vehicleInfo = new LinkedHashMap<>();

    @Column(name = "depreciation_method", length = 50)
    private String depreciationMethod;

    @Column(name = "depreciation_years")
    private Integer depreciationYears;

    @Column(name = "section_179_eligible", nullable = false)
    private boolean section179Eligible;

    @Column(name = "substantiation_notes")
    private String substantiationNotes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Default constructor for JPA
    public BusinessExpenseTrackingEntity() {}

    /**
     * Complete when a receipt is attached or not required, and a business purpose is recorded.
     */
    public boolean isSubstantiationComplete() {
        boolean receiptOk = !receiptRequired || receiptAttached;
        return receiptOk && businessPurpose != null && !businessPurpose.isBlank();
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getTransactionId() { return transactionId; }
    public void setTransactionId(UUID transactionId) { this.transactionId = transactionId; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public String getBusinessPurpose() { return businessPurpose; }
    public void setBusinessPurpose(String businessPurpose) { this.businessPurpose = businessPurpose; }

    public BigDecimal getBusinessPercentage() { return businessPercentage; }
    public void setBusinessPercentage(BigDecimal businessPercentage) { this.businessPercentage = businessPercentage; }

    public boolean isReceiptRequired() { return receiptRequired; }
    public void setReceiptRequired(boolean receiptRequired) { this.receiptRequired = receiptRequired; }

    public boolean isReceiptAttached() { return receiptAttached; }
    public void setReceiptAttached(boolean receiptAttached) { this.receiptAttached = receiptAttached; }

    public String getReceiptUrl() { return receiptUrl; }
    public void setReceiptUrl(String receiptUrl) { this.receiptUrl = receiptUrl; }

    public String getMileageStartLocation() { return mileageStartLocation; }
    public void setMileageStartLocation(String mileageStartLocation) { this.mileageStartLocation = mileageStartLocation; }

    public String getMileageEndLocation() { return mileageEndLocation; }
    public void setMileageEndLocation(String mileageEndLocation) { this.mileageEndLocation = mileageEndLocation; }

    public BigDecimal getMilesDriven() { return milesDriven; }
    public void setMilesDriven(BigDecimal milesDriven) { this.milesDriven = milesDriven; }

    public Map<String, String> getVehicleInfo() { return vehicleInfo; }
    public void setVehicleInfo(Map<String, String> vehicleInfo) { this.vehicleInfo = vehicleInfo; }

    public String getDepreciationMethod() { return depreciationMethod; }
    public void setDepreciationMethod(String depreciationMethod) { this.depreciationMethod = depreciationMethod; }

    public Integer getDepreciationYears() { return depreciationYears; }
    public void setDepreciationYears(Integer depreciationYears) { this.depreciationYears = depreciationYears; }

    public boolean isSection179Eligible() { return section179Eligible; }
    public void setSection179Eligible(boolean section179Eligible) { this.section179Eligible = section179Eligible; }

    public String getSubstantiationNotes() { return substantiationNotes; }
    public void setSubstantiationNotes(String substantiationNotes) { this.substantiationNotes = substantiationNotes; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
