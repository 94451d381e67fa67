package com.manna.ledger.controller.dto;

import com.manna.ledger.model.AuditEntry;
import java.util.List;
import java.util.UUID;

public record AuditTrailResponseDto(UUID transactionId, List<AuditEntry> entries, String traceId) {
}
