package com.manna.ledger.model;

import java.util.List;
import java.util.UUID;

public record BulkCategorizationResult(
        int successCount,
        int errorCount,
        List<CategorizationResult> results,
        List<ItemError> errors
) {
    public BulkCategorizationResult {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }

    public record ItemError(UUID transactionId, String code, String message) {
    }
}
