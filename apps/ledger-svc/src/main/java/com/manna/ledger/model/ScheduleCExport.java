package com.manna.ledger.model;

import java.math.BigDecimal;
import java.util.List;

public record ScheduleCExport(
        int taxYear,
        List<Line> lines,
        BigDecimal totalExpenses
) {
    public record Line(
            String lineNumber,
            String lineDescription,
            BigDecimal amount,
            int transactionCount
    ) {
    }
}
