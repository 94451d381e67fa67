package com.manna.ledger.tax;

import com.manna.ledger.entity.TransactionEntity;
import com.manna.ledger.model.ScheduleCExport;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.model.TaxSummary;
import com.manna.ledger.repository.JpaTransactionRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Year-level views over categorized transactions: deductions per tax category and Schedule C lines.
 */
@Service
public class TaxReportService {

    private static final Pattern LINE_PREFIX = Pattern.compile("(?i)^\\s*line\\s+");
    private static final Pattern SUB_LINE_SUFFIX = Pattern.compile("[a-zA-Z]+\\s*$");
    private static final Comparator<String> LINE_ORDER = Comparator
            .<String>comparingInt(TaxReportService::numericPrefix)
            .thenComparing(Comparator.naturalOrder());

    private final JpaTransactionRepository transactionRepository;
    private final TaxCategoryCatalog catalog;
    private final RlsGuard rlsGuard;

    public TaxReportService(JpaTransactionRepository transactionRepository, TaxCategoryCatalog catalog, RlsGuard rlsGuard) {
        this.transactionRepository = transactionRepository;
        this.catalog = catalog;
        this.rlsGuard = rlsGuard;
    }

    @Transactional(readOnly = true)
    public TaxSummary getTaxSummary(UUID userId, int taxYear) {
        rlsGuard.setAppsecUser(userId);
        List<TransactionEntity> transactions = transactionRepository.findDeductibleByUserIdAndTaxYear(userId, taxYear);
        Map<UUID, Optional<TaxCategory>> categories = new HashMap<>();
        Map<String, Accumulator> byCode = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO;
        int counted = 0;
        for (TransactionEntity tx : transactions) {
            Optional<TaxCategory> category = categories.computeIfAbsent(tx.getTaxCategoryId(), catalog::findById);
            if (category.isEmpty()) {
                continue;
            }
            Accumulator acc = byCode.computeIfAbsent(category.get().code(), code -> new Accumulator(category.get()));
            acc.amount = acc.amount.add(tx.getDeductibleAmount());
            acc.count++;
            if (tx.isRequiresSubstantiation() && !tx.isSubstantiationComplete()) {
                acc.pending++;
            }
            total = total.add(tx.getDeductibleAmount());
            counted++;
        }
        List<TaxSummary.CategoryTotal> totals = byCode.values().stream()
                .map(acc -> new TaxSummary.CategoryTotal(
                        acc.category.code(),
                        acc.category.name(),
                        acc.category.taxForm(),
                        acc.category.taxLine(),
                        acc.amount,
                        acc.count,
                        acc.pending))
                .toList();
        return new TaxSummary(taxYear, total, totals, counted);
    }

    /**
     * Rolls the tax summary up to Schedule C lines. Sub-lines such as 24a and 24b merge into line 24.
     */
    @Transactional(readOnly = true)
    public ScheduleCExport exportScheduleC(UUID userId, int taxYear) {
        TaxSummary summary = getTaxSummary(userId, taxYear);
        Map<String, LineAccumulator> lines = new LinkedHashMap<>();
        for (TaxSummary.CategoryTotal category : summary.categories()) {
            if (!TaxCategory.SCHEDULE_C.equals(category.taxForm()) || category.taxLine() == null) {
                continue;
            }
            String lineNumber = normalizeLine(category.taxLine());
            LineAccumulator line = lines.computeIfAbsent(lineNumber, key -> new LineAccumulator(category.categoryName()));
            line.amount = line.amount.add(category.totalAmount());
            line.count += category.transactionCount();
        }
        List<ScheduleCExport.Line> ordered = new ArrayList<>();
        lines.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(LINE_ORDER))
                .forEach(entry -> ordered.add(new ScheduleCExport.Line(
                        entry.getKey(), entry.getValue().description, entry.getValue().amount, entry.getValue().count)));
        BigDecimal totalExpenses = ordered.stream()
                .map(ScheduleCExport.Line::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new ScheduleCExport(taxYear, ordered, totalExpenses);
    }

    static String normalizeLine(String taxLine) {
        String stripped = LINE_PREFIX.matcher(taxLine).replaceFirst("");
        return SUB_LINE_SUFFIX.matcher(stripped).replaceFirst("").trim();
    }

    private static int numericPrefix(String line) {
        try {
            return Integer.parseInt(line);
        } catch (NumberFormatException ex) {
            return Integer.MAX_VALUE;
        }
    }

    private static final class Accumulator {
        private final TaxCategory category;
        private BigDecimal amount = BigDecimal.ZERO;
        private int count;
        private int pending;

        private Accumulator(TaxCategory category) {
            this.category = category;
        }
    }

    private static final class LineAccumulator {
        private final String description;
        private BigDecimal amount = BigDecimal.ZERO;
        private int count;

        private LineAccumulator(String description) {
            this.description = description;
        }
    }
}
