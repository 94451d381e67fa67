package com.manna.ledger.controller;

import com.manna.ledger.controller.dto.AuditTrailResponseDto;
import com.manna.ledger.controller.dto.BulkCategorizeRequestDto;
import com.manna.ledger.controller.dto.CategorizeRequestDto;
import com.manna.ledger.model.BulkCategorizationResult;
import com.manna.ledger.model.CategorizationRequest;
import com.manna.ledger.model.CategorizationResult;
import com.manna.ledger.model.ScheduleCExport;
import com.manna.ledger.model.TaxSummary;
import com.manna.ledger.security.AuthenticatedUserProvider;
import com.manna.ledger.security.RequestContextHolder;
import com.manna.ledger.tax.CategorizationAuditService;
import com.manna.ledger.tax.TaxCategorizationService;
import com.manna.ledger.tax.TaxReportService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tax")
public class TaxCategorizationController {

    private final TaxCategorizationService categorizationService;
    private final TaxReportService reportService;
    private final CategorizationAuditService auditService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public TaxCategorizationController(
            TaxCategorizationService categorizationService,
            TaxReportService reportService,
            CategorizationAuditService auditService,
            AuthenticatedUserProvider authenticatedUserProvider
    ) {
        this.categorizationService = categorizationService;
        this.reportService = reportService;
        this.auditService = auditService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @PostMapping("/categorize")
    public ResponseEntity<CategorizationResult> categorize(@RequestBody @Valid CategorizeRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var result = categorizationService.categorize(new CategorizationRequest(
                request.transactionId(),
                userId,
                request.taxCategoryId(),
                request.chartAccountId(),
                request.businessPercentage(),
                request.businessPurpose(),
                request.overrideAutomatedFlag()
        ));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/bulk-categorize")
    public ResponseEntity<BulkCategorizationResult> bulkCategorize(@RequestBody @Valid BulkCategorizeRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var result = categorizationService.bulkCategorize(
                request.transactionIds(),
                userId,
                request.taxCategoryId(),
                request.chartAccountId(),
                request.businessPercentage()
        );
        return ResponseEntity.ok(result);
    }

    @GetMapping("/summary/{taxYear}")
    public TaxSummary taxSummary(@PathVariable("taxYear") int taxYear) {
        return reportService.getTaxSummary(authenticatedUserProvider.requireCurrentUserId(), taxYear);
    }

    @GetMapping("/export/schedule-c/{taxYear}")
    public ScheduleCExport scheduleC(@PathVariable("taxYear") int taxYear) {
        return reportService.exportScheduleC(authenticatedUserProvider.requireCurrentUserId(), taxYear);
    }

    @GetMapping("/transactions/{transactionId}/audit")
    public AuditTrailResponseDto auditTrail(@PathVariable("transactionId") UUID transactionId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return new AuditTrailResponseDto(transactionId, auditService.getAuditTrail(transactionId, userId), traceId);
    }
}
