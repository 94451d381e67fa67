package com.manna.ledger.controller;

import com.manna.ledger.controller.dto.AccountBalanceResponseDto;
import com.manna.ledger.controller.dto.ChartAccountCreateRequestDto;
import com.manna.ledger.controller.dto.ChartAccountUpdateRequestDto;
import com.manna.ledger.controller.dto.ChartAccountsListResponseDto;
import com.manna.ledger.ledger.ChartOfAccountsService;
import com.manna.ledger.ledger.LedgerReportService;
import com.manna.ledger.model.AccountDeletion;
import com.manna.ledger.model.AccountNode;
import com.manna.ledger.model.AccountType;
import com.manna.ledger.model.AccountUpdate;
import com.manna.ledger.model.ChartAccount;
import com.manna.ledger.model.FinancialStatements;
import com.manna.ledger.model.NewAccount;
import com.manna.ledger.model.TrialBalance;
import com.manna.ledger.security.AuthenticatedUserProvider;
import com.manna.ledger.security.RequestContextHolder;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/chart-of-accounts")
public class ChartOfAccountsController {

    private final ChartOfAccountsService chartOfAccountsService;
    private final LedgerReportService ledgerReportService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public ChartOfAccountsController(
            ChartOfAccountsService chartOfAccountsService,
            LedgerReportService ledgerReportService,
            AuthenticatedUserProvider authenticatedUserProvider
    ) {
        this.chartOfAccountsService = chartOfAccountsService;
        this.ledgerReportService = ledgerReportService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @PostMapping
    public ResponseEntity<ChartAccount> createAccount(@RequestBody @Valid ChartAccountCreateRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var created = chartOfAccountsService.createAccount(userId, new NewAccount(
                request.accountCode(),
                request.accountName(),
                request.accountType(),
                request.normalBalance(),
                request.parentAccountId(),
                request.description(),
                request.taxCategory(),
                request.taxLineMapping(),
                Boolean.TRUE.equals(request.requires1099()),
                false
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ChartAccountsListResponseDto listAccounts(
            @RequestParam(value = "accountType", required = false) AccountType accountType
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return new ChartAccountsListResponseDto(chartOfAccountsService.listAccounts(userId, accountType), traceId);
    }

    @GetMapping("/hierarchy")
    public List<AccountNode> hierarchy() {
        return chartOfAccountsService.getHierarchy(authenticatedUserProvider.requireCurrentUserId());
    }

    @GetMapping("/{accountId}")
    public ChartAccount getAccount(@PathVariable("accountId") UUID accountId) {
        return chartOfAccountsService.getAccount(authenticatedUserProvider.requireCurrentUserId(), accountId);
    }

    @GetMapping("/{accountId}/balance")
    public AccountBalanceResponseDto getBalance(
            @PathVariable("accountId") UUID accountId,
            @RequestParam(value = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return new AccountBalanceResponseDto(accountId, chartOfAccountsService.getAccountBalance(accountId, userId, asOf), asOf);
    }

    @PatchMapping("/{accountId}")
    public ChartAccount updateAccount(
            @PathVariable("accountId") UUID accountId,
            @RequestBody @Valid ChartAccountUpdateRequestDto request
    ) {
        var update = new AccountUpdate(
                request.accountName(),
                request.description(),
                request.taxCategory(),
                request.taxLineMapping(),
                request.requires1099(),
                request.active(),
                request.parentAccountId(),
                request.accountCode(),
                request.accountType(),
                request.normalBalance()
        );
        return chartOfAccountsService.updateAccount(authenticatedUserProvider.requireCurrentUserId(), accountId, update);
    }

    @DeleteMapping("/{accountId}")
    public AccountDeletion deleteAccount(@PathVariable("accountId") UUID accountId) {
        return chartOfAccountsService.deleteAccount(authenticatedUserProvider.requireCurrentUserId(), accountId);
    }

    @GetMapping("/reports/trial-balance")
    public TrialBalance trialBalance(
            @RequestParam(value = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ledgerReportService.getTrialBalance(authenticatedUserProvider.requireCurrentUserId(), asOf);
    }

    @GetMapping("/reports/financial-statements")
    public FinancialStatements financialStatements(
            @RequestParam(value = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ledgerReportService.generateFinancialStatements(authenticatedUserProvider.requireCurrentUserId(), asOf);
    }
}
