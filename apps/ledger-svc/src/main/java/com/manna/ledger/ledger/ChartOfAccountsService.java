package com.manna.ledger.ledger;

import com.manna.ledger.entity.CategoryMappingEntity;
import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.exception.DuplicateCodeException;
import com.manna.ledger.exception.InvalidParentException;
import com.manna.ledger.exception.NotFoundException;
import com.manna.ledger.exception.SystemAccountProtectedException;
import com.manna.ledger.exception.ValidationException;
import com.manna.ledger.model.AccountDeletion;
import com.manna.ledger.model.AccountNode;
import com.manna.ledger.model.AccountType;
import com.manna.ledger.model.AccountUpdate;
import com.manna.ledger.model.ChartAccount;
import com.manna.ledger.model.NewAccount;
import com.manna.ledger.model.NormalBalance;
import com.manna.ledger.repository.JpaCategoryMappingRepository;
import com.manna.ledger.repository.JpaChartOfAccountRepository;
import com.manna.ledger.repository.JpaTransactionRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-user chart of accounts: lifecycle, hierarchy and balances.
 */
@Service
public class ChartOfAccountsService {

    private static final Logger log = LoggerFactory.getLogger(ChartOfAccountsService.class);

    private final JpaChartOfAccountRepository accountRepository;
    private final JpaTransactionRepository transactionRepository;
    private final JpaCategoryMappingRepository mappingRepository;
    private final RlsGuard rlsGuard;
    private final Clock clock;

    public ChartOfAccountsService(JpaChartOfAccountRepository accountRepository,
                                  JpaTransactionRepository transactionRepository,
                                  JpaCategoryMappingRepository mappingRepository,
                                  RlsGuard rlsGuard,
                                  Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.mappingRepository = mappingRepository;
        this.rlsGuard = rlsGuard;
        this.clock = clock;
    }

    @Transactional
    public ChartAccount createAccount(UUID userId, NewAccount request) {
        rlsGuard.setAppsecUser(userId);
        if (request.accountCode() == null || request.accountCode().isBlank()) {
            throw new ValidationException("accountCode", "accountCode is required");
        }
        if (request.accountName() == null || request.accountName().isBlank()) {
            throw new ValidationException("accountName", "accountName is required");
        }
        if (request.accountType() == null) {
            throw new ValidationException("accountType", "accountType is required");
        }
        NormalBalance normalBalance = checkNormalBalance(request.accountType(), request.normalBalance());
        if (accountRepository.existsByUserIdAndAccountCode(userId, request.accountCode())) {
            throw new DuplicateCodeException(request.accountCode(),
                    "Account code " + request.accountCode() + " already exists");
        }
        if (request.parentAccountId() != null) {
            requireUsableParent(userId, request.parentAccountId());
        }

        Instant now = Instant.now(clock);
        ChartOfAccountEntity entity = new ChartOfAccountEntity();
        entity.setId(UUID.randomUUID());
        entity.setUserId(userId);
        entity.setAccountCode(request.accountCode());
        entity.setAccountName(request.accountName());
        entity.setAccountType(request.accountType());
        entity.setNormalBalance(normalBalance);
        entity.setParentAccountId(request.parentAccountId());
        entity.setDescription(request.description());
        entity.setSystemAccount(request.systemAccount());
        entity.setCurrentBalance(BigDecimal.ZERO);
        entity.setTaxCategory(request.taxCategory());
        entity.setTaxLineMapping(request.taxLineMapping());
        entity.setRequires1099(request.requires1099());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        ChartOfAccountEntity saved = accountRepository.save(entity);
        log.info("chart_account_created userId={} accountId={} code={} type={}",
                userId, saved.getId(), saved.getAccountCode(), saved.getAccountType());
        return toModel(saved);
    }

    @Transactional
    public ChartAccount updateAccount(UUID userId, UUID accountId, AccountUpdate update) {
        rlsGuard.setAppsecUser(userId);
        ChartOfAccountEntity account = requireAccount(userId, accountId);
        if (account.isSystemAccount() && update.touchesStructure()) {
            throw new SystemAccountProtectedException(account.getAccountCode(),
                    "Cannot change code, type or normal balance of system account " + account.getAccountCode());
        }

        if (update.accountCode() != null && !update.accountCode().equals(account.getAccountCode())) {
            if (update.accountCode().isBlank()) {
                throw new ValidationException("accountCode", "accountCode must not be blank");
            }
            if (accountRepository.existsByUserIdAndAccountCode(userId, update.accountCode())) {
                throw new DuplicateCodeException(update.accountCode(),
                        "Account code " + update.accountCode() + " already exists");
            }
            account.setAccountCode(update.accountCode());
        }
        if (update.accountType() != null || update.normalBalance() != null) {
            AccountType type = update.accountType() != null ? update.accountType() : account.getAccountType();
            account.setAccountType(type);
            account.setNormalBalance(checkNormalBalance(type, update.normalBalance()));
        }
        if (update.parentAccountId() != null && !update.parentAccountId().equals(account.getParentAccountId())) {
            ChartOfAccountEntity parent = requireUsableParent(userId, update.parentAccountId());
            rejectCycle(userId, account.getId(), parent);
            account.setParentAccountId(parent.getId());
        }
        if (update.accountName() != null) {
            if (update.accountName().isBlank()) {
                throw new ValidationException("accountName", "accountName must not be blank");
            }
            account.setAccountName(update.accountName());
        }
        if (update.description() != null) {
            account.setDescription(update.description());
        }
        if (update.taxCategory() != null) {
            account.setTaxCategory(update.taxCategory());
        }
        if (update.taxLineMapping() != null) {
            account.setTaxLineMapping(update.taxLineMapping());
        }
        if (update.requires1099() != null) {
            account.setRequires1099(update.requires1099());
        }
        if (update.active() != null) {
            if (account.isSystemAccount() && !update.active()) {
                throw new SystemAccountProtectedException(account.getAccountCode(),
                        "Cannot deactivate system account " + account.getAccountCode());
            }
            account.setActive(update.active());
            if (!update.active()) {
                deactivateMappings(account.getId());
            }
        }
        account.setUpdatedAt(Instant.now(clock));
        ChartOfAccountEntity saved = accountRepository.save(account);
        log.info("chart_account_updated userId={} accountId={} code={}", userId, saved.getId(), saved.getAccountCode());
        return toModel(saved);
    }

    /**
     * Removes an account, or only deactivates it while transactions, child accounts or category
     * mappings still point at it.
     */
    @Transactional
    public AccountDeletion deleteAccount(UUID userId, UUID accountId) {
        rlsGuard.setAppsecUser(userId);
        ChartOfAccountEntity account = requireAccount(userId, accountId);
        if (account.isSystemAccount()) {
            throw new SystemAccountProtectedException(account.getAccountCode(),
                    "Cannot delete system account " + account.getAccountCode());
        }
        long references = transactionRepository.countByChartAccountId(accountId)
                + accountRepository.countByParentAccountId(accountId)
                + mappingRepository.countByChartAccountId(accountId);
        if (references > 0) {
            account.setActive(false);
            account.setUpdatedAt(Instant.now(clock));
            accountRepository.save(account);
            int mappings = deactivateMappings(accountId);
            log.info("chart_account_deactivated userId={} accountId={} references={} mappingsDeactivated={}",
                    userId, accountId, references, mappings);
            return new AccountDeletion(accountId, account.getAccountCode(), true);
        }
        accountRepository.delete(account);
        log.info("chart_account_deleted userId={} accountId={}", userId, accountId);
        return new AccountDeletion(accountId, account.getAccountCode(), false);
    }

    private int deactivateMappings(UUID accountId) {
        List<CategoryMappingEntity> mappings = mappingRepository.findByChartAccountIdAndActiveTrue(accountId);
        for (CategoryMappingEntity mapping : mappings) {
            mapping.setActive(false);
        }
        mappingRepository.saveAll(mappings);
        return mappings.size();
    }

    @Transactional(readOnly = true)
    public List<ChartAccount> listAccounts(UUID userId, AccountType accountType) {
        rlsGuard.setAppsecUser(userId);
        List<ChartOfAccountEntity> accounts = accountType == null
                ? accountRepository.findByUserIdAndActiveTrueOrderByAccountCodeAsc(userId)
                : accountRepository.findByUserIdAndAccountTypeAndActiveTrueOrderByAccountCodeAsc(userId, accountType);
        return accounts.stream().map(ChartOfAccountsService::toModel).toList();
    }

    /**
     * Active accounts as a forest. An account whose parent is inactive is listed as a root.
     */
    @Transactional(readOnly = true)
    public List<AccountNode> getHierarchy(UUID userId) {
        rlsGuard.setAppsecUser(userId);
        List<ChartOfAccountEntity> accounts = accountRepository.findByUserIdAndActiveTrueOrderByAccountCodeAsc(userId);
        Map<UUID, List<ChartOfAccountEntity>> children = new LinkedHashMap<>();
        Set<UUID> ids = new HashSet<>();
        accounts.forEach(account -> ids.add(account.getId()));
        List<ChartOfAccountEntity> roots = new ArrayList<>();
        for (ChartOfAccountEntity account : accounts) {
            UUID parentId = account.getParentAccountId();
            if (parentId == null || !ids.contains(parentId)) {
                roots.add(account);
            } else {
                children.computeIfAbsent(parentId, key -> new ArrayList<>()).add(account);
            }
        }
        return roots.stream().map(root -> toNode(root, children)).toList();
    }

    @Transactional
    public ChartAccount getAccount(UUID userId, UUID accountId) {
        rlsGuard.setAppsecUser(userId);
        ChartOfAccountEntity account = requireAccount(userId, accountId);
        refreshBalance(account, null);
        return toModel(account);
    }

    /**
     * Recomputes the balance from linked transactions and overwrites the cached value.
     */
    @Transactional
    public BigDecimal getAccountBalance(UUID accountId, UUID userId, LocalDate asOfDate) {
        rlsGuard.setAppsecUser(userId);
        return refreshBalance(requireAccount(userId, accountId), asOfDate);
    }

    BigDecimal refreshBalance(ChartOfAccountEntity account, LocalDate asOfDate) {
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        List<Object[]> rows = asOfDate == null
                ? transactionRepository.debitCreditTotals(account.getId(), account.getUserId())
                : transactionRepository.debitCreditTotalsAsOf(account.getId(), account.getUserId(), asOfDate);
        if (!rows.isEmpty() && rows.get(0) != null) {
            debits = toDecimal(rows.get(0)[0]);
            credits = toDecimal(rows.get(0)[1]);
        }
        BigDecimal balance = account.getNormalBalance() == NormalBalance.DEBIT
                ? debits.subtract(credits)
                : credits.subtract(debits);
        account.setCurrentBalance(balance);
        accountRepository.save(account);
        return balance;
    }

    List<ChartOfAccountEntity> activeAccounts(UUID userId) {
        return accountRepository.findByUserIdAndActiveTrueOrderByAccountCodeAsc(userId);
    }

    private ChartOfAccountEntity requireAccount(UUID userId, UUID accountId) {
        return accountRepository.findByIdAndUserId(accountId, userId)
                .orElseThrow(() -> new NotFoundException("Chart account", accountId));
    }

    private ChartOfAccountEntity requireUsableParent(UUID userId, UUID parentAccountId) {
        ChartOfAccountEntity parent = accountRepository.findByIdAndUserId(parentAccountId, userId)
                .orElseThrow(() -> new InvalidParentException(parentAccountId, "not found"));
        if (!parent.isActive()) {
            throw new InvalidParentException(parentAccountId, "is inactive");
        }
        return parent;
    }

    private void rejectCycle(UUID userId, UUID accountId, ChartOfAccountEntity newParent) {
        Set<UUID> visited = new HashSet<>();
        ChartOfAccountEntity cursor = newParent;
        while (cursor != null) {
            if (cursor.getId().equals(accountId)) {
                throw new InvalidParentException(newParent.getId(), "would create a cycle");
            }
            if (!visited.add(cursor.getId()) || cursor.getParentAccountId() == null) {
                return;
            }
            cursor = accountRepository.findByIdAndUserId(cursor.getParentAccountId(), userId).orElse(null);
        }
    }

    private static NormalBalance checkNormalBalance(AccountType type, NormalBalance requested) {
        if (requested == null) {
            return type.normalBalance();
        }
        if (requested != type.normalBalance()) {
            throw new ValidationException("normalBalance",
                    type + " accounts carry a " + type.normalBalance() + " normal balance");
        }
        return requested;
    }

    private static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }

    private static AccountNode toNode(ChartOfAccountEntity account, Map<UUID, List<ChartOfAccountEntity>> children) {
        List<AccountNode> nested = children.getOrDefault(account.getId(), List.of()).stream()
                .map(child -> toNode(child, children))
                .toList();
        return new AccountNode(
                account.getId(),
                account.getAccountCode(),
                account.getAccountName(),
                account.getAccountType(),
                account.getNormalBalance(),
                account.getCurrentBalance(),
                account.getTaxCategory(),
                account.getTaxLineMapping(),
                account.isSystemAccount(),
                nested
        );
    }

    static ChartAccount toModel(ChartOfAccountEntity entity) {
        return new ChartAccount(
                entity.getId(),
                entity.getUserId(),
                entity.getAccountCode(),
                entity.getAccountName(),
                entity.getAccountType(),
                entity.getNormalBalance(),
                entity.getParentAccountId(),
                entity.getDescription(),
                entity.isActive(),
                entity.isSystemAccount(),
                entity.getCurrentBalance(),
                entity.getTaxCategory(),
                entity.getTaxLineMapping(),
                entity.isRequires1099(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
