package com.manna.ledger.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.manna.ledger.entity.CategorizationAuditEntity;
import com.manna.ledger.model.AuditAction;
import com.manna.ledger.model.AuditEntry;
import com.manna.ledger.repository.JpaCategorizationAuditRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategorizationAuditServiceTest {

    @Mock
    JpaCategorizationAuditRepository auditRepository;
    @Mock
    RlsGuard rlsGuard;

    CategorizationAuditService service;

    private final UUID userId = UUID.randomUUID();
    private final UUID transactionId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new CategorizationAuditService(auditRepository, rlsGuard, Clock.systemUTC());
        when(auditRepository.save(any(CategorizationAuditEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void firstEntryHasNoPriorConfidence() {
        when(auditRepository.findFirstByTransactionIdOrderByCreatedAtDesc(transactionId)).thenReturn(Optional.empty());

        AuditEntry entry = service.record(transactionId, userId, AuditAction.TAX_CATEGORIZE, null, UUID.randomUUID(),
                null, UUID.randomUUID(), "keyword", new BigDecimal("0.5"), true);

        assertThat(entry.confidenceBefore()).isNull();
        assertThat(entry.confidenceAfter()).isEqualByComparingTo("0.5000");
        assertThat(entry.automated()).isTrue();
    }

    @Test
    void previousConfidenceCarriesForward() {
        CategorizationAuditEntity previous = new CategorizationAuditEntity(UUID.randomUUID(), transactionId, userId,
                AuditAction.TAX_CATEGORIZE, null, null, null, null, "keyword", null, new BigDecimal("0.5000"), true,
                Instant.parse("2025-01-01T00:00:00Z"));
        when(auditRepository.findFirstByTransactionIdOrderByCreatedAtDesc(transactionId)).thenReturn(Optional.of(previous));

        AuditEntry entry = service.record(transactionId, userId, AuditAction.TAX_CATEGORIZE, null, null, null, null,
                "manual", BigDecimal.ONE, false);

        assertThat(entry.confidenceBefore()).isEqualByComparingTo("0.5");
        assertThat(entry.confidenceAfter()).isEqualByComparingTo("1");
        assertThat(entry.reason()).isEqualTo("manual");
    }
}
