package com.manna.ledger.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.manna.ledger.entity.CategoryMappingEntity;
import com.manna.ledger.entity.ChartOfAccountEntity;
import com.manna.ledger.exception.InvalidReferenceException;
import com.manna.ledger.exception.NotFoundException;
import com.manna.ledger.exception.ValidationException;
import com.manna.ledger.model.CategoryMapping;
import com.manna.ledger.model.NewCategoryMapping;
import com.manna.ledger.repository.JpaCategoryMappingRepository;
import com.manna.ledger.repository.JpaChartOfAccountRepository;
import com.manna.ledger.security.RlsGuard;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class CategoryMappingServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @Mock
    JpaCategoryMappingRepository mappingRepository;
    @Mock
    JpaChartOfAccountRepository chartOfAccountRepository;
    @Mock
    TaxCategoryCatalog catalog;
    @Mock
    RlsGuard rlsGuard;

    CategoryMappingService service;

    private final UUID userId = UUID.randomUUID();
    private final UUID sourceCategoryId = UUID.randomUUID();
    private ChartOfAccountEntity account;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T08:00:00Z"), ZoneOffset.UTC);
        service = new CategoryMappingService(mappingRepository, chartOfAccountRepository, catalog, rlsGuard, clock);
        account = new ChartOfAccountEntity();
        account.setId(UUID.randomUUID());
        account.setUserId(userId);
        account.setAccountCode("5200");
        account.setActive(true);
        lenient().when(chartOfAccountRepository.findByIdAndUserId(account.getId(), userId)).thenReturn(Optional.of(account));
        lenient().when(mappingRepository.saveAndFlush(any(CategoryMappingEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createMappingAppliesDefaults() {
        CategoryMapping mapping = service.createMapping(userId, request(null, null));

        assertThat(mapping.userId()).isEqualTo(userId);
        assertThat(mapping.confidenceScore()).isEqualByComparingTo("1");
        assertThat(mapping.effectiveDate()).isEqualTo(TODAY);
        assertThat(mapping.userDefined()).isTrue();
        assertThat(mapping.active()).isTrue();
        verify(rlsGuard).setAppsecUser(userId);
    }

    @Test
    void confidenceAboveOneIsRejected() {
        assertThatThrownBy(() -> service.createMapping(userId, request(new BigDecimal("1.5"), null)))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("confidenceScore");
        verify(mappingRepository, never()).saveAndFlush(any());
    }

    @Test
    void unknownTaxCategoryIsNotFound() {
        UUID taxCategoryId = UUID.randomUUID();
        when(catalog.findById(taxCategoryId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createMapping(userId, request(null, taxCategoryId)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void inactiveAccountIsAnInvalidReference() {
        account.setActive(false);

        assertThatThrownBy(() -> service.createMapping(userId, request(null, null)))
                .isInstanceOf(InvalidReferenceException.class);
    }

    @Test
    void secondActiveMappingOnSameDateIsRejected() {
        when(mappingRepository.existsByUserIdAndSourceCategoryIdAndEffectiveDateAndActiveTrue(userId, sourceCategoryId, TODAY))
                .thenReturn(true);

        assertThatThrownBy(() -> service.createMapping(userId, request(null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void concurrentInsertHittingUniqueIndexIsReportedAsValidationError() {
        when(mappingRepository.saveAndFlush(any(CategoryMappingEntity.class)))
                .thenThrow(new DataIntegrityViolationException("ux_category_mappings_active_source"));

        assertThatThrownBy(() -> service.createMapping(userId, request(null, null)))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("sourceCategoryId");
    }

    @Test
    void deactivateMappingKeepsTheRow() {
        CategoryMappingEntity entity = new CategoryMappingEntity();
        entity.setId(UUID.randomUUID());
        entity.setUserId(userId);
        entity.setActive(true);
        when(mappingRepository.findByIdAndUserId(entity.getId(), userId)).thenReturn(Optional.of(entity));

        CategoryMapping mapping = service.deactivateMapping(userId, entity.getId());

        assertThat(mapping.active()).isFalse();
        verify(mappingRepository).save(entity);
    }

    private NewCategoryMapping request(BigDecimal confidence, UUID taxCategoryId) {
        return new NewCategoryMapping(sourceCategoryId, account.getId(), taxCategoryId, confidence, null,
                null, null, null, false, null);
    }
}
