package com.manna.ledger.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.manna.ledger.entity.TaxCategoryEntity;
import com.manna.ledger.entity.TransactionEntity;
import com.manna.ledger.model.TransactionType;
import com.manna.ledger.repository.JpaBusinessExpenseTrackingRepository;
import com.manna.ledger.repository.JpaTaxCategoryRepository;
import com.manna.ledger.repository.JpaTransactionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class LedgerApiIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    JpaTaxCategoryRepository taxCategoryRepository;

    @Autowired
    JpaTransactionRepository transactionRepository;

    @Autowired
    JpaBusinessExpenseTrackingRepository trackingRepository;

    private UUID userId;
    private UUID mealsCategoryId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        TaxCategoryEntity meals = new TaxCategoryEntity();
        meals.setId(UUID.randomUUID());
        meals.setCode("MEALS_" + meals.getId().toString().substring(0, 8));
        meals.setName("Meals");
        meals.setTaxForm("Schedule C");
        meals.setTaxLine("Line 24b");
        meals.setDeductionType("business");
        meals.setPercentageLimit(new BigDecimal("50"));
        meals.setDocumentationRequired(true);
        meals.setBusinessExpense(true);
        meals.setActive(true);
        meals.setEffectiveDate(LocalDate.of(2020, 1, 1));
        meals.setKeywords(List.of("restaurant", "dinner", "lunch"));
        meals.setExclusions(List.of());
        meals.setSpecialRules(Map.of());
        meals.setCreatedAt(Instant.now());
        mealsCategoryId = taxCategoryRepository.save(meals).getId();
    }

    @Test
    void requestsWithoutTokenAreRejected() throws Exception {
        mockMvc.perform(get("/chart-of-accounts"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void categorizeMealComputesHalfDeductionAndWritesAudit() throws Exception {
        UUID accountId = createAccount("5100", "Meals Expense", "EXPENSE");
        TransactionEntity dinner = saveTransaction("Client dinner", "85.00");

        mockMvc.perform(post("/tax/categorize").with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "transactionId", dinner.getId(),
                                "taxCategoryId", mealsCategoryId,
                                "chartAccountId", accountId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.deductibleAmount").value(42.5))
                .andExpect(jsonPath("$.scheduleCLine").value("Line 24b"))
                .andExpect(jsonPath("$.requiresSubstantiation").value(true))
                .andExpect(jsonPath("$.source").value("manual"));

        TransactionEntity stored = transactionRepository.findById(dinner.getId()).orElseThrow();
        assertThat(stored.getDeductibleAmount()).isEqualByComparingTo("42.50");
        assertThat(stored.getTaxYear()).isEqualTo(LocalDate.now().getYear());
        assertThat(trackingRepository.findByTransactionId(dinner.getId())).isPresent();

        mockMvc.perform(get("/tax/transactions/{id}/audit", dinner.getId()).with(user()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries.length()").value(1))
                .andExpect(jsonPath("$.entries[0].reason").value("manual"));
    }

    @Test
    void categorizingUnknownTransactionReturnsNotFound() throws Exception {
        mockMvc.perform(post("/tax/categorize").with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "transactionId", UUID.randomUUID(),
                                "taxCategoryId", mealsCategoryId))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void businessPercentageOutOfRangeFailsValidation() throws Exception {
        TransactionEntity dinner = saveTransaction("Client dinner", "85.00");

        mockMvc.perform(post("/tax/categorize").with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "transactionId", dinner.getId(),
                                "businessPercentage", 150))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.businessPercentage").exists());
    }

    @Test
    void bulkCategorizeReportsPartialSuccess() throws Exception {
        UUID accountId = createAccount("5100", "Meals Expense", "EXPENSE");
        TransactionEntity lunch = saveTransaction("Team lunch", "30.00");

        mockMvc.perform(post("/tax/bulk-categorize").with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "transactionIds", List.of(lunch.getId(), UUID.randomUUID()),
                                "taxCategoryId", mealsCategoryId,
                                "chartAccountId", accountId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successCount").value(1))
                .andExpect(jsonPath("$.errorCount").value(1))
                .andExpect(jsonPath("$.errors[0].code").value("NOT_FOUND"));
    }

    @Test
    void accountCodesAreUniquePerUser() throws Exception {
        createAccount("5100", "Meals Expense", "EXPENSE");

        mockMvc.perform(post("/chart-of-accounts").with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(accountBody("5100", "Duplicate", "EXPENSE")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_CODE"));

        mockMvc.perform(post("/chart-of-accounts").with(jwt().jwt(j -> j.subject(UUID.randomUUID().toString())))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(accountBody("5100", "Meals Expense", "EXPENSE")))
                .andExpect(status().isCreated());
    }

    @Test
    void accountWithTransactionsIsDeactivatedOnDelete() throws Exception {
        UUID accountId = createAccount("5200", "Office Supplies", "EXPENSE");
        for (int i = 0; i < 5; i++) {
            TransactionEntity tx = saveTransaction("Paper " + i, "10.00");
            tx.setChartAccountId(accountId);
            transactionRepository.save(tx);
        }

        mockMvc.perform(delete("/chart-of-accounts/{id}", accountId).with(user()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deactivated").value(true));

        mockMvc.perform(get("/chart-of-accounts").with(user()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accounts.length()").value(0));
    }

    @Test
    void reparentingIntoOwnSubtreeIsUnprocessable() throws Exception {
        UUID parent = createAccount("6000", "Operating", "EXPENSE");
        UUID child = createAccount("6100", "Rent", "EXPENSE");
        mockMvc.perform(patch("/chart-of-accounts/{id}", child).with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("parentAccountId", parent))))
                .andExpect(status().isOk());

        mockMvc.perform(patch("/chart-of-accounts/{id}", parent).with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("parentAccountId", child))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_PARENT"));
    }

    @Test
    void trialBalanceIsAvailableForEmptyBook() throws Exception {
        createAccount("1000", "Cash", "ASSET");

        mockMvc.perform(get("/chart-of-accounts/reports/trial-balance").with(user()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accounts.length()").value(1))
                .andExpect(jsonPath("$.balanced").value(true));
    }

    private JwtRequestPostProcessor user() {
        return jwt().jwt(j -> j.subject(userId.toString()));
    }

    private UUID createAccount(String code, String name, String type) throws Exception {
        MvcResult result = mockMvc.perform(post("/chart-of-accounts").with(user())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(accountBody(code, name, type)))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }

    private String accountBody(String code, String name, String type) throws Exception {
        return objectMapper.writeValueAsString(Map.of("accountCode", code, "accountName", name, "accountType", type));
    }

    private TransactionEntity saveTransaction(String name, String amount) {
        TransactionEntity tx = new TransactionEntity(UUID.randomUUID(), userId, null, name, null, null,
                new BigDecimal(amount), TransactionType.DEBIT, LocalDate.now(), null);
        return transactionRepository.save(tx);
    }
}
