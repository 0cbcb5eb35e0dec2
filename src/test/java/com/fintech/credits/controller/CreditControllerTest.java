package com.fintech.credits.controller;

import com.fintech.credits.dto.LedgerResult;
import com.fintech.credits.entity.CreditTransaction;
import com.fintech.credits.entity.CreditTransactionType;
import com.fintech.credits.entity.UserCreditBalance;
import com.fintech.credits.exception.InsufficientBalanceException;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.service.CreditLedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for CreditController and the error mapping in ApiExceptionHandler.
 */
@WebMvcTest(CreditController.class)
class CreditControllerTest {

    private static final UUID SUBJECT = UUID.fromString("6f1c2a7e-3b4d-4e5f-8a9b-0c1d2e3f4a5b");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreditLedgerService ledgerService;

    @Test
    @DisplayName("Should return the balance for a subject and provider")
    void shouldReturnBalance() throws Exception {
        when(ledgerService.getBalance(SUBJECT, "semo")).thenReturn(balance("70.00"));

        mockMvc.perform(get("/api/v1/credits/{subjectId}/balance", SUBJECT).param("provider", "semo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentBalance").value(70.00))
                .andExpect(jsonPath("$.provider").value("semo"));
    }

    @Test
    @DisplayName("Should answer 402 with the shortfall when credits are insufficient")
    void shouldMapInsufficientBalance() throws Exception {
        when(ledgerService.useCredits(eq(SUBJECT), eq("semo"), any(), anyString(), eq("x"), isNull()))
                .thenThrow(new InsufficientBalanceException(new BigDecimal("30.00"), new BigDecimal("20.00")));

        mockMvc.perform(post("/api/v1/credits/{subjectId}/usage", SUBJECT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"semo\",\"amount\":30,\"description\":\"report\",\"featureName\":\"x\"}"))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.shortfall").value(10.00));
    }

    @Test
    @DisplayName("Should answer 404 when the subject has no balance to debit")
    void shouldMapNotFound() throws Exception {
        when(ledgerService.useCredits(eq(SUBJECT), eq("semo"), any(), anyString(), any(), any()))
                .thenThrow(new NotFoundException("Credit balance", SUBJECT + "/semo"));

        mockMvc.perform(post("/api/v1/credits/{subjectId}/usage", SUBJECT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"semo\",\"amount\":1,\"description\":\"report\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Should reject an invalid body before reaching the ledger")
    void shouldRejectInvalidBody() throws Exception {
        mockMvc.perform(post("/api/v1/credits/{subjectId}/usage", SUBJECT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"semo\",\"amount\":-5,\"description\":\"report\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(ledgerService);
    }

    @Test
    @DisplayName("Should answer 201 for a new allocation and 200 for a replayed one")
    void shouldDistinguishReplayedAllocation() throws Exception {
        String body = "{\"provider\":\"semo\",\"amount\":100,\"description\":\"grant\",\"referenceId\":\"promo-1\"}";
        when(ledgerService.allocateCredits(eq(SUBJECT), eq("semo"), any(), eq("grant"), eq("promo-1")))
                .thenReturn(result(false), result(true));

        mockMvc.perform(post("/api/v1/credits/{subjectId}/allocations", SUBJECT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.replayed").value(false));

        mockMvc.perform(post("/api/v1/credits/{subjectId}/allocations", SUBJECT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replayed").value(true));
    }

    @Test
    @DisplayName("Should answer 400 for a reference already recorded for another subject")
    void shouldRejectForeignReference() throws Exception {
        when(ledgerService.allocateCredits(eq(SUBJECT), eq("semo"), any(), eq("grant"), eq("stripe:in_1")))
                .thenThrow(new ValidationException(
                        "Reference stripe:in_1 was already used by a different subject or provider"));

        mockMvc.perform(post("/api/v1/credits/{subjectId}/allocations", SUBJECT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"semo\",\"amount\":100,\"description\":\"grant\","
                                + "\"referenceId\":\"stripe:in_1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.transaction").doesNotExist());
    }

    @Test
    @DisplayName("Should reject a malformed subject id")
    void shouldRejectMalformedSubject() throws Exception {
        mockMvc.perform(get("/api/v1/credits/{subjectId}/balance", "not-a-uuid").param("provider", "semo"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    private UserCreditBalance balance(String amount) {
        return UserCreditBalance.builder()
                .subjectId(SUBJECT)
                .provider("semo")
                .currentBalance(new BigDecimal(amount))
                .build();
    }

    private LedgerResult result(boolean replayed) {
        return LedgerResult.builder()
                .balance(balance("100.00"))
                .transaction(CreditTransaction.builder()
                        .subjectId(SUBJECT)
                        .provider("semo")
                        .type(CreditTransactionType.ALLOCATION)
                        .amount(new BigDecimal("100.00"))
                        .balanceAfter(new BigDecimal("100.00"))
                        .referenceId("promo-1")
                        .build())
                .replayed(replayed)
                .build();
    }
}
