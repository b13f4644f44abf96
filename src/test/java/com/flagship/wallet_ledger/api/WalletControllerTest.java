package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.ledger.WalletDeactivation;
import com.flagship.wallet_ledger.orchestration.WalletTransactionOrchestrationService;
import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.PageResult;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException;
import com.flagship.wallet_ledger.shared.exception.WalletNotFoundException;
import com.flagship.wallet_ledger.transaction.TransactionDomainService;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletDomainService;
import com.flagship.wallet_ledger.wallet.WalletFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {WalletController.class, TransactionController.class})
class WalletControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WalletDomainService walletService;

    @MockBean
    private TransactionDomainService transactionService;

    @MockBean
    private WalletTransactionOrchestrationService orchestrationService;

    private static Wallet wallet(String label, long balance) {
        Instant now = Instant.parse("2024-05-01T10:15:30Z");
        return new Wallet(WalletId.newId(), label, Money.of(balance), true, null, now, now);
    }

    @Test
    @DisplayName("POST /api/v1/wallets creates a wallet")
    void testCreateWallet() throws Exception {
        Wallet alice = wallet("Alice", 0);
        when(walletService.createWallet("Alice")).thenReturn(alice);

        mockMvc.perform(post("/api/v1/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"label\": \"Alice\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(alice.getId().toString()))
            .andExpect(jsonPath("$.label").value("Alice"))
            .andExpect(jsonPath("$.balance").value(0))
            .andExpect(jsonPath("$.is_active").value(true))
            .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    @DisplayName("Blank label fails bean validation with 400")
    void testCreateWalletBlankLabel() throws Exception {
        mockMvc.perform(post("/api/v1/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"label\": \"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION"))
            .andExpect(jsonPath("$.details.label").exists());

        verify(walletService, never()).createWallet(any());
    }

    @Test
    @DisplayName("Unknown wallet maps to 404 with the id in the message")
    void testGetWalletNotFound() throws Exception {
        WalletId id = WalletId.newId();
        when(walletService.getWallet(id)).thenThrow(new WalletNotFoundException(id));

        mockMvc.perform(get("/api/v1/wallets/{id}", id.toString()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"))
            .andExpect(jsonPath("$.message").value("Wallet with ID " + id + " not found"))
            .andExpect(jsonPath("$.details.wallet_id").value(id.toString()));
    }

    @Test
    @DisplayName("Malformed wallet id maps to 400")
    void testMalformedWalletId() throws Exception {
        mockMvc.perform(get("/api/v1/wallets/{id}", "not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid wallet ID format: not-a-uuid"));
    }

    @Test
    @DisplayName("Listing parses filters and passes paging through")
    void testListWallets() throws Exception {
        Wallet alice = wallet("Alice", 300);
        UUID filtered = UUID.randomUUID();
        when(walletService.listWallets(any(), any()))
            .thenReturn(new PageResult<>(List.of(alice), 1, 1, 5, 1));

        mockMvc.perform(get("/api/v1/wallets")
                .param("is_active", "yes")
                .param("wallet_ids", filtered.toString())
                .param("page_size", "5")
                .param("ordering", "-created_at"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.page_size").value(5))
            .andExpect(jsonPath("$.has_next").value(false))
            .andExpect(jsonPath("$.results[0].balance").value(300));

        ArgumentCaptor<WalletFilter> filter = ArgumentCaptor.forClass(WalletFilter.class);
        verify(walletService).listWallets(filter.capture(), eq(PageQuery.of(1, 5, "-created_at")));
        assertEquals(Boolean.TRUE, filter.getValue().getActive());
        assertTrue(filter.getValue().getWalletIds().contains(WalletId.of(filtered)));
    }

    @Test
    @DisplayName("Invalid is_active filter maps to 400")
    void testListWalletsBadFilter() throws Exception {
        mockMvc.perform(get("/api/v1/wallets").param("is_active", "sometimes"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PATCH updates the label")
    void testUpdateLabel() throws Exception {
        Wallet renamed = wallet("Alice Savings", 0);
        when(walletService.updateLabel(renamed.getId(), "Alice Savings")).thenReturn(renamed);

        mockMvc.perform(patch("/api/v1/wallets/{id}", renamed.getId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"label\": \"Alice Savings\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.label").value("Alice Savings"));
    }

    @Test
    @DisplayName("DELETE deactivates the wallet with its transactions")
    void testDeactivate() throws Exception {
        Wallet alice = wallet("Alice", 300);
        alice.deactivate();
        Wallet deactivated = new Wallet(alice.getId(), "Alice", Money.ZERO, false,
            alice.getDeactivatedAt(), alice.getCreatedAt(), alice.getUpdatedAt());
        when(orchestrationService.deactivateWalletWithTransactions(alice.getId()))
            .thenReturn(new WalletDeactivation(deactivated, List.of(), Money.of(300)));

        mockMvc.perform(delete("/api/v1/wallets/{id}", alice.getId().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.wallet.is_active").value(false))
            .andExpect(jsonPath("$.wallet.balance").value(0))
            .andExpect(jsonPath("$.deactivated_total").value(300));
    }

    @Test
    @DisplayName("Deactivating twice maps to 422")
    void testDeactivateTwice() throws Exception {
        WalletId id = WalletId.newId();
        when(orchestrationService.deactivateWalletWithTransactions(id))
            .thenThrow(AlreadyDeactivatedException.wallet(id));

        mockMvc.perform(delete("/api/v1/wallets/{id}", id.toString()))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("ALREADY_DEACTIVATED"));
    }
}
