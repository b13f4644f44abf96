package com.flagship.wallet_ledger.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.api.dto.CreateTransactionRequest;
import com.flagship.wallet_ledger.api.dto.WalletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JacksonConfigTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("Amounts are read exactly as sent")
    void testReadsAmountExactly() throws Exception {
        CreateTransactionRequest request = mapper.readValue(
            "{\"wallet_id\": \"" + UUID.randomUUID() + "\", \"amount\": 123456789012345678}",
            CreateTransactionRequest.class);

        assertEquals(new BigDecimal("123456789012345678"), request.getAmount());
    }

    @Test
    @DisplayName("Oversized number literals fail while parsing")
    void testRejectsOversizedLiteral() {
        String seventyDigits = "1".repeat(70);

        assertThrows(JsonProcessingException.class, () -> mapper.readValue(
            "{\"wallet_id\": \"" + UUID.randomUUID() + "\", \"amount\": " + seventyDigits + "}",
            CreateTransactionRequest.class));
    }

    @Test
    @DisplayName("Balances are written plain and timestamps as ISO-8601")
    void testWritesPlainBalance() throws Exception {
        WalletResponse response = WalletResponse.builder()
            .id(UUID.randomUUID())
            .label("Alice")
            .balance(new BigDecimal("1E+3"))
            .active(true)
            .createdAt(Instant.parse("2024-05-01T10:15:30Z"))
            .updatedAt(Instant.parse("2024-05-01T10:15:30Z"))
            .build();

        String json = mapper.writeValueAsString(response);

        assertTrue(json.contains("\"balance\":1000"), json);
        assertTrue(json.contains("\"created_at\":\"2024-05-01T10:15:30Z\""), json);
    }
}
