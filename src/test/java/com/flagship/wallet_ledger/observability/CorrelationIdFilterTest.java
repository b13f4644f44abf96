package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.shared.WalletId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Client correlation ID is logged during the request and echoed back")
    void testPropagatesClientId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/transactions");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response,
            (req, res) -> seen.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY)));

        assertEquals("abc-123", seen.get());
        assertEquals("abc-123", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Missing header gets a generated ID")
    void testGeneratesId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/v1/wallets"), response, (req, res) -> { });

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    @DisplayName("A wallet scope left open by a failing operation is closed with the request")
    void testEndRequestClearsWallet() {
        assertThrows(IllegalStateException.class, () -> filter.doFilter(
            new MockHttpServletRequest("DELETE", "/api/v1/wallets/x"), new MockHttpServletResponse(),
            (req, res) -> {
                CorrelationContext.enterWallet(WalletId.newId());
                throw new IllegalStateException("boom");
            }));

        assertNull(MDC.get(CorrelationContext.WALLET_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Wallet scope tags and untags log lines")
    void testWalletScope() {
        WalletId walletId = WalletId.newId();

        CorrelationContext.enterWallet(walletId);
        assertEquals(walletId.toString(), MDC.get(CorrelationContext.WALLET_ID_MDC_KEY));

        CorrelationContext.exitWallet();
        assertNull(MDC.get(CorrelationContext.WALLET_ID_MDC_KEY));
    }
}
