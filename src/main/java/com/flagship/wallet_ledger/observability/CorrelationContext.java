package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.shared.WalletId;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Logging context of the request being served.
 *
 * A request carries a correlation ID for its whole lifetime, taken from the
 * X-Correlation-ID header or generated. Ledger operations additionally bind
 * the wallet they act on, so lock waits and rejections can be traced per
 * wallet. Both values live in the MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String WALLET_ID_MDC_KEY = "walletId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Opens the request scope with the ID sent by the client, or a fresh one.
     *
     * @return the correlation ID now in effect
     */
    public static String beginRequest(String requestedId) {
        String id = requestedId != null && !requestedId.isBlank() ? requestedId : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Closes the request scope, including any wallet scope left open.
     */
    public static void endRequest() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(WALLET_ID_MDC_KEY);
    }

    /**
     * Tags subsequent log lines with the wallet being operated on.
     */
    public static void enterWallet(WalletId walletId) {
        MDC.put(WALLET_ID_MDC_KEY, walletId.toString());
    }

    public static void exitWallet() {
        MDC.remove(WALLET_ID_MDC_KEY);
    }

    /**
     * Short random ID, readable in logs.
     */
    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
