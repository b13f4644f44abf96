package com.flagship.wallet_ledger.shared;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Source of entity timestamps.
 *
 * PostgreSQL stores timestamps with microsecond precision, so in-memory values
 * are truncated to the same unit to keep persisted and re-read entities equal.
 */
public final class Timestamps {

    private Timestamps() {
        // Utility class
    }

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
