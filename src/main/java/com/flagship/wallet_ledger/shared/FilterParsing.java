package com.flagship.wallet_ledger.shared;

import com.flagship.wallet_ledger.shared.exception.ValidationException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Parses raw listing filters as received from the API layer.
 */
public final class FilterParsing {

    private FilterParsing() {
        // Utility class
    }

    /**
     * Parses an is_active filter.
     *
     * @return TRUE/FALSE, or null when the filter is absent
     * @throws ValidationException for anything other than true/false/1/0/yes/no
     */
    public static Boolean parseActiveFlag(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes" -> Boolean.TRUE;
            case "false", "0", "no" -> Boolean.FALSE;
            default -> throw new ValidationException("is_active filter must be 'true' or 'false'");
        };
    }

    /**
     * Parses a wallet_ids filter. Entries may themselves be comma-separated.
     *
     * @return the wallet IDs, empty when the filter is absent
     * @throws ValidationException if any entry is not a UUID
     */
    public static Set<WalletId> parseWalletIds(Collection<String> values) {
        Set<WalletId> walletIds = new LinkedHashSet<>();
        if (values == null) {
            return walletIds;
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    walletIds.add(WalletId.parse(trimmed));
                } catch (ValidationException e) {
                    throw new ValidationException("Invalid wallet ID format in wallet_ids filter: " + trimmed);
                }
            }
        }
        return walletIds;
    }
}
