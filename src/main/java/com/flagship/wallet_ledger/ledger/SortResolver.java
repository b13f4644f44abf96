package com.flagship.wallet_ledger.ledger;

import org.springframework.data.domain.Sort;

import java.util.Map;

/**
 * Resolves API sort keys ({@code "balance"}, {@code "-created_at"}) against an
 * allow-list of sortable fields.
 *
 * Unknown keys fall back to the default ordering instead of failing, and every
 * resolved sort ends with an {@code id} tiebreaker so page boundaries are stable.
 */
public final class SortResolver {

    private final Map<String, String> sortableFields;
    private final Sort defaultSort;

    private SortResolver(Map<String, String> sortableFields, Sort defaultSort) {
        this.sortableFields = Map.copyOf(sortableFields);
        this.defaultSort = defaultSort;
    }

    /** Wallets: highest balance first by default. */
    public static final SortResolver WALLETS = new SortResolver(
        Map.of(
            "balance", "balance",
            "created_at", "createdAt",
            "updated_at", "updatedAt",
            "label", "label"
        ),
        Sort.by(Sort.Direction.DESC, "balance")
    );

    /** Transactions: newest first by default. */
    public static final SortResolver TRANSACTIONS = new SortResolver(
        Map.of(
            "created_at", "createdAt",
            "updated_at", "updatedAt",
            "amount", "amount",
            "txid", "txid"
        ),
        Sort.by(Sort.Direction.DESC, "createdAt")
    );

    public Sort resolve(String ordering) {
        return primarySort(ordering).and(Sort.by(Sort.Direction.ASC, "id"));
    }

    private Sort primarySort(String ordering) {
        if (ordering == null || ordering.isBlank()) {
            return defaultSort;
        }
        String key = ordering.trim();
        Sort.Direction direction = Sort.Direction.ASC;
        if (key.startsWith("-")) {
            direction = Sort.Direction.DESC;
            key = key.substring(1);
        }
        String property = sortableFields.get(key);
        if (property == null) {
            return defaultSort;
        }
        return Sort.by(direction, property);
    }

    public boolean isSortable(String field) {
        return sortableFields.containsKey(field);
    }
}
