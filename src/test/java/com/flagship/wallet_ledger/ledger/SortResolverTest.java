package com.flagship.wallet_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SortResolverTest {

    private static List<Sort.Order> orders(Sort sort) {
        return sort.toList();
    }

    @Test
    @DisplayName("Default wallet ordering is highest balance first with id tiebreaker")
    void testWalletDefault() {
        List<Sort.Order> orders = orders(SortResolver.WALLETS.resolve(null));

        assertEquals(2, orders.size());
        assertEquals(Sort.Order.desc("balance"), orders.get(0));
        assertEquals(Sort.Order.asc("id"), orders.get(1));
    }

    @Test
    @DisplayName("Snake-case keys map to entity properties, '-' means descending")
    void testExplicitKeys() {
        assertEquals(Sort.Order.asc("createdAt"), orders(SortResolver.WALLETS.resolve("created_at")).get(0));
        assertEquals(Sort.Order.desc("updatedAt"), orders(SortResolver.TRANSACTIONS.resolve("-updated_at")).get(0));
        assertEquals(Sort.Order.asc("txid"), orders(SortResolver.TRANSACTIONS.resolve("txid")).get(0));
    }

    @Test
    @DisplayName("Unknown keys fall back to the default ordering")
    void testUnknownKeyFallsBack() {
        assertEquals(Sort.Order.desc("createdAt"), orders(SortResolver.TRANSACTIONS.resolve("-label")).get(0));
        assertEquals(Sort.Order.desc("balance"), orders(SortResolver.WALLETS.resolve("password")).get(0));
        assertFalse(SortResolver.WALLETS.isSortable("amount"));
        assertTrue(SortResolver.TRANSACTIONS.isSortable("amount"));
    }
}
