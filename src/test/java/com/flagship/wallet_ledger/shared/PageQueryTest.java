package com.flagship.wallet_ledger.shared;

import com.flagship.wallet_ledger.shared.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageQueryTest {

    @Test
    @DisplayName("Page numbers start at 1")
    void testRejectsPageZero() {
        assertThrows(ValidationException.class, () -> PageQuery.of(0, 20));
        assertThrows(ValidationException.class, () -> PageQuery.of(1, 0));
    }

    @Test
    @DisplayName("Oversized pages are clamped to the maximum")
    void testClampsPageSize() {
        PageQuery query = PageQuery.of(2, 500, "-balance").withMaxPageSize(100);

        assertEquals(2, query.getPage());
        assertEquals(100, query.getPageSize());
        assertEquals("-balance", query.getOrdering());
    }

    @Test
    @DisplayName("Blank ordering is treated as absent")
    void testBlankOrdering() {
        assertNull(PageQuery.of(1, 20, "  ").getOrdering());
    }

    @Test
    @DisplayName("PageResult reports neighbours")
    void testPageResultNavigation() {
        PageResult<String> result = new PageResult<>(List.of("a", "b"), 5, 2, 2, 3);

        assertTrue(result.hasNext());
        assertTrue(result.hasPrevious());
        assertEquals(List.of("A", "B"), result.map(String::toUpperCase).getItems());
    }
}
