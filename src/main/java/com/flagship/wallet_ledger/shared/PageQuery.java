package com.flagship.wallet_ledger.shared;

import com.flagship.wallet_ledger.shared.exception.ValidationException;
import lombok.Value;

/**
 * Page request for listing operations.
 *
 * Page numbers are 1-based. {@code ordering} is an optional sort key such as
 * {@code "balance"} or {@code "-created_at"}; keys outside the allow-list of the
 * listed resource fall back to that resource's default ordering.
 */
@Value
public class PageQuery {
    public static final int DEFAULT_PAGE_SIZE = 20;

    int page;
    int pageSize;
    String ordering;

    private PageQuery(int page, int pageSize, String ordering) {
        if (page < 1) {
            throw new ValidationException("Page number must be 1 or greater");
        }
        if (pageSize < 1) {
            throw new ValidationException("Page size must be 1 or greater");
        }
        this.page = page;
        this.pageSize = pageSize;
        this.ordering = ordering == null || ordering.isBlank() ? null : ordering.trim();
    }

    public static PageQuery of(int page, int pageSize, String ordering) {
        return new PageQuery(page, pageSize, ordering);
    }

    public static PageQuery of(int page, int pageSize) {
        return new PageQuery(page, pageSize, null);
    }

    public static PageQuery firstPage() {
        return new PageQuery(1, DEFAULT_PAGE_SIZE, null);
    }

    /**
     * Returns a copy whose page size is at most {@code maxPageSize}.
     */
    public PageQuery withMaxPageSize(int maxPageSize) {
        return pageSize <= maxPageSize ? this : new PageQuery(page, maxPageSize, ordering);
    }
}
