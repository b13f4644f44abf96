package com.flagship.wallet_ledger.shared;

import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a filtered listing together with its pagination metadata.
 */
@Value
public class PageResult<T> {
    List<T> items;
    long totalCount;
    int page;
    int pageSize;
    int totalPages;

    public boolean hasNext() {
        return page < totalPages;
    }

    public boolean hasPrevious() {
        return page > 1;
    }

    public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PageResult<>(mapped, totalCount, page, pageSize, totalPages);
    }
}
