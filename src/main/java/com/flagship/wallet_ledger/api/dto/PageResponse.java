package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.shared.PageResult;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing with its pagination metadata.
 */
@Value
public class PageResponse<T> {

    @JsonProperty("results")
    List<T> results;

    @JsonProperty("count")
    long count;

    @JsonProperty("page")
    int page;

    @JsonProperty("page_size")
    int pageSize;

    @JsonProperty("total_pages")
    int totalPages;

    @JsonProperty("has_next")
    boolean hasNext;

    @JsonProperty("has_previous")
    boolean hasPrevious;

    public static <S, T> PageResponse<T> from(PageResult<S> result, Function<S, T> mapper) {
        return new PageResponse<>(
            result.getItems().stream().map(mapper).toList(),
            result.getTotalCount(),
            result.getPage(),
            result.getPageSize(),
            result.getTotalPages(),
            result.hasNext(),
            result.hasPrevious()
        );
    }
}
