package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

@Value
public class PageResponse<T> {

    @JsonProperty("items")
    List<T> items;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total_items")
    long totalItems;

    public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
        return new PageResponse<>(page.getContent().stream().map(mapper).toList(),
            page.getNumber(), page.getSize(), page.getTotalElements());
    }
}
