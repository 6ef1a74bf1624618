package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing. {@code page} is 0-based.
 */
public record PageResponse<T>(
    @JsonProperty("content")
    List<T> content,

    @JsonProperty("page")
    int page,

    @JsonProperty("size")
    int size,

    @JsonProperty("totalElements")
    long totalElements,

    @JsonProperty("totalPages")
    int totalPages
) {
    public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper) {
        return new PageResponse<>(
            page.getContent().stream().map(mapper).toList(),
            page.getNumber(),
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages()
        );
    }
}
