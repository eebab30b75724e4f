package com.example.transcribe_backend.api.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results, decoupled from Spring Data's {@link Page} JSON shape.
 */
public record PageResponse<T>(List<T> content, int page, int size, long total) {

    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        return new PageResponse<>(page.map(mapper).getContent(), page.getNumber(), page.getSize(), page.getTotalElements());
    }
}
