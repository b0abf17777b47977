package com.siat.siat_backend.model.dto;

import org.springframework.data.domain.Page;

import java.util.List;

public record PagedResponse<T>(boolean success, List<T> data, Pagination pagination) {

    public record Pagination(int page, int limit, long total, long pages) {}

    /** {@code page} is 1-based; pages is ceil(total / limit). */
    public static <T> PagedResponse<T> of(Page<T> page, int pageNumber, int limit) {
        long total = page.getTotalElements();
        long pages = limit > 0 ? (total + limit - 1) / limit : 0;
        return new PagedResponse<>(true, page.getContent(), new Pagination(pageNumber, limit, total, pages));
    }
}
