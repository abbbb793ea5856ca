package com.microservices.learningservice.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * Builds page requests from the 1-based {@code page} / {@code pageSize} query parameters.
 */
@Component
public class PageableFactory {

    private final int defaultSize;
    private final int maxSize;

    public PageableFactory(@Value("${learning.pagination.default-size:12}") int defaultSize,
                           @Value("${learning.pagination.max-size:50}") int maxSize) {
        this.defaultSize = defaultSize;
        this.maxSize = maxSize;
    }

    public Pageable of(Integer page, Integer pageSize) {
        return of(page, pageSize, Sort.unsorted());
    }

    public Pageable of(Integer page, Integer pageSize, Sort sort) {
        int number = page == null || page < 1 ? 0 : page - 1;
        int size = pageSize == null || pageSize < 1 ? defaultSize : Math.min(pageSize, maxSize);
        return PageRequest.of(number, size, sort);
    }
}
