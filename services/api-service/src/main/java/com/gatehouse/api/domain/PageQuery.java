package com.gatehouse.api.domain;

/**
 * Offset pagination for list queries.
 *
 * @param skip rows to skip, at least 0
 * @param size page size, 1 to {@value #MAX_SIZE}
 */
public record PageQuery(int skip, int size) {

    public static final int DEFAULT_SIZE = 100;
    public static final int MAX_SIZE = 10_000;

    /**
     * @throws IllegalArgumentException when either bound is violated
     */
    public PageQuery {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be greater than or equal to 0, got " + skip);
        }
        if (size <= 0 || size > MAX_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_SIZE + ", got " + size);
        }
    }
}
