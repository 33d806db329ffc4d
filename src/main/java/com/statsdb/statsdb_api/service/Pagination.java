package com.statsdb.statsdb_api.service;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * One page of an ordered listing plus totals.
 *
 * Pages are zero based. A page past the end is empty but still reports the
 * real totals; mapping that to an error is left to the caller.
 */
public record Pagination<T>(List<T> items, int page, int perPage, long total, int totalPages) {

    /**
     * @param lister  returns the items for (page, perPage)
     * @param counter returns the total item count
     */
    public static <T> Pagination<T> of(int page, int perPage,
                                       BiFunction<Integer, Integer, List<T>> lister,
                                       LongSupplier counter) {
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be at least 1, was " + perPage);
        }
        long total = counter.getAsLong();
        int totalPages = (int) Math.max(1, (total + perPage - 1) / perPage);
        return new Pagination<>(List.copyOf(lister.apply(page, perPage)), page, perPage, total, totalPages);
    }

    /**
     * Slice of {@code items} for a page. A null page size means the whole list.
     * Negative or out-of-range pages give an empty slice.
     */
    public static <T> List<T> slice(List<T> items, int page, Integer pageSize) {
        if (pageSize == null) {
            return items;
        }
        long from = (long) page * pageSize;
        if (page < 0 || pageSize < 1 || from >= items.size()) {
            return List.of();
        }
        int to = (int) Math.min(items.size(), from + pageSize);
        return items.subList((int) from, to);
    }

    public <R> Pagination<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new Pagination<>(mapped, page, perPage, total, totalPages);
    }
}
