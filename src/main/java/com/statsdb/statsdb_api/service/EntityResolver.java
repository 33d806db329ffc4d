package com.statsdb.statsdb_api.service;

import java.util.List;

/**
 * Listing and lookup shared by every entity kind.
 *
 * Subclasses supply the ordered name listing and how to build a view for a
 * name; existence checks, slicing and pagination live here.
 *
 * @param <V> the view built for one entity
 */
public abstract class EntityResolver<V> {

    /** Distinct, non-empty names, most recently seen first where that applies. */
    public abstract List<String> list();

    /** Build the view for a name already known to exist. */
    protected abstract V load(String name);

    /** Entity kind used in errors and cache keys. */
    public abstract String kind();

    public long count() {
        return list().size();
    }

    public boolean exists(String name) {
        return list().contains(name);
    }

    public V resolve(String name) {
        if (!exists(name)) {
            throw new NotFoundException(kind(), name);
        }
        return load(name);
    }

    /** Views for one page of the listing; a null page size loads everything. */
    public List<V> all(int page, Integer pageSize) {
        return Pagination.slice(list(), page, pageSize).stream().map(this::load).toList();
    }

    public List<V> all() {
        return all(0, null);
    }

    public Pagination<V> paginate(int page, int perPage) {
        return Pagination.of(page, perPage, this::all, this::count);
    }
}
