package org.ccwonline.management.repository;

import java.util.List;
import java.util.Objects;

/**
 * One page of a query result.
 *
 * @param items      The entities on this page
 * @param pageIndex  The 1-based page number
 * @param pageSize   The maximum number of entities per page
 * @param totalCount The number of entities matching the filter across all pages
 */
public record Page<T>(List<T> items, int pageIndex, int pageSize, long totalCount) {

    public Page {
        Objects.requireNonNull(items, "Items cannot be null");
        items = List.copyOf(items);
    }

    public int pageCount() {
        return pageSize == 0 ? 0 : (int) ((totalCount + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return pageIndex < pageCount();
    }
}
