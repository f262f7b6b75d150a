package com.pizzaindex.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a complete result set through offset/limit pagination.
 *
 * Pages are requested one after another; a page shorter than the page size, or an empty
 * page, ends the read. Any exception from the page source aborts the whole read, so a
 * partial result is never returned. No retry.
 */
public class PaginatedFetcher {

    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);

    public static final int DEFAULT_PAGE_SIZE = 1000;

    private final int pageSize;

    public PaginatedFetcher(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * Fetches every page from {@code source} and concatenates them in arrival order.
     *
     * @throws DataStoreException if any page request fails
     */
    public <T> List<T> fetchAll(PageSource<T> source) {
        List<T> rows = new ArrayList<>();
        int offset = 0;
        int pages = 0;
        while (true) {
            List<T> page = source.fetchPage(offset, pageSize);
            pages++;
            if (page == null || page.isEmpty()) {
                break;
            }
            rows.addAll(page);
            if (page.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }
        log.debug("Paginated read complete: {} rows in {} pages (pageSize={})", rows.size(), pages, pageSize);
        return rows;
    }

    /** One page of a paginated read. */
    @FunctionalInterface
    public interface PageSource<T> {
        List<T> fetchPage(int offset, int limit);
    }
}
