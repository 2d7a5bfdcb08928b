package com.dcruver.weekly.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drains a cursor-paginated source into one ordered list.
 *
 * Any failure aborts the whole run; partial results are never returned.
 */
@Component
@Slf4j
public class PaginatedFetcher {

    /**
     * Source of pages, keyed by cursor.
     */
    @FunctionalInterface
    public interface PageSource<T> {
        ContentPage<T> fetchPage(String cursor);
    }

    public <T> List<T> fetchAll(PageSource<T> source) {
        List<T> all = new ArrayList<>();
        Set<String> requested = new HashSet<>();
        String cursor = null;
        int pages = 0;

        while (true) {
            ContentPage<T> page = source.fetchPage(cursor);
            pages++;

            if (page.getItems() != null) {
                if (page.getItems().size() > ContentStoreClient.MAX_PAGE_SIZE) {
                    throw ContentStoreException.protocol(String.format(
                        "page of %d items exceeds limit of %d",
                        page.getItems().size(), ContentStoreClient.MAX_PAGE_SIZE));
                }
                all.addAll(page.getItems());
            }

            if (!page.isHasMore()) {
                break;
            }

            String next = page.getNextCursor();
            if (next == null || next.isBlank()) {
                throw ContentStoreException.protocol("page reported more results but no cursor");
            }
            if (!requested.add(next)) {
                throw ContentStoreException.protocol("cursor requested twice: " + next);
            }
            cursor = next;
        }

        log.debug("Fetched {} items across {} pages", all.size(), pages);
        return all;
    }
}
