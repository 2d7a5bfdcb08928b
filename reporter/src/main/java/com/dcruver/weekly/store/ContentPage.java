package com.dcruver.weekly.store;

import lombok.Value;

import java.util.List;

/**
 * One page of a cursor-paginated listing.
 *
 * @param <T> item type
 */
@Value
public class ContentPage<T> {
    List<T> items;
    String nextCursor;
    boolean hasMore;

    public static <T> ContentPage<T> last(List<T> items) {
        return new ContentPage<>(items, null, false);
    }

    public static <T> ContentPage<T> of(List<T> items, String nextCursor) {
        return new ContentPage<>(items, nextCursor, true);
    }
}
