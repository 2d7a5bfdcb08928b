package com.dcruver.weekly.store;

import com.dcruver.weekly.domain.Block;
import com.dcruver.weekly.domain.CollectionInfo;
import com.dcruver.weekly.domain.Document;

/**
 * Read-only access to a paginated, hierarchical content store.
 * A {@code null} cursor requests the first page.
 */
public interface ContentStoreClient {

    /**
     * Largest page the store will return.
     */
    int MAX_PAGE_SIZE = 100;

    ContentPage<Block> fetchChildPage(String parentId, String cursor);

    ContentPage<Document> fetchCollectionPage(String collectionId, String cursor);

    CollectionInfo fetchCollection(String collectionId);
}
