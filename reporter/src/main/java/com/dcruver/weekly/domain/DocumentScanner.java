package com.dcruver.weekly.domain;

import com.dcruver.weekly.store.ContentStoreClient;
import com.dcruver.weekly.store.ContentStoreException;
import com.dcruver.weekly.store.ContentStoreProperties;
import com.dcruver.weekly.store.PaginatedFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Lists every document of a collection.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentScanner {

    private final ContentStoreClient client;
    private final PaginatedFetcher fetcher;
    private final ContentStoreProperties properties;

    /**
     * Scan the configured collection.
     *
     * @throws IllegalStateException if no collection id is configured
     */
    public List<Document> scanCollection() {
        return scanCollection(configuredCollectionId());
    }

    /**
     * @throws ContentStoreException if any page fails; nothing is returned in that case
     */
    public List<Document> scanCollection(String collectionId) {
        log.info("Scanning collection {}", collectionId);
        List<Document> documents = fetcher.fetchAll(cursor -> client.fetchCollectionPage(collectionId, cursor));
        log.info("Found {} documents", documents.size());
        return documents;
    }

    /**
     * @throws IllegalStateException if no collection id is configured
     */
    public CollectionInfo describeCollection() {
        return client.fetchCollection(configuredCollectionId());
    }

    private String configuredCollectionId() {
        String collectionId = properties.getCollectionId();
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalStateException("No collection configured (weekly.store.collection-id)");
        }
        return collectionId;
    }
}
