package com.dcruver.weekly.store;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the content store API.
 */
@ConfigurationProperties(prefix = "weekly.store")
@Data
public class ContentStoreProperties {
    private String baseUrl = "https://api.notion.com/v1";
    private String apiKey;
    private String apiVersion = "2022-06-28";
    private String collectionId;
    private int pageSize = ContentStoreClient.MAX_PAGE_SIZE;
    private int timeoutMs = 30000;

    /**
     * Page size actually requested, clamped to the store's limit.
     */
    public int effectivePageSize() {
        return Math.max(1, Math.min(pageSize, ContentStoreClient.MAX_PAGE_SIZE));
    }
}
