package com.dcruver.weekly.store;

import com.dcruver.weekly.domain.Block;
import com.dcruver.weekly.domain.CollectionInfo;
import com.dcruver.weekly.domain.Document;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Content store client for the Notion REST API.
 *
 * Databases are collections, pages are documents, and blocks are tree nodes. Every failure,
 * network or HTTP, surfaces as a {@link ContentStoreException}.
 */
@Slf4j
public class NotionContentStoreClient implements ContentStoreClient {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final NotionPayloadMapper mapper;
    private final ContentStoreProperties properties;

    public NotionContentStoreClient(HttpClient httpClient, ObjectMapper objectMapper,
                                    NotionPayloadMapper mapper, ContentStoreProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.mapper = mapper;
        this.properties = properties;

        log.info("Content store client initialized with base URL: {} (API version {}, timeout: {}ms)",
            properties.getBaseUrl(), properties.getApiVersion(), properties.getTimeoutMs());
    }

    @Override
    public ContentPage<Block> fetchChildPage(String parentId, String cursor) {
        StringBuilder url = new StringBuilder(properties.getBaseUrl())
            .append("/blocks/").append(encode(parentId)).append("/children")
            .append("?page_size=").append(properties.effectivePageSize());
        if (cursor != null) {
            url.append("&start_cursor=").append(encode(cursor));
        }

        HttpRequest request = requestBuilder(url.toString()).GET().build();
        return mapper.toBlockPage(send(request));
    }

    @Override
    public ContentPage<Document> fetchCollectionPage(String collectionId, String cursor) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("page_size", properties.effectivePageSize());
        if (cursor != null) {
            body.put("start_cursor", cursor);
        }

        HttpRequest request = requestBuilder(
                properties.getBaseUrl() + "/databases/" + encode(collectionId) + "/query")
            .POST(HttpRequest.BodyPublishers.ofString(writeJson(body)))
            .build();
        return mapper.toDocumentPage(send(request));
    }

    @Override
    public CollectionInfo fetchCollection(String collectionId) {
        HttpRequest request = requestBuilder(properties.getBaseUrl() + "/databases/" + encode(collectionId))
            .GET()
            .build();
        return mapper.toCollectionInfo(send(request));
    }

    private HttpRequest.Builder requestBuilder(String url) {
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Authorization", "Bearer " + properties.getApiKey())
            .header("Notion-Version", properties.getApiVersion())
            .header("Content-Type", "application/json");
    }

    private JsonNode send(HttpRequest request) {
        log.debug("Sending {} {}", request.method(), request.uri());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ContentStoreException(0, "network request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentStoreException(0, "request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new ContentStoreException(response.statusCode(), errorMessage(response.body()));
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ContentStoreException(response.statusCode(), "malformed JSON response", e);
        }
    }

    /**
     * The API's "message" field when the body is JSON, the raw body otherwise.
     */
    String errorMessage(String body) {
        if (body == null) {
            return "";
        }
        try {
            JsonNode error = objectMapper.readTree(body);
            if (error != null && error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON");
        }
        return body;
    }

    private String writeJson(JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize request body", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
