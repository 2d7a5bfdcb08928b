package com.dcruver.weekly.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Collection (database) metadata with its property schema, name to type.
 */
@Value
@Builder
public class CollectionInfo {
    String id;
    String title;
    Instant createdTime;
    String url;
    Map<String, String> propertyTypes;
}
