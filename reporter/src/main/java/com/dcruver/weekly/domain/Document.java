package com.dcruver.weekly.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A top-level document listed in a collection.
 * Everything is fixed at fetch time except {@link #classification}, which each classification
 * run replaces.
 */
@Data
@Builder
public class Document {
    private final String id;
    private final Instant createdTime;
    private final Instant lastEditedTime;
    private final String url;

    @Builder.Default
    private final Map<String, PropertyValue> properties = new LinkedHashMap<>();

    // Start of the first populated date property, as sent by the store
    private final String dateString;

    private WeekAssignment classification;

    /**
     * The extracted date string, or else the start of the first populated date property.
     */
    public Optional<String> getDate() {
        if (dateString != null && !dateString.isBlank()) {
            return Optional.of(dateString);
        }
        return firstDateProperty(properties);
    }

    public Optional<WeekAssignment> getClassificationIfPresent() {
        return Optional.ofNullable(classification);
    }

    public static Optional<String> firstDateProperty(Map<String, PropertyValue> properties) {
        if (properties == null) {
            return Optional.empty();
        }
        for (PropertyValue property : properties.values()) {
            if (property.isType("date") && property.hasValue()) {
                String start = property.getValue().path("start").asText("");
                if (!start.isBlank()) {
                    return Optional.of(start);
                }
            }
        }
        return Optional.empty();
    }
}
