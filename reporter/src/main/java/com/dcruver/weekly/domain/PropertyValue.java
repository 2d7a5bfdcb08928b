package com.dcruver.weekly.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * A typed document property. {@code value} is the type-specific JSON payload,
 * e.g. the {@code date} object for a date property.
 */
@Value
public class PropertyValue {
    String type;
    JsonNode value;

    public boolean isType(String candidate) {
        return type != null && type.equals(candidate);
    }

    public boolean hasValue() {
        return value != null && !value.isNull() && !value.isMissingNode();
    }
}
