package com.dcruver.weekly.io;

import com.dcruver.weekly.domain.Document;
import com.dcruver.weekly.domain.PropertyValue;
import com.dcruver.weekly.store.NotionPayloadMapper;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats typed document properties for display.
 */
@Component
public class DocumentFormatter {

    static final String UNTITLED = "(untitled)";
    public static final String TITLE_LABEL = "Title";

    /**
     * Display string of a property value, empty when the value is unset or the type is not shown.
     */
    public String formatValue(PropertyValue property) {
        if (property == null || property.getType() == null) {
            return "";
        }
        JsonNode value = property.getValue();

        if ("checkbox".equals(property.getType())) {
            return value != null && value.asBoolean(false) ? "✓" : "✗";
        }
        if (!property.hasValue()) {
            return "";
        }

        return switch (property.getType()) {
            case "title", "rich_text" -> NotionPayloadMapper.plainText(value);
            case "select", "status" -> value.path("name").asText("");
            case "multi_select" -> joinNames(value);
            case "date" -> formatDate(value);
            case "number" -> value.isNumber() ? value.asText() : "";
            case "url", "email", "phone_number" -> value.asText("");
            default -> "";
        };
    }

    public String title(Document document) {
        for (PropertyValue property : document.getProperties().values()) {
            if (property.isType("title")) {
                String title = formatValue(property);
                if (!title.isBlank()) {
                    return title;
                }
            }
        }
        return UNTITLED;
    }

    /**
     * Non-empty properties in declaration order, the title property keyed as "Title".
     */
    public Map<String, String> formatProperties(Document document) {
        Map<String, String> formatted = new LinkedHashMap<>();
        document.getProperties().forEach((name, property) -> {
            String value = formatValue(property);
            if (!value.isEmpty()) {
                formatted.put(property.isType("title") ? TITLE_LABEL : name, value);
            }
        });
        return formatted;
    }

    private String formatDate(JsonNode value) {
        String start = value.path("start").asText("");
        JsonNode end = value.get("end");
        if (end != null && !end.isNull() && !end.asText().isBlank()) {
            return start + " ~ " + end.asText();
        }
        return start;
    }

    private String joinNames(JsonNode values) {
        List<String> names = new ArrayList<>();
        for (JsonNode option : values) {
            names.add(option.path("name").asText(""));
        }
        return String.join(", ", names);
    }
}
