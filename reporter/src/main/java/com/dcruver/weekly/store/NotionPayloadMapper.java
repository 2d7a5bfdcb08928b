package com.dcruver.weekly.store;

import com.dcruver.weekly.domain.Block;
import com.dcruver.weekly.domain.BlockContent;
import com.dcruver.weekly.domain.BlockType;
import com.dcruver.weekly.domain.CollectionInfo;
import com.dcruver.weekly.domain.Document;
import com.dcruver.weekly.domain.PropertyValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps Notion API JSON (pages, blocks, databases, list responses) to the domain model.
 */
@Component
@Slf4j
public class NotionPayloadMapper {

    public ContentPage<Block> toBlockPage(JsonNode response) {
        return toPage(response, this::toBlock);
    }

    public ContentPage<Document> toDocumentPage(JsonNode response) {
        return toPage(response, this::toDocument);
    }

    public Block toBlock(JsonNode node) {
        String type = node.path("type").asText(null);
        JsonNode payload = type != null ? node.path(type) : node.path("__missing__");

        return Block.builder()
            .id(node.path("id").asText())
            .hasChildren(node.path("has_children").asBoolean(false))
            .content(toContent(type, payload))
            .build();
    }

    public Document toDocument(JsonNode node) {
        Map<String, PropertyValue> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String propType = field.getValue().path("type").asText(null);
            JsonNode value = propType != null ? field.getValue().get(propType) : null;
            properties.put(field.getKey(), new PropertyValue(propType, value));
        }

        return Document.builder()
            .id(node.path("id").asText())
            .createdTime(parseInstant(node.path("created_time").asText(null)))
            .lastEditedTime(parseInstant(node.path("last_edited_time").asText(null)))
            .url(node.path("url").asText(null))
            .properties(properties)
            .dateString(Document.firstDateProperty(properties).orElse(null))
            .build();
    }

    public CollectionInfo toCollectionInfo(JsonNode node) {
        Map<String, String> propertyTypes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            propertyTypes.put(field.getKey(), field.getValue().path("type").asText("unknown"));
        }

        return CollectionInfo.builder()
            .id(node.path("id").asText())
            .title(plainText(node.path("title")))
            .createdTime(parseInstant(node.path("created_time").asText(null)))
            .url(node.path("url").asText(null))
            .propertyTypes(propertyTypes)
            .build();
    }

    /**
     * Concatenate the plain_text of a rich text array.
     */
    public static String plainText(JsonNode richText) {
        if (richText == null || !richText.isArray()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : richText) {
            sb.append(part.path("plain_text").asText(""));
        }
        return sb.toString();
    }

    private <T> ContentPage<T> toPage(JsonNode response, Function<JsonNode, T> itemMapper) {
        JsonNode results = response.get("results");
        if (results == null || !results.isArray()) {
            throw ContentStoreException.protocol("list response has no results array");
        }

        List<T> items = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            items.add(itemMapper.apply(result));
        }

        JsonNode cursor = response.get("next_cursor");
        String nextCursor = cursor == null || cursor.isNull() ? null : cursor.asText();
        return new ContentPage<>(items, nextCursor, response.path("has_more").asBoolean(false));
    }

    private BlockContent toContent(String type, JsonNode payload) {
        String text = plainText(payload.path("rich_text"));

        return switch (BlockType.fromWireName(type)) {
            case HEADING_1 -> new BlockContent.Heading(1, text);
            case HEADING_2 -> new BlockContent.Heading(2, text);
            case HEADING_3 -> new BlockContent.Heading(3, text);
            case PARAGRAPH -> new BlockContent.Paragraph(text);
            case TO_DO -> new BlockContent.ToDo(text, payload.path("checked").asBoolean(false));
            case BULLETED_LIST_ITEM -> new BlockContent.ListItem(text, false);
            case NUMBERED_LIST_ITEM -> new BlockContent.ListItem(text, true);
            case CODE -> new BlockContent.Code(text, payload.path("language").asText(""));
            case QUOTE -> new BlockContent.Quote(text);
            case DIVIDER -> BlockContent.Divider.INSTANCE;
            case UNKNOWN -> new BlockContent.Unknown(type, payload.isMissingNode() ? null : payload);
        };
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}'", value);
            return null;
        }
    }
}
