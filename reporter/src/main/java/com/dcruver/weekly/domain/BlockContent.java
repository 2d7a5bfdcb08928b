package com.dcruver.weekly.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Type-specific payload of a {@link Block}.
 * One subclass per known block kind, plus {@link Unknown} which keeps the raw payload.
 */
public abstract class BlockContent {

    private BlockContent() {
    }

    public abstract BlockType getType();

    /**
     * Plain text carried by the block, empty for kinds without text.
     */
    public abstract String getText();

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Heading extends BlockContent {
        private final int level;
        private final String text;

        public Heading(int level, String text) {
            if (level < 1 || level > 3) {
                throw new IllegalArgumentException("Heading level must be 1-3: " + level);
            }
            this.level = level;
            this.text = text;
        }

        @Override
        public BlockType getType() {
            return switch (level) {
                case 1 -> BlockType.HEADING_1;
                case 2 -> BlockType.HEADING_2;
                default -> BlockType.HEADING_3;
            };
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Paragraph extends BlockContent {
        private final String text;

        public Paragraph(String text) {
            this.text = text;
        }

        @Override
        public BlockType getType() {
            return BlockType.PARAGRAPH;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class ToDo extends BlockContent {
        private final String text;
        private final boolean checked;

        public ToDo(String text, boolean checked) {
            this.text = text;
            this.checked = checked;
        }

        @Override
        public BlockType getType() {
            return BlockType.TO_DO;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class ListItem extends BlockContent {
        private final String text;
        private final boolean numbered;

        public ListItem(String text, boolean numbered) {
            this.text = text;
            this.numbered = numbered;
        }

        @Override
        public BlockType getType() {
            return numbered ? BlockType.NUMBERED_LIST_ITEM : BlockType.BULLETED_LIST_ITEM;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Code extends BlockContent {
        private final String text;
        private final String language;

        public Code(String text, String language) {
            this.text = text;
            this.language = language;
        }

        @Override
        public BlockType getType() {
            return BlockType.CODE;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Quote extends BlockContent {
        private final String text;

        public Quote(String text) {
            this.text = text;
        }

        @Override
        public BlockType getType() {
            return BlockType.QUOTE;
        }
    }

    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Divider extends BlockContent {
        public static final Divider INSTANCE = new Divider();

        private Divider() {
        }

        @Override
        public BlockType getType() {
            return BlockType.DIVIDER;
        }

        @Override
        public String getText() {
            return "";
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Unknown extends BlockContent {
        private final String rawType;
        private final JsonNode rawPayload;

        public Unknown(String rawType, JsonNode rawPayload) {
            this.rawType = rawType;
            this.rawPayload = rawPayload;
        }

        @Override
        public BlockType getType() {
            return BlockType.UNKNOWN;
        }

        /**
         * Text of the raw payload's rich_text, if the unknown kind carries one.
         */
        @Override
        public String getText() {
            if (rawPayload == null || !rawPayload.has("rich_text")) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : rawPayload.get("rich_text")) {
                sb.append(part.path("plain_text").asText(""));
            }
            return sb.toString();
        }
    }
}
