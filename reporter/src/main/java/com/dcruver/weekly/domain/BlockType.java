package com.dcruver.weekly.domain;

import java.util.Arrays;

/**
 * Closed set of block kinds the renderer understands.
 */
public enum BlockType {
    HEADING_1("heading_1"),
    HEADING_2("heading_2"),
    HEADING_3("heading_3"),
    PARAGRAPH("paragraph"),
    TO_DO("to_do"),
    BULLETED_LIST_ITEM("bulleted_list_item"),
    NUMBERED_LIST_ITEM("numbered_list_item"),
    CODE("code"),
    QUOTE("quote"),
    DIVIDER("divider"),

    /**
     * Anything the store sends that is not listed above
     */
    UNKNOWN("unknown");

    private final String wireName;

    BlockType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static BlockType fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
            .filter(t -> t != UNKNOWN && t.wireName.equals(name))
            .findFirst()
            .orElse(UNKNOWN);
    }
}
