package com.dcruver.weekly.domain;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a document's content tree.
 *
 * {@code children} is filled in during tree materialization. An empty list does not mean the
 * source has no children: the node may have been truncated by depth or by a failed fetch.
 */
@Data
@Builder
public class Block {
    private final String id;
    private final BlockContent content;
    private final boolean hasChildren;

    @Builder.Default
    private List<Block> children = new ArrayList<>();

    public BlockType getType() {
        return content.getType();
    }
}
