package com.dcruver.weekly.io;

import com.dcruver.weekly.domain.Block;
import com.dcruver.weekly.domain.BlockContent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockTextRendererTest {

    private BlockTextRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new BlockTextRenderer();
    }

    @Test
    void testEachKindHasItsPrefix() {
        assertEquals("# Title", line(new BlockContent.Heading(1, "Title")));
        assertEquals("## Sub", line(new BlockContent.Heading(2, "Sub")));
        assertEquals("### Minor", line(new BlockContent.Heading(3, "Minor")));
        assertEquals("[x] Done", line(new BlockContent.ToDo("Done", true)));
        assertEquals("[ ] Open", line(new BlockContent.ToDo("Open", false)));
        assertEquals("- Bullet", line(new BlockContent.ListItem("Bullet", false)));
        assertEquals("1. Number", line(new BlockContent.ListItem("Number", true)));
        assertEquals("```java\nint x;\n```", line(new BlockContent.Code("int x;", "java")));
        assertEquals("> Quoted", line(new BlockContent.Quote("Quoted")));
        assertEquals("---", line(BlockContent.Divider.INSTANCE));
        assertEquals("Plain", line(new BlockContent.Paragraph("Plain")));
    }

    @Test
    void testUnknownKindFallsBackToItsText() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        assertEquals("Callout text", line(new BlockContent.Unknown("callout",
            objectMapper.readTree("{\"rich_text\": [{\"plain_text\": \"Callout text\"}]}"))));
        assertEquals("", line(new BlockContent.Unknown("image", objectMapper.readTree("{\"type\": \"file\"}"))));
    }

    @Test
    void testChildrenAreIndentedAndBlankLinesDropped() {
        Block nested = block("n", new BlockContent.ListItem("Nested", false));
        Block item = block("i", new BlockContent.ListItem("Item", false), nested);
        Block empty = block("e", new BlockContent.Paragraph(""));
        Block heading = block("h", new BlockContent.Heading(2, "Plan"), item);

        String rendered = renderer.render(List.of(heading, empty, block("p", new BlockContent.Paragraph("End"))));

        assertEquals("## Plan\n  - Item\n    - Nested\nEnd", rendered);
    }

    @Test
    void testChildrenOfBlankParentAreStillRendered() {
        Block child = block("c", new BlockContent.Paragraph("Kept"));
        Block parent = block("p", new BlockContent.Paragraph(" "), child);

        assertEquals("  Kept", renderer.render(List.of(parent)));
    }

    @Test
    void testEmptyTreeRendersEmpty() {
        assertEquals("", renderer.render(List.of()));
    }

    private String line(BlockContent content) {
        return renderer.renderLine(block("x", content));
    }

    private static Block block(String id, BlockContent content, Block... children) {
        Block block = Block.builder().id(id).content(content).hasChildren(children.length > 0).build();
        block.setChildren(new ArrayList<>(List.of(children)));
        return block;
    }
}
