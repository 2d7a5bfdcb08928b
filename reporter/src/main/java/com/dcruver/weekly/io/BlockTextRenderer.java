package com.dcruver.weekly.io;

import com.dcruver.weekly.domain.Block;
import com.dcruver.weekly.domain.BlockContent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders block trees as markdown-flavoured plain text, two spaces of indent per level.
 */
@Component
public class BlockTextRenderer {

    private static final int INDENT_STEP = 2;

    public String render(List<Block> blocks) {
        List<String> lines = new ArrayList<>();
        renderInto(blocks, 0, lines);
        return String.join("\n", lines);
    }

    /**
     * Render a single block without its children.
     */
    public String renderLine(Block block) {
        BlockContent content = block.getContent();
        if (content == null) {
            return "";
        }

        return switch (content.getType()) {
            case HEADING_1 -> "# " + content.getText();
            case HEADING_2 -> "## " + content.getText();
            case HEADING_3 -> "### " + content.getText();
            case TO_DO -> (((BlockContent.ToDo) content).isChecked() ? "[x] " : "[ ] ") + content.getText();
            case BULLETED_LIST_ITEM -> "- " + content.getText();
            case NUMBERED_LIST_ITEM -> "1. " + content.getText();
            case CODE -> "```" + ((BlockContent.Code) content).getLanguage() + "\n" + content.getText() + "\n```";
            case QUOTE -> "> " + content.getText();
            case DIVIDER -> "---";
            case PARAGRAPH, UNKNOWN -> content.getText();
        };
    }

    private void renderInto(List<Block> blocks, int indent, List<String> lines) {
        String prefix = " ".repeat(indent);
        for (Block block : blocks) {
            String line = renderLine(block);
            if (!line.isBlank()) {
                lines.add(prefix + line);
            }
            if (block.getChildren() != null && !block.getChildren().isEmpty()) {
                renderInto(block.getChildren(), indent + INDENT_STEP, lines);
            }
        }
    }
}
