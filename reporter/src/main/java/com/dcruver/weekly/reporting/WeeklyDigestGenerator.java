package com.dcruver.weekly.reporting;

import com.dcruver.weekly.domain.Document;
import com.dcruver.weekly.domain.WeekAssignment;
import com.dcruver.weekly.domain.tree.BlockTree;
import com.dcruver.weekly.domain.tree.BlockTreeMaterializer;
import com.dcruver.weekly.domain.week.WeekBucket;
import com.dcruver.weekly.domain.week.WeekPreview;
import com.dcruver.weekly.io.BlockTextRenderer;
import com.dcruver.weekly.io.DocumentFormatter;
import com.dcruver.weekly.store.ContentStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds plain-text summaries and per-week digests from classified buckets.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WeeklyDigestGenerator {

    static final String EMPTY_CONTENT = "(no content)";
    static final String RULE = "=".repeat(60);

    private final BlockTreeMaterializer materializer;
    private final BlockTextRenderer renderer;
    private final DocumentFormatter formatter;

    @Value("${weekly.tree.max-depth:10}")
    private int maxDepth = 10;

    /**
     * One section per week: header, up to three documents, and a "+K more" line.
     */
    public String buildSummary(List<WeekPreview> previews, String policyDescription) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append("\n");
        sb.append("Weekly summary (").append(policyDescription).append(")\n");
        sb.append(RULE).append("\n");

        if (previews.isEmpty()) {
            sb.append("No classified documents.\n");
            return sb.toString();
        }

        for (WeekPreview preview : previews) {
            sb.append("\nWeek ").append(preview.getWeekNumber())
                .append(" (").append(preview.getTotal()).append(" documents)");
            preview.getRangeIfPresent().ifPresent(r -> sb.append(" - ").append(r.format()));
            sb.append("\n");

            for (Document document : preview.getShown()) {
                sb.append("  - ").append(displayDate(document)).append(": ")
                    .append(formatter.title(document)).append("\n");
            }
            preview.moreLabel().ifPresent(label -> sb.append("  ").append(label).append("\n"));
        }
        return sb.toString();
    }

    /**
     * Full digest of one week with each document's rendered content. A document whose
     * content cannot be fetched gets an error line; the rest of the digest is still built.
     */
    public String buildDigest(WeekBucket bucket) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append("\n");
        sb.append("Week ").append(bucket.getWeekNumber())
            .append(" (").append(bucket.size()).append(" documents)\n");
        bucket.getRangeIfPresent().ifPresent(r -> sb.append("Period: ").append(r.format()).append("\n"));
        sb.append(RULE).append("\n");

        int index = 1;
        for (Document document : bucket.getDocuments()) {
            sb.append("\n").append(index++).append(". ")
                .append(displayDate(document)).append(" - ").append(formatter.title(document)).append("\n");
            formatter.formatProperties(document).forEach((name, value) -> {
                if (!DocumentFormatter.TITLE_LABEL.equals(name)) {
                    sb.append("   ").append(name).append(": ").append(value).append("\n");
                }
            });
            sb.append("-".repeat(50)).append("\n");
            sb.append(renderContent(document)).append("\n");
        }
        return sb.toString();
    }

    private String renderContent(Document document) {
        try {
            BlockTree tree = materializer.fetchTree(document.getId(), maxDepth);
            if (tree.isEmpty()) {
                return EMPTY_CONTENT;
            }
            String content = renderer.render(tree.getBlocks());
            if (!tree.isComplete()) {
                content += "\n(" + tree.getFailures().size() + " section(s) could not be loaded)";
            }
            return content.isBlank() ? EMPTY_CONTENT : content;
        } catch (ContentStoreException e) {
            log.error("Could not load content of document {}", document.getId(), e);
            return "(content unavailable: " + e.getMessage() + ")";
        }
    }

    private String displayDate(Document document) {
        return document.getClassificationIfPresent()
            .map(WeekAssignment::getDisplayDate)
            .orElse("no date");
    }

    void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
}
