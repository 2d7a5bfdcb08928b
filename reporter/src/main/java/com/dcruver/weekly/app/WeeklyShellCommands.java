package com.dcruver.weekly.app;

import com.dcruver.weekly.domain.CollectionInfo;
import com.dcruver.weekly.domain.Document;
import com.dcruver.weekly.domain.DocumentScanner;
import com.dcruver.weekly.domain.tree.BlockTree;
import com.dcruver.weekly.domain.tree.BlockTreeMaterializer;
import com.dcruver.weekly.domain.tree.BranchFailure;
import com.dcruver.weekly.domain.week.PolicyParameters;
import com.dcruver.weekly.domain.week.WeekClassifier;
import com.dcruver.weekly.domain.week.WeekNotFoundException;
import com.dcruver.weekly.domain.week.WeekPolicy;
import com.dcruver.weekly.domain.week.WeeklyAggregator;
import com.dcruver.weekly.io.BlockTextRenderer;
import com.dcruver.weekly.reporting.WeeklyDigestGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Spring Shell commands for loading, classifying and reading weekly notes.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class WeeklyShellCommands {

    private final DocumentScanner documentScanner;
    private final WeeklyAggregator aggregator;
    private final WeekClassifier classifier;
    private final BlockTreeMaterializer materializer;
    private final BlockTextRenderer renderer;
    private final WeeklyDigestGenerator digestGenerator;

    @Value("${weekly.tree.max-depth:10}")
    private int maxDepth = 10;

    // Documents from the last load
    private List<Document> loadedDocuments = List.of();

    @ShellMethod(key = "collection-info", value = "Show the configured collection and its properties")
    public String collectionInfo() {
        try {
            CollectionInfo info = documentScanner.describeCollection();

            StringBuilder sb = new StringBuilder();
            sb.append("Title: ").append(info.getTitle().isBlank() ? "(untitled)" : info.getTitle()).append("\n");
            sb.append("Created: ").append(info.getCreatedTime()).append("\n");
            sb.append("ID: ").append(info.getId()).append("\n");
            sb.append("URL: ").append(info.getUrl()).append("\n");
            sb.append(String.format("Properties (%d):\n", info.getPropertyTypes().size()));
            info.getPropertyTypes().forEach((name, type) ->
                sb.append("  - ").append(name).append(" (").append(type).append(")\n"));
            return sb.toString();

        } catch (Exception e) {
            log.error("Collection lookup failed", e);
            return "Collection lookup failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"load", "fetch"}, value = "Fetch every document of the collection and classify it")
    public String load() {
        log.info("Loading documents...");

        try {
            loadedDocuments = documentScanner.scanCollection();
            aggregator.classify(loadedDocuments);

            return String.format("Loaded %d documents into %d weeks.\n\n", loadedDocuments.size(),
                aggregator.getAvailableWeeks().size())
                + digestGenerator.buildSummary(aggregator.getPreviews(), aggregator.describePolicy());

        } catch (Exception e) {
            log.error("Load failed", e);
            return "Load failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "policy", value = "Show or change the week policy (project, monthly, iso)")
    public String policy(
            @ShellOption(defaultValue = ShellOption.NULL, help = "Policy name") String name,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Anchor date yyyy-MM-dd for the project policy") String anchor) {

        try {
            if (name != null) {
                WeekPolicy policy = WeekPolicy.fromKey(name);
                PolicyParameters params = aggregator.getParameters();
                if (anchor != null) {
                    params = PolicyParameters.anchoredAt(LocalDate.parse(anchor));
                }
                aggregator.selectPolicy(policy, params);
            } else if (anchor != null) {
                aggregator.selectPolicy(aggregator.getPolicy(), PolicyParameters.anchoredAt(LocalDate.parse(anchor)));
            }

            StringBuilder sb = new StringBuilder();
            sb.append("Week policy: ").append(aggregator.describePolicy()).append("\n");
            int currentWeek = classifier.currentWeek(aggregator.getPolicy(), aggregator.getParameters());
            sb.append("Current week: ").append(currentWeek).append("\n");
            classifier.weekRange(currentWeek, aggregator.getPolicy(), aggregator.getParameters())
                .ifPresent(r -> sb.append("Current range: ").append(r.format()).append("\n"));
            if (name != null || anchor != null) {
                sb.append("\nRun 'classify' to regroup the loaded documents.\n");
            }
            return sb.toString();

        } catch (DateTimeParseException e) {
            return "Invalid anchor date '" + anchor + "', expected yyyy-MM-dd";
        } catch (Exception e) {
            log.error("Policy change failed", e);
            return "Policy change failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "classify", value = "Regroup loaded documents under the active policy")
    public String classify() {
        if (loadedDocuments.isEmpty()) {
            return "No documents loaded. Run 'load' first.";
        }
        aggregator.classify(loadedDocuments);
        return digestGenerator.buildSummary(aggregator.getPreviews(), aggregator.describePolicy());
    }

    @ShellMethod(key = "weeks", value = "List populated weeks with a short preview")
    public String weeks() {
        return digestGenerator.buildSummary(aggregator.getPreviews(), aggregator.describePolicy());
    }

    @ShellMethod(key = "week", value = "Show every document of a week with its content")
    public String week(@ShellOption(help = "Week number") int number) {
        try {
            return digestGenerator.buildDigest(aggregator.getBucket(number));
        } catch (WeekNotFoundException e) {
            return e.getMessage() + ". Available weeks: " + aggregator.getAvailableWeeks();
        }
    }

    @ShellMethod(key = "tree", value = "Render the block tree under a page or block")
    public String tree(
            @ShellOption(help = "Page or block id") String id,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Levels below the direct children") Integer depth) {

        try {
            BlockTree tree = materializer.fetchTree(id, depth != null ? depth : maxDepth);

            StringBuilder sb = new StringBuilder(renderer.render(tree.getBlocks()));
            if (!tree.isComplete()) {
                sb.append("\n\nIncomplete branches:\n");
                for (BranchFailure failure : tree.getFailures()) {
                    sb.append("  - ").append(failure.getBlockId())
                        .append(" (depth ").append(failure.getDepth()).append("): ")
                        .append(failure.getMessage()).append("\n");
                }
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Tree fetch failed for {}", id, e);
            return "Tree fetch failed: " + e.getMessage();
        }
    }
}
