package com.dcruver.weekly.domain.week;

import com.dcruver.weekly.domain.Document;
import com.dcruver.weekly.domain.WeekAssignment;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups documents into week buckets.
 *
 * Holds the active policy and the buckets of the last {@link #classify} run. Selecting a
 * policy does not reclassify; each {@code classify} call replaces every bucket. Not thread-safe.
 */
@Slf4j
public class WeeklyAggregator {

    static final int PREVIEW_SIZE = 3;

    private final WeekClassifier classifier;
    private final Map<Integer, List<Document>> buckets = new TreeMap<>();

    private WeekPolicy policy;
    private PolicyParameters parameters;

    // Policy and parameters the current buckets were built with
    private WeekPolicy classifiedPolicy;
    private PolicyParameters classifiedParameters;

    public WeeklyAggregator(WeekClassifier classifier, WeekPolicy policy, PolicyParameters parameters) {
        this.classifier = classifier;
        selectPolicy(policy, parameters);
    }

    /**
     * Change the active policy. Existing buckets are left as they are until the next
     * {@link #classify(List)}.
     */
    public void selectPolicy(WeekPolicy policy, PolicyParameters parameters) {
        if (policy == null) {
            throw new InvalidPolicyException("Week policy must not be null");
        }
        PolicyParameters params = parameters != null ? parameters : PolicyParameters.none();
        if (policy.requiresAnchor() && !params.hasAnchor()) {
            throw new InvalidPolicyException("Policy '" + policy.getKey() + "' requires an anchor date");
        }
        this.policy = policy;
        this.parameters = params;
        log.info("Week policy: {}", describePolicy());
    }

    public Map<Integer, List<Document>> classify(List<Document> documents, WeekPolicy policy,
                                                 PolicyParameters parameters) {
        selectPolicy(policy, parameters);
        return classify(documents);
    }

    /**
     * Rebuild every bucket from {@code documents} under the active policy.
     * Documents without a usable date are left out.
     */
    public Map<Integer, List<Document>> classify(List<Document> documents) {
        buckets.clear();
        classifiedPolicy = policy;
        classifiedParameters = parameters;

        Map<Integer, Set<Integer>> isoYearsByWeek = new HashMap<>();
        int skipped = 0;

        for (Document document : documents) {
            Optional<LocalDate> date = document.getDate().flatMap(classifier::parseDate);
            if (date.isEmpty()) {
                document.setClassification(null);
                skipped++;
                continue;
            }

            int week = classifier.weekNumber(date.get(), policy, parameters);
            document.setClassification(WeekAssignment.builder()
                .policy(policy)
                .date(date.get())
                .displayDate(classifier.formatDisplayDate(date.get()))
                .weekNumber(week)
                .range(classifier.weekRange(week, policy, parameters).orElse(null))
                .build());

            buckets.computeIfAbsent(week, k -> new ArrayList<>()).add(document);

            if (policy == WeekPolicy.ISO) {
                isoYearsByWeek.computeIfAbsent(week, k -> new HashSet<>()).add(classifier.isoYear(date.get()));
            }
        }

        isoYearsByWeek.forEach((week, years) -> {
            if (years.size() > 1) {
                log.warn("ISO week {} mixes documents from years {}", week, years);
            }
        });

        log.info("Classified {} documents into {} weeks ({} without a date)",
            documents.size() - skipped, buckets.size(), skipped);
        return snapshot();
    }

    public List<Integer> getAvailableWeeks() {
        return List.copyOf(buckets.keySet());
    }

    /**
     * @throws WeekNotFoundException if the week holds no documents
     */
    public WeekBucket getBucket(int weekNumber) {
        List<Document> documents = buckets.get(weekNumber);
        if (documents == null) {
            throw new WeekNotFoundException(weekNumber);
        }
        return new WeekBucket(weekNumber, List.copyOf(documents), rangeOf(weekNumber));
    }

    public List<WeekPreview> getPreviews() {
        List<WeekPreview> previews = new ArrayList<>();
        buckets.forEach((week, documents) -> previews.add(new WeekPreview(
            week,
            documents.size(),
            List.copyOf(documents.subList(0, Math.min(PREVIEW_SIZE, documents.size()))),
            rangeOf(week))));
        return previews;
    }

    public Map<Integer, List<Document>> getBuckets() {
        return snapshot();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    public WeekPolicy getPolicy() {
        return policy;
    }

    public PolicyParameters getParameters() {
        return parameters;
    }

    public String describePolicy() {
        if (policy.requiresAnchor()) {
            return policy.getDescription() + ", anchor " + parameters.getAnchorDate();
        }
        return policy.getDescription();
    }

    private WeekRange rangeOf(int weekNumber) {
        if (classifiedPolicy == null) {
            return null;
        }
        return classifier.weekRange(weekNumber, classifiedPolicy, classifiedParameters).orElse(null);
    }

    private Map<Integer, List<Document>> snapshot() {
        Map<Integer, List<Document>> copy = new LinkedHashMap<>();
        buckets.forEach((week, documents) -> copy.put(week, List.copyOf(documents)));
        return Collections.unmodifiableMap(copy);
    }
}
