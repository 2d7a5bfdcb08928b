package com.dcruver.weekly.domain.week;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Week-numbering policies. Week numbers from different policies are not comparable.
 */
public enum WeekPolicy {
    /**
     * Continuous weeks counted from an anchor date; 0 before the anchor
     */
    PROJECT("project", "Project-based (continuous weeks from the anchor date)"),

    /**
     * Weeks restart at 1 every month
     */
    MONTHLY("monthly", "Monthly (week 1 restarts every month)"),

    /**
     * ISO-8601 week number, year dropped
     */
    ISO("iso", "ISO-8601 week number");

    private final String key;
    private final String description;

    WeekPolicy(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public String getKey() {
        return key;
    }

    public String getDescription() {
        return description;
    }

    public boolean requiresAnchor() {
        return this == PROJECT;
    }

    public static WeekPolicy fromKey(String key) {
        if (key == null) {
            throw new InvalidPolicyException("Week policy must not be null");
        }
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(p -> p.key.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new InvalidPolicyException(String.format(
                "Unsupported week policy '%s'. Available: %s", key,
                Arrays.stream(values()).map(WeekPolicy::getKey).collect(Collectors.joining(", ")))));
    }
}
