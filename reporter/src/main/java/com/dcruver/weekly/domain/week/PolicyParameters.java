package com.dcruver.weekly.domain.week;

import lombok.Value;

import java.time.LocalDate;

/**
 * Parameters passed with every classification. Only the project policy reads the anchor.
 */
@Value
public class PolicyParameters {

    private static final PolicyParameters NONE = new PolicyParameters(null);

    LocalDate anchorDate;

    public static PolicyParameters none() {
        return NONE;
    }

    public static PolicyParameters anchoredAt(LocalDate anchorDate) {
        if (anchorDate == null) {
            throw new InvalidPolicyException("Anchor date must not be null");
        }
        return new PolicyParameters(anchorDate);
    }

    public boolean hasAnchor() {
        return anchorDate != null;
    }
}
