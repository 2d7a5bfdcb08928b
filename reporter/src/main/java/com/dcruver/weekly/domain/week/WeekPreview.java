package com.dcruver.weekly.domain.week;

import com.dcruver.weekly.domain.Document;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * First few documents of a bucket plus the count left out.
 */
@Value
public class WeekPreview {
    int weekNumber;
    int total;
    List<Document> shown;
    WeekRange range;

    public int getRemaining() {
        return total - shown.size();
    }

    /**
     * "+K more", or empty when every document is shown.
     */
    public Optional<String> moreLabel() {
        int remaining = getRemaining();
        return remaining > 0 ? Optional.of("+" + remaining + " more") : Optional.empty();
    }

    public Optional<WeekRange> getRangeIfPresent() {
        return Optional.ofNullable(range);
    }
}
