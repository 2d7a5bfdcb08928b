package com.dcruver.weekly.domain.week;

import com.dcruver.weekly.domain.Document;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Documents assigned to one week, in input order. Only project-policy buckets carry a range.
 */
@Value
public class WeekBucket {
    int weekNumber;
    List<Document> documents;
    WeekRange range;

    public Optional<WeekRange> getRangeIfPresent() {
        return Optional.ofNullable(range);
    }

    public int size() {
        return documents.size();
    }
}
