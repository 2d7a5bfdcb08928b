package com.dcruver.weekly.domain.tree;

import com.dcruver.weekly.domain.Block;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Materialized content of one node: its top-level blocks with children filled in,
 * plus every branch that failed along the way.
 */
@Value
public class BlockTree {
    String rootId;
    int maxDepth;
    List<Block> blocks;
    List<BranchFailure> failures;

    /**
     * True when no branch failed. Depth truncation does not count as a failure.
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }

    public Set<String> getFailedBlockIds() {
        return failures.stream()
            .map(BranchFailure::getBlockId)
            .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
