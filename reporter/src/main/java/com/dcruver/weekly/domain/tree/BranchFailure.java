package com.dcruver.weekly.domain.tree;

import lombok.Value;

/**
 * A descendant whose children could not be fetched.
 */
@Value
public class BranchFailure {
    String blockId;
    int depth;
    String message;
}
