package com.dcruver.weekly.domain.tree;

import com.dcruver.weekly.domain.Block;
import com.dcruver.weekly.store.ContentStoreClient;
import com.dcruver.weekly.store.ContentStoreException;
import com.dcruver.weekly.store.PaginatedFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a block tree from the store's flat, paginated child listings.
 *
 * A failure listing the root's own children propagates. A failure listing any descendant's
 * children is logged and recorded, the descendant is kept with no children, and its siblings
 * carry on. Fetches are strictly sequential.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BlockTreeMaterializer {

    private final ContentStoreClient client;
    private final PaginatedFetcher fetcher;

    /**
     * Fetch the children of {@code rootId} and their subtrees.
     *
     * @param rootId   node whose children are listed
     * @param maxDepth levels to descend below the direct children; 0 returns the direct
     *                 children only, each with an empty child list
     * @throws ContentStoreException if the root's children cannot be listed
     */
    public BlockTree fetchTree(String rootId, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }

        List<BranchFailure> failures = new ArrayList<>();
        List<Block> blocks = materialize(rootId, maxDepth, 0, failures);

        if (!failures.isEmpty()) {
            log.warn("Tree for {} is incomplete: {} branch(es) failed", rootId, failures.size());
        }
        log.debug("Materialized {} top-level blocks for {}", blocks.size(), rootId);
        return new BlockTree(rootId, maxDepth, List.copyOf(blocks), List.copyOf(failures));
    }

    private List<Block> materialize(String parentId, int remainingDepth, int depth,
                                    List<BranchFailure> failures) {
        List<Block> children = fetcher.fetchAll(cursor -> client.fetchChildPage(parentId, cursor));

        for (Block child : children) {
            if (!child.isHasChildren() || remainingDepth <= 0) {
                continue;
            }
            try {
                child.setChildren(materialize(child.getId(), remainingDepth - 1, depth + 1, failures));
            } catch (ContentStoreException e) {
                log.warn("Could not fetch children of block {} (depth {}): {}",
                    child.getId(), depth + 1, e.getMessage());
                failures.add(new BranchFailure(child.getId(), depth + 1, e.getMessage()));
                child.setChildren(new ArrayList<>());
            }
        }

        return children;
    }
}
