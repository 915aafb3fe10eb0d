package io.github.luanext.core.dom;

import com.google.common.flogger.FluentLogger;
import io.github.luanext.core.cfg.BlockId;
import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.util.GraphWalker;

import java.util.*;

/**
 * The dominator tree of a {@link ControlFlowGraph}, with dominance frontiers.
 * <p>
 * Only blocks reachable from {@link BlockId#ENTRY} take part in dominance;
 * unreachable blocks have no immediate dominator, no children and an empty frontier.
 */
public final class DominatorTree {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final BlockId[] idom;
    private final List<List<BlockId>> children;
    private final List<List<BlockId>> frontiers;
    private final List<BlockId> reversePostorder;

    private DominatorTree(BlockId[] idom,
                          List<List<BlockId>> children,
                          List<List<BlockId>> frontiers,
                          List<BlockId> reversePostorder) {
        this.idom = idom;
        this.children = children;
        this.frontiers = frontiers;
        this.reversePostorder = reversePostorder;
    }

    /**
     * Compute the dominator tree of a graph.
     *
     * @param cfg The graph.
     * @return The dominator tree.
     */
    public static DominatorTree build(ControlFlowGraph cfg) {
        // Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
        List<BlockId> rpo = cfg.reversePostorder();
        int n = cfg.blockCount();
        int[] rpoIndex = new int[n];
        Arrays.fill(rpoIndex, -1);
        for (int i = 0; i < rpo.size(); i++) {
            rpoIndex[rpo.get(i).index()] = i;
        }

        BlockId[] idom = new BlockId[n];
        idom[BlockId.ENTRY.index()] = BlockId.ENTRY;
        boolean changed = true;
        int iterations = 0;
        while (changed) {
            changed = false;
            iterations++;
            for (BlockId block : rpo.subList(1, rpo.size())) {
                BlockId newIdom = null;
                for (BlockId pred : cfg.preds(block)) {
                    if (idom[pred.index()] == null) continue;
                    newIdom = newIdom == null ? pred : intersect(pred, newIdom, idom, rpoIndex);
                }
                if (newIdom != null && !newIdom.equals(idom[block.index()])) {
                    idom[block.index()] = newIdom;
                    changed = true;
                }
            }
        }
        logger.atFine().log("dominators of %d blocks converged after %d iterations", rpo.size(), iterations);

        List<List<BlockId>> children = emptyLists(n);
        for (BlockId block : rpo) {
            if (!block.equals(BlockId.ENTRY)) {
                children.get(idom[block.index()].index()).add(block);
            }
        }

        List<Set<BlockId>> frontierSets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            frontierSets.add(new LinkedHashSet<>());
        }
        for (BlockId block : rpo) {
            List<BlockId> preds = new ArrayList<>();
            for (BlockId pred : cfg.preds(block)) {
                if (idom[pred.index()] != null) preds.add(pred);
            }
            if (preds.size() < 2) continue;
            BlockId blockIdom = idom[block.index()];
            for (BlockId pred : preds) {
                BlockId runner = pred;
                while (!runner.equals(blockIdom)) {
                    frontierSets.get(runner.index()).add(block);
                    runner = idom[runner.index()];
                }
            }
        }
        List<List<BlockId>> frontiers = new ArrayList<>(n);
        for (Set<BlockId> set : frontierSets) {
            frontiers.add(Collections.unmodifiableList(new ArrayList<>(set)));
        }

        for (int i = 0; i < n; i++) {
            children.set(i, Collections.unmodifiableList(children.get(i)));
        }
        return new DominatorTree(idom, children, frontiers, rpo);
    }

    private static BlockId intersect(BlockId a, BlockId b, BlockId[] idom, int[] rpoIndex) {
        while (!a.equals(b)) {
            while (rpoIndex[a.index()] > rpoIndex[b.index()]) {
                a = idom[a.index()];
            }
            while (rpoIndex[b.index()] > rpoIndex[a.index()]) {
                b = idom[b.index()];
            }
        }
        return a;
    }

    private static List<List<BlockId>> emptyLists(int n) {
        List<List<BlockId>> lists = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            lists.add(new ArrayList<>());
        }
        return lists;
    }

    /**
     * Check whether {@code a} dominates {@code b}, that is, whether every path from
     * {@link BlockId#ENTRY} to {@code b} passes through {@code a}.
     * <p>
     * Every block dominates itself. No block dominates an unreachable block other than itself.
     *
     * @param a The candidate dominator.
     * @param b The block.
     * @return Whether {@code a} dominates {@code b}.
     */
    public boolean dominates(BlockId a, BlockId b) {
        if (a.equals(b)) return true;
        BlockId current = b;
        while (true) {
            BlockId dom = idom[current.index()];
            if (dom == null || dom.equals(current)) return false;
            if (dom.equals(a)) return true;
            current = dom;
        }
    }

    /**
     * Get the closest strict dominator of a block.
     *
     * @param block The block.
     * @return The immediate dominator, or empty for {@link BlockId#ENTRY} and unreachable blocks.
     */
    public Optional<BlockId> immediateDominator(BlockId block) {
        BlockId dom = idom[block.index()];
        if (dom == null || dom.equals(block)) return Optional.empty();
        return Optional.of(dom);
    }

    /**
     * Get the dominance frontier of a block: the blocks where its dominance ends.
     *
     * @param block The block.
     * @return The frontier, in discovery order.
     */
    public List<BlockId> frontier(BlockId block) {
        return frontiers.get(block.index());
    }

    /**
     * Get the blocks immediately dominated by a block.
     *
     * @param block The block.
     * @return The children, in reverse post-order.
     */
    public List<BlockId> children(BlockId block) {
        return children.get(block.index());
    }

    public boolean isReachable(BlockId block) {
        return idom[block.index()] != null;
    }

    /**
     * Get the reverse post-order of the graph the tree was built from.
     *
     * @return The reachable blocks, in reverse post-order.
     */
    public List<BlockId> reversePostorder() {
        return reversePostorder;
    }

    /**
     * Get the reachable blocks in a pre-order walk of this tree, parents before children.
     *
     * @return The blocks.
     */
    public List<BlockId> preorder() {
        return new GraphWalker<>(BlockId.ENTRY, this::children).preOrder().toList();
    }
}
