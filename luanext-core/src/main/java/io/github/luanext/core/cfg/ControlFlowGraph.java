package io.github.luanext.core.cfg;

import io.github.luanext.core.util.GraphWalker;

import java.util.*;

/**
 * The control-flow graph of one scope.
 * <p>
 * The graph owns its blocks; edges, the statement-to-block index and loop headers
 * are all derived from the blocks' terminators when the graph is constructed.
 * The graph is immutable.
 */
public final class ControlFlowGraph {
    private final List<BasicBlock> blocks;
    private final List<List<BlockId>> predecessors;
    private final List<List<BlockId>> successors;
    private final BlockId[] stmtToBlock;
    private final Set<BlockId> loopHeaders;
    private final List<BlockId> reversePostorder;

    /**
     * Construct a graph from its blocks.
     *
     * @param blocks         The blocks, such that the block at each position has that index as its id.
     * @param statementCount The number of statements in the scope the blocks were built from.
     * @param repeatHeaders  The headers of {@code repeat} loops, whose back-edges are branches.
     */
    ControlFlowGraph(List<BasicBlock> blocks, int statementCount, Collection<BlockId> repeatHeaders) {
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        List<List<BlockId>> preds = new ArrayList<>(blocks.size());
        List<List<BlockId>> succs = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            preds.add(new ArrayList<>());
            succs.add(new ArrayList<>());
        }
        stmtToBlock = new BlockId[statementCount];
        Set<BlockId> headers = new LinkedHashSet<>();

        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (block.getId().index() != i) {
                throw new IllegalArgumentException("block " + block.getId() + " at position " + i);
            }
            for (int stmt : block.getStatementIndices()) {
                stmtToBlock[stmt] = block.getId();
            }
            Terminator term = block.getTerminator();
            for (BlockId target : term.targets()) {
                succs.get(i).add(target);
                preds.get(target.index()).add(block.getId());
            }
            if (term instanceof Terminator.LoopBack) {
                headers.add(((Terminator.LoopBack) term).header);
            } else if (term instanceof Terminator.Branch
                    && ((Terminator.Branch) term).falseTarget.equals(block.getId())) {
                headers.add(block.getId());
            }
        }
        headers.addAll(repeatHeaders);

        for (int i = 0; i < blocks.size(); i++) {
            preds.set(i, Collections.unmodifiableList(preds.get(i)));
            succs.set(i, Collections.unmodifiableList(succs.get(i)));
        }
        predecessors = Collections.unmodifiableList(preds);
        successors = Collections.unmodifiableList(succs);
        loopHeaders = Collections.unmodifiableSet(headers);
        reversePostorder = Collections.unmodifiableList(
                new GraphWalker<>(BlockId.ENTRY, this::succs).reversePostOrder());
    }

    public int blockCount() {
        return blocks.size();
    }

    /**
     * Get the block with the given id.
     *
     * @param id The id.
     * @return The block.
     * @throws IndexOutOfBoundsException If there is no such block in this graph.
     */
    public BasicBlock block(BlockId id) {
        return blocks.get(id.index());
    }

    /**
     * Get all blocks, in id order.
     *
     * @return The blocks.
     */
    public List<BasicBlock> blocks() {
        return blocks;
    }

    /**
     * Get the predecessors of a block, one per incoming edge.
     *
     * @param id The block.
     * @return The predecessors, in block order.
     */
    public List<BlockId> preds(BlockId id) {
        return predecessors.get(id.index());
    }

    /**
     * Get the successors of a block, in the order of its terminator's targets.
     *
     * @param id The block.
     * @return The successors.
     */
    public List<BlockId> succs(BlockId id) {
        return successors.get(id.index());
    }

    /**
     * Get the block that holds a statement.
     *
     * @param stmtIndex The index of the statement.
     * @return The block.
     * @throws IndexOutOfBoundsException If the index is out of range.
     */
    public BlockId blockOf(int stmtIndex) {
        return stmtToBlock[stmtIndex];
    }

    /**
     * Get the loop headers: targets of {@link Terminator.LoopBack} edges and
     * {@code repeat} bodies re-entered by a {@link Terminator.Branch}.
     *
     * @return The loop headers, in discovery order.
     */
    public Set<BlockId> loopHeaders() {
        return loopHeaders;
    }

    public boolean isLoopHeader(BlockId id) {
        return loopHeaders.contains(id);
    }

    /**
     * Get the blocks reachable from {@link BlockId#ENTRY}, in reverse post-order.
     * <p>
     * The first element is always {@link BlockId#ENTRY}.
     *
     * @return The blocks.
     */
    public List<BlockId> reversePostorder() {
        return reversePostorder;
    }

    /**
     * Get the number of statements in the scope this graph was built from.
     *
     * @return The statement count.
     */
    public int statementCount() {
        return stmtToBlock.length;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.toString();
    }
}
