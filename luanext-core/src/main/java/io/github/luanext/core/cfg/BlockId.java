package io.github.luanext.core.cfg;

import org.jetbrains.annotations.NotNull;

/**
 * An opaque handle to a {@link BasicBlock} in a {@link ControlFlowGraph}.
 * <p>
 * Ids are assigned in creation order, so {@link #ENTRY} and {@link #EXIT}
 * are the same in every graph.
 */
public final class BlockId implements Comparable<BlockId> {
    /**
     * The unique entry block, which has no predecessors.
     */
    public static final BlockId ENTRY = new BlockId(0);
    /**
     * The unique logical end of the scope, reached by {@link Terminator.Return}
     * and {@link Terminator.FallThrough}.
     */
    public static final BlockId EXIT = new BlockId(1);

    private final int index;

    private BlockId(int index) {
        this.index = index;
    }

    /**
     * Get the block id with the given index.
     *
     * @param index The index.
     * @return The block id.
     */
    public static BlockId of(int index) {
        if (index < 0) throw new IllegalArgumentException("negative block index " + index);
        if (index == 0) return ENTRY;
        if (index == 1) return EXIT;
        return new BlockId(index);
    }

    /**
     * Get the index of this block, its position in {@link ControlFlowGraph#blocks()}.
     *
     * @return The index.
     */
    public int index() {
        return index;
    }

    @Override
    public int compareTo(@NotNull BlockId o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof BlockId && ((BlockId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "B" + index;
    }
}
