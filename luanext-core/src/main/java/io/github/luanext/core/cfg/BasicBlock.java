package io.github.luanext.core.cfg;

import io.github.luanext.ast.Span;

import java.util.Collections;
import java.util.List;

/**
 * A maximal straight-line run of statements, with one entry and one {@link Terminator}.
 * <p>
 * Statements are referred to by their index in the {@link StatementIndex} the graph was built from.
 * Synthetic blocks, such as loop headers and joins, may hold no statements.
 */
public final class BasicBlock {
    private final BlockId id;
    private final List<Integer> statementIndices;
    private final Span span;
    private final Terminator terminator;

    BasicBlock(BlockId id, List<Integer> statementIndices, Span span, Terminator terminator) {
        this.id = id;
        this.statementIndices = Collections.unmodifiableList(statementIndices);
        this.span = span;
        this.terminator = terminator;
    }

    public BlockId getId() {
        return id;
    }

    /**
     * Get the indices of the statements in this block, in execution order.
     *
     * @return The statement indices.
     */
    public List<Integer> getStatementIndices() {
        return statementIndices;
    }

    public Span getSpan() {
        return span;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    @Override
    public String toString() {
        return id + statementIndices.toString() + " " + terminator;
    }
}
