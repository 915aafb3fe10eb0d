package io.github.luanext.ast;

import java.util.Collections;
import java.util.List;

/**
 * A sequence of statements forming one lexical body, such as the body of a loop.
 */
public final class Block {
    /**
     * The statements of the block, in source order.
     */
    public final List<Statement> statements;
    /**
     * The span of the whole block.
     */
    public final Span span;

    /**
     * Construct a block.
     *
     * @param statements The statements.
     * @param span       The span.
     */
    public Block(List<? extends Statement> statements, Span span) {
        this.statements = Collections.unmodifiableList(statements);
        this.span = span;
    }

    /**
     * Get an empty block.
     *
     * @return The block.
     */
    public static Block empty() {
        return new Block(Collections.emptyList(), Span.DUMMY);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("do");
        for (Statement statement : statements) {
            sb.append(' ').append(statement).append(';');
        }
        return sb.append(" end").toString();
    }
}
