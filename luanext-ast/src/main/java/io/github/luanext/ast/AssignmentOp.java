package io.github.luanext.ast;

/**
 * The operator of an {@link Expression.Assignment}.
 */
public enum AssignmentOp {
    ASSIGN("="),
    ADD("+="),
    SUBTRACT("-="),
    MULTIPLY("*="),
    DIVIDE("/="),
    FLOOR_DIVIDE("//="),
    MODULO("%="),
    POWER("^="),
    CONCAT("..="),
    BIT_AND("&="),
    BIT_OR("|="),
    SHIFT_LEFT("<<="),
    SHIFT_RIGHT(">>=");

    /**
     * The source form of the operator.
     */
    public final String symbol;

    AssignmentOp(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Get whether this operator reads its target before writing it.
     *
     * @return Whether this is a compound assignment.
     */
    public boolean isCompound() {
        return this != ASSIGN;
    }
}
