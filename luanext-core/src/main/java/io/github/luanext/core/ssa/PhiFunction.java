package io.github.luanext.core.ssa;

import io.github.luanext.core.cfg.BlockId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A join-point definition, selecting a version of a variable by the predecessor control came from.
 * <p>
 * A phi has exactly one operand per predecessor edge of its block, in predecessor order.
 */
public final class PhiFunction {
    private SsaVar target;
    private final List<Operand> operands;

    PhiFunction(String name, List<BlockId> preds) {
        target = new SsaVar(name, 0);
        operands = new ArrayList<>(preds.size());
        for (BlockId pred : preds) {
            operands.add(new Operand(pred, target));
        }
    }

    public SsaVar getTarget() {
        return target;
    }

    public List<Operand> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * Get the version flowing in from a predecessor.
     *
     * @param pred The predecessor.
     * @return The incoming version, or empty if {@code pred} is not a predecessor.
     */
    public Optional<SsaVar> operandFrom(BlockId pred) {
        for (Operand operand : operands) {
            if (operand.pred.equals(pred)) return Optional.of(operand.value);
        }
        return Optional.empty();
    }

    void setTarget(SsaVar target) {
        this.target = target;
    }

    void setOperand(BlockId pred, SsaVar value) {
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i).pred.equals(pred)) {
                operands.set(i, new Operand(pred, value));
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(target).append(" = phi(");
        for (int i = 0; i < operands.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(operands.get(i));
        }
        return sb.append(')').toString();
    }

    /**
     * The version of the variable on one incoming edge.
     */
    public static final class Operand {
        /**
         * The predecessor the edge comes from.
         */
        public final BlockId pred;
        public final SsaVar value;

        public Operand(BlockId pred, SsaVar value) {
            this.pred = pred;
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Operand)) return false;
            Operand that = (Operand) o;
            return pred.equals(that.pred) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pred, value);
        }

        @Override
        public String toString() {
            return pred + ": " + value;
        }
    }
}
