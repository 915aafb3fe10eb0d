package io.github.luanext.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The way control leaves a {@link BasicBlock}.
 * <p>
 * The set of terminators is closed. Use {@link #getKind()} to dispatch on it.
 */
public abstract class Terminator {
    /**
     * The kinds of terminator.
     */
    public enum Kind {
        GOTO,
        BRANCH,
        RETURN,
        UNREACHABLE,
        LOOP_BACK,
        FALL_THROUGH,
        TRY_CATCH,
    }

    private static final Return RETURN = new Return();
    private static final Unreachable UNREACHABLE = new Unreachable();
    private static final FallThrough FALL_THROUGH = new FallThrough();

    Terminator() {
    }

    /**
     * Get the kind of this terminator.
     *
     * @return The kind.
     */
    public abstract Kind getKind();

    /**
     * Get the blocks control may go to from this terminator, in order.
     * <p>
     * {@link Return} and {@link FallThrough} reach {@link BlockId#EXIT}.
     *
     * @return The targets.
     */
    public abstract List<BlockId> targets();

    public static Goto jump(BlockId target) {
        return new Goto(target);
    }

    public static Branch branch(int conditionRef, BlockId trueTarget, BlockId falseTarget) {
        return new Branch(conditionRef, trueTarget, falseTarget);
    }

    public static Return ret() {
        return RETURN;
    }

    public static Unreachable unreachable() {
        return UNREACHABLE;
    }

    public static LoopBack loopBack(BlockId header) {
        return new LoopBack(header);
    }

    public static FallThrough fallThrough() {
        return FALL_THROUGH;
    }

    public static TryCatch tryCatch(BlockId normal, List<BlockId> catchTargets) {
        return new TryCatch(normal, catchTargets);
    }

    /**
     * An unconditional jump.
     */
    public static final class Goto extends Terminator {
        public final BlockId target;

        Goto(BlockId target) {
            this.target = target;
        }

        @Override
        public Kind getKind() {
            return Kind.GOTO;
        }

        @Override
        public List<BlockId> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Goto && ((Goto) o).target.equals(target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), target);
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    /**
     * A two-way conditional jump.
     */
    public static final class Branch extends Terminator {
        /**
         * The index of the statement whose condition decides the branch.
         */
        public final int conditionRef;
        public final BlockId trueTarget;
        public final BlockId falseTarget;

        Branch(int conditionRef, BlockId trueTarget, BlockId falseTarget) {
            this.conditionRef = conditionRef;
            this.trueTarget = trueTarget;
            this.falseTarget = falseTarget;
        }

        @Override
        public Kind getKind() {
            return Kind.BRANCH;
        }

        @Override
        public List<BlockId> targets() {
            List<BlockId> targets = new ArrayList<>(2);
            targets.add(trueTarget);
            targets.add(falseTarget);
            return Collections.unmodifiableList(targets);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Branch)) return false;
            Branch that = (Branch) o;
            return conditionRef == that.conditionRef
                    && trueTarget.equals(that.trueTarget)
                    && falseTarget.equals(that.falseTarget);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), conditionRef, trueTarget, falseTarget);
        }

        @Override
        public String toString() {
            return "br #" + conditionRef + " ? " + trueTarget + " : " + falseTarget;
        }
    }

    /**
     * A return from the scope.
     */
    public static final class Return extends Terminator {
        private Return() {
        }

        @Override
        public Kind getKind() {
            return Kind.RETURN;
        }

        @Override
        public List<BlockId> targets() {
            return Collections.singletonList(BlockId.EXIT);
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    /**
     * Control provably cannot leave the block normally, as after a {@code throw}.
     */
    public static final class Unreachable extends Terminator {
        private Unreachable() {
        }

        @Override
        public Kind getKind() {
            return Kind.UNREACHABLE;
        }

        @Override
        public List<BlockId> targets() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "unreachable";
        }
    }

    /**
     * The back-edge of a loop, to its header.
     */
    public static final class LoopBack extends Terminator {
        public final BlockId header;

        LoopBack(BlockId header) {
            this.header = header;
        }

        @Override
        public Kind getKind() {
            return Kind.LOOP_BACK;
        }

        @Override
        public List<BlockId> targets() {
            return Collections.singletonList(header);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof LoopBack && ((LoopBack) o).header.equals(header);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), header);
        }

        @Override
        public String toString() {
            return "loop " + header;
        }
    }

    /**
     * Control reaches the end of the scope without an explicit return.
     */
    public static final class FallThrough extends Terminator {
        private FallThrough() {
        }

        @Override
        public Kind getKind() {
            return Kind.FALL_THROUGH;
        }

        @Override
        public List<BlockId> targets() {
            return Collections.singletonList(BlockId.EXIT);
        }

        @Override
        public String toString() {
            return "fallthrough";
        }
    }

    /**
     * Entry into a protected region, which either completes normally or transfers
     * to one of its handlers.
     */
    public static final class TryCatch extends Terminator {
        public final BlockId normal;
        public final List<BlockId> catchTargets;

        TryCatch(BlockId normal, List<BlockId> catchTargets) {
            this.normal = normal;
            this.catchTargets = Collections.unmodifiableList(new ArrayList<>(catchTargets));
        }

        @Override
        public Kind getKind() {
            return Kind.TRY_CATCH;
        }

        @Override
        public List<BlockId> targets() {
            List<BlockId> targets = new ArrayList<>(catchTargets.size() + 1);
            targets.add(normal);
            targets.addAll(catchTargets);
            return Collections.unmodifiableList(targets);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof TryCatch)) return false;
            TryCatch that = (TryCatch) o;
            return normal.equals(that.normal) && catchTargets.equals(that.catchTargets);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), normal, catchTargets);
        }

        @Override
        public String toString() {
            return "try " + normal + " catch " + catchTargets;
        }
    }
}
