package io.github.luanext.core.passes.misc;

import io.github.luanext.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of passes, each run on the output of the one before.
 * <p>
 * Nested chains are flattened when the chain is built, so passes are numbered by
 * their position in the whole sequence. If a pass throws, the exception gets a suppressed
 * exception naming that position and the pass.
 *
 * @param <A> The input type of the first pass.
 * @param <C> The output type of the last pass.
 */
public class ChainedPass<A, C> implements IRPass<A, C> {
    private final List<IRPass<Object, Object>> passes;
    private final boolean isInPlace;

    /**
     * Chain two passes.
     *
     * @param firstPass The pass to run first.
     * @param nextPass  The pass to run on its output.
     * @param <B>       The type passed between them.
     */
    public <B> ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<Object, Object>> passes = new ArrayList<>();
        flatten(firstPass, passes);
        flatten(nextPass, passes);
        this.passes = Collections.unmodifiableList(passes);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    private static void flatten(IRPass<?, ?> pass, List<IRPass<Object, Object>> into) {
        if (pass instanceof ChainedPass) {
            into.addAll(((ChainedPass<?, ?>) pass).passes);
        } else {
            into.add((IRPass<Object, Object>) pass);
        }
    }

    /**
     * Get the passes in this chain, in the order they are run.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " (" + pass + ") in chain"));
                throw t;
            }
        }
        return (C) acc;
    }
}
