package io.github.luanext.core.ext;

import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.passes.IRPass;
import io.github.luanext.core.passes.form.BuildSsa;
import io.github.luanext.core.passes.meta.BuildCfg;
import io.github.luanext.core.passes.meta.ComputeDominators;

import java.util.EnumSet;
import java.util.Set;

/**
 * Records which analyses of an {@link AnalysisUnit} are attached and up to date.
 */
public final class MetadataState {
    /**
     * An analysis that can be attached to a unit, and the pass that computes it.
     */
    public enum Kind {
        CFG,
        DOMS,
        SSA_FORM;

        IRPass<AnalysisUnit, AnalysisUnit> pass() {
            switch (this) {
                case CFG:
                    return BuildCfg.INSTANCE;
                case DOMS:
                    return ComputeDominators.INSTANCE;
                case SSA_FORM:
                    return BuildSsa.INSTANCE;
                default:
                    throw new AssertionError(this);
            }
        }
    }

    private final Set<Kind> valid = EnumSet.noneOf(Kind.class);

    public boolean isValid(Kind kind) {
        return valid.contains(kind);
    }

    /**
     * Compute each of the given analyses that is not already valid, in order.
     *
     * @param unit  The unit this state belongs to.
     * @param kinds The analyses.
     */
    public void ensureValid(AnalysisUnit unit, Kind... kinds) {
        for (Kind kind : kinds) {
            if (!isValid(kind)) {
                kind.pass().run(unit);
                validate(kind);
            }
        }
    }

    /**
     * Mark analyses as valid, after they have been attached.
     *
     * @param kinds The analyses.
     */
    public void validate(Kind... kinds) {
        for (Kind kind : kinds) {
            valid.add(kind);
        }
    }
}
