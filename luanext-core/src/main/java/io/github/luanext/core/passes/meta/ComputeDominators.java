package io.github.luanext.core.passes.meta;

import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.dom.DominatorTree;
import io.github.luanext.core.ext.AnalysisExts;
import io.github.luanext.core.ext.MetadataState;
import io.github.luanext.core.passes.AnalysisPass;

/**
 * Computes {@link AnalysisExts#DOM_TREE}, with dominance frontiers, for a unit.
 */
public class ComputeDominators extends AnalysisPass {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDominators INSTANCE = new ComputeDominators();

    private ComputeDominators() {
    }

    @Override
    protected void runOn(AnalysisUnit unit) {
        MetadataState ms = unit.getExtOrThrow(AnalysisExts.METADATA_STATE);
        ms.ensureValid(unit, MetadataState.Kind.CFG);
        unit.attachExt(AnalysisExts.DOM_TREE, DominatorTree.build(unit.getExtOrThrow(AnalysisExts.CFG)));
        ms.validate(MetadataState.Kind.DOMS);
    }
}
