package io.github.luanext.core.passes.form;

import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.ext.AnalysisExts;
import io.github.luanext.core.ext.MetadataState;
import io.github.luanext.core.passes.AnalysisPass;
import io.github.luanext.core.ssa.SsaForm;

/**
 * Computes {@link AnalysisExts#SSA_FORM} for a unit,
 * computing its control-flow graph and dominators first if needed.
 */
public class BuildSsa extends AnalysisPass {
    /**
     * A singleton instance of this pass.
     */
    public static final BuildSsa INSTANCE = new BuildSsa();

    private BuildSsa() {
    }

    @Override
    protected void runOn(AnalysisUnit unit) {
        MetadataState ms = unit.getExtOrThrow(AnalysisExts.METADATA_STATE);
        ms.ensureValid(unit, MetadataState.Kind.CFG, MetadataState.Kind.DOMS);
        unit.attachExt(AnalysisExts.SSA_FORM, SsaForm.build(
                unit.getExtOrThrow(AnalysisExts.CFG),
                unit.getExtOrThrow(AnalysisExts.DOM_TREE),
                unit.getIndex()
        ));
        ms.validate(MetadataState.Kind.SSA_FORM);
    }
}
