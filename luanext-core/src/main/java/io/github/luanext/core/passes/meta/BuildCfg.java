package io.github.luanext.core.passes.meta;

import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.cfg.CfgBuilder;
import io.github.luanext.core.ext.AnalysisExts;
import io.github.luanext.core.ext.MetadataState;
import io.github.luanext.core.passes.AnalysisPass;

/**
 * Computes {@link AnalysisExts#CFG} for a unit.
 */
public class BuildCfg extends AnalysisPass {
    /**
     * A singleton instance of this pass.
     */
    public static final BuildCfg INSTANCE = new BuildCfg();

    private BuildCfg() {
    }

    @Override
    protected void runOn(AnalysisUnit unit) {
        unit.attachExt(AnalysisExts.CFG, CfgBuilder.build(unit.getIndex()));
        unit.getExtOrThrow(AnalysisExts.METADATA_STATE).validate(MetadataState.Kind.CFG);
    }
}
