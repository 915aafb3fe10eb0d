package io.github.luanext.core.passes;

import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.FunctionAnalysis;
import io.github.luanext.core.passes.form.BuildSsa;
import io.github.luanext.core.passes.meta.BuildCfg;
import io.github.luanext.core.passes.meta.ComputeDominators;

public class Passes {
    public static final IRPass<AnalysisUnit, FunctionAnalysis> FULL_ANALYSIS =
            BuildCfg.INSTANCE
                    .then(ComputeDominators.INSTANCE)
                    .then(BuildSsa.INSTANCE)
                    .then(FunctionAnalysis::of);
}
