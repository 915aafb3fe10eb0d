package io.github.luanext.core.ext;

import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.dom.DominatorTree;
import io.github.luanext.core.ssa.SsaForm;

/**
 * Exts attached to an {@link AnalysisUnit}.
 */
public class AnalysisExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.of("METADATA_STATE", MetadataState.class);

    public static final Ext<ControlFlowGraph> CFG = Ext.of("CFG", ControlFlowGraph.class);
    public static final Ext<DominatorTree> DOM_TREE = Ext.of("DOM_TREE", DominatorTree.class);
    public static final Ext<SsaForm> SSA_FORM = Ext.of("SSA_FORM", SsaForm.class);
}
