package io.github.luanext.core;

import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.cfg.StatementIndex;
import io.github.luanext.core.dom.DominatorTree;
import io.github.luanext.core.ext.AnalysisExts;
import io.github.luanext.core.ssa.SsaForm;

/**
 * The control-flow graph, dominator tree and SSA form of one scope.
 */
public final class FunctionAnalysis {
    private final String name;
    private final StatementIndex index;
    private final ControlFlowGraph cfg;
    private final DominatorTree dominators;
    private final SsaForm ssa;

    public FunctionAnalysis(String name,
                            StatementIndex index,
                            ControlFlowGraph cfg,
                            DominatorTree dominators,
                            SsaForm ssa) {
        this.name = name;
        this.index = index;
        this.cfg = cfg;
        this.dominators = dominators;
        this.ssa = ssa;
    }

    /**
     * Collect the analyses attached to a unit.
     *
     * @param unit The unit.
     * @return The analyses.
     * @throws java.util.NoSuchElementException If an analysis has not been run on the unit.
     */
    public static FunctionAnalysis of(AnalysisUnit unit) {
        return new FunctionAnalysis(
                unit.getName(),
                unit.getIndex(),
                unit.getExtOrThrow(AnalysisExts.CFG),
                unit.getExtOrThrow(AnalysisExts.DOM_TREE),
                unit.getExtOrThrow(AnalysisExts.SSA_FORM)
        );
    }

    public String getName() {
        return name;
    }

    /**
     * Get the numbering of the scope's statements, which statement indices in the
     * other analyses refer to.
     *
     * @return The statement index.
     */
    public StatementIndex getIndex() {
        return index;
    }

    public ControlFlowGraph getCfg() {
        return cfg;
    }

    public DominatorTree getDominators() {
        return dominators;
    }

    public SsaForm getSsa() {
        return ssa;
    }
}
