package io.github.luanext.core.ssa;

import io.github.luanext.ast.Statement;
import io.github.luanext.core.cfg.BlockId;
import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.cfg.StatementIndex;
import io.github.luanext.core.dom.DominatorTree;

import java.util.*;

/**
 * The static single assignment form of a scope.
 * <p>
 * Phi functions are placed at every block in the iterated dominance frontier of a
 * variable's definitions (no pruning), and every definition and use of a tracked
 * variable is given a version.
 * <p>
 * Statements in blocks unreachable from {@link BlockId#ENTRY} have no recorded
 * definitions or uses.
 */
public final class SsaForm {
    private final Map<BlockId, List<PhiFunction>> phiFunctions;
    private final Map<Integer, List<SsaVar>> definitions;
    private final Map<Integer, List<SsaVar>> uses;
    private final Map<String, Integer> versionCounters;
    private final Map<BlockId, Map<String, SsaVar>> reachingDefs;
    private final Set<String> allVariables;

    SsaForm(Map<BlockId, List<PhiFunction>> phiFunctions,
            Map<Integer, List<SsaVar>> definitions,
            Map<Integer, List<SsaVar>> uses,
            Map<String, Integer> versionCounters,
            Map<BlockId, Map<String, SsaVar>> reachingDefs,
            Set<String> allVariables) {
        this.phiFunctions = phiFunctions;
        this.definitions = definitions;
        this.uses = uses;
        this.versionCounters = Collections.unmodifiableMap(versionCounters);
        this.reachingDefs = reachingDefs;
        this.allVariables = Collections.unmodifiableSet(allVariables);
    }

    /**
     * Build the SSA form of a scope.
     *
     * @param cfg   The control-flow graph of the scope.
     * @param dom   The dominator tree of {@code cfg}.
     * @param index The statements {@code cfg} was built from.
     * @return The SSA form.
     * @throws IllegalArgumentException If {@code index} does not have as many statements as {@code cfg} was built from.
     */
    public static SsaForm build(ControlFlowGraph cfg, DominatorTree dom, StatementIndex index) {
        if (index.size() != cfg.statementCount()) {
            throw new IllegalArgumentException("graph was built from " + cfg.statementCount()
                    + " statements, but " + index.size() + " were given");
        }
        return new SsaBuilder(cfg, dom, index).build();
    }

    /**
     * Build the SSA form of a scope.
     *
     * @param cfg        The control-flow graph of the scope.
     * @param dom        The dominator tree of {@code cfg}.
     * @param statements The top-level statements {@code cfg} was built from.
     * @return The SSA form.
     * @throws IllegalArgumentException If the statements do not match those {@code cfg} was built from.
     */
    public static SsaForm build(ControlFlowGraph cfg, DominatorTree dom, List<Statement> statements) {
        return build(cfg, dom, StatementIndex.of(statements));
    }

    /**
     * Get the phi functions at the start of a block.
     *
     * @param block The block.
     * @return The phi functions, in placement order.
     */
    public List<PhiFunction> phisAt(BlockId block) {
        return phiFunctions.getOrDefault(block, Collections.emptyList());
    }

    /**
     * Get the versions a statement defines.
     *
     * @param stmtIndex The statement index.
     * @return The definitions, in order.
     */
    public List<SsaVar> defsAt(int stmtIndex) {
        return definitions.getOrDefault(stmtIndex, Collections.emptyList());
    }

    /**
     * Get the versions a statement reads.
     *
     * @param stmtIndex The statement index.
     * @return The uses, in order of appearance.
     */
    public List<SsaVar> usesAt(int stmtIndex) {
        return uses.getOrDefault(stmtIndex, Collections.emptyList());
    }

    /**
     * Get the version of a variable that is live at the end of a block.
     *
     * @param block The block.
     * @param name  The variable.
     * @return The version, or empty if the block is unreachable or the name is not tracked.
     */
    public Optional<SsaVar> reachingDef(BlockId block, String name) {
        Map<String, SsaVar> defs = reachingDefs.get(block);
        return defs == null ? Optional.empty() : Optional.ofNullable(defs.get(name));
    }

    /**
     * Get the number of versions created for a variable, including phi targets.
     *
     * @param name The variable.
     * @return The highest version, or {@code 0} if the variable was never defined.
     */
    public int versionCount(String name) {
        return versionCounters.getOrDefault(name, 0);
    }

    /**
     * Get the highest version of every tracked variable.
     *
     * @return The version counters.
     */
    public Map<String, Integer> versionCounters() {
        return versionCounters;
    }

    /**
     * Get every variable defined somewhere in the scope.
     *
     * @return The variables, in discovery order.
     */
    public Set<String> allVariables() {
        return allVariables;
    }
}
