package io.github.luanext.core.ssa;

import com.google.common.flogger.FluentLogger;
import io.github.luanext.core.cfg.BasicBlock;
import io.github.luanext.core.cfg.BlockId;
import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.cfg.StatementIndex;
import io.github.luanext.core.dom.DominatorTree;

import java.util.*;

/**
 * Builds {@link SsaForm}, after Cytron et al. (1991),
 * "Efficiently Computing Static Single Assignment Form and the Control Dependence Graph".
 */
final class SsaBuilder {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final ControlFlowGraph cfg;
    private final DominatorTree dom;
    private final StatementIndex index;

    private final Map<String, Set<BlockId>> defBlocks = new HashMap<>();
    private final Set<String> allVariables = new LinkedHashSet<>();
    private final Map<BlockId, List<PhiFunction>> phiFunctions = new HashMap<>();
    private final Map<Integer, List<SsaVar>> definitions = new HashMap<>();
    private final Map<Integer, List<SsaVar>> uses = new HashMap<>();
    private final Map<String, Integer> versionCounters = new LinkedHashMap<>();
    private final Map<String, List<Integer>> versionStacks = new HashMap<>();
    private final Map<BlockId, Map<String, SsaVar>> reachingDefs = new HashMap<>();

    SsaBuilder(ControlFlowGraph cfg, DominatorTree dom, StatementIndex index) {
        this.cfg = cfg;
        this.dom = dom;
        this.index = index;
    }

    SsaForm build() {
        collectDefinitions();
        int phis = placePhis();
        rename();
        logger.atFine().log("SSA: %d variables, %d phi functions", allVariables.size(), phis);

        Map<BlockId, List<PhiFunction>> frozenPhis = new HashMap<>();
        for (Map.Entry<BlockId, List<PhiFunction>> entry : phiFunctions.entrySet()) {
            frozenPhis.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
        }
        return new SsaForm(frozenPhis, definitions, uses, versionCounters, reachingDefs, allVariables);
    }

    private void collectDefinitions() {
        for (BasicBlock block : cfg.blocks()) {
            for (int stmt : block.getStatementIndices()) {
                for (String name : VariableCollector.definitions(index.get(stmt))) {
                    allVariables.add(name);
                    defBlocks.computeIfAbsent(name, $ -> new LinkedHashSet<>()).add(block.getId());
                }
            }
        }
    }

    private int placePhis() {
        int count = 0;
        for (String name : allVariables) {
            Deque<BlockId> worklist = new ArrayDeque<>(defBlocks.get(name));
            Set<BlockId> processed = new HashSet<>();
            Set<BlockId> placed = new HashSet<>();
            while (!worklist.isEmpty()) {
                BlockId block = worklist.pop();
                if (!processed.add(block)) continue;
                for (BlockId frontier : dom.frontier(block)) {
                    if (placed.add(frontier)) {
                        count++;
                        phiFunctions.computeIfAbsent(frontier, $ -> new ArrayList<>())
                                .add(new PhiFunction(name, cfg.preds(frontier)));
                        worklist.push(frontier);
                    }
                }
            }
        }
        return count;
    }

    private void rename() {
        for (String name : allVariables) {
            versionCounters.put(name, 0);
            versionStacks.put(name, new ArrayList<>(Collections.singletonList(0)));
        }
        // iterative, the dominator tree can be as deep as the chunk is long
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(enter(BlockId.ENTRY));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.children.hasNext()) {
                stack.push(enter(top.children.next()));
            } else {
                stack.pop();
                leave(top);
            }
        }
    }

    private Frame enter(BlockId block) {
        // one entry per version pushed in this block, popped in leave
        List<String> pushed = new ArrayList<>();

        for (PhiFunction phi : phisAt(block)) {
            String name = phi.getTarget().name;
            pushed.add(name);
            phi.setTarget(newVersion(name));
        }

        for (int stmt : cfg.block(block).getStatementIndices()) {
            List<SsaVar> stmtUses = new ArrayList<>();
            for (String name : VariableCollector.uses(index.get(stmt), allVariables)) {
                stmtUses.add(current(name));
            }
            if (!stmtUses.isEmpty()) {
                uses.put(stmt, Collections.unmodifiableList(stmtUses));
            }

            List<SsaVar> stmtDefs = new ArrayList<>();
            for (String name : VariableCollector.definitions(index.get(stmt))) {
                pushed.add(name);
                stmtDefs.add(newVersion(name));
            }
            if (!stmtDefs.isEmpty()) {
                definitions.put(stmt, Collections.unmodifiableList(stmtDefs));
            }
        }

        Map<String, SsaVar> live = new HashMap<>();
        for (String name : allVariables) {
            live.put(name, current(name));
        }
        reachingDefs.put(block, Collections.unmodifiableMap(live));

        for (BlockId succ : cfg.succs(block)) {
            for (PhiFunction phi : phisAt(succ)) {
                phi.setOperand(block, current(phi.getTarget().name));
            }
        }

        return new Frame(pushed, dom.children(block).iterator());
    }

    private void leave(Frame frame) {
        for (int i = frame.pushed.size() - 1; i >= 0; i--) {
            List<Integer> stack = versionStacks.get(frame.pushed.get(i));
            stack.remove(stack.size() - 1);
        }
    }

    private List<PhiFunction> phisAt(BlockId block) {
        return phiFunctions.getOrDefault(block, Collections.emptyList());
    }

    private SsaVar newVersion(String name) {
        int version = versionCounters.merge(name, 1, Integer::sum);
        versionStacks.get(name).add(version);
        return new SsaVar(name, version);
    }

    private SsaVar current(String name) {
        List<Integer> stack = versionStacks.get(name);
        return new SsaVar(name, stack.get(stack.size() - 1));
    }

    private static final class Frame {
        final List<String> pushed;
        final Iterator<BlockId> children;

        Frame(List<String> pushed, Iterator<BlockId> children) {
            this.pushed = pushed;
            this.children = children;
        }
    }
}
