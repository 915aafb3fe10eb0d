package io.github.luanext.core;

import com.google.common.flogger.FluentLogger;
import io.github.luanext.ast.Statement;
import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.cfg.StatementIndex;
import io.github.luanext.core.display.AnalysisDisplay;
import io.github.luanext.core.passes.Passes;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * The analyses of every scope in a program: the top level, and the body of every
 * named function declaration, however deeply nested.
 * <p>
 * If two functions are declared with the same name, the one found later
 * (in pre-order) replaces the earlier.
 */
public final class AnalysisContext {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /**
     * The name the top-level scope is analyzed under.
     */
    public static final String TOP_LEVEL = "<top-level>";

    private final Map<String, FunctionAnalysis> analyses;

    private AnalysisContext(Map<String, FunctionAnalysis> analyses) {
        this.analyses = Collections.unmodifiableMap(analyses);
    }

    /**
     * Analyze a program with the {@link AnalysisOptions#defaults() default options}.
     *
     * @param program The top-level statements of the program.
     * @return The analyses.
     */
    public static AnalysisContext compute(List<Statement> program) {
        return compute(program, AnalysisOptions.defaults());
    }

    /**
     * Analyze a program.
     *
     * @param program The top-level statements of the program.
     * @param options The options.
     * @return The analyses.
     */
    public static AnalysisContext compute(List<Statement> program, AnalysisOptions options) {
        Map<String, AnalysisUnit> units = new LinkedHashMap<>();
        AnalysisUnit top = new AnalysisUnit(TOP_LEVEL, program);
        units.put(TOP_LEVEL, top);
        collectFunctions(top.getIndex(), units);

        Map<String, CompletableFuture<FunctionAnalysis>> futures = new LinkedHashMap<>();
        for (AnalysisUnit unit : units.values()) {
            futures.put(unit.getName(), CompletableFuture.supplyAsync(
                    () -> Passes.FULL_ANALYSIS.run(unit),
                    options.getExecutor()
            ));
        }

        Map<String, FunctionAnalysis> analyses = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<FunctionAnalysis>> entry : futures.entrySet()) {
            try {
                analyses.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
                if (e.getCause() instanceof Error) throw (Error) e.getCause();
                throw e;
            }
        }
        logger.atFine().log("analyzed %d scopes", analyses.size());

        Path dumpDirectory = options.getDumpDirectory();
        if (dumpDirectory != null) {
            for (FunctionAnalysis analysis : analyses.values()) {
                AnalysisDisplay.writeDot(analysis, dumpDirectory);
            }
            logger.atInfo().log("dumped %d scopes to %s", analyses.size(), dumpDirectory);
        }
        return new AnalysisContext(analyses);
    }

    private static void collectFunctions(StatementIndex index, Map<String, AnalysisUnit> units) {
        for (Statement stmt : index.statements()) {
            if (stmt instanceof Statement.FunctionDecl) {
                Statement.FunctionDecl decl = (Statement.FunctionDecl) stmt;
                AnalysisUnit unit = new AnalysisUnit(decl.name, decl.body.statements);
                if (units.remove(decl.name) != null) {
                    logger.atFine().log("function %s is declared more than once, keeping the last", decl.name);
                }
                units.put(decl.name, unit);
                collectFunctions(unit.getIndex(), units);
            }
        }
    }

    /**
     * Get the analyses of the top-level scope.
     *
     * @return The analyses.
     */
    public FunctionAnalysis topLevel() {
        return analyses.get(TOP_LEVEL);
    }

    /**
     * Get the control-flow graph of the top-level scope.
     *
     * @return The graph.
     */
    public ControlFlowGraph topLevelCfg() {
        return topLevel().getCfg();
    }

    /**
     * Get the analyses of a named function.
     *
     * @param name The function name, or {@link #TOP_LEVEL}.
     * @return The analyses, or empty if no such function was declared.
     */
    public Optional<FunctionAnalysis> functionAnalysis(String name) {
        return Optional.ofNullable(analyses.get(name));
    }

    /**
     * Get the names of every analyzed scope, including {@link #TOP_LEVEL}.
     *
     * @return The names, in discovery order.
     */
    public Set<String> analyzedFunctions() {
        return analyses.keySet();
    }
}
