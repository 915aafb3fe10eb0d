package io.github.luanext.core.display;

import io.github.luanext.core.FunctionAnalysis;
import io.github.luanext.core.cfg.BasicBlock;
import io.github.luanext.core.cfg.BlockId;
import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.dom.DominatorTree;
import io.github.luanext.core.ssa.PhiFunction;
import io.github.luanext.core.ssa.SsaForm;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders analyses as Graphviz DOT, for debugging.
 * <p>
 * Control-flow edges are solid. Each block also has a dotted edge from its immediate dominator.
 * Blocks unreachable from the entry are dashed, and loop headers are bold.
 */
public class AnalysisDisplay {
    /**
     * Render the analyses of a scope.
     *
     * @param analysis The analyses.
     * @return The DOT source.
     */
    public static String toDot(FunctionAnalysis analysis) {
        ControlFlowGraph cfg = analysis.getCfg();
        DominatorTree dom = analysis.getDominators();
        SsaForm ssa = analysis.getSsa();

        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(analysis.getName())).append("\" {\n");
        sb.append("  node [shape=box, fontname=\"monospace\"];\n");
        for (BasicBlock block : cfg.blocks()) {
            BlockId id = block.getId();
            StringBuilder label = new StringBuilder(id.toString());
            if (id.equals(BlockId.ENTRY)) label.append(" (entry)");
            if (id.equals(BlockId.EXIT)) label.append(" (exit)");
            label.append("\\l");
            for (PhiFunction phi : ssa.phisAt(id)) {
                label.append(escape(phi.toString())).append("\\l");
            }
            for (int stmt : block.getStatementIndices()) {
                label.append('#').append(stmt).append(": ")
                        .append(escape(analysis.getIndex().get(stmt).toString()));
                List<?> defs = ssa.defsAt(stmt);
                if (!defs.isEmpty()) label.append("  ; defs ").append(escape(defs.toString()));
                label.append("\\l");
            }
            label.append(escape(block.getTerminator().toString())).append("\\l");

            sb.append("  ").append(id).append(" [label=\"").append(label).append('"');
            if (!dom.isReachable(id)) sb.append(", style=dashed");
            else if (cfg.isLoopHeader(id)) sb.append(", style=bold");
            sb.append("];\n");
        }
        for (BasicBlock block : cfg.blocks()) {
            for (BlockId succ : cfg.succs(block.getId())) {
                sb.append("  ").append(block.getId()).append(" -> ").append(succ).append(";\n");
            }
        }
        for (BlockId block : dom.reversePostorder()) {
            dom.immediateDominator(block).ifPresent(idom -> sb.append("  ")
                    .append(idom).append(" -> ").append(block)
                    .append(" [style=dotted, color=blue, constraint=false];\n"));
        }
        return sb.append("}\n").toString();
    }

    /**
     * Write the rendering of a scope to {@code <directory>/<name>.dot}, creating the directory if needed.
     * <p>
     * Characters that are unsafe in a file name are replaced with {@code _}, and the file name
     * then gets a suffix from the hash of the scope name, so distinct scopes get distinct files.
     *
     * @param analysis  The analyses.
     * @param directory The directory.
     * @return The file written.
     */
    public static Path writeDot(FunctionAnalysis analysis, Path directory) {
        Path file = directory.resolve(fileName(analysis.getName()));
        try {
            Files.createDirectories(directory);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(toDot(analysis));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    static String fileName(String scopeName) {
        String safe = scopeName.replaceAll("[^A-Za-z0-9_.]", "_");
        if (safe.equals(scopeName)) return safe + ".dot";
        // '-' never survives sanitizing, so suffixed names cannot clash with plain ones
        return safe + "-" + Integer.toHexString(scopeName.hashCode()) + ".dot";
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\l");
    }
}
