package io.github.luanext.core;

import io.github.luanext.ast.Statement;
import io.github.luanext.core.cfg.StatementIndex;
import io.github.luanext.core.ext.AnalysisExts;
import io.github.luanext.core.ext.ExtHolder;
import io.github.luanext.core.ext.MetadataState;

import java.util.List;

/**
 * One scope to be analyzed: the top level of a program, or the body of a function.
 * <p>
 * Analysis results are attached to the unit as exts (see {@link AnalysisExts}),
 * and its {@link MetadataState} records which of them have been computed.
 */
public class AnalysisUnit extends ExtHolder {
    private final String name;
    private final StatementIndex index;

    /**
     * Construct an analysis unit.
     *
     * @param name       The name of the scope.
     * @param statements The top-level statements of the scope.
     * @throws IllegalArgumentException If a statement object occurs more than once in the scope.
     */
    public AnalysisUnit(String name, List<Statement> statements) {
        this.name = name;
        index = StatementIndex.of(statements);
        attachExt(AnalysisExts.METADATA_STATE, new MetadataState());
    }

    public String getName() {
        return name;
    }

    /**
     * Get the numbering of every statement in the scope.
     *
     * @return The statement index.
     */
    public StatementIndex getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return name;
    }
}
