package io.github.luanext.core.cfg;

import io.github.luanext.ast.Block;
import io.github.luanext.ast.Statement;

import java.util.*;

/**
 * A stable numbering of every statement in a scope.
 * <p>
 * Statements are numbered in pre-order: a statement comes before the statements
 * of its nested bodies, which come before the statement that follows it.
 * Bodies of function declarations and function expressions are separate scopes,
 * and are not numbered.
 */
public final class StatementIndex {
    private final List<Statement> roots;
    private final List<Statement> statements = new ArrayList<>();
    private final Map<Statement, Integer> indices = new IdentityHashMap<>();

    private StatementIndex(List<Statement> roots) {
        this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
        for (Statement stmt : roots) {
            add(stmt);
        }
    }

    /**
     * Number the statements of a scope.
     *
     * @param statements The top-level statements of the scope.
     * @return The index.
     */
    public static StatementIndex of(List<Statement> statements) {
        return new StatementIndex(statements);
    }

    /**
     * Number the statements of a scope.
     *
     * @param block The body of the scope.
     * @return The index.
     */
    public static StatementIndex of(Block block) {
        return of(block.statements);
    }

    private void add(Statement stmt) {
        if (indices.put(stmt, statements.size()) != null) {
            throw new IllegalArgumentException("statement " + stmt + " appears more than once in the scope");
        }
        statements.add(stmt);
        for (Block nested : stmt.nestedBlocks()) {
            for (Statement child : nested.statements) {
                add(child);
            }
        }
    }

    /**
     * Get the top-level statements of the scope.
     *
     * @return The statements, as given.
     */
    public List<Statement> roots() {
        return roots;
    }

    /**
     * Get the number of statements in the scope, including nested ones.
     *
     * @return The number of statements.
     */
    public int size() {
        return statements.size();
    }

    public Statement get(int index) {
        return statements.get(index);
    }

    /**
     * Get the index of a statement.
     *
     * @param stmt The statement.
     * @return Its index.
     * @throws IllegalArgumentException If the statement is not part of this scope.
     */
    public int indexOf(Statement stmt) {
        Integer index = indices.get(stmt);
        if (index == null) {
            throw new IllegalArgumentException("statement " + stmt + " is not part of this scope");
        }
        return index;
    }

    /**
     * Get all statements in the scope, in index order.
     *
     * @return The statements.
     */
    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }
}
