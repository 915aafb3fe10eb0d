package io.github.luanext.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A statement node.
 * <p>
 * The set of statement kinds is closed; use a {@link Visitor} to dispatch on it.
 * Statements are compared by identity.
 */
public abstract class Statement {
    /**
     * The span of this statement.
     */
    public final Span span;

    Statement(Span span) {
        this.span = span;
    }

    /**
     * Accept a visitor.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Get the bodies nested directly in this statement that belong to the same scope,
     * in source order.
     * <p>
     * Function bodies are not included, since they form scopes of their own.
     *
     * @return The nested blocks.
     */
    public List<Block> nestedBlocks() {
        return Collections.emptyList();
    }

    /**
     * A visitor over the kinds of statement.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitVariable(Variable stmt);

        R visitFunction(FunctionDecl stmt);

        R visitExpression(ExprStatement stmt);

        R visitMultiAssignment(MultiAssignment stmt);

        R visitIf(If stmt);

        R visitWhile(While stmt);

        R visitNumericFor(NumericFor stmt);

        R visitGenericFor(GenericFor stmt);

        R visitRepeat(Repeat stmt);

        R visitReturn(Return stmt);

        R visitBreak(Break stmt);

        R visitContinue(Continue stmt);

        R visitLabel(Label stmt);

        R visitGoto(Goto stmt);

        R visitDo(Do stmt);

        R visitTry(Try stmt);

        R visitThrow(Throw stmt);

        R visitRethrow(Rethrow stmt);

        R visitDeclaration(Declaration stmt);
    }

    /**
     * A visitor which returns {@link #otherwise(Statement)} for every statement kind
     * it does not override.
     *
     * @param <R> The result type.
     */
    public abstract static class BaseVisitor<R> implements Visitor<R> {
        /**
         * The result for statement kinds that are not overridden.
         *
         * @param stmt The statement.
         * @return The result.
         */
        protected abstract R otherwise(Statement stmt);

        @Override
        public R visitVariable(Variable stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitFunction(FunctionDecl stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitExpression(ExprStatement stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitMultiAssignment(MultiAssignment stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitIf(If stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitWhile(While stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitNumericFor(NumericFor stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitGenericFor(GenericFor stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitRepeat(Repeat stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitReturn(Return stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitBreak(Break stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitContinue(Continue stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitLabel(Label stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitGoto(Goto stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitDo(Do stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitTry(Try stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitThrow(Throw stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitRethrow(Rethrow stmt) {
            return otherwise(stmt);
        }

        @Override
        public R visitDeclaration(Declaration stmt) {
            return otherwise(stmt);
        }
    }

    /**
     * The storage class of a {@link Variable}.
     */
    public enum VariableKind {
        LOCAL,
        CONST,
        GLOBAL,
    }

    /**
     * A variable declaration, {@code local pattern = initializer}.
     */
    public static final class Variable extends Statement {
        public final VariableKind kind;
        public final Pattern pattern;
        @Nullable
        public final Expression initializer;

        Variable(VariableKind kind, Pattern pattern, @Nullable Expression initializer, Span span) {
            super(span);
            this.kind = kind;
            this.pattern = pattern;
            this.initializer = initializer;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public String toString() {
            return kind.name().toLowerCase() + " " + pattern + (initializer == null ? "" : " = " + initializer);
        }
    }

    /**
     * A named function declaration. Its body is a scope of its own.
     */
    public static final class FunctionDecl extends Statement {
        public final String name;
        public final List<String> parameters;
        public final Block body;

        FunctionDecl(String name, List<String> parameters, Block body, Span span) {
            super(span);
            this.name = name;
            this.parameters = Collections.unmodifiableList(parameters);
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public String toString() {
            return "function " + name + "(" + String.join(", ", parameters) + ") ... end";
        }
    }

    /**
     * An expression evaluated for its effect, such as a call or an assignment.
     */
    public static final class ExprStatement extends Statement {
        public final Expression expression;

        ExprStatement(Expression expression, Span span) {
            super(span);
            this.expression = expression;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpression(this);
        }

        @Override
        public String toString() {
            return expression.toString();
        }
    }

    /**
     * A parallel assignment, {@code a, b = b, a}.
     */
    public static final class MultiAssignment extends Statement {
        public final List<Expression> targets;
        public final List<Expression> values;

        MultiAssignment(List<Expression> targets, List<Expression> values, Span span) {
            super(span);
            this.targets = Collections.unmodifiableList(targets);
            this.values = Collections.unmodifiableList(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMultiAssignment(this);
        }

        @Override
        public String toString() {
            return Ast.join(targets) + " = " + Ast.join(values);
        }
    }

    /**
     * An {@code elseif} arm of an {@link If}.
     */
    public static final class ElseIf {
        public final Expression condition;
        public final Block body;
        public final Span span;

        ElseIf(Expression condition, Block body, Span span) {
            this.condition = condition;
            this.body = body;
            this.span = span;
        }
    }

    /**
     * An {@code if ... elseif ... else ... end} statement.
     */
    public static final class If extends Statement {
        public final Expression condition;
        public final Block thenBlock;
        public final List<ElseIf> elseIfs;
        @Nullable
        public final Block elseBlock;

        If(Expression condition, Block thenBlock, List<ElseIf> elseIfs, @Nullable Block elseBlock, Span span) {
            super(span);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseIfs = Collections.unmodifiableList(elseIfs);
            this.elseBlock = elseBlock;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public List<Block> nestedBlocks() {
            return Ast.blocks(thenBlock, elseIfs.stream().map(it -> it.body), elseBlock);
        }

        @Override
        public String toString() {
            return "if " + condition + " then ... end";
        }
    }

    /**
     * A {@code while cond do ... end} loop.
     */
    public static final class While extends Statement {
        public final Expression condition;
        public final Block body;

        While(Expression condition, Block body, Span span) {
            super(span);
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }

        @Override
        public List<Block> nestedBlocks() {
            return Collections.singletonList(body);
        }

        @Override
        public String toString() {
            return "while " + condition + " do ... end";
        }
    }

    /**
     * A numeric {@code for i = start, end, step do ... end} loop.
     */
    public static final class NumericFor extends Statement {
        public final String variable;
        public final Expression start;
        public final Expression end;
        @Nullable
        public final Expression step;
        public final Block body;

        NumericFor(String variable, Expression start, Expression end, @Nullable Expression step, Block body, Span span) {
            super(span);
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.step = step;
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumericFor(this);
        }

        @Override
        public List<Block> nestedBlocks() {
            return Collections.singletonList(body);
        }

        @Override
        public String toString() {
            return "for " + variable + " = " + start + ", " + end + (step == null ? "" : ", " + step) + " do ... end";
        }
    }

    /**
     * A generic {@code for k, v in iterators do ... end} loop.
     */
    public static final class GenericFor extends Statement {
        public final List<String> variables;
        public final List<Expression> iterators;
        public final Block body;

        GenericFor(List<String> variables, List<Expression> iterators, Block body, Span span) {
            super(span);
            this.variables = Collections.unmodifiableList(variables);
            this.iterators = Collections.unmodifiableList(iterators);
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGenericFor(this);
        }

        @Override
        public List<Block> nestedBlocks() {
            return Collections.singletonList(body);
        }

        @Override
        public String toString() {
            return "for " + String.join(", ", variables) + " in " + Ast.join(iterators) + " do ... end";
        }
    }

    /**
     * A {@code repeat ... until cond} loop.
     */
    public static final class Repeat extends Statement {
        public final Block body;
        public final Expression condition;

        Repeat(Block body, Expression condition, Span span) {
            super(span);
            this.body = body;
            this.condition = condition;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }

        @Override
        public List<Block> nestedBlocks() {
            return Collections.singletonList(body);
        }

        @Override
        public String toString() {
            return "repeat ... until " + condition;
        }
    }

    /**
     * A {@code return} statement.
     */
    public static final class Return extends Statement {
        public final List<Expression> values;

        Return(List<Expression> values, Span span) {
            super(span);
            this.values = Collections.unmodifiableList(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public String toString() {
            return values.isEmpty() ? "return" : "return " + Ast.join(values);
        }
    }

    /**
     * A {@code break} statement.
     */
    public static final class Break extends Statement {
        Break(Span span) {
            super(span);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }

        @Override
        public String toString() {
            return "break";
        }
    }

    /**
     * A {@code continue} statement.
     */
    public static final class Continue extends Statement {
        Continue(Span span) {
            super(span);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }

        @Override
        public String toString() {
            return "continue";
        }
    }

    /**
     * A {@code ::name::} label.
     */
    public static final class Label extends Statement {
        public final String name;

        Label(String name, Span span) {
            super(span);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLabel(this);
        }

        @Override
        public String toString() {
            return "::" + name + "::";
        }
    }

    /**
     * A {@code goto name} statement.
     */
    public static final class Goto extends Statement {
        public final String target;

        Goto(String target, Span span) {
            super(span);
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGoto(this);
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    /**
     * A {@code do ... end} block.
     */
    public static final class Do extends Statement {
        public final Block body;

        Do(Block body, Span span) {
            super(span);
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDo(this);
        }

        @Override
        public List<Block> nestedBlocks() {
            return Collections.singletonList(body);
        }

        @Override
        public String toString() {
            return "do ... end";
        }
    }

    /**
     * A {@code catch (variable) ... } clause of a {@link Try}.
     */
    public static final class CatchClause {
        @Nullable
        public final String variable;
        public final Block body;
        public final Span span;

        CatchClause(@Nullable String variable, Block body, Span span) {
            this.variable = variable;
            this.body = body;
            this.span = span;
        }
    }

    /**
     * A {@code try ... catch ... finally ... end} statement.
     */
    public static final class Try extends Statement {
        public final Block tryBlock;
        public final List<CatchClause> catchClauses;
        @Nullable
        public final Block finallyBlock;

        Try(Block tryBlock, List<CatchClause> catchClauses, @Nullable Block finallyBlock, Span span) {
            super(span);
            this.tryBlock = tryBlock;
            this.catchClauses = Collections.unmodifiableList(catchClauses);
            this.finallyBlock = finallyBlock;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTry(this);
        }

        @Override
        public List<Block> nestedBlocks() {
            return Ast.blocks(tryBlock, catchClauses.stream().map(it -> it.body), finallyBlock);
        }

        @Override
        public String toString() {
            return "try ... end";
        }
    }

    /**
     * A {@code throw value} statement.
     */
    public static final class Throw extends Statement {
        public final Expression value;

        Throw(Expression value, Span span) {
            super(span);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThrow(this);
        }

        @Override
        public String toString() {
            return "throw " + value;
        }
    }

    /**
     * A {@code rethrow} statement, only valid in a catch clause.
     */
    public static final class Rethrow extends Statement {
        Rethrow(Span span) {
            super(span);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRethrow(this);
        }

        @Override
        public String toString() {
            return "rethrow";
        }
    }

    /**
     * The kind of a {@link Declaration}.
     */
    public enum DeclarationKind {
        CLASS,
        INTERFACE,
        TYPE_ALIAS,
        ENUM,
        IMPORT,
        EXPORT,
        NAMESPACE,
        DECLARE_FUNCTION,
        DECLARE_NAMESPACE,
        DECLARE_TYPE,
        DECLARE_INTERFACE,
        DECLARE_CONST,
    }

    /**
     * A declaration with no control flow of its own, such as a class or an import.
     * <p>
     * Its contents are opaque to the analyses in this project.
     */
    public static final class Declaration extends Statement {
        public final DeclarationKind kind;
        @Nullable
        public final String name;

        Declaration(DeclarationKind kind, @Nullable String name, Span span) {
            super(span);
            this.kind = kind;
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeclaration(this);
        }

        @Override
        public String toString() {
            return kind.name().toLowerCase() + (name == null ? "" : " " + name);
        }
    }
}
