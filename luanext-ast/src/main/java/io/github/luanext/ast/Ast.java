package io.github.luanext.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Static factories for building syntax trees without a parser.
 * <p>
 * Nodes built here carry {@link Span#DUMMY} unless a span is given.
 */
public final class Ast {
    private Ast() {
    }

    // expressions

    public static Expression.Literal nil() {
        return new Expression.Literal(null, Span.DUMMY);
    }

    public static Expression.Literal literal(Object value) {
        return new Expression.Literal(value, Span.DUMMY);
    }

    public static Expression.Identifier name(String name) {
        return new Expression.Identifier(name, Span.DUMMY);
    }

    public static Expression.Binary binary(String operator, Expression left, Expression right) {
        return new Expression.Binary(operator, left, right, Span.DUMMY);
    }

    public static Expression.Unary unary(String operator, Expression operand) {
        return new Expression.Unary(operator, operand, Span.DUMMY);
    }

    public static Expression.Assignment assign(Expression target, AssignmentOp op, Expression value) {
        return new Expression.Assignment(target, op, value, Span.DUMMY);
    }

    public static Expression.Call call(Expression callee, Expression... arguments) {
        return new Expression.Call(callee, Arrays.asList(arguments), Span.DUMMY);
    }

    public static Expression.MethodCall methodCall(Expression receiver, String method, Expression... arguments) {
        return new Expression.MethodCall(receiver, method, Arrays.asList(arguments), Span.DUMMY);
    }

    public static Expression.Member member(Expression object, String name) {
        return new Expression.Member(object, name, Span.DUMMY);
    }

    public static Expression.Index index(Expression object, Expression index) {
        return new Expression.Index(object, index, Span.DUMMY);
    }

    public static Expression.Conditional conditional(Expression condition, Expression whenTrue, Expression whenFalse) {
        return new Expression.Conditional(condition, whenTrue, whenFalse, Span.DUMMY);
    }

    public static Expression.Parenthesized paren(Expression inner) {
        return new Expression.Parenthesized(inner, Span.DUMMY);
    }

    public static Expression.Pipe pipe(Expression left, Expression right) {
        return new Expression.Pipe(left, right, Span.DUMMY);
    }

    /**
     * Create an array-style table constructor.
     *
     * @param values The positional values.
     * @return The table constructor.
     */
    public static Expression.Table table(Expression... values) {
        return new Expression.Table(
                new ArrayList<>(Collections.<Expression>nCopies(values.length, null)),
                Arrays.asList(values),
                Span.DUMMY
        );
    }

    public static Expression.Table table(List<Expression> keys, List<Expression> values) {
        return new Expression.Table(keys, values, Span.DUMMY);
    }

    public static Expression.FunctionExpr function(List<String> parameters, Statement... body) {
        return new Expression.FunctionExpr(parameters, block(body), Span.DUMMY);
    }

    // patterns

    public static Pattern.IdentifierPattern bind(String name) {
        return new Pattern.IdentifierPattern(name, Span.DUMMY);
    }

    public static Pattern.ArrayPattern arrayPattern(@Nullable String rest, Pattern... elements) {
        return new Pattern.ArrayPattern(Arrays.asList(elements), rest, Span.DUMMY);
    }

    public static Pattern.ObjectPattern objectPattern(Pattern.Property... properties) {
        return new Pattern.ObjectPattern(Arrays.asList(properties), Span.DUMMY);
    }

    public static Pattern.Property property(String key, @Nullable Pattern value) {
        return new Pattern.Property(key, value);
    }

    public static Pattern.WildcardPattern wildcard() {
        return new Pattern.WildcardPattern(Span.DUMMY);
    }

    public static Pattern.LiteralPattern literalPattern(Object value) {
        return new Pattern.LiteralPattern(literal(value), Span.DUMMY);
    }

    // statements

    public static Block block(Statement... statements) {
        return new Block(Arrays.asList(statements), Span.DUMMY);
    }

    public static Statement.Variable local(String name, @Nullable Expression initializer) {
        return local(bind(name), initializer, Span.DUMMY);
    }

    public static Statement.Variable local(String name) {
        return local(name, nil());
    }

    public static Statement.Variable local(Pattern pattern, @Nullable Expression initializer, Span span) {
        return new Statement.Variable(Statement.VariableKind.LOCAL, pattern, initializer, span);
    }

    public static Statement.Variable variable(Statement.VariableKind kind, Pattern pattern, @Nullable Expression initializer) {
        return new Statement.Variable(kind, pattern, initializer, Span.DUMMY);
    }

    public static Statement.FunctionDecl functionDecl(String name, List<String> parameters, Statement... body) {
        return new Statement.FunctionDecl(name, parameters, block(body), Span.DUMMY);
    }

    public static Statement.ExprStatement expr(Expression expression) {
        return expr(expression, Span.DUMMY);
    }

    public static Statement.ExprStatement expr(Expression expression, Span span) {
        return new Statement.ExprStatement(expression, span);
    }

    /**
     * Create the statement {@code name = value}.
     *
     * @param name  The assigned name.
     * @param value The value.
     * @return The statement.
     */
    public static Statement.ExprStatement assign(String name, Expression value) {
        return expr(assign(name(name), AssignmentOp.ASSIGN, value));
    }

    public static Statement.MultiAssignment multiAssign(List<Expression> targets, List<Expression> values) {
        return new Statement.MultiAssignment(targets, values, Span.DUMMY);
    }

    public static Statement.If ifThen(Expression condition, Block thenBlock) {
        return ifThen(condition, thenBlock, Collections.emptyList(), null);
    }

    public static Statement.If ifThenElse(Expression condition, Block thenBlock, Block elseBlock) {
        return ifThen(condition, thenBlock, Collections.emptyList(), elseBlock);
    }

    public static Statement.If ifThen(Expression condition, Block thenBlock, List<Statement.ElseIf> elseIfs, @Nullable Block elseBlock) {
        return new Statement.If(condition, thenBlock, elseIfs, elseBlock, Span.DUMMY);
    }

    public static Statement.ElseIf elseIf(Expression condition, Block body) {
        return new Statement.ElseIf(condition, body, Span.DUMMY);
    }

    public static Statement.While whileLoop(Expression condition, Statement... body) {
        return new Statement.While(condition, block(body), Span.DUMMY);
    }

    public static Statement.NumericFor numericFor(String variable, Expression start, Expression end, @Nullable Expression step, Statement... body) {
        return new Statement.NumericFor(variable, start, end, step, block(body), Span.DUMMY);
    }

    public static Statement.GenericFor genericFor(List<String> variables, List<Expression> iterators, Statement... body) {
        return new Statement.GenericFor(variables, iterators, block(body), Span.DUMMY);
    }

    public static Statement.Repeat repeat(Expression condition, Statement... body) {
        return new Statement.Repeat(block(body), condition, Span.DUMMY);
    }

    public static Statement.Return ret(Expression... values) {
        return new Statement.Return(Arrays.asList(values), Span.DUMMY);
    }

    public static Statement.Break breakStmt() {
        return new Statement.Break(Span.DUMMY);
    }

    public static Statement.Continue continueStmt() {
        return new Statement.Continue(Span.DUMMY);
    }

    public static Statement.Label label(String name) {
        return new Statement.Label(name, Span.DUMMY);
    }

    public static Statement.Goto gotoStmt(String target) {
        return new Statement.Goto(target, Span.DUMMY);
    }

    public static Statement.Do doBlock(Statement... body) {
        return new Statement.Do(block(body), Span.DUMMY);
    }

    public static Statement.Try tryCatch(Block tryBlock, List<Statement.CatchClause> catchClauses, @Nullable Block finallyBlock) {
        return new Statement.Try(tryBlock, catchClauses, finallyBlock, Span.DUMMY);
    }

    public static Statement.CatchClause catchClause(@Nullable String variable, Statement... body) {
        return new Statement.CatchClause(variable, block(body), Span.DUMMY);
    }

    public static Statement.Throw throwStmt(Expression value) {
        return new Statement.Throw(value, Span.DUMMY);
    }

    public static Statement.Rethrow rethrow() {
        return new Statement.Rethrow(Span.DUMMY);
    }

    public static Statement.Declaration declaration(Statement.DeclarationKind kind, @Nullable String name) {
        return new Statement.Declaration(kind, name, Span.DUMMY);
    }

    // helpers

    static String join(List<?> items) {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    static List<Block> blocks(Block first, Stream<Block> middle, @Nullable Block last) {
        List<Block> blocks = new ArrayList<>();
        blocks.add(first);
        middle.forEach(blocks::add);
        if (last != null) blocks.add(last);
        return Collections.unmodifiableList(blocks);
    }
}
