package io.github.luanext.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * An expression node.
 * <p>
 * The set of expression kinds is closed; use a {@link Visitor} to dispatch on it.
 */
public abstract class Expression {
    /**
     * The span of this expression.
     */
    public final Span span;

    Expression(Span span) {
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
     * A visitor over the kinds of expression.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitLiteral(Literal expr);

        R visitIdentifier(Identifier expr);

        R visitBinary(Binary expr);

        R visitUnary(Unary expr);

        R visitAssignment(Assignment expr);

        R visitCall(Call expr);

        R visitMethodCall(MethodCall expr);

        R visitMember(Member expr);

        R visitIndex(Index expr);

        R visitConditional(Conditional expr);

        R visitParenthesized(Parenthesized expr);

        R visitPipe(Pipe expr);

        R visitTable(Table expr);

        R visitFunction(FunctionExpr expr);
    }

    /**
     * A literal value. {@code nil}, booleans, numbers and strings.
     */
    public static final class Literal extends Expression {
        /**
         * The value of the literal, {@code null} for {@code nil}.
         */
        @Nullable
        public final Object value;

        Literal(@Nullable Object value, Span span) {
            super(span);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            if (value == null) return "nil";
            if (value instanceof String) return '"' + (String) value + '"';
            return value.toString();
        }
    }

    /**
     * A reference to a variable by name.
     */
    public static final class Identifier extends Expression {
        /**
         * The name referenced.
         */
        public final String name;

        Identifier(String name, Span span) {
            super(span);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A binary operation, such as {@code a + b} or {@code a and b}.
     */
    public static final class Binary extends Expression {
        public final String operator;
        public final Expression left;
        public final Expression right;

        Binary(String operator, Expression left, Expression right, Span span) {
            super(span);
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    /**
     * A unary operation, such as {@code -a}, {@code not a} or {@code #a}.
     */
    public static final class Unary extends Expression {
        public final String operator;
        public final Expression operand;

        Unary(String operator, Expression operand, Span span) {
            super(span);
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public String toString() {
            return operator + operand;
        }
    }

    /**
     * An assignment, {@code target op value}, where the operator may be compound.
     */
    public static final class Assignment extends Expression {
        public final Expression target;
        public final AssignmentOp operator;
        public final Expression value;

        Assignment(Expression target, AssignmentOp operator, Expression value, Span span) {
            super(span);
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }

        @Override
        public String toString() {
            return target + " " + operator.symbol + " " + value;
        }
    }

    /**
     * A function call, {@code callee(args...)}.
     */
    public static final class Call extends Expression {
        public final Expression callee;
        public final List<Expression> arguments;

        Call(Expression callee, List<Expression> arguments, Span span) {
            super(span);
            this.callee = callee;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            return callee + "(" + Ast.join(arguments) + ")";
        }
    }

    /**
     * A method call, {@code receiver:method(args...)}.
     */
    public static final class MethodCall extends Expression {
        public final Expression receiver;
        public final String method;
        public final List<Expression> arguments;

        MethodCall(Expression receiver, String method, List<Expression> arguments, Span span) {
            super(span);
            this.receiver = receiver;
            this.method = method;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMethodCall(this);
        }

        @Override
        public String toString() {
            return receiver + ":" + method + "(" + Ast.join(arguments) + ")";
        }
    }

    /**
     * A field access, {@code object.name}.
     */
    public static final class Member extends Expression {
        public final Expression object;
        public final String name;

        Member(Expression object, String name, Span span) {
            super(span);
            this.object = object;
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMember(this);
        }

        @Override
        public String toString() {
            return object + "." + name;
        }
    }

    /**
     * An indexing operation, {@code object[index]}.
     */
    public static final class Index extends Expression {
        public final Expression object;
        public final Expression index;

        Index(Expression object, Expression index, Span span) {
            super(span);
            this.object = object;
            this.index = index;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }

        @Override
        public String toString() {
            return object + "[" + index + "]";
        }
    }

    /**
     * A conditional expression, {@code if c then a else b}.
     */
    public static final class Conditional extends Expression {
        public final Expression condition;
        public final Expression whenTrue;
        public final Expression whenFalse;

        Conditional(Expression condition, Expression whenTrue, Expression whenFalse, Span span) {
            super(span);
            this.condition = condition;
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }

        @Override
        public String toString() {
            return "(if " + condition + " then " + whenTrue + " else " + whenFalse + ")";
        }
    }

    /**
     * A parenthesized expression, which truncates multiple results to one.
     */
    public static final class Parenthesized extends Expression {
        public final Expression inner;

        Parenthesized(Expression inner, Span span) {
            super(span);
            this.inner = inner;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParenthesized(this);
        }

        @Override
        public String toString() {
            return "(" + inner + ")";
        }
    }

    /**
     * A pipe, {@code left |> right}.
     */
    public static final class Pipe extends Expression {
        public final Expression left;
        public final Expression right;

        Pipe(Expression left, Expression right, Span span) {
            super(span);
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPipe(this);
        }

        @Override
        public String toString() {
            return left + " |> " + right;
        }
    }

    /**
     * A table constructor. Keys of positional entries are {@code null}.
     */
    public static final class Table extends Expression {
        public final List<Expression> keys;
        public final List<Expression> values;

        Table(List<Expression> keys, List<Expression> values, Span span) {
            super(span);
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException("keys and values differ in length");
            }
            this.keys = Collections.unmodifiableList(keys);
            this.values = Collections.unmodifiableList(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTable(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < values.size(); i++) {
                if (i != 0) sb.append(", ");
                Expression key = keys.get(i);
                if (key != null) sb.append('[').append(key).append("] = ");
                sb.append(values.get(i));
            }
            return sb.append('}').toString();
        }
    }

    /**
     * An anonymous function. Its body is a scope of its own.
     */
    public static final class FunctionExpr extends Expression {
        public final List<String> parameters;
        public final Block body;

        FunctionExpr(List<String> parameters, Block body, Span span) {
            super(span);
            this.parameters = Collections.unmodifiableList(parameters);
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public String toString() {
            return "function(" + String.join(", ", parameters) + ") ... end";
        }
    }
}
