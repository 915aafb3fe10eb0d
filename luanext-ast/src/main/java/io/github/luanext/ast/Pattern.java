package io.github.luanext.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A binding pattern, as found on the left of a variable declaration.
 */
public abstract class Pattern {
    /**
     * The span of this pattern.
     */
    public final Span span;

    Pattern(Span span) {
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
     * A visitor over the kinds of pattern.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitIdentifier(IdentifierPattern pattern);

        R visitArray(ArrayPattern pattern);

        R visitObject(ObjectPattern pattern);

        R visitWildcard(WildcardPattern pattern);

        R visitLiteral(LiteralPattern pattern);
    }

    /**
     * Binds a single name.
     */
    public static final class IdentifierPattern extends Pattern {
        public final String name;

        IdentifierPattern(String name, Span span) {
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
     * Destructures an array, {@code [a, b, ...rest]}.
     */
    public static final class ArrayPattern extends Pattern {
        public final List<Pattern> elements;
        /**
         * The name bound to the remaining elements, if any.
         */
        @Nullable
        public final String rest;

        ArrayPattern(List<Pattern> elements, @Nullable String rest, Span span) {
            super(span);
            this.elements = Collections.unmodifiableList(elements);
            this.rest = rest;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }

        @Override
        public String toString() {
            return "[" + Ast.join(elements) + (rest == null ? "" : ", ..." + rest) + "]";
        }
    }

    /**
     * Destructures an object, {@code {x, y: [a, b]}}.
     */
    public static final class ObjectPattern extends Pattern {
        public final List<Property> properties;

        ObjectPattern(List<Property> properties, Span span) {
            super(span);
            this.properties = Collections.unmodifiableList(properties);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }

        @Override
        public String toString() {
            return "{" + Ast.join(properties) + "}";
        }
    }

    /**
     * One property of an {@link ObjectPattern}.
     */
    public static final class Property {
        public final String key;
        /**
         * The pattern the value is bound to, or {@code null} for shorthand {@code {key}},
         * which binds {@link #key} itself.
         */
        @Nullable
        public final Pattern value;

        Property(String key, @Nullable Pattern value) {
            this.key = key;
            this.value = value;
        }

        @Override
        public String toString() {
            return value == null ? key : key + ": " + value;
        }
    }

    /**
     * Matches anything, binding nothing, {@code _}.
     */
    public static final class WildcardPattern extends Pattern {
        WildcardPattern(Span span) {
            super(span);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWildcard(this);
        }

        @Override
        public String toString() {
            return "_";
        }
    }

    /**
     * Matches a constant, binding nothing.
     */
    public static final class LiteralPattern extends Pattern {
        public final Expression.Literal literal;

        LiteralPattern(Expression.Literal literal, Span span) {
            super(span);
            this.literal = literal;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            return literal.toString();
        }
    }
}
