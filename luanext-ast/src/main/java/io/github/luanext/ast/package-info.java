/**
 * The syntax tree of LuaNext programs, as produced by the parser and consumed by
 * the analyses in {@code luanext-core}.
 * <p>
 * Statements, expressions and patterns are closed class hierarchies, each with a
 * visitor interface. Nodes are immutable, and carry no identity other than their
 * object identity; analyses refer to statements by position in a
 * statement index rather than by reference.
 * <p>
 * {@link io.github.luanext.ast.Ast} has factories for building trees by hand.
 */
package io.github.luanext.ast;
