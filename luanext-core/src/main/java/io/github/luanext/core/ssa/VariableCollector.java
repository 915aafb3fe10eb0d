package io.github.luanext.core.ssa;

import io.github.luanext.ast.Expression;
import io.github.luanext.ast.Pattern;
import io.github.luanext.ast.Statement;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Finds the variable names a single statement defines and uses.
 * <p>
 * Only the statement itself is inspected. Statements in its nested bodies are
 * separate statements, and function bodies are separate scopes.
 */
final class VariableCollector {
    private VariableCollector() {
    }

    /**
     * Get the names a statement defines, in order, without duplicates.
     */
    static Set<String> definitions(Statement stmt) {
        Set<String> defs = new LinkedHashSet<>();
        stmt.accept(new Statement.BaseVisitor<Void>() {
            @Override
            protected Void otherwise(Statement stmt) {
                return null;
            }

            @Override
            public Void visitVariable(Statement.Variable stmt) {
                stmt.pattern.accept(new PatternNames(defs));
                return null;
            }

            @Override
            public Void visitFunction(Statement.FunctionDecl stmt) {
                defs.add(stmt.name);
                return null;
            }

            @Override
            public Void visitNumericFor(Statement.NumericFor stmt) {
                defs.add(stmt.variable);
                return null;
            }

            @Override
            public Void visitGenericFor(Statement.GenericFor stmt) {
                defs.addAll(stmt.variables);
                return null;
            }

            @Override
            public Void visitExpression(Statement.ExprStatement stmt) {
                if (stmt.expression instanceof Expression.Assignment) {
                    Expression target = ((Expression.Assignment) stmt.expression).target;
                    if (target instanceof Expression.Identifier) {
                        defs.add(((Expression.Identifier) target).name);
                    }
                }
                return null;
            }

            @Override
            public Void visitMultiAssignment(Statement.MultiAssignment stmt) {
                for (Expression target : stmt.targets) {
                    if (target instanceof Expression.Identifier) {
                        defs.add(((Expression.Identifier) target).name);
                    }
                }
                return null;
            }
        });
        return defs;
    }

    /**
     * Get the tracked names a statement reads, in order of appearance, without duplicates.
     */
    static List<String> uses(Statement stmt, Set<String> tracked) {
        Uses uses = new Uses(tracked);
        stmt.accept(new Statement.BaseVisitor<Void>() {
            @Override
            protected Void otherwise(Statement stmt) {
                return null;
            }

            @Override
            public Void visitVariable(Statement.Variable stmt) {
                uses.scan(stmt.initializer);
                return null;
            }

            @Override
            public Void visitExpression(Statement.ExprStatement stmt) {
                uses.scan(stmt.expression);
                return null;
            }

            @Override
            public Void visitMultiAssignment(Statement.MultiAssignment stmt) {
                uses.scanAll(stmt.values);
                for (Expression target : stmt.targets) {
                    if (!(target instanceof Expression.Identifier)) {
                        uses.scan(target);
                    }
                }
                return null;
            }

            @Override
            public Void visitIf(Statement.If stmt) {
                uses.scan(stmt.condition);
                for (Statement.ElseIf elseIf : stmt.elseIfs) {
                    uses.scan(elseIf.condition);
                }
                return null;
            }

            @Override
            public Void visitWhile(Statement.While stmt) {
                uses.scan(stmt.condition);
                return null;
            }

            @Override
            public Void visitRepeat(Statement.Repeat stmt) {
                uses.scan(stmt.condition);
                return null;
            }

            @Override
            public Void visitNumericFor(Statement.NumericFor stmt) {
                uses.scan(stmt.start);
                uses.scan(stmt.end);
                uses.scan(stmt.step);
                return null;
            }

            @Override
            public Void visitGenericFor(Statement.GenericFor stmt) {
                uses.scanAll(stmt.iterators);
                return null;
            }

            @Override
            public Void visitReturn(Statement.Return stmt) {
                uses.scanAll(stmt.values);
                return null;
            }

            @Override
            public Void visitThrow(Statement.Throw stmt) {
                uses.scan(stmt.value);
                return null;
            }
        });
        return new ArrayList<>(uses.names);
    }

    private static final class PatternNames implements Pattern.Visitor<Void> {
        private final Set<String> names;

        PatternNames(Set<String> names) {
            this.names = names;
        }

        @Override
        public Void visitIdentifier(Pattern.IdentifierPattern pattern) {
            names.add(pattern.name);
            return null;
        }

        @Override
        public Void visitArray(Pattern.ArrayPattern pattern) {
            for (Pattern element : pattern.elements) {
                element.accept(this);
            }
            if (pattern.rest != null) names.add(pattern.rest);
            return null;
        }

        @Override
        public Void visitObject(Pattern.ObjectPattern pattern) {
            for (Pattern.Property property : pattern.properties) {
                if (property.value == null) {
                    names.add(property.key);
                } else {
                    property.value.accept(this);
                }
            }
            return null;
        }

        @Override
        public Void visitWildcard(Pattern.WildcardPattern pattern) {
            return null;
        }

        @Override
        public Void visitLiteral(Pattern.LiteralPattern pattern) {
            return null;
        }
    }

    private static final class Uses implements Expression.Visitor<Void> {
        private final Set<String> tracked;
        final Set<String> names = new LinkedHashSet<>();

        Uses(Set<String> tracked) {
            this.tracked = tracked;
        }

        void scan(@Nullable Expression expr) {
            if (expr != null) expr.accept(this);
        }

        void scanAll(List<Expression> exprs) {
            for (Expression expr : exprs) {
                scan(expr);
            }
        }

        @Override
        public Void visitLiteral(Expression.Literal expr) {
            return null;
        }

        @Override
        public Void visitIdentifier(Expression.Identifier expr) {
            if (tracked.contains(expr.name)) names.add(expr.name);
            return null;
        }

        @Override
        public Void visitBinary(Expression.Binary expr) {
            scan(expr.left);
            scan(expr.right);
            return null;
        }

        @Override
        public Void visitUnary(Expression.Unary expr) {
            scan(expr.operand);
            return null;
        }

        @Override
        public Void visitAssignment(Expression.Assignment expr) {
            scan(expr.value);
            // a compound assignment reads its target before writing it
            if (!(expr.target instanceof Expression.Identifier) || expr.operator.isCompound()) {
                scan(expr.target);
            }
            return null;
        }

        @Override
        public Void visitCall(Expression.Call expr) {
            scan(expr.callee);
            scanAll(expr.arguments);
            return null;
        }

        @Override
        public Void visitMethodCall(Expression.MethodCall expr) {
            scan(expr.receiver);
            scanAll(expr.arguments);
            return null;
        }

        @Override
        public Void visitMember(Expression.Member expr) {
            scan(expr.object);
            return null;
        }

        @Override
        public Void visitIndex(Expression.Index expr) {
            scan(expr.object);
            scan(expr.index);
            return null;
        }

        @Override
        public Void visitConditional(Expression.Conditional expr) {
            scan(expr.condition);
            scan(expr.whenTrue);
            scan(expr.whenFalse);
            return null;
        }

        @Override
        public Void visitParenthesized(Expression.Parenthesized expr) {
            scan(expr.inner);
            return null;
        }

        @Override
        public Void visitPipe(Expression.Pipe expr) {
            scan(expr.left);
            scan(expr.right);
            return null;
        }

        @Override
        public Void visitTable(Expression.Table expr) {
            for (int i = 0; i < expr.values.size(); i++) {
                scan(expr.keys.get(i));
                scan(expr.values.get(i));
            }
            return null;
        }

        @Override
        public Void visitFunction(Expression.FunctionExpr expr) {
            return null;
        }
    }
}
