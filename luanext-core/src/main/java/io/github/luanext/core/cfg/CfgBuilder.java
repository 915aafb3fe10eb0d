package io.github.luanext.core.cfg;

import com.google.common.flogger.FluentLogger;
import io.github.luanext.ast.Block;
import io.github.luanext.ast.Span;
import io.github.luanext.ast.Statement;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Builds the {@link ControlFlowGraph} of a scope.
 * <p>
 * The builder walks the statements once, keeping a cursor on the block
 * that straight-line code is appended to. Control statements close the cursor
 * with a terminator and move it to a fresh block. Statements that follow a closed
 * block are placed in a new block with no incoming edges, so every statement
 * belongs to some block while dead code stays unreachable.
 * <p>
 * Ill-formed control flow, such as a {@code break} outside of a loop or a {@code goto}
 * to an undeclared label, closes the block as {@link Terminator.Unreachable} rather than failing.
 */
public final class CfgBuilder {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final StatementIndex index;
    private final List<PendingBlock> blocks = new ArrayList<>();
    private final Deque<LoopContext> loops = new ArrayDeque<>();
    private final Map<String, BlockId> labelsByName = new HashMap<>();
    private final Map<Statement, BlockId> labelBlocks = new IdentityHashMap<>();
    private final Set<BlockId> repeatHeaders = new LinkedHashSet<>();

    private CfgBuilder(StatementIndex index) {
        this.index = index;
    }

    /**
     * Build the control-flow graph of a scope.
     *
     * @param index The statements of the scope.
     * @return The graph.
     */
    public static ControlFlowGraph build(StatementIndex index) {
        return new CfgBuilder(index).build();
    }

    /**
     * Build the control-flow graph of a scope.
     *
     * @param statements The top-level statements of the scope.
     * @return The graph.
     */
    public static ControlFlowGraph build(List<Statement> statements) {
        return build(StatementIndex.of(statements));
    }

    private ControlFlowGraph build() {
        BlockId entry = newBlock();
        BlockId exit = newBlock();
        assert entry.equals(BlockId.ENTRY) && exit.equals(BlockId.EXIT);

        for (Statement stmt : index.statements()) {
            if (stmt instanceof Statement.Label) {
                Statement.Label label = (Statement.Label) stmt;
                if (labelsByName.containsKey(label.name)) {
                    logger.atFine().log("duplicate label %s, keeping the first", label.name);
                    continue;
                }
                BlockId labelBlock = newBlock();
                append(labelBlock, stmt);
                labelsByName.put(label.name, labelBlock);
                labelBlocks.put(stmt, labelBlock);
            }
        }

        BlockId first = newBlock();
        terminate(entry, Terminator.jump(first));
        BlockId last = walk(index.roots(), first);
        if (get(last).isOpen()) {
            terminate(last, Terminator.fallThrough());
        }
        markUnreachable(exit);

        List<BasicBlock> built = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            built.add(blocks.get(i).finish(BlockId.of(i)));
        }
        logger.atFine().log("built %d blocks for %d statements", built.size(), index.size());
        return new ControlFlowGraph(built, index.size(), repeatHeaders);
    }

    private BlockId walk(List<Statement> statements, BlockId current) {
        for (Statement stmt : statements) {
            current = statement(stmt, current);
        }
        return current;
    }

    private BlockId walk(Block body, BlockId current) {
        return walk(body.statements, current);
    }

    private BlockId statement(Statement stmt, BlockId current) {
        BlockId labelBlock = labelBlocks.get(stmt);
        if (labelBlock != null) {
            if (get(current).isOpen()) {
                terminate(current, Terminator.jump(labelBlock));
            }
            return labelBlock;
        }
        if (!get(current).isOpen()) {
            current = newBlock();
        }
        return stmt.accept(new Placer(current));
    }

    /**
     * Walk a body starting at a fresh block, and jump to {@code join} if it falls off the end.
     */
    private BlockId arm(Block body, BlockId join) {
        BlockId start = newBlock();
        closeInto(walk(body, start), join);
        return start;
    }

    private void closeInto(BlockId block, BlockId target) {
        if (get(block).isOpen()) {
            terminate(block, Terminator.jump(target));
        }
    }

    private BlockId newBlock() {
        blocks.add(new PendingBlock());
        return BlockId.of(blocks.size() - 1);
    }

    private PendingBlock get(BlockId id) {
        return blocks.get(id.index());
    }

    private void append(BlockId block, Statement stmt) {
        get(block).add(index.indexOf(stmt), stmt.span);
    }

    private void terminate(BlockId block, Terminator terminator) {
        get(block).terminate(terminator);
    }

    private void markUnreachable(BlockId block) {
        get(block).terminate(Terminator.unreachable());
    }

    /**
     * Places a single statement, returning the new cursor.
     */
    private final class Placer implements Statement.Visitor<BlockId> {
        private final BlockId current;

        Placer(BlockId current) {
            this.current = current;
        }

        private BlockId straightLine(Statement stmt) {
            append(current, stmt);
            return current;
        }

        /**
         * Build a header-tested loop. The statement is placed in the header if the
         * condition is re-evaluated there, or else before the loop.
         */
        private BlockId loop(Statement stmt, Block loopBody, boolean inHeader) {
            BlockId header = newBlock();
            BlockId body = newBlock();
            BlockId exit = newBlock();
            append(inHeader ? header : current, stmt);
            terminate(current, Terminator.jump(header));
            terminate(header, Terminator.branch(index.indexOf(stmt), body, exit));

            loops.push(new LoopContext(header, exit));
            BlockId end = walk(loopBody, body);
            loops.pop();
            if (get(end).isOpen()) {
                terminate(end, Terminator.loopBack(header));
            }
            return exit;
        }

        @Override
        public BlockId visitVariable(Statement.Variable stmt) {
            return straightLine(stmt);
        }

        @Override
        public BlockId visitFunction(Statement.FunctionDecl stmt) {
            return straightLine(stmt);
        }

        @Override
        public BlockId visitExpression(Statement.ExprStatement stmt) {
            return straightLine(stmt);
        }

        @Override
        public BlockId visitMultiAssignment(Statement.MultiAssignment stmt) {
            return straightLine(stmt);
        }

        @Override
        public BlockId visitDeclaration(Statement.Declaration stmt) {
            return straightLine(stmt);
        }

        @Override
        public BlockId visitDo(Statement.Do stmt) {
            append(current, stmt);
            return walk(stmt.body, current);
        }

        @Override
        public BlockId visitIf(Statement.If stmt) {
            append(current, stmt);
            int cond = index.indexOf(stmt);
            BlockId join = newBlock();
            BlockId then = arm(stmt.thenBlock, join);

            if (stmt.elseIfs.isEmpty()) {
                BlockId otherwise = stmt.elseBlock == null ? join : arm(stmt.elseBlock, join);
                terminate(current, Terminator.branch(cond, then, otherwise));
                return join;
            }

            BlockId test = newBlock();
            terminate(current, Terminator.branch(cond, then, test));
            Iterator<Statement.ElseIf> it = stmt.elseIfs.iterator();
            while (it.hasNext()) {
                Statement.ElseIf elseIf = it.next();
                BlockId body = arm(elseIf.body, join);
                BlockId next;
                if (it.hasNext()) {
                    next = newBlock();
                } else {
                    next = stmt.elseBlock == null ? join : arm(stmt.elseBlock, join);
                }
                get(test).span = get(test).span.merge(elseIf.span);
                terminate(test, Terminator.branch(cond, body, next));
                test = next;
            }
            return join;
        }

        @Override
        public BlockId visitWhile(Statement.While stmt) {
            return loop(stmt, stmt.body, true);
        }

        @Override
        public BlockId visitNumericFor(Statement.NumericFor stmt) {
            return loop(stmt, stmt.body, false);
        }

        @Override
        public BlockId visitGenericFor(Statement.GenericFor stmt) {
            return loop(stmt, stmt.body, false);
        }

        @Override
        public BlockId visitRepeat(Statement.Repeat stmt) {
            BlockId body = newBlock();
            BlockId exit = newBlock();
            terminate(current, Terminator.jump(body));

            loops.push(new LoopContext(body, exit));
            BlockId end = walk(stmt.body, body);
            loops.pop();
            if (get(end).isOpen()) {
                append(end, stmt);
                terminate(end, Terminator.branch(index.indexOf(stmt), exit, body));
                repeatHeaders.add(body);
            } else {
                append(current, stmt);
            }
            return exit;
        }

        @Override
        public BlockId visitReturn(Statement.Return stmt) {
            append(current, stmt);
            terminate(current, Terminator.ret());
            return newBlock();
        }

        @Override
        public BlockId visitBreak(Statement.Break stmt) {
            append(current, stmt);
            LoopContext loop = loops.peek();
            if (loop == null) {
                logger.atFine().log("break outside of a loop at %s", stmt.span);
                markUnreachable(current);
            } else {
                terminate(current, Terminator.jump(loop.exit));
            }
            return newBlock();
        }

        @Override
        public BlockId visitContinue(Statement.Continue stmt) {
            append(current, stmt);
            LoopContext loop = loops.peek();
            if (loop == null) {
                logger.atFine().log("continue outside of a loop at %s", stmt.span);
                markUnreachable(current);
            } else {
                terminate(current, Terminator.loopBack(loop.header));
            }
            return newBlock();
        }

        @Override
        public BlockId visitLabel(Statement.Label stmt) {
            // only duplicates of an earlier label get here
            return straightLine(stmt);
        }

        @Override
        public BlockId visitGoto(Statement.Goto stmt) {
            append(current, stmt);
            BlockId target = labelsByName.get(stmt.target);
            if (target == null) {
                logger.atFine().log("goto undeclared label %s at %s", stmt.target, stmt.span);
                markUnreachable(current);
            } else {
                terminate(current, Terminator.jump(target));
            }
            return newBlock();
        }

        @Override
        public BlockId visitTry(Statement.Try stmt) {
            append(current, stmt);
            BlockId tryBody = newBlock();
            BlockId join = newBlock();
            BlockId finallyStart = stmt.finallyBlock == null ? null : newBlock();
            BlockId continuation = finallyStart == null ? join : finallyStart;

            List<BlockId> catchTargets = new ArrayList<>(stmt.catchClauses.size());
            for (Statement.CatchClause clause : stmt.catchClauses) {
                catchTargets.add(arm(clause.body, continuation));
            }
            closeInto(walk(stmt.tryBlock, tryBody), continuation);
            if (finallyStart != null) {
                closeInto(walk(stmt.finallyBlock, finallyStart), join);
            }
            terminate(current, Terminator.tryCatch(tryBody, catchTargets));
            return join;
        }

        @Override
        public BlockId visitThrow(Statement.Throw stmt) {
            append(current, stmt);
            markUnreachable(current);
            return newBlock();
        }

        @Override
        public BlockId visitRethrow(Statement.Rethrow stmt) {
            append(current, stmt);
            markUnreachable(current);
            return newBlock();
        }
    }

    private static final class LoopContext {
        final BlockId header;
        final BlockId exit;

        LoopContext(BlockId header, BlockId exit) {
            this.header = header;
            this.exit = exit;
        }
    }

    /**
     * A block under construction.
     */
    private static final class PendingBlock {
        private final List<Integer> statementIndices = new ArrayList<>();
        Span span = Span.DUMMY;
        private State state = State.OPEN;
        @Nullable
        private Terminator terminator;

        boolean isOpen() {
            return state == State.OPEN;
        }

        void add(int stmtIndex, Span stmtSpan) {
            statementIndices.add(stmtIndex);
            span = span.merge(stmtSpan);
        }

        void terminate(Terminator terminator) {
            if (state != State.OPEN) {
                throw new IllegalStateException("block already closed with " + this.terminator);
            }
            this.terminator = terminator;
            state = terminator instanceof Terminator.Unreachable ? State.UNREACHABLE : State.TERMINATED;
        }

        BasicBlock finish(BlockId id) {
            return new BasicBlock(
                    id,
                    statementIndices,
                    span,
                    state == State.OPEN ? Terminator.unreachable() : Objects.requireNonNull(terminator)
            );
        }

        enum State {
            OPEN,
            UNREACHABLE,
            TERMINATED,
        }
    }
}
