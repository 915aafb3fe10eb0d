package io.github.luanext.core.cfg;

import io.github.luanext.ast.Span;
import io.github.luanext.ast.Statement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.luanext.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class CfgBuilderTest {
    static void assertConsistent(ControlFlowGraph cfg) {
        assertTrue(cfg.blockCount() >= 2);
        for (BasicBlock a : cfg.blocks()) {
            for (BasicBlock b : cfg.blocks()) {
                assertEquals(
                        cfg.succs(a.getId()).contains(b.getId()),
                        cfg.preds(b.getId()).contains(a.getId()),
                        a.getId() + " -> " + b.getId()
                );
            }
        }
        assertEquals(BlockId.ENTRY, cfg.reversePostorder().get(0));
        for (int i = 0; i < cfg.statementCount(); i++) {
            assertTrue(cfg.block(cfg.blockOf(i)).getStatementIndices().contains(i), "statement " + i);
        }
    }

    @Test
    void testEmpty() {
        ControlFlowGraph cfg = CfgBuilder.build(Collections.<Statement>emptyList());
        assertConsistent(cfg);
        assertEquals(3, cfg.blockCount());
        assertEquals(Terminator.jump(BlockId.of(2)), cfg.block(BlockId.ENTRY).getTerminator());
        assertEquals(Terminator.fallThrough(), cfg.block(BlockId.of(2)).getTerminator());
        assertTrue(cfg.succs(BlockId.EXIT).isEmpty());
        assertEquals(Collections.singletonList(BlockId.of(2)), cfg.preds(BlockId.EXIT));
    }

    @Test
    void testStraightLine() {
        List<Statement> stmts = Arrays.asList(
                local("a", literal(1)),
                local("b", literal(2)),
                local("c", literal(3))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        int holding = 0;
        for (BasicBlock block : cfg.blocks()) {
            if (block.getId().equals(BlockId.ENTRY) || block.getId().equals(BlockId.EXIT)) continue;
            if (block.getStatementIndices().equals(Arrays.asList(0, 1, 2))) {
                holding++;
                assertEquals(Terminator.Kind.FALL_THROUGH, block.getTerminator().getKind());
            }
        }
        assertEquals(1, holding);
    }

    @Test
    void testSpansAreMerged() {
        List<Statement> stmts = Arrays.asList(
                local(bind("a"), literal(1), new Span(0, 11, 1, 1)),
                local(bind("b"), literal(2), new Span(12, 23, 2, 1))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertEquals(new Span(0, 23, 1, 1), cfg.block(cfg.blockOf(0)).getSpan());
    }

    @Test
    void testIfElse() {
        List<Statement> stmts = Collections.singletonList(ifThenElse(
                literal(true),
                block(local("a", literal(1))),
                block(local("b", literal(2)))
        ));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);
        assertTrue(cfg.blockCount() >= 5);

        Terminator term = cfg.block(cfg.blockOf(0)).getTerminator();
        assertInstanceOf(Terminator.Branch.class, term);
        Terminator.Branch branch = (Terminator.Branch) term;
        assertEquals(0, branch.conditionRef);
        assertNotEquals(branch.trueTarget, branch.falseTarget);
        assertEquals(branch.trueTarget, cfg.blockOf(1));
        assertEquals(branch.falseTarget, cfg.blockOf(2));

        BlockId join = ((Terminator.Goto) cfg.block(branch.trueTarget).getTerminator()).target;
        assertEquals(Terminator.jump(join), cfg.block(branch.falseTarget).getTerminator());
        assertEquals(Terminator.fallThrough(), cfg.block(join).getTerminator());
    }

    @Test
    void testIfWithoutElseBranchesToJoin() {
        List<Statement> stmts = Arrays.asList(
                ifThen(name("c"), block(expr(call(name("f"))))),
                expr(call(name("g")))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);
        Terminator.Branch branch = (Terminator.Branch) cfg.block(cfg.blockOf(0)).getTerminator();
        assertEquals(cfg.blockOf(2), branch.falseTarget);
        assertEquals(Terminator.jump(branch.falseTarget), cfg.block(branch.trueTarget).getTerminator());
    }

    @Test
    void testElseIfChain() {
        List<Statement> stmts = Collections.singletonList(ifThen(
                name("a"),
                block(expr(call(name("f")))),
                Arrays.asList(
                        elseIf(name("b"), block(expr(call(name("g"))))),
                        elseIf(name("c"), block(expr(call(name("h")))))
                ),
                block(expr(call(name("k"))))
        ));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        Terminator.Branch first = (Terminator.Branch) cfg.block(cfg.blockOf(0)).getTerminator();
        assertEquals(cfg.blockOf(1), first.trueTarget);
        Terminator.Branch second = (Terminator.Branch) cfg.block(first.falseTarget).getTerminator();
        assertEquals(cfg.blockOf(2), second.trueTarget);
        Terminator.Branch third = (Terminator.Branch) cfg.block(second.falseTarget).getTerminator();
        assertEquals(cfg.blockOf(3), third.trueTarget);
        assertEquals(cfg.blockOf(4), third.falseTarget);

        BlockId join = ((Terminator.Goto) cfg.block(cfg.blockOf(1)).getTerminator()).target;
        for (int arm = 1; arm <= 4; arm++) {
            assertEquals(Terminator.jump(join), cfg.block(cfg.blockOf(arm)).getTerminator());
        }
        assertEquals(4, cfg.preds(join).size());
    }

    @Test
    void testWhile() {
        ControlFlowGraph cfg = CfgBuilder.build(Collections.<Statement>singletonList(whileLoop(literal(true))));
        assertConsistent(cfg);
        assertFalse(cfg.loopHeaders().isEmpty());

        BlockId header = cfg.blockOf(0);
        assertTrue(cfg.isLoopHeader(header));
        Terminator.Branch test = (Terminator.Branch) cfg.block(header).getTerminator();
        assertEquals(Terminator.loopBack(header), cfg.block(test.trueTarget).getTerminator());
        assertEquals(Terminator.fallThrough(), cfg.block(test.falseTarget).getTerminator());
    }

    @Test
    void testNumericForPlacesStatementBeforeHeader() {
        List<Statement> stmts = Collections.singletonList(
                numericFor("i", literal(1), literal(10), null, expr(call(name("print"), name("i"))))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        BlockId preHeader = cfg.blockOf(0);
        BlockId header = ((Terminator.Goto) cfg.block(preHeader).getTerminator()).target;
        assertTrue(cfg.isLoopHeader(header));
        Terminator.Branch test = (Terminator.Branch) cfg.block(header).getTerminator();
        assertEquals(cfg.blockOf(1), test.trueTarget);
        assertEquals(Terminator.loopBack(header), cfg.block(cfg.blockOf(1)).getTerminator());
    }

    @Test
    void testRepeatBodyIsItsOwnHeader() {
        List<Statement> stmts = Collections.singletonList(
                repeat(name("x"), local("x", literal(1)))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        BlockId body = cfg.blockOf(1);
        assertEquals(body, cfg.blockOf(0));
        assertEquals(Arrays.asList(1, 0), cfg.block(body).getStatementIndices());
        Terminator.Branch back = (Terminator.Branch) cfg.block(body).getTerminator();
        assertEquals(body, back.falseTarget);
        assertTrue(cfg.isLoopHeader(body));
    }

    @Test
    void testRepeatWithNestedControlFlowIsLoopHeader() {
        List<Statement> stmts = Collections.singletonList(
                repeat(name("done"), ifThen(name("c"), block(expr(call(name("f"))))))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        BlockId body = cfg.blockOf(1);
        BlockId test = cfg.blockOf(0);
        assertNotEquals(body, test);
        assertEquals(body, ((Terminator.Branch) cfg.block(test).getTerminator()).falseTarget);
        assertTrue(cfg.isLoopHeader(body));
    }

    @Test
    void testBreakAndContinue() {
        List<Statement> stmts = Collections.singletonList(whileLoop(
                name("c"),
                ifThen(name("a"), block(breakStmt())),
                continueStmt()
        ));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        BlockId header = cfg.blockOf(0);
        BlockId exit = ((Terminator.Branch) cfg.block(header).getTerminator()).falseTarget;
        assertEquals(Terminator.jump(exit), cfg.block(cfg.blockOf(2)).getTerminator());
        assertEquals(Terminator.loopBack(header), cfg.block(cfg.blockOf(3)).getTerminator());
    }

    @Test
    void testBreakOutsideLoopIsUnreachable() {
        List<Statement> stmts = Arrays.asList(breakStmt(), expr(call(name("f"))));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        assertEquals(Terminator.unreachable(), cfg.block(cfg.blockOf(0)).getTerminator());
        assertTrue(cfg.succs(cfg.blockOf(0)).isEmpty());
        BlockId dead = cfg.blockOf(1);
        assertNotEquals(cfg.blockOf(0), dead);
        assertTrue(cfg.preds(dead).isEmpty());
        assertFalse(cfg.reversePostorder().contains(dead));
    }

    @Test
    void testContinueOutsideLoopIsUnreachable() {
        ControlFlowGraph cfg = CfgBuilder.build(Collections.<Statement>singletonList(continueStmt()));
        assertEquals(Terminator.unreachable(), cfg.block(cfg.blockOf(0)).getTerminator());
    }

    @Test
    void testReturnStartsDeadBlock() {
        List<Statement> stmts = Arrays.asList(ret(literal(1)), local("y", literal(2)));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        assertEquals(Terminator.ret(), cfg.block(cfg.blockOf(0)).getTerminator());
        assertEquals(Collections.singletonList(BlockId.EXIT), cfg.succs(cfg.blockOf(0)));
        BlockId dead = cfg.blockOf(1);
        assertNotEquals(cfg.blockOf(0), dead);
        assertTrue(cfg.preds(dead).isEmpty());
    }

    @Test
    void testForwardGoto() {
        List<Statement> stmts = Arrays.asList(
                gotoStmt("skip"),
                local("a", literal(1)),
                label("skip"),
                local("b", literal(2))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        BlockId labelBlock = cfg.blockOf(2);
        assertEquals(labelBlock, cfg.blockOf(3));
        assertEquals(Terminator.jump(labelBlock), cfg.block(cfg.blockOf(0)).getTerminator());
        assertTrue(cfg.reversePostorder().contains(labelBlock));
        assertFalse(cfg.reversePostorder().contains(cfg.blockOf(1)));
    }

    @Test
    void testBackwardGotoAndDeadLabel() {
        List<Statement> stmts = Arrays.asList(
                label("top"),
                expr(call(name("f"))),
                gotoStmt("top"),
                label("after")
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        BlockId top = cfg.blockOf(0);
        assertEquals(top, cfg.blockOf(1));
        assertEquals(Terminator.jump(top), cfg.block(cfg.blockOf(2)).getTerminator());
        assertFalse(cfg.reversePostorder().contains(cfg.blockOf(3)));
    }

    @Test
    void testGotoUndeclaredLabelIsUnreachable() {
        ControlFlowGraph cfg = CfgBuilder.build(Collections.<Statement>singletonList(gotoStmt("nowhere")));
        assertEquals(Terminator.unreachable(), cfg.block(cfg.blockOf(0)).getTerminator());
    }

    @Test
    void testTryCatch() {
        List<Statement> stmts = Collections.singletonList(tryCatch(
                block(local("a", literal(1))),
                Collections.singletonList(catchClause("e", local("b", literal(2)))),
                null
        ));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        Terminator.TryCatch term = (Terminator.TryCatch) cfg.block(cfg.blockOf(0)).getTerminator();
        assertEquals(1, term.catchTargets.size());
        assertEquals(cfg.blockOf(1), term.normal);
        assertEquals(cfg.blockOf(2), term.catchTargets.get(0));
        assertEquals(
                cfg.block(cfg.blockOf(1)).getTerminator(),
                cfg.block(cfg.blockOf(2)).getTerminator()
        );
    }

    @Test
    void testTryFinally() {
        List<Statement> stmts = Collections.singletonList(tryCatch(
                block(expr(call(name("a")))),
                Collections.singletonList(catchClause("e", expr(call(name("b"))))),
                block(expr(call(name("c"))))
        ));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);

        BlockId finallyBlock = cfg.blockOf(3);
        assertEquals(Terminator.jump(finallyBlock), cfg.block(cfg.blockOf(1)).getTerminator());
        assertEquals(Terminator.jump(finallyBlock), cfg.block(cfg.blockOf(2)).getTerminator());
        BlockId join = ((Terminator.Goto) cfg.block(finallyBlock).getTerminator()).target;
        assertEquals(Terminator.fallThrough(), cfg.block(join).getTerminator());
    }

    @Test
    void testThrowIsUnreachable() {
        List<Statement> stmts = Arrays.asList(throwStmt(literal("boom")), expr(call(name("f"))));
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);
        assertEquals(Terminator.unreachable(), cfg.block(cfg.blockOf(0)).getTerminator());
        assertTrue(cfg.preds(cfg.blockOf(1)).isEmpty());
    }

    @Test
    void testDoBlockIsStraightLine() {
        List<Statement> stmts = Arrays.asList(
                local("a", literal(1)),
                doBlock(local("b", literal(2))),
                local("c", literal(3))
        );
        ControlFlowGraph cfg = CfgBuilder.build(stmts);
        assertConsistent(cfg);
        BlockId only = cfg.blockOf(0);
        for (int i = 0; i < 4; i++) {
            assertEquals(only, cfg.blockOf(i));
        }
    }

    @Test
    void testDeterministic() {
        List<Statement> stmts = Arrays.asList(
                local("i", literal(0)),
                whileLoop(binary("<", name("i"), literal(10)),
                        ifThen(name("c"), block(breakStmt())),
                        assign("i", binary("+", name("i"), literal(1)))),
                ret(name("i"))
        );
        assertEquals(CfgBuilder.build(stmts).toString(), CfgBuilder.build(stmts).toString());
    }
}
