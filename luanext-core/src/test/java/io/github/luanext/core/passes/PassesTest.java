package io.github.luanext.core.passes;

import io.github.luanext.ast.Statement;
import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.FunctionAnalysis;
import io.github.luanext.core.cfg.ControlFlowGraph;
import io.github.luanext.core.ext.AnalysisExts;
import io.github.luanext.core.ext.MetadataState;
import io.github.luanext.core.passes.form.BuildSsa;
import io.github.luanext.core.passes.meta.BuildCfg;
import io.github.luanext.core.passes.meta.ComputeDominators;
import io.github.luanext.core.passes.misc.ChainedPass;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static io.github.luanext.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    static AnalysisUnit unit() {
        List<Statement> stmts = Arrays.asList(
                local("x", literal(0)),
                ifThen(name("c"), block(assign("x", literal(1)))),
                ret(name("x"))
        );
        return new AnalysisUnit("f", stmts);
    }

    @Test
    void testPrerequisitesComputed() {
        AnalysisUnit unit = unit();
        MetadataState ms = unit.getExtOrThrow(AnalysisExts.METADATA_STATE);
        assertFalse(ms.isValid(MetadataState.Kind.CFG));

        assertSame(unit, BuildSsa.INSTANCE.run(unit));
        assertEquals("BuildSsa", BuildSsa.INSTANCE.toString());
        assertTrue(ms.isValid(MetadataState.Kind.CFG));
        assertTrue(ms.isValid(MetadataState.Kind.DOMS));
        assertTrue(ms.isValid(MetadataState.Kind.SSA_FORM));
        assertTrue(unit.getExt(AnalysisExts.DOM_TREE).isPresent());
    }

    @Test
    void testValidMetadataNotRecomputed() {
        AnalysisUnit unit = unit();
        BuildCfg.INSTANCE.run(unit);
        ControlFlowGraph cfg = unit.getExtOrThrow(AnalysisExts.CFG);
        ComputeDominators.INSTANCE.run(unit);
        assertSame(cfg, unit.getExtOrThrow(AnalysisExts.CFG));
    }

    @Test
    void testFullAnalysis() {
        AnalysisUnit unit = unit();
        assertFalse(unit.getExt(AnalysisExts.SSA_FORM).isPresent());
        FunctionAnalysis analysis = Passes.FULL_ANALYSIS.run(unit);

        assertEquals("f", analysis.getName());
        assertSame(unit.getIndex(), analysis.getIndex());
        assertEquals(4, analysis.getCfg().statementCount());
        assertEquals(3, analysis.getSsa().versionCount("x"));
        assertTrue(Passes.FULL_ANALYSIS.run(unit()).getDominators().isReachable(analysis.getCfg().blockOf(3)));
    }

    @Test
    void testMissingAnalysis() {
        NoSuchElementException e = assertThrows(NoSuchElementException.class, () -> FunctionAnalysis.of(unit()));
        assertEquals("ext CFG is not attached to f", e.getMessage());
    }

    @Test
    void testChainReportsFailingPass() {
        IRPass<AnalysisUnit, AnalysisUnit> failing = unit -> {
            throw new IllegalStateException("boom");
        };
        IRPass<AnalysisUnit, AnalysisUnit> chain = BuildCfg.INSTANCE.then(ComputeDominators.INSTANCE).then(failing);
        assertTrue(BuildCfg.INSTANCE.then(ComputeDominators.INSTANCE).isInPlace());
        assertFalse(chain.isInPlace());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(unit()));
        assertEquals("boom", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("running pass 2 ("));
        assertEquals(3, ((ChainedPass<?, ?>) chain).getPasses().size());
    }
}
