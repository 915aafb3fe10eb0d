package io.github.luanext.core;

import io.github.luanext.ast.Statement;
import io.github.luanext.core.cfg.BlockId;
import io.github.luanext.core.cfg.Terminator;
import io.github.luanext.core.ssa.SsaVar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.github.luanext.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisContextTest {
    static List<Statement> program() {
        return Arrays.asList(
                local("total", literal(0)),
                functionDecl("outer", Collections.singletonList("n"),
                        functionDecl("inner", Collections.<String>emptyList(), ret(literal(1))),
                        local("i", literal(0)),
                        whileLoop(binary("<", name("i"), name("n")),
                                assign("i", binary("+", name("i"), literal(1)))),
                        ret(name("i"))),
                ifThen(name("flag"), block(
                        functionDecl("helper", Collections.singletonList("x"), ret(name("x"))))),
                expr(call(name("outer"), literal(3)))
        );
    }

    @Test
    void testScopesDiscovered() {
        AnalysisContext ctx = AnalysisContext.compute(program());

        assertEquals(new HashSet<>(Arrays.asList(AnalysisContext.TOP_LEVEL, "outer", "inner", "helper")),
                ctx.analyzedFunctions());
        assertFalse(ctx.functionAnalysis("missing").isPresent());
        assertSame(ctx.topLevel().getCfg(), ctx.topLevelCfg());
        assertEquals(5, ctx.topLevelCfg().statementCount());
    }

    @Test
    void testFunctionBodiesAreSeparateScopes() {
        AnalysisContext ctx = AnalysisContext.compute(program());
        FunctionAnalysis outer = ctx.functionAnalysis("outer").orElseThrow(AssertionError::new);

        assertEquals(5, outer.getCfg().statementCount());
        assertEquals(1, outer.getCfg().loopHeaders().size());
        assertFalse(ctx.topLevel().getSsa().allVariables().contains("i"));
        assertTrue(ctx.topLevel().getSsa().allVariables().contains("outer"));
        assertTrue(outer.getSsa().allVariables().contains("inner"));

        // parameters are not definitions in the body
        FunctionAnalysis helper = ctx.functionAnalysis("helper").orElseThrow(AssertionError::new);
        assertTrue(helper.getSsa().usesAt(0).isEmpty());
        assertEquals(Terminator.ret(), helper.getCfg().block(helper.getCfg().blockOf(0)).getTerminator());
    }

    @Test
    void testLaterDeclarationWins() {
        List<Statement> program = Arrays.asList(
                functionDecl("f", Collections.<String>emptyList(), ret()),
                functionDecl("f", Collections.<String>emptyList(), local("a"), local("b"), ret(name("a")))
        );
        AnalysisContext ctx = AnalysisContext.compute(program);
        FunctionAnalysis f = ctx.functionAnalysis("f").orElseThrow(AssertionError::new);

        assertEquals(3, f.getCfg().statementCount());
        assertEquals(Collections.singletonList(new SsaVar("a", 1)), f.getSsa().usesAt(2));
        assertEquals(2, ctx.analyzedFunctions().size());
    }

    @Test
    void testParallelMatchesSerial() throws Exception {
        AnalysisContext serial = AnalysisContext.compute(program());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            AnalysisContext parallel = AnalysisContext.compute(program(), AnalysisOptions.builder()
                    .executor(pool)
                    .dumpDirectory(null)
                    .build());
            assertEquals(serial.analyzedFunctions(), parallel.analyzedFunctions());
            for (String name : serial.analyzedFunctions()) {
                FunctionAnalysis a = serial.functionAnalysis(name).orElseThrow(AssertionError::new);
                FunctionAnalysis b = parallel.functionAnalysis(name).orElseThrow(AssertionError::new);
                assertEquals(a.getCfg().toString(), b.getCfg().toString());
                assertEquals(a.getSsa().versionCounters(), b.getSsa().versionCounters());
            }
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void testFailurePropagates() {
        Statement shared = local("a");
        List<Statement> program = Collections.<Statement>singletonList(
                functionDecl("broken", Collections.<String>emptyList(), shared, doBlock(shared)));
        assertThrows(IllegalArgumentException.class, () -> AnalysisContext.compute(program));
    }

    @Test
    void testDump(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("dot");
        AnalysisContext.compute(program(), AnalysisOptions.builder().dumpDirectory(out).build());

        assertTrue(Files.isRegularFile(out.resolve("_top-level_-5d9b29ee.dot")));
        assertTrue(Files.isRegularFile(out.resolve("outer.dot")));
        String dot = new String(Files.readAllBytes(out.resolve("inner.dot")), StandardCharsets.UTF_8);
        assertTrue(dot.startsWith("digraph \"inner\""));
    }

    @Test
    void testDumpKeepsSimilarNamesApart(@TempDir Path dir) throws Exception {
        List<Statement> program = Arrays.<Statement>asList(
                functionDecl("a:b", Collections.<String>emptyList(), ret(literal(1))),
                functionDecl("a_b", Collections.<String>emptyList(), ret(literal(2))));
        AnalysisContext.compute(program, AnalysisOptions.builder().dumpDirectory(dir).build());

        Set<String> files = new HashSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path file : stream) {
                files.add(file.getFileName().toString());
            }
        }
        assertEquals(new HashSet<>(Arrays.asList("_top-level_-5d9b29ee.dot", "a_b-17389.dot", "a_b.dot")), files);
        String dot = new String(Files.readAllBytes(dir.resolve("a_b-17389.dot")), StandardCharsets.UTF_8);
        assertTrue(dot.startsWith("digraph \"a:b\""));
    }

    @Test
    void testEntryAlwaysFirst() {
        AnalysisContext ctx = AnalysisContext.compute(Collections.<Statement>emptyList());
        assertEquals(Collections.singleton(AnalysisContext.TOP_LEVEL), ctx.analyzedFunctions());
        assertEquals(BlockId.ENTRY, ctx.topLevelCfg().reversePostorder().get(0));
    }
}
