package io.github.luanext.core.display;

import io.github.luanext.ast.Statement;
import io.github.luanext.core.AnalysisUnit;
import io.github.luanext.core.FunctionAnalysis;
import io.github.luanext.core.passes.Passes;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.luanext.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisDisplayTest {
    @Test
    void testDot() {
        List<Statement> stmts = Arrays.asList(
                local("i", literal(0)),
                whileLoop(binary("<", name("i"), literal(10)),
                        assign("i", binary("+", name("i"), literal(1)))),
                ret(literal("done")),
                expr(call(name("dead")))
        );
        FunctionAnalysis analysis = Passes.FULL_ANALYSIS.run(new AnalysisUnit("loop", stmts));
        String dot = AnalysisDisplay.toDot(analysis);

        assertTrue(dot.startsWith("digraph \"loop\" {"));
        assertTrue(dot.endsWith("}\n"));
        assertTrue(dot.contains("B0 (entry)"));
        assertTrue(dot.contains("i_2 = phi("));
        assertTrue(dot.contains("; defs [i_1]"));
        assertTrue(dot.contains("\\\"done\\\""));
        assertTrue(dot.contains("style=bold"));
        assertTrue(dot.contains("style=dashed"));
        assertTrue(dot.contains("B0 -> B2;"));
        assertTrue(dot.contains("[style=dotted, color=blue, constraint=false]"));
    }

    @Test
    void testFileName() {
        assertEquals("_top-level_-5d9b29ee.dot", AnalysisDisplay.fileName("<top-level>"));
        assertEquals("Point.new.dot", AnalysisDisplay.fileName("Point.new"));
        assertEquals("a_b.dot", AnalysisDisplay.fileName("a_b"));
        assertEquals("a_b-17063.dot", AnalysisDisplay.fileName("a b"));
        assertEquals("a_b-17389.dot", AnalysisDisplay.fileName("a:b"));
    }
}
