package io.github.luanext.core.cfg;

import io.github.luanext.ast.Statement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.luanext.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class StatementIndexTest {
    @Test
    void testPreOrder() {
        Statement inner = local("b", literal(2));
        Statement loop = whileLoop(name("c"), inner);
        Statement after = ret(name("b"));
        StatementIndex index = StatementIndex.of(Arrays.asList(local("a", literal(1)), loop, after));

        assertEquals(4, index.size());
        assertEquals(1, index.indexOf(loop));
        assertEquals(2, index.indexOf(inner));
        assertEquals(3, index.indexOf(after));
        assertSame(inner, index.get(2));
        assertEquals(3, index.roots().size());
    }

    @Test
    void testFunctionBodiesAreNotNumbered() {
        List<Statement> stmts = Collections.singletonList(
                functionDecl("f", Collections.singletonList("x"), ret(name("x")))
        );
        assertEquals(1, StatementIndex.of(stmts).size());
    }

    @Test
    void testForeignStatement() {
        StatementIndex index = StatementIndex.of(block(local("a")));
        assertThrows(IllegalArgumentException.class, () -> index.indexOf(local("a")));
    }

    @Test
    void testSharedStatementRejected() {
        Statement shared = local("a");
        assertThrows(IllegalArgumentException.class, () -> StatementIndex.of(Arrays.asList(shared, doBlock(shared))));
    }
}
