package com.jsrefactor.ast;

import com.jsrefactor.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodesTest {

    @Test
    void testChildrenInFieldOrder() {
        IfStatement statement = (IfStatement) Parser.parse("if (a) b; else c;").body().get(0);
        List<Nodes.Child> children = Nodes.children(statement);

        assertEquals(List.of("test", "consequent", "alternate"), children.stream().map(Nodes.Child::key).toList());
        assertEquals(-1, children.get(0).index());
    }

    @Test
    void testChildrenSkipNullsAndIndexLists() {
        Program program = Parser.parse("if (a) b;\nf(x, y);");
        assertEquals(2, Nodes.children(program.body().get(0)).size());

        CallExpression call = (CallExpression) ((ExpressionStatement) program.body().get(1)).expression();
        List<Nodes.Child> children = Nodes.children(call);
        assertEquals("arguments", children.get(2).key());
        assertEquals(1, children.get(2).index());
    }

    @Test
    void testFinalReturn() {
        BlockStatement block = (BlockStatement) Parser.parse("{ a(); return b; }").body().get(0);

        assertTrue(Nodes.hasFinalReturn(block.body()));
        assertFalse(Nodes.hasFinalReturn(List.of()));
        assertEquals(2, Nodes.getStatements(block).size());
    }

    @Test
    void testQuote() {
        assertEquals("\"a\\\"b\\nc\"", Nodes.quote("a\"b\nc"));
    }
}
