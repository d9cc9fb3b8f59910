package com.jsrefactor.traverse;

import com.jsrefactor.Parser;
import com.jsrefactor.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TraversalTest {

    @Test
    void testPreOrder() {
        Program program = Parser.parse("a + b;");
        List<String> visited = new ArrayList<>();

        Traversal.traverse(program, (path, rewrite) -> {
            visited.add(path.toString());
            return TraversalControl.CONTINUE;
        });

        assertEquals(List.of(
            "Program",
            "body[0]:ExpressionStatement",
            "expression:BinaryExpression",
            "left:Identifier",
            "right:Identifier"
        ), visited);
    }

    @Test
    void testSkipSubtree() {
        Program program = Parser.parse("f(a); g(b);");
        List<String> names = new ArrayList<>();

        Traversal.traverse(program, (path, rewrite) -> {
            if (path.node() instanceof Identifier identifier) {
                names.add(identifier.name());
            }
            if (path.node() instanceof CallExpression call && ((Identifier) call.callee()).name().equals("f")) {
                return TraversalControl.SKIP_SUBTREE;
            }
            return TraversalControl.CONTINUE;
        });

        assertEquals(List.of("g", "b"), names);
    }

    @Test
    void testStopEndsTheWalk() {
        Program program = Parser.parse("a; b; c;");
        List<String> names = new ArrayList<>();

        Traversal.traverse(program, Visitor.on(Identifier.class, (identifier, path, rewrite) -> {
            names.add(identifier.name());
            return identifier.name().equals("b") ? TraversalControl.STOP : TraversalControl.CONTINUE;
        }));

        assertEquals(List.of("a", "b"), names);
    }

    @Test
    void testReplacementsAreCollectedNotApplied() {
        Program program = Parser.parse("a;");
        Identifier replacement = new Identifier("z");

        Rewrite rewrite = Traversal.traverse(program, Visitor.on(Identifier.class, (identifier, path, r) -> {
            r.replace(path, replacement);
            return TraversalControl.CONTINUE;
        }));

        ExpressionStatement statement = (ExpressionStatement) program.body().get(0);
        assertSame(replacement, rewrite.replacements().get(statement.expression()));
        assertEquals("a", ((Identifier) statement.expression()).name());
    }

    @Test
    void testReplacingWithSameNodeIsIgnored() {
        Program program = Parser.parse("a;");

        Rewrite rewrite = Traversal.traverse(program, (path, r) -> {
            r.replace(path, path.node());
            return TraversalControl.CONTINUE;
        });

        assertTrue(rewrite.isEmpty());
    }

    @Test
    void testNodePathParents() {
        Program program = Parser.parse("if (a) { f(b); }");
        NodePath[] found = {null};

        Traversal.traverse(program, Visitor.on(Identifier.class, (identifier, path, rewrite) -> {
            if (identifier.name().equals("b")) {
                found[0] = path;
                return TraversalControl.STOP;
            }
            return TraversalControl.CONTINUE;
        }));

        NodePath path = found[0];
        assertEquals("arguments", path.key());
        assertEquals(0, path.index());
        assertInstanceOf(CallExpression.class, path.parentNode());
        NodePath ifPath = path.findParent(parent -> parent.node() instanceof IfStatement).orElseThrow();
        assertEquals("body[0]", ifPath.key() + "[" + ifPath.index() + "]");
        assertTrue(ifPath.parent().isRoot());
        assertTrue(path.findParent(parent -> parent.node() instanceof SwitchStatement).isEmpty());
    }
}
