package com.jsrefactor.traverse;

import com.jsrefactor.ParseException;
import com.jsrefactor.Printer;
import com.jsrefactor.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformerTest {
    private final Transformer transformer = new Transformer(new Printer());

    private static Visitor renaming(String from, String to) {
        return Visitor.on(Identifier.class, (identifier, path, rewrite) -> {
            if (identifier.name().equals(from)) {
                rewrite.replace(path, new Identifier(to));
            }
            return TraversalControl.CONTINUE;
        });
    }

    @Test
    void testKeepsTextOutsideReplacements() {
        String code = "// keep me\nfoo(  a ,b);  /* and me */\na;";

        Transformer.Transformed result = transformer.transform(code, renaming("a", "renamed"));

        assertTrue(result.hasCodeChanged());
        assertEquals("// keep me\nfoo(  renamed ,b);  /* and me */\nrenamed;", result.code());
    }

    @Test
    void testNoReplacement() {
        Transformer.Transformed result = transformer.transform("a;", renaming("x", "y"));

        assertFalse(result.hasCodeChanged());
        assertEquals("a;", result.code());
    }

    @Test
    void testIdenticalOutputIsNotAChange() {
        Transformer.Transformed result = transformer.transform("a;", renaming("a", "a"));

        assertFalse(result.hasCodeChanged());
    }

    @Test
    void testMultiLineReplacementFollowsIndentation() {
        String code = "function f() {\n  if (a) b();\n}";
        Visitor visitor = Visitor.on(IfStatement.class, (statement, path, rewrite) -> {
            rewrite.replace(path, new IfStatement(statement.test(),
                new BlockStatement(List.of(statement.consequent())), null));
            return TraversalControl.SKIP_SUBTREE;
        });

        Transformer.Transformed result = transformer.transform(code, visitor);

        assertEquals("function f() {\n  if (a) {\n    b();\n  }\n}", result.code());
    }

    @Test
    void testOverlappingReplacementsAreRejected() {
        Visitor visitor = (path, rewrite) -> {
            if (path.node() instanceof ExpressionStatement || path.node() instanceof Identifier) {
                rewrite.replace(path, path.node() instanceof Identifier
                    ? new Identifier("x")
                    : new ExpressionStatement(new Identifier("y")));
            }
            return TraversalControl.CONTINUE;
        };

        assertThrows(IllegalStateException.class, () -> transformer.transform("a;", visitor));
    }

    @Test
    void testParseErrorPropagates() {
        assertThrows(ParseException.class, () -> transformer.transform("if (", renaming("a", "b")));
    }

    @Test
    void testCommentsInsideReplacementAreKept() {
        String code = "function f() {\n  if (a) {\n    // note\n    b();\n  }\n}";
        Visitor visitor = Visitor.on(IfStatement.class, (statement, path, rewrite) -> {
            BlockStatement block = (BlockStatement) statement.consequent();
            rewrite.replace(path, new IfStatement(new Identifier("ready"), new BlockStatement(block.body()), null));
            return TraversalControl.SKIP_SUBTREE;
        });

        Transformer.Transformed result = transformer.transform(code, visitor);

        assertEquals("function f() {\n  if (ready) {\n    // note\n    b();\n  }\n}", result.code());
    }
}
