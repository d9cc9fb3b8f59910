package com.jsrefactor;

import com.jsrefactor.ast.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {
    private final Printer printer = new Printer();

    @ParameterizedTest
    @ValueSource(strings = {
        "a + b * c;",
        "(a + b) * c;",
        "a - (b - c);",
        "!(a && b);",
        "a ? b : c;",
        "x = y === 'z';",
        "obj.value[key](1, \"two\");",
        "typeof a === 'string';",
        "`Hello ${name}!`;",
        "const { a, b: c } = { a: 1, b };",
        "items.map((item) => item.id);",
        "return;",
        "throw error;",
        "(a || b) ?? c;",
        "a ?? (b && c);",
        "a | b & c;",
        "(a | b) & c;",
        "x << 2 >>> y ^ z;"
    })
    void testReprintsParsedStatement(String source) {
        Statement statement = Parser.parse(source).body().get(0);
        assertEquals(source, printer.print(statement));
    }

    @Test
    void testBlockIndentation() {
        String source = "if (a) {\n  f();\n} else {\n  g();\n}";
        assertEquals(source, printer.print(Parser.parse(source)));
    }

    @Test
    void testSwitchLayout() {
        SwitchStatement statement = new SwitchStatement(
            new Identifier("x"),
            List.of(
                new SwitchCase(new Literal(1.0, null), List.of(new ExpressionStatement(new CallExpression(new Identifier("f"), List.of())), new BreakStatement())),
                new SwitchCase(null, List.of(new ReturnStatement(null)))
            )
        );

        assertEquals("switch (x) {\n  case 1:\n    f();\n    break;\n  default:\n    return;\n}", printer.print(statement));
    }

    @Test
    void testIndentSize() {
        BlockStatement block = new BlockStatement(List.of(new ExpressionStatement(new Identifier("a"))));

        assertEquals("{\n    a;\n}", new Printer(4).print(block));
        assertEquals("{}", printer.print(new BlockStatement(List.of())));
    }

    @Test
    void testSynthesizedNodesGetParentheses() {
        Expression negated = new UnaryExpression("!", new BinaryExpression("===", new Identifier("a"), new Identifier("b")));
        assertEquals("!(a === b)", printer.print(negated));

        Expression nested = new BinaryExpression("*", new LogicalExpression("||", new Identifier("a"), new Identifier("b")), new Identifier("c"));
        assertEquals("(a || b) * c", printer.print(nested));
    }

    @Test
    void testLiteralWithoutRaw() {
        assertEquals("\"it's \\\"quoted\\\"\"", printer.print(new Literal("it's \"quoted\"", null)));
        assertEquals("3", printer.print(new Literal(3.0, null)));
        assertEquals("null", printer.print(new Literal(null, null)));
    }

    @Test
    void testObjectStatementIsWrapped() {
        Statement statement = new ExpressionStatement(new ObjectExpression(List.of()));
        assertEquals("({});", printer.print(statement));
    }

    @Test
    void testStatementStartingWithObjectIsWrapped() {
        Expression toString = new CallExpression(
            new MemberExpression(new ObjectExpression(List.of()), new Identifier("toString"), false), List.of());

        String printed = printer.print(new ExpressionStatement(toString));

        assertEquals("({}.toString());", printed);
        assertEquals(1, Parser.parse(printed).body().size());
    }

    @Test
    void testArrowBodyStartingWithObjectIsWrapped() {
        Expression member = new MemberExpression(new ObjectExpression(List.of()), new Identifier("x"), false);

        assertEquals("() => ({}.x)", printer.print(new ArrowFunctionExpression(List.of(), member, true)));
    }

    @Test
    void testCoalesceNextToLogicalOperatorKeepsParentheses() {
        Identifier a = new Identifier("a");
        Identifier b = new Identifier("b");
        Identifier c = new Identifier("c");

        assertEquals("(a || b) ?? c", printer.print(new LogicalExpression("??", new LogicalExpression("||", a, b), c)));
        assertEquals("a ?? (b && c)", printer.print(new LogicalExpression("??", a, new LogicalExpression("&&", b, c))));
        assertEquals("(a ?? b) || c", printer.print(new LogicalExpression("||", new LogicalExpression("??", a, b), c)));
    }

    @Test
    void testReplacementCopiesKeptNodesWithTheirComments() {
        String source = "if (a) {\n  // why\n  f(1, /* two */ 2);\n  g(); // after\n}";
        IfStatement statement = (IfStatement) Parser.parse(source).body().get(0);
        BlockStatement block = (BlockStatement) statement.consequent();
        IfStatement replacement = new IfStatement(new UnaryExpression("!", statement.test()),
            new BlockStatement(List.of(new ReturnStatement(null))), new BlockStatement(block.body()));

        String printed = printer.print(replacement, source, statement);

        assertEquals("if (!a) {\n  return;\n} else {\n  // why\n  f(1, /* two */ 2);\n  g(); // after\n}", printed);
    }

    @Test
    void testCommentsWithoutAPlaceGoFirst() {
        String source = "  if (a /* test */) b();";
        IfStatement statement = (IfStatement) Parser.parse(source).body().get(0);

        String printed = printer.print(new ExpressionStatement(new Identifier("c")), source, statement);

        assertEquals("/* test */\n  c;", printed);
    }
}
