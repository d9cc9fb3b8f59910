package com.jsrefactor.refactoring.negateexpression;

import com.jsrefactor.ast.BinaryExpression;
import com.jsrefactor.ast.Identifier;
import com.jsrefactor.ast.UnaryExpression;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.FakeEditor;
import com.jsrefactor.editor.Selection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NegateExpressionTest {
    private final NegateExpression refactoring = new NegateExpression(RefactoringConfig.defaults());

    @ParameterizedTest
    @CsvSource(delimiterString = " -> ", value = {
        "if (a === b) f(); -> if (!(a !== b)) f();",
        "if (a < b) f(); -> if (!(a >= b)) f();",
        "if (!(a == b)) f(); -> if (a != b) f();",
        "if (!(a && b)) f(); -> if (!a || !b) f();",
        "if (a || !b) f(); -> if (!(!a && b)) f();"
    })
    void testNegates(String code, String expected) {
        assertEquals(expected, refactoring.updateCode(code, Selection.cursorAt(0, 6)).code());
    }

    @Test
    void testInnermostExpression() {
        String code = "if (a && b > 1) f();";

        assertEquals("if (a && !(b <= 1)) f();", refactoring.updateCode(code, Selection.cursorAt(0, 10)).code());
    }

    @Test
    void testNothingToNegate() {
        FakeEditor editor = new FakeEditor("f(a);", Selection.cursorAt(0, 2));

        refactoring.perform(editor).join();

        assertEquals(List.of(ErrorReason.DID_NOT_FIND_NEGATABLE_EXPRESSION), editor.errors());
    }

    @Test
    void testNegationHelpers() {
        assertEquals("!==", Negation.negatedOperator("==="));
        assertNull(Negation.negatedOperator("+"));
        assertFalse(Negation.isNegatable(new BinaryExpression("+", new Identifier("a"), new Identifier("b"))));

        Identifier a = new Identifier("a");
        assertSame(a, Negation.negate(new UnaryExpression("!", a)));
        assertInstanceOf(UnaryExpression.class, Negation.negate(a));
    }
}
