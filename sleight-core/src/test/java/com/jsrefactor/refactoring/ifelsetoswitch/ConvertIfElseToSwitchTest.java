package com.jsrefactor.refactoring.ifelsetoswitch;

import com.jsrefactor.Parser;
import com.jsrefactor.ast.UnaryExpression;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.FakeEditor;
import com.jsrefactor.editor.Selection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ConvertIfElseToSwitchTest {
    private final ConvertIfElseToSwitch refactoring = new ConvertIfElseToSwitch(RefactoringConfig.defaults());

    private String convert(String code, Selection selection) {
        return refactoring.updateCode(code, selection).code();
    }

    @Test
    void testConvertsChainWithDefault() {
        String code = "if (x === 'a') { f(); } else if (x === 'b') { g(); } else { h(); }";

        String expected = "switch (x) {\n"
            + "  case 'a':\n"
            + "    f();\n"
            + "    break;\n"
            + "  case 'b':\n"
            + "    g();\n"
            + "    break;\n"
            + "  default:\n"
            + "    h();\n"
            + "    break;\n"
            + "}";
        assertEquals(expected, convert(code, Selection.cursorAt(0, 0)));
    }

    @Test
    void testLiteralOnTheLeft() {
        String code = "if ('a' === x) f();\nelse if (2 === x) g();";

        assertEquals("switch (x) {\n  case 'a':\n    f();\n    break;\n  case 2:\n    g();\n    break;\n}",
            convert(code, Selection.cursorAt(0, 0)));
    }

    @Test
    void testFinalReturnReplacesBreak() {
        String code = "function f() {\n  if (x === 1) {\n    return 'one';\n  } else {\n    log();\n  }\n}";

        String expected = "function f() {\n"
            + "  switch (x) {\n"
            + "    case 1:\n"
            + "      return 'one';\n"
            + "    default:\n"
            + "      log();\n"
            + "      break;\n"
            + "  }\n"
            + "}";
        assertEquals(expected, convert(code, Selection.cursorAt(1, 4)));
    }

    @Test
    void testSingleBranch() {
        String code = "if (x === 1) doIt();";

        assertEquals("switch (x) {\n  case 1:\n    doIt();\n    break;\n}", convert(code, Selection.cursorAt(0, 0)));
    }

    @Test
    void testCoalesceNextToLogicalOperatorStaysValid() {
        String code = "if (x === 1) { y = (a || b) ?? c; }";

        String converted = convert(code, Selection.cursorAt(0, 0));

        assertEquals("switch (x) {\n  case 1:\n    y = (a || b) ?? c;\n    break;\n}", converted);
        assertDoesNotThrow(() -> Parser.parse(converted));
    }

    @Test
    void testStatementStartingWithObjectStaysValid() {
        String code = "if (x === 1) { ({}).toString(); }";

        String converted = convert(code, Selection.cursorAt(0, 0));

        assertEquals("switch (x) {\n  case 1:\n    ({}).toString();\n    break;\n}", converted);
        assertDoesNotThrow(() -> Parser.parse(converted));
    }

    @Test
    void testCommentsInBranchesAreKept() {
        String code = "if (x === 1) {\n  // keep me\n  f();\n} else {\n  g(); /* and me */\n}";

        String expected = "switch (x) {\n"
            + "  case 1:\n"
            + "    // keep me\n"
            + "    f();\n"
            + "    break;\n"
            + "  default:\n"
            + "    g(); /* and me */\n"
            + "    break;\n"
            + "}";
        assertEquals(expected, convert(code, Selection.cursorAt(0, 0)));
    }

    @Test
    @DisplayName("A branch that is not an equality test leaves the whole chain unchanged")
    void testAllOrNothing() {
        String code = "if (x === 'a') { f(); } else if (y > 2) { g(); }";

        assertFalse(refactoring.canPerform(code, Selection.cursorAt(0, 0)));
    }

    @Test
    void testDifferentDiscriminantsAreNotConverted() {
        String code = "if (x === 'a') { f(); } else if (y === 'b') { g(); }";

        assertFalse(refactoring.canPerform(code, Selection.cursorAt(0, 0)));
    }

    @Test
    void testStructurallyEqualDiscriminants() {
        String code = "if (a.b === 1) f();\nelse if (a . b === 2) g();";

        assertTrue(convert(code, Selection.cursorAt(0, 0)).startsWith("switch (a.b) {"));
    }

    @Test
    void testLooseEqualityRequiresConfiguration() {
        String code = "if (x == 1) f();\nelse if (x == 2) g();";

        assertFalse(refactoring.canPerform(code, Selection.cursorAt(0, 0)));

        ConvertIfElseToSwitch loose = new ConvertIfElseToSwitch(
            RefactoringConfig.defaults().withEqualityOperators(List.of("===", "==")));
        assertTrue(loose.canPerform(code, Selection.cursorAt(0, 0)));
    }

    @Test
    void testInnermostChainIsConverted() {
        String code = "if (a === 1) {\n  if (b === 2) {\n    x();\n  } else if (b === 3) {\n    y();\n  }\n}";

        String expected = "if (a === 1) {\n"
            + "  switch (b) {\n"
            + "    case 2:\n"
            + "      x();\n"
            + "      break;\n"
            + "    case 3:\n"
            + "      y();\n"
            + "      break;\n"
            + "  }\n"
            + "}";
        assertEquals(expected, convert(code, Selection.cursorAt(2, 4)));
    }

    @Test
    void testOuterChainWhenSelectionIsOutsideTheInnerOne() {
        String code = "if (a === 1) {\n  if (b === 2) {\n    x();\n  }\n}";

        assertTrue(convert(code, Selection.cursorAt(0, 2)).startsWith("switch (a) {"));
    }

    @Test
    void testInnerChainThatCannotConvertLetsTheOuterOneConvert() {
        String code = "if (a === 1) {\n  if (b > 2) {\n    x();\n  }\n}";

        assertTrue(convert(code, Selection.cursorAt(2, 4)).startsWith("switch (a) {"));
    }

    @Test
    void testSecondRunFindsNothing() {
        String code = "if (x === 'a') { f(); } else { g(); }";
        String converted = convert(code, Selection.cursorAt(0, 0));

        assertFalse(refactoring.canPerform(converted, Selection.cursorAt(0, 0)));
    }

    @Test
    void testSelectionOutsideAnyIf() {
        String code = "foo();\nif (x === 1) f();";

        assertFalse(refactoring.hasIfElseToConvert(code, Selection.cursorAt(0, 2)));
        assertTrue(refactoring.hasIfElseToConvert(code, Selection.cursorAt(1, 2)));
    }

    @Test
    void testPerformWritesCode() {
        FakeEditor editor = new FakeEditor("if (x === 1) f();", Selection.cursorAt(0, 0));

        refactoring.perform(editor).join();

        assertEquals("switch (x) {\n  case 1:\n    f();\n    break;\n}", editor.code());
        assertTrue(editor.errors().isEmpty());
    }

    @Test
    void testPerformReportsErrors() {
        FakeEditor notFound = new FakeEditor("foo();", Selection.cursorAt(0, 0));
        refactoring.perform(notFound).join();
        assertEquals(List.of(ErrorReason.DID_NOT_FIND_IF_ELSE_TO_CONVERT), notFound.errors());
        assertEquals("foo();", notFound.code());

        FakeEditor invalid = new FakeEditor("if (", Selection.cursorAt(0, 0));
        refactoring.perform(invalid).join();
        assertEquals(List.of(ErrorReason.DID_NOT_PARSE_CODE), invalid.errors());
    }

    @Test
    void testCustomDiscriminantExtractor() {
        DiscriminantExtractor typeofOnly = test -> new EqualityDiscriminantExtractor(Set.of("==="))
            .extract(test)
            .filter(switchTest -> switchTest.discriminant() instanceof UnaryExpression);
        ConvertIfElseToSwitch custom = new ConvertIfElseToSwitch(RefactoringConfig.defaults(), typeofOnly);

        assertTrue(custom.canPerform("if (typeof v === 'string') f();", Selection.cursorAt(0, 0)));
        assertFalse(custom.canPerform("if (v === 'string') f();", Selection.cursorAt(0, 0)));
    }
}
