package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.FakeEditor;
import com.jsrefactor.editor.Position;
import com.jsrefactor.editor.Selection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExtractVariableTest {
    private final ExtractVariable refactoring = new ExtractVariable(RefactoringConfig.defaults());

    private FakeEditor perform(String code, Selection selection) {
        return perform(new FakeEditor(code, selection));
    }

    private FakeEditor perform(FakeEditor editor) {
        refactoring.perform(editor).join();
        return editor;
    }

    @Nested
    class Generic {

        @Test
        void testExtractsSelectedExpression() {
            FakeEditor editor = perform("console.log(1 + 2);", Selection.fromPositions(0, 12, 0, 17));

            assertEquals("const extracted = 1 + 2;\nconsole.log(extracted);", editor.code());
            assertEquals(new Position(1, 21), editor.cursor());
        }

        @Test
        void testDeclarationKeepsStatementIndentation() {
            FakeEditor editor = perform("function f() {\n  return a * b;\n}", Selection.fromPositions(1, 9, 1, 14));

            assertEquals("function f() {\n  const extracted = a * b;\n  return extracted;\n}", editor.code());
            assertEquals(new Position(2, 18), editor.cursor());
        }

        @Test
        void testDeclarationInsideSwitchCase() {
            FakeEditor editor = perform("switch (x) {\n  case 1:\n    f(a + b);\n}", Selection.fromPositions(2, 6, 2, 11));

            assertEquals("switch (x) {\n  case 1:\n    const extracted = a + b;\n    f(extracted);\n}", editor.code());
        }

        @Test
        void testCursorPicksInnermostExpression() {
            FakeEditor editor = perform("f(a + g(b));", Selection.cursorAt(0, 8));

            assertEquals("const extracted = b;\nf(a + g(extracted));", editor.code());
        }

        @Test
        void testConfiguredKeyword() {
            ExtractVariable withLet = new ExtractVariable(RefactoringConfig.defaults().withDeclarationKeyword("let"));
            FakeEditor editor = new FakeEditor("f(1 + 2);", Selection.fromPositions(0, 2, 0, 7));

            withLet.perform(editor).join();

            assertEquals("let extracted = 1 + 2;\nf(extracted);", editor.code());
        }

        @Test
        void testComputedKeyGivesDefaultName() {
            FakeEditor editor = perform("const o = { [k]: a + b };", Selection.fromPositions(0, 17, 0, 22));

            assertEquals("const extracted = a + b;\nconst o = { [k]: extracted };", editor.code());
        }
    }

    @Nested
    class MemberAccess {
        private static final String CODE = "const copy = obj.value;";

        @Test
        void testDestructure() {
            FakeEditor editor = perform(new FakeEditor(CODE, Selection.cursorAt(0, 18)).answering(0));

            assertEquals("const { value } = obj;\nconst copy = value;", editor.code());
            assertEquals(new Position(1, 18), editor.cursor());
            assertEquals(List.of(List.of(
                "Destructure => `const { value } = obj`",
                "Preserve => `const value = obj.value`"
            )), editor.prompts());
        }

        @Test
        void testPreserve() {
            FakeEditor editor = perform(new FakeEditor(CODE, Selection.cursorAt(0, 18)).answering(1));

            assertEquals("const value = obj.value;\nconst copy = value;", editor.code());
        }

        @Test
        @DisplayName("Dismissing the prompt keeps destructuring")
        void testDismissedPrompt() {
            FakeEditor editor = perform(new FakeEditor(CODE, Selection.cursorAt(0, 18)).answering(-1));

            assertEquals("const { value } = obj;\nconst copy = value;", editor.code());
        }

        @Test
        void testComputedAccessDoesNotPrompt() {
            FakeEditor editor = perform("const copy = obj[key];", Selection.fromPositions(0, 13, 0, 21));

            assertEquals("const extracted = obj[key];\nconst copy = extracted;", editor.code());
            assertTrue(editor.prompts().isEmpty());
        }
    }

    @Nested
    class Shorthand {

        @Test
        void testCollapsesProperty() {
            FakeEditor editor = perform("const o = { foo: 1 + 2 };", Selection.fromPositions(0, 17, 0, 22));

            assertEquals("const foo = 1 + 2;\nconst o = { foo };", editor.code());
            assertEquals(new Position(1, 15), editor.cursor());
        }

        @Test
        void testStringKeyIsNotShorthand() {
            FakeEditor editor = perform("const o = { 'foo': 1 + 2 };", Selection.fromPositions(0, 19, 0, 24));

            assertEquals("const extracted = 1 + 2;\nconst o = { 'foo': extracted };", editor.code());
        }
    }

    @Nested
    class StringLiteral {

        @Test
        void testNameFromContent() {
            FakeEditor editor = perform("console.log(\"Hello world\");", Selection.cursorAt(0, 15));

            assertEquals("const helloWorld = \"Hello world\";\nconsole.log(helloWorld);", editor.code());
            assertEquals(new Position(1, 22), editor.cursor());
        }

        @Test
        void testLongContentFallsBackToDefaultName() {
            FakeEditor editor = perform("f('this is a very long sentence indeed');", Selection.cursorAt(0, 4));

            assertEquals("const extracted = 'this is a very long sentence indeed';\nf(extracted);", editor.code());
        }

        @Test
        void testSubSelectionBecomesTemplate() {
            FakeEditor editor = perform("console.log(\"Hello world\");", Selection.fromPositions(0, 19, 0, 24));

            assertEquals("const world = \"world\";\nconsole.log(`Hello ${world}`);", editor.code());
        }

        @Test
        void testSubSelectionAfterBacktickMatchesSelectedText() {
            FakeEditor editor = perform("f('a`b cd');", Selection.fromPositions(0, 7, 0, 9));

            assertEquals("const cd = \"cd\";\nf(`a\\`b ${cd}`);", editor.code());
            assertEquals(new Position(1, 10), editor.cursor());
        }
    }

    @Nested
    class TemplateLiteral {

        @Test
        void testPartialSelection() {
            FakeEditor editor = perform("const msg = `Hello world`;", Selection.fromPositions(0, 19, 0, 24));

            assertEquals("const world = \"world\";\nconst msg = `Hello ${world}`;", editor.code());
            assertEquals(new Position(1, 21), editor.cursor());
        }

        @Test
        void testPartialSelectionNextToSubstitution() {
            FakeEditor editor = perform("const msg = `Dear ${name}, welcome`;", Selection.fromPositions(0, 27, 0, 34));

            assertEquals("const welcome = \"welcome\";\nconst msg = `Dear ${name}, ${welcome}`;", editor.code());
        }

        @Test
        void testEscapedQuotesAreNotEscapedTwice() {
            FakeEditor editor = perform("const s = `say \\\"hi\\\" now`;", Selection.fromPositions(0, 15, 0, 21));

            assertEquals("const hi = \"\\\"hi\\\"\";\nconst s = `say ${hi} now`;", editor.code());
            assertEquals(new Position(1, 17), editor.cursor());
        }

        @Test
        void testMultiLineTemplateIsExtractedWhole() {
            FakeEditor editor = perform("const msg = `Hello\nworld`;", Selection.fromPositions(1, 0, 1, 5));

            assertEquals("const extracted = `Hello\nworld`;\nconst msg = extracted;", editor.code());
        }
    }

    @Nested
    class Errors {

        @Test
        void testNothingExtractable() {
            FakeEditor editor = perform("const a = 1;", Selection.cursorAt(0, 6));

            assertEquals(List.of(ErrorReason.DID_NOT_FIND_EXTRACTABLE_CODE), editor.errors());
            assertEquals("const a = 1;", editor.code());
        }

        @Test
        void testInvalidCode() {
            FakeEditor editor = perform("const = ;", Selection.cursorAt(0, 0));

            assertEquals(List.of(ErrorReason.DID_NOT_PARSE_CODE), editor.errors());
        }
    }

    @Test
    void testCanPerform() {
        assertTrue(refactoring.canPerform("f(a);", Selection.cursorAt(0, 2)));
        assertFalse(refactoring.canPerform("const a = 1;", Selection.cursorAt(0, 6)));
        assertFalse(refactoring.canPerform("if (", Selection.cursorAt(0, 0)));
    }
}
