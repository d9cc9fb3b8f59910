package com.jsrefactor.editor;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptRegionEditorTest {
    private static final String COMPONENT = String.join("\n",
        "<template>",
        "  <p>{{ message }}</p>",
        "</template>",
        "<script lang=\"js\">",
        "const message = 'hi';",
        "</script>",
        ""
    );

    @Test
    void testCodeIsTheScriptRegion() {
        ScriptRegionEditor editor = new ScriptRegionEditor(new FakeEditor(COMPONENT, Selection.cursorAt(4, 6)));

        assertEquals("\nconst message = 'hi';\n", editor.code());
    }

    @Test
    void testSelectionIsShiftedIntoTheRegion() {
        ScriptRegionEditor editor = new ScriptRegionEditor(new FakeEditor(COMPONENT, Selection.fromPositions(4, 6, 4, 13)));

        assertEquals(Selection.fromPositions(1, 6, 1, 13), editor.selection());
    }

    @Test
    void testSelectionBeforeTheRegion() {
        ScriptRegionEditor editor = new ScriptRegionEditor(new FakeEditor(COMPONENT, Selection.cursorAt(1, 3)));

        assertEquals(Selection.cursorAt(0, 0), editor.selection());
    }

    @Test
    void testWriteReplacesOnlyTheRegion() {
        FakeEditor delegate = new FakeEditor(COMPONENT, Selection.cursorAt(4, 0));
        ScriptRegionEditor editor = new ScriptRegionEditor(delegate);

        editor.write("\nconst greeting = 'hi';\nconst message = greeting;\n", new Position(2, 16)).join();

        assertTrue(delegate.code().startsWith("<template>\n  <p>{{ message }}</p>\n</template>\n<script lang=\"js\">\n"));
        assertTrue(delegate.code().endsWith("const message = greeting;\n</script>\n"));
        assertEquals(new Position(5, 16), delegate.cursor());
    }

    @Test
    void testDocumentWithoutScriptTag() {
        FakeEditor delegate = new FakeEditor("a;\nb;", Selection.cursorAt(1, 0));
        ScriptRegionEditor editor = new ScriptRegionEditor(delegate);

        assertEquals("a;\nb;", editor.code());
        assertEquals(Selection.cursorAt(1, 0), editor.selection());
        editor.write("c;").join();
        assertEquals("c;", delegate.code());
    }

    @Test
    void testPromptsAndErrorsAreDelegated() {
        FakeEditor delegate = new FakeEditor(COMPONENT, Selection.cursorAt(4, 0)).answering(1);
        ScriptRegionEditor editor = new ScriptRegionEditor(delegate);

        Optional<Choice<String>> choice = editor.askUser(List.of(new Choice<>("A", "a"), new Choice<>("B", "b"))).join();
        editor.showError(ErrorReason.DID_NOT_PARSE_CODE);

        assertEquals("b", choice.orElseThrow().value());
        assertEquals(List.of(ErrorReason.DID_NOT_PARSE_CODE), delegate.errors());
    }
}
