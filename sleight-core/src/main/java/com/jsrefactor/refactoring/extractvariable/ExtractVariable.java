package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.LineIndex;
import com.jsrefactor.ParseException;
import com.jsrefactor.Parser;
import com.jsrefactor.ast.Program;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.Editor;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.Modification;
import com.jsrefactor.editor.Modifications;
import com.jsrefactor.editor.Position;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.refactoring.Refactoring;
import com.jsrefactor.traverse.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Moves the selected expression into a new variable declared just before the
 * enclosing statement, and puts the cursor on the replacing identifier.
 */
public class ExtractVariable implements Refactoring {
    private static final Logger log = LoggerFactory.getLogger(ExtractVariable.class);

    private final RefactoringConfig config;
    private final Occurrences occurrences;

    public ExtractVariable(RefactoringConfig config) {
        this.config = config;
        this.occurrences = new Occurrences(config);
    }

    @Override
    public String key() {
        return "extractVariable";
    }

    @Override
    public String title() {
        return "Extract Variable";
    }

    @Override
    public String actionMessage() {
        return "Extract variable";
    }

    @Override
    public boolean canPerform(String code, Selection selection) {
        try {
            return ExtractableCode.find(Parser.parse(code), selection).isPresent();
        } catch (ParseException e) {
            log.debug("{} not applicable, code does not parse: {}", key(), e.getMessage());
            return false;
        }
    }

    @Override
    public CompletableFuture<Void> perform(Editor editor) {
        String code = editor.code();
        Selection selection = editor.selection();

        Program program;
        try {
            program = Parser.parse(code);
        } catch (ParseException e) {
            log.debug("{} aborted, code does not parse: {}", key(), e.getMessage());
            editor.showError(ErrorReason.DID_NOT_PARSE_CODE);
            return CompletableFuture.completedFuture(null);
        }

        Optional<NodePath> found = ExtractableCode.find(program, selection);
        if (found.isEmpty()) {
            log.debug("{} found nothing to extract at {}", key(), selection);
            editor.showError(ErrorReason.DID_NOT_FIND_EXTRACTABLE_CODE);
            return CompletableFuture.completedFuture(null);
        }

        Occurrence occurrence = occurrences.classify(found.get(), code, selection);
        log.debug("{} classified {} as {}", key(), occurrence.code(), occurrence.getClass().getSimpleName());
        return occurrence.onClassified(editor)
            .thenCompose(chosen -> editor.write(extract(code, chosen), chosen.extractedIdPosition()))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("{} failed at {}", key(), selection, error);
                }
            });
    }

    /**
     * The code with the declaration inserted and the occurrence replaced.
     */
    String extract(String code, Occurrence occurrence) {
        Position scopePosition = occurrence.parentScopePosition();
        String declaration = occurrence.declaration().toCode(config.declarationKeyword());
        Modification insertion = new Modification(
            declaration + "\n" + indentation(code, scopePosition),
            Selection.cursorAtPosition(scopePosition)
        );
        return Modifications.apply(code, List.of(insertion, occurrence.modification()));
    }

    // Whitespace before the scope statement on its line
    private static String indentation(String code, Position position) {
        LineIndex lineIndex = new LineIndex(code);
        int lineStart = lineIndex.lineStart(position.line() + 1);
        String prefix = code.substring(lineStart, Math.min(lineStart + position.character(), code.length()));
        return prefix.isBlank() ? prefix : " ".repeat(position.character());
    }
}
