package com.jsrefactor.refactoring;

import com.jsrefactor.ParseException;
import com.jsrefactor.Printer;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.Editor;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.Transformer;
import com.jsrefactor.traverse.Visitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Base for refactorings that rewrite the tree with a single visitor. The
 * applicability check is a dry run of the same transformation.
 */
public abstract class AstRefactoring implements Refactoring {
    private final Logger log = LoggerFactory.getLogger(getClass());

    private final Transformer transformer;

    protected AstRefactoring(RefactoringConfig config) {
        this.transformer = new Transformer(new Printer(config.indentSize()));
    }

    protected abstract Visitor visitor(Selection selection);

    /**
     * Reported when the selection holds nothing this refactoring can change.
     */
    protected abstract ErrorReason notFoundReason();

    /**
     * @throws ParseException if the code does not parse
     */
    public Transformer.Transformed updateCode(String code, Selection selection) {
        return transformer.transform(code, visitor(selection));
    }

    @Override
    public boolean canPerform(String code, Selection selection) {
        try {
            return updateCode(code, selection).hasCodeChanged();
        } catch (ParseException e) {
            log.debug("{} not applicable, code does not parse: {}", key(), e.getMessage());
            return false;
        }
    }

    @Override
    public CompletableFuture<Void> perform(Editor editor) {
        String code = editor.code();
        Selection selection = editor.selection();

        Transformer.Transformed transformed;
        try {
            transformed = updateCode(code, selection);
        } catch (ParseException e) {
            log.debug("{} aborted, code does not parse: {}", key(), e.getMessage());
            editor.showError(ErrorReason.DID_NOT_PARSE_CODE);
            return CompletableFuture.completedFuture(null);
        }

        if (!transformed.hasCodeChanged()) {
            log.debug("{} found nothing to change at {}", key(), selection);
            editor.showError(notFoundReason());
            return CompletableFuture.completedFuture(null);
        }

        log.debug("{} rewrote the code at {}", key(), selection);
        return editor.write(transformed.code());
    }
}
