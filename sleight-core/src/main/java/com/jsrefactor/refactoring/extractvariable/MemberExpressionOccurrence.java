package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.editor.Choice;
import com.jsrefactor.editor.Editor;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A property access. Unless computed, the user picks between destructuring
 * the object and keeping the access.
 *
 * @param parentObject source text of the accessed object
 */
public record MemberExpressionOccurrence(
    NodePath path,
    Selection selection,
    String code,
    Variable variable,
    String parentObject,
    boolean computed,
    String declarationKeyword,
    DestructureStrategy strategy
) implements Occurrence {
    private static final Logger log = LoggerFactory.getLogger(MemberExpressionOccurrence.class);

    @Override
    public Declaration declaration() {
        if (computed || strategy == DestructureStrategy.PRESERVE) {
            return Occurrence.super.declaration();
        }
        return new Declaration("{ " + variable.name() + " }", parentObject);
    }

    @Override
    public CompletableFuture<Occurrence> onClassified(Editor editor) {
        if (computed) {
            return CompletableFuture.completedFuture(this);
        }
        String name = variable.name();
        List<Choice<DestructureStrategy>> choices = List.of(
            new Choice<>("Destructure => `" + declarationKeyword + " { " + name + " } = " + parentObject + "`", DestructureStrategy.DESTRUCTURE),
            new Choice<>("Preserve => `" + declarationKeyword + " " + name + " = " + parentObject + "." + name + "`", DestructureStrategy.PRESERVE)
        );
        return editor.askUser(choices).thenApply(choice -> {
            if (choice.isEmpty()) {
                log.debug("No strategy picked for {}, keeping {}", code, strategy);
                return this;
            }
            return withStrategy(choice.get().value());
        });
    }

    public MemberExpressionOccurrence withStrategy(DestructureStrategy strategy) {
        return new MemberExpressionOccurrence(path, selection, code, variable, parentObject, computed, declarationKeyword, strategy);
    }
}
