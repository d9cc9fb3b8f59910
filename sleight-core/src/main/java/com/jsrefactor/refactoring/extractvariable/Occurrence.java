package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.ast.BlockStatement;
import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Program;
import com.jsrefactor.ast.SwitchCase;
import com.jsrefactor.editor.Editor;
import com.jsrefactor.editor.Modification;
import com.jsrefactor.editor.Position;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;

import java.util.concurrent.CompletableFuture;

/**
 * A selected expression classified for extraction: what replaces it, what
 * gets declared, and where the cursor and the declaration go.
 *
 * <p>The defaults describe the plain case: the expression's text is
 * declared under the variable name and replaced by that name.</p>
 */
public sealed interface Occurrence permits
    GenericOccurrence,
    StringLiteralOccurrence,
    ShorthandOccurrence,
    MemberExpressionOccurrence,
    PartialTemplateLiteralOccurrence {

    NodePath path();

    /**
     * Range of the extracted expression.
     */
    Selection selection();

    /**
     * Source text of the extracted expression.
     */
    String code();

    Variable variable();

    default Modification modification() {
        return new Modification(variable().id(), selection());
    }

    default Declaration declaration() {
        return new Declaration(variable().name(), code());
    }

    /**
     * Where the cursor lands after extraction: the end of the inserted
     * identifier, one line down to account for the new declaration.
     */
    default Position extractedIdPosition() {
        Selection selection = selection();
        return new Position(
            selection.start().line() + selection.height() + 1,
            selection.start().character() + variable().length()
        );
    }

    /**
     * Start of the statement the declaration goes before: the nearest
     * ancestor sitting directly in a program, block or switch case.
     */
    default Position parentScopePosition() {
        NodePath scope = path();
        while (scope.parent() != null && !isScope(scope.parentNode())) {
            scope = scope.parent();
        }
        Node parent = scope.parent() != null ? scope.node() : path().node();
        if (!parent.hasLocation()) {
            return selection().start();
        }
        return Position.fromAst(parent.loc().start());
    }

    /**
     * Completes once the user has supplied whatever the occurrence needs,
     * with the occurrence to extract.
     */
    default CompletableFuture<Occurrence> onClassified(Editor editor) {
        return CompletableFuture.completedFuture(this);
    }

    private static boolean isScope(Node node) {
        return node instanceof Program || node instanceof BlockStatement || node instanceof SwitchCase;
    }
}
