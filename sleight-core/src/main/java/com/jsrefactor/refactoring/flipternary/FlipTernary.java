package com.jsrefactor.refactoring.flipternary;

import com.jsrefactor.ast.ConditionalExpression;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.refactoring.AstRefactoring;
import com.jsrefactor.refactoring.SelectionVisitors;
import com.jsrefactor.refactoring.negateexpression.Negation;
import com.jsrefactor.traverse.Visitor;

/**
 * {@code a ? b : c} becomes {@code !a ? c : b}, with the test negated as
 * readably as possible.
 */
public class FlipTernary extends AstRefactoring {

    public FlipTernary(RefactoringConfig config) {
        super(config);
    }

    @Override
    public String key() {
        return "flipTernary";
    }

    @Override
    public String title() {
        return "Flip Ternary";
    }

    @Override
    public String actionMessage() {
        return "Flip ternary";
    }

    @Override
    protected ErrorReason notFoundReason() {
        return ErrorReason.DID_NOT_FIND_TERNARY_TO_FLIP;
    }

    @Override
    protected Visitor visitor(Selection selection) {
        return SelectionVisitors.innermost(
            selection,
            path -> path.node() instanceof ConditionalExpression,
            path -> {
                ConditionalExpression ternary = (ConditionalExpression) path.node();
                return new ConditionalExpression(Negation.negate(ternary.test()), ternary.alternate(), ternary.consequent());
            }
        );
    }
}
