package com.jsrefactor.refactoring.negateexpression;

import com.jsrefactor.ast.Expression;
import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.UnaryExpression;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.refactoring.AstRefactoring;
import com.jsrefactor.refactoring.SelectionVisitors;
import com.jsrefactor.traverse.NodePath;
import com.jsrefactor.traverse.Visitor;

/**
 * Negates a comparison or logical expression while keeping its meaning:
 * {@code a === b} becomes {@code !(a !== b)} and {@code !(a && b)} becomes
 * {@code !a || !b}.
 */
public class NegateExpression extends AstRefactoring {

    public NegateExpression(RefactoringConfig config) {
        super(config);
    }

    @Override
    public String key() {
        return "negateExpression";
    }

    @Override
    public String title() {
        return "Negate Expression";
    }

    @Override
    public String actionMessage() {
        return "Negate the expression";
    }

    @Override
    protected ErrorReason notFoundReason() {
        return ErrorReason.DID_NOT_FIND_NEGATABLE_EXPRESSION;
    }

    @Override
    protected Visitor visitor(Selection selection) {
        return SelectionVisitors.innermost(selection, NegateExpression::isCandidate, NegateExpression::convert);
    }

    // A negatable expression already under '!' is handled through that '!'
    private static boolean isCandidate(NodePath path) {
        if (isNot(path.node())) {
            return Negation.isNegatable(((UnaryExpression) path.node()).argument());
        }
        return path.node() instanceof Expression expression
            && Negation.isNegatable(expression)
            && !isNot(path.parentNode());
    }

    private static Node convert(NodePath path) {
        if (isNot(path.node())) {
            return Negation.negate(((UnaryExpression) path.node()).argument());
        }
        return new UnaryExpression("!", Negation.negate((Expression) path.node()));
    }

    private static boolean isNot(Node node) {
        return node instanceof UnaryExpression unary && unary.operator().equals("!");
    }
}
