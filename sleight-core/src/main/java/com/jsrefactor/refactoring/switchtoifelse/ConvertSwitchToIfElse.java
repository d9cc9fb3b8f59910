package com.jsrefactor.refactoring.switchtoifelse;

import com.jsrefactor.ast.ArrowFunctionExpression;
import com.jsrefactor.ast.BinaryExpression;
import com.jsrefactor.ast.BlockStatement;
import com.jsrefactor.ast.BreakStatement;
import com.jsrefactor.ast.Expression;
import com.jsrefactor.ast.FunctionDeclaration;
import com.jsrefactor.ast.Identifier;
import com.jsrefactor.ast.IfStatement;
import com.jsrefactor.ast.Literal;
import com.jsrefactor.ast.MemberExpression;
import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Nodes;
import com.jsrefactor.ast.ReturnStatement;
import com.jsrefactor.ast.Statement;
import com.jsrefactor.ast.SwitchCase;
import com.jsrefactor.ast.SwitchStatement;
import com.jsrefactor.ast.ThisExpression;
import com.jsrefactor.ast.ThrowStatement;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.refactoring.AstRefactoring;
import com.jsrefactor.refactoring.SelectionVisitors;
import com.jsrefactor.traverse.Visitor;

import java.util.List;

/**
 * Turns a switch back into an if/else-if chain comparing the discriminant
 * with {@code ===}. Only switches without fall-through and with a
 * discriminant that is safe to evaluate once per branch are converted.
 */
public class ConvertSwitchToIfElse extends AstRefactoring {

    public ConvertSwitchToIfElse(RefactoringConfig config) {
        super(config);
    }

    @Override
    public String key() {
        return "convertSwitchToIfElse";
    }

    @Override
    public String title() {
        return "Convert Switch To If Else";
    }

    @Override
    public String actionMessage() {
        return "Convert switch to if else";
    }

    @Override
    protected ErrorReason notFoundReason() {
        return ErrorReason.DID_NOT_FIND_SWITCH_TO_CONVERT;
    }

    @Override
    protected Visitor visitor(Selection selection) {
        return SelectionVisitors.innermost(
            selection,
            path -> path.node() instanceof SwitchStatement,
            path -> convert((SwitchStatement) path.node())
        );
    }

    static Statement convert(SwitchStatement node) {
        if (!canConvert(node)) {
            return node;
        }

        Statement alternate = null;
        List<SwitchCase> cases = node.cases();
        for (int i = cases.size() - 1; i >= 0; i--) {
            SwitchCase switchCase = cases.get(i);
            BlockStatement body = new BlockStatement(withoutFinalBreak(switchCase.consequent()));
            if (switchCase.test() == null) {
                alternate = body;
            } else {
                Expression test = new BinaryExpression("===", node.discriminant(), switchCase.test());
                alternate = new IfStatement(test, body, alternate);
            }
        }
        return alternate;
    }

    private static boolean canConvert(SwitchStatement node) {
        List<SwitchCase> cases = node.cases();
        if (cases.isEmpty() || !isSideEffectFree(node.discriminant())) {
            return false;
        }
        if (cases.get(0).test() == null && cases.size() == 1) {
            return false;
        }

        for (int i = 0; i < cases.size(); i++) {
            SwitchCase switchCase = cases.get(i);
            boolean last = i == cases.size() - 1;
            List<Statement> consequent = switchCase.consequent();

            if (consequent.isEmpty()) {
                return false;
            }
            if (switchCase.test() == null && !last) {
                return false;
            }
            if (!last && !endsWithExit(consequent)) {
                return false;
            }
            for (Statement statement : withoutFinalBreak(consequent)) {
                if (containsBreak(statement)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean endsWithExit(List<Statement> statements) {
        Statement lastStatement = statements.get(statements.size() - 1);
        return lastStatement instanceof BreakStatement
            || lastStatement instanceof ReturnStatement
            || lastStatement instanceof ThrowStatement;
    }

    private static List<Statement> withoutFinalBreak(List<Statement> statements) {
        if (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof BreakStatement) {
            return statements.subList(0, statements.size() - 1);
        }
        return statements;
    }

    // Breaks inside nested switches and functions belong to those
    private static boolean containsBreak(Node node) {
        if (node instanceof BreakStatement) {
            return true;
        }
        if (node instanceof SwitchStatement || node instanceof FunctionDeclaration || node instanceof ArrowFunctionExpression) {
            return false;
        }
        for (Nodes.Child child : Nodes.children(node)) {
            if (containsBreak(child.node())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSideEffectFree(Expression expression) {
        if (expression instanceof Identifier || expression instanceof ThisExpression || expression instanceof Literal) {
            return true;
        }
        if (expression instanceof MemberExpression member) {
            boolean safeProperty = !member.computed() || member.property() instanceof Literal;
            return safeProperty && isSideEffectFree(member.object());
        }
        return false;
    }
}
