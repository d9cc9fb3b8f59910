package com.jsrefactor.refactoring.ifelsetoswitch;

import com.jsrefactor.ast.BreakStatement;
import com.jsrefactor.ast.Expression;
import com.jsrefactor.ast.IfStatement;
import com.jsrefactor.ast.Nodes;
import com.jsrefactor.ast.Statement;
import com.jsrefactor.ast.StructuralEquality;
import com.jsrefactor.ast.SwitchCase;
import com.jsrefactor.ast.SwitchStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts one if/else-if chain into a switch. Single use: the discriminant is
 * fixed by the first branch and every later branch must test the same one.
 * A single branch that does not decompose leaves the whole chain as is.
 */
class IfElseToSwitch {
    private final IfStatement node;
    private final DiscriminantExtractor extractor;
    private final List<SwitchCase> cases = new ArrayList<>();
    private Expression discriminant;
    private boolean canConvertAllBranches = true;

    IfElseToSwitch(IfStatement node, DiscriminantExtractor extractor) {
        this.node = node;
        this.extractor = extractor;
    }

    /**
     * The switch, or the original node when the chain cannot be converted.
     */
    Statement convert() {
        convertNode(node);

        return discriminant != null && canConvertAllBranches
            ? new SwitchStatement(discriminant, cases)
            : node;
    }

    private void convertNode(IfStatement statement) {
        convertConsequent(statement);
        convertAlternate(statement);
    }

    private void convertConsequent(IfStatement statement) {
        Optional<SwitchTest> switchTest = extractor.extract(statement.test());
        if (switchTest.isEmpty()) {
            canConvertAllBranches = false;
            return;
        }

        if (discriminant == null) {
            discriminant = switchTest.get().discriminant();
        }
        if (!StructuralEquality.areEqual(discriminant, switchTest.get().discriminant())) {
            canConvertAllBranches = false;
        }

        addCase(switchTest.get().test(), statement.consequent());
    }

    private void convertAlternate(IfStatement statement) {
        Statement alternate = statement.alternate();
        if (alternate == null) {
            return;
        }
        if (alternate instanceof IfStatement elseIf) {
            convertNode(elseIf);
            return;
        }
        addCase(null, alternate);
    }

    private void addCase(Expression test, Statement statement) {
        List<Statement> consequent = new ArrayList<>(Nodes.getStatements(statement));
        if (!Nodes.hasFinalReturn(consequent)) {
            consequent.add(new BreakStatement());
        }
        cases.add(new SwitchCase(test, consequent));
    }
}
