package com.jsrefactor.refactoring.ifelsetoswitch;

import com.jsrefactor.ast.IfStatement;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.ErrorReason;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.refactoring.AstRefactoring;
import com.jsrefactor.refactoring.SelectionVisitors;
import com.jsrefactor.traverse.Visitor;

import java.util.Set;

/**
 * Turns an if/else-if chain that compares one value against literals into a
 * switch. The innermost convertible chain around the selection wins.
 */
public class ConvertIfElseToSwitch extends AstRefactoring {
    private final DiscriminantExtractor extractor;

    public ConvertIfElseToSwitch(RefactoringConfig config) {
        this(config, new EqualityDiscriminantExtractor(Set.copyOf(config.equalityOperators())));
    }

    public ConvertIfElseToSwitch(RefactoringConfig config, DiscriminantExtractor extractor) {
        super(config);
        this.extractor = extractor;
    }

    @Override
    public String key() {
        return "convertIfElseToSwitch";
    }

    @Override
    public String title() {
        return "Convert If/Else to Switch";
    }

    @Override
    public String actionMessage() {
        return "Convert if/else to switch";
    }

    public boolean hasIfElseToConvert(String code, Selection selection) {
        return canPerform(code, selection);
    }

    @Override
    protected ErrorReason notFoundReason() {
        return ErrorReason.DID_NOT_FIND_IF_ELSE_TO_CONVERT;
    }

    @Override
    protected Visitor visitor(Selection selection) {
        return SelectionVisitors.innermost(
            selection,
            path -> path.node() instanceof IfStatement,
            path -> new IfElseToSwitch((IfStatement) path.node(), extractor).convert()
        );
    }
}
