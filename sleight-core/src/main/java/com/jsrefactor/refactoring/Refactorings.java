package com.jsrefactor.refactoring;

import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.refactoring.extractvariable.ExtractVariable;
import com.jsrefactor.refactoring.flipternary.FlipTernary;
import com.jsrefactor.refactoring.ifelsetoswitch.ConvertIfElseToSwitch;
import com.jsrefactor.refactoring.negateexpression.NegateExpression;
import com.jsrefactor.refactoring.switchtoifelse.ConvertSwitchToIfElse;

import java.util.List;
import java.util.Optional;

/**
 * All refactorings, built for one configuration.
 */
public class Refactorings {
    private final List<Refactoring> all;

    public Refactorings(RefactoringConfig config) {
        this.all = List.of(
            new ConvertIfElseToSwitch(config),
            new ConvertSwitchToIfElse(config),
            new ExtractVariable(config),
            new FlipTernary(config),
            new NegateExpression(config)
        );
    }

    public List<Refactoring> all() {
        return all;
    }

    public Optional<Refactoring> find(String key) {
        return all.stream().filter(refactoring -> refactoring.key().equals(key)).findFirst();
    }

    /**
     * Refactorings that would change the code at this selection, in
     * registration order.
     */
    public List<Refactoring> applicableAt(String code, Selection selection) {
        return all.stream().filter(refactoring -> refactoring.canPerform(code, selection)).toList();
    }
}
