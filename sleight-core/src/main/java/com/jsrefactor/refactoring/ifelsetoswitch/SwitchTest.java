package com.jsrefactor.refactoring.ifelsetoswitch;

import com.jsrefactor.ast.Expression;

/**
 * A branch test decomposed into the value being dispatched on and the case
 * value it is compared against.
 */
public record SwitchTest(Expression discriminant, Expression test) {
}
