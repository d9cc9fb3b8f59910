package com.jsrefactor.ast;

/**
 * Base interface for all ESTree AST nodes.
 *
 * <p>Nodes produced by the parser carry their source offsets and line/column
 * positions. Nodes built by a refactoring carry zeros and report
 * {@link #hasLocation()} as false.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    Pattern,
    TemplateElement,
    Property,
    SwitchCase,
    VariableDeclarator {

    String type();
    int start();
    int end();
    int startLine();
    int startCol();
    int endLine();
    int endCol();

    default SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine(), startCol()),
            new SourceLocation.Position(endLine(), endCol())
        );
    }

    /**
     * Lines are 1-based, so a node that was never parsed has line 0.
     */
    default boolean hasLocation() {
        return startLine() > 0;
    }
}
