package com.jsrefactor.ast;

public sealed interface Statement extends Node permits
    ExpressionStatement,
    BlockStatement,
    IfStatement,
    SwitchStatement,
    ReturnStatement,
    BreakStatement,
    ThrowStatement,
    EmptyStatement,
    VariableDeclaration,
    FunctionDeclaration {
}
