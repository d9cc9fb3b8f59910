package com.jsrefactor.ast;

public sealed interface Expression extends Node permits
    Identifier,
    ThisExpression,
    Literal,
    TemplateLiteral,
    ObjectExpression,
    ArrayExpression,
    MemberExpression,
    CallExpression,
    BinaryExpression,
    LogicalExpression,
    UnaryExpression,
    ConditionalExpression,
    AssignmentExpression,
    ArrowFunctionExpression {
}
