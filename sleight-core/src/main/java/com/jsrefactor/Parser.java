package com.jsrefactor;

import com.jsrefactor.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Pratt parser producing ESTree nodes for the JavaScript subset the
 * refactorings operate on: declarations, functions, conditionals, switches and
 * the expression grammar without regular expressions, classes or loops.
 *
 * <p>{@code return} and {@code break} are accepted anywhere, since editors
 * commonly hand over fragments of a function body.</p>
 */
public class Parser {
    // Binding powers, lowest to highest
    private static final int BP_ASSIGNMENT = 2;     // Assignment (=, +=, etc.) - right-associative
    private static final int BP_TERNARY = 3;        // Conditional (? :)
    private static final int BP_NULLISH = 4;        // Nullish coalescing (??)
    private static final int BP_OR = 5;             // Logical OR (||)
    private static final int BP_AND = 6;            // Logical AND (&&)
    private static final int BP_BIT_OR = 7;         // Bitwise OR (|)
    private static final int BP_BIT_XOR = 8;        // Bitwise XOR (^)
    private static final int BP_BIT_AND = 9;        // Bitwise AND (&)
    private static final int BP_EQUALITY = 10;      // Equality (==, !=, ===, !==)
    private static final int BP_RELATIONAL = 11;    // Relational (<, <=, >, >=, instanceof, in)
    private static final int BP_SHIFT = 12;         // Shift (<<, >>, >>>)
    private static final int BP_ADDITIVE = 13;      // Additive (+, -)
    private static final int BP_MULTIPLICATIVE = 14;// Multiplicative (*, /, %)
    private static final int BP_UNARY = 16;         // Prefix unary (!, -, +, ~, typeof, void)
    private static final int BP_POSTFIX = 17;       // Call and member access

    private final String source;
    private final List<Token> tokens;
    private final LineIndex lineIndex;
    private int current = 0;

    // ?? must not be mixed with && or || at the same expression level
    private boolean inCoalesceChain = false;
    private boolean inLogicalChain = false;

    public Parser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
        this.lineIndex = new LineIndex(source);
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }

    public Program parse() {
        List<Statement> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.add(parseStatement());
        }
        SourceLocation.Position end = lineIndex.positionAt(source.length());
        return new Program(0, source.length(), 1, 0, end.line(), end.column(), body);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement parseStatement() {
        return switch (peek().type()) {
            case VAR, LET, CONST -> parseVariableDeclaration();
            case FUNCTION -> parseFunctionDeclaration();
            case IF -> parseIfStatement();
            case SWITCH -> parseSwitchStatement();
            case RETURN -> parseReturnStatement();
            case BREAK -> parseBreakStatement();
            case THROW -> parseThrowStatement();
            case LBRACE -> parseBlockStatement();
            case SEMICOLON -> {
                Token token = advance();
                yield new EmptyStatement(getStart(token), getEnd(token), token.line(), token.column(), token.endLine(), token.endColumn());
            }
            default -> parseExpressionStatement();
        };
    }

    private ExpressionStatement parseExpressionStatement() {
        Token startToken = peek();
        Expression expr = parseExpression();
        consumeSemicolon("Expected ';' after expression");
        Token endToken = previous();
        return new ExpressionStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), expr);
    }

    private VariableDeclaration parseVariableDeclaration() {
        Token kindToken = advance();
        List<VariableDeclarator> declarations = new ArrayList<>();
        do {
            Token patternStart = peek();
            Pattern id = parseBindingPattern();
            Expression init = null;
            if (match(TokenType.ASSIGN)) {
                init = parseExpr(BP_ASSIGNMENT);
            } else if (kindToken.type() == TokenType.CONST || id instanceof ObjectPattern) {
                throw new ParseException("Missing initializer in destructuring or const declaration", previous());
            }
            Token declaratorEnd = previous();
            declarations.add(new VariableDeclarator(getStart(patternStart), getEnd(declaratorEnd), patternStart.line(), patternStart.column(), declaratorEnd.endLine(), declaratorEnd.endColumn(), id, init));
        } while (match(TokenType.COMMA));

        consumeSemicolon("Expected ';' after variable declaration");
        Token endToken = previous();
        return new VariableDeclaration(getStart(kindToken), getEnd(endToken), kindToken.line(), kindToken.column(), endToken.endLine(), endToken.endColumn(), declarations, kindToken.lexeme());
    }

    private Pattern parseBindingPattern() {
        if (!check(TokenType.LBRACE)) {
            return parseBindingIdentifier();
        }
        Token startToken = advance();
        List<Property> properties = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            Token keyToken = peek();
            if (!isIdentifierName(keyToken)) {
                throw new ParseException("Expected property name in object pattern", keyToken);
            }
            advance();
            Identifier key = identifier(keyToken);
            Property property;
            if (match(TokenType.COLON)) {
                Identifier value = parseBindingIdentifier();
                Token endToken = previous();
                property = new Property(getStart(keyToken), getEnd(endToken), keyToken.line(), keyToken.column(), endToken.endLine(), endToken.endColumn(), false, false, key, value, "init");
            } else {
                if (keyToken.type() != TokenType.IDENTIFIER) {
                    throw new ParseException("Unexpected keyword in shorthand property", keyToken);
                }
                property = new Property(getStart(keyToken), getEnd(keyToken), keyToken.line(), keyToken.column(), keyToken.endLine(), keyToken.endColumn(), true, false, key, key, "init");
            }
            properties.add(property);
            if (!check(TokenType.RBRACE)) {
                consume(TokenType.COMMA, "Expected ',' between object pattern properties");
            }
        }
        consume(TokenType.RBRACE, "Expected '}' after object pattern");
        Token endToken = previous();
        return new ObjectPattern(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), properties);
    }

    private Identifier parseBindingIdentifier() {
        Token token = peek();
        if (token.type() != TokenType.IDENTIFIER) {
            throw new ParseException("Expected identifier", token);
        }
        advance();
        return identifier(token);
    }

    private FunctionDeclaration parseFunctionDeclaration() {
        Token startToken = advance();
        Identifier id = parseBindingIdentifier();
        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<Identifier> params = parseParameterList();
        BlockStatement body = parseBlockStatement();
        Token endToken = previous();
        return new FunctionDeclaration(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), id, params, body);
    }

    // Assumes '(' was consumed; consumes the closing ')'
    private List<Identifier> parseParameterList() {
        List<Identifier> params = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            params.add(parseBindingIdentifier());
            if (!check(TokenType.RPAREN)) {
                consume(TokenType.COMMA, "Expected ',' between parameters");
            }
        }
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        return params;
    }

    private IfStatement parseIfStatement() {
        Token startToken = advance();
        consume(TokenType.LPAREN, "Expected '(' after 'if'");
        Expression test = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after if condition");
        Statement consequent = parseStatement();

        Statement alternate = null;
        if (match(TokenType.ELSE)) {
            alternate = parseStatement();
        }

        Token endToken = previous();
        return new IfStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), test, consequent, alternate);
    }

    private SwitchStatement parseSwitchStatement() {
        Token startToken = advance();
        consume(TokenType.LPAREN, "Expected '(' after 'switch'");
        Expression discriminant = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after switch discriminant");
        consume(TokenType.LBRACE, "Expected '{' before switch body");

        List<SwitchCase> cases = new ArrayList<>();
        boolean hasDefault = false;

        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            Token caseStart = peek();
            Expression test = null;

            if (match(TokenType.CASE)) {
                test = parseExpression();
                consume(TokenType.COLON, "Expected ':' after case test");
            } else if (match(TokenType.DEFAULT)) {
                if (hasDefault) {
                    throw new ParseException("More than one default clause in switch statement", caseStart);
                }
                hasDefault = true;
                consume(TokenType.COLON, "Expected ':' after 'default'");
            } else {
                throw new ParseException("Expected 'case' or 'default' in switch body", peek());
            }

            List<Statement> consequent = new ArrayList<>();
            while (!check(TokenType.CASE) && !check(TokenType.DEFAULT) && !check(TokenType.RBRACE) && !isAtEnd()) {
                consequent.add(parseStatement());
            }

            Token caseEnd = previous();
            cases.add(new SwitchCase(getStart(caseStart), getEnd(caseEnd), caseStart.line(), caseStart.column(), caseEnd.endLine(), caseEnd.endColumn(), test, consequent));
        }

        consume(TokenType.RBRACE, "Expected '}' after switch body");
        Token endToken = previous();
        return new SwitchStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), discriminant, cases);
    }

    private ReturnStatement parseReturnStatement() {
        Token startToken = advance();
        Expression argument = null;
        // Restricted production: a line break ends the return statement
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RBRACE) && !isAtEnd() && peek().line() == startToken.endLine()) {
            argument = parseExpression();
        }
        consumeSemicolon("Expected ';' after return statement");
        Token endToken = previous();
        return new ReturnStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), argument);
    }

    private BreakStatement parseBreakStatement() {
        Token startToken = advance();
        consumeSemicolon("Expected ';' after break statement");
        Token endToken = previous();
        return new BreakStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn());
    }

    private ThrowStatement parseThrowStatement() {
        Token startToken = advance();
        if (isAtEnd() || peek().line() != startToken.endLine()) {
            throw new ParseException("Illegal newline after throw", startToken);
        }
        Expression argument = parseExpression();
        consumeSemicolon("Expected ';' after throw statement");
        Token endToken = previous();
        return new ThrowStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), argument);
    }

    private BlockStatement parseBlockStatement() {
        Token startToken = peek();
        consume(TokenType.LBRACE, "Expected '{'");
        List<Statement> body = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            body.add(parseStatement());
        }
        consume(TokenType.RBRACE, "Expected '}' after block");
        Token endToken = previous();
        return new BlockStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), body);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpression() {
        return parseExpr(BP_ASSIGNMENT);
    }

    /**
     * Parses an expression whose operators all bind at least as tightly as
     * {@code minBp}: a prefix expression followed by infix and postfix
     * operators.
     */
    private Expression parseExpr(int minBp) {
        // A fresh expression (top level, parenthesized, argument, ternary
        // branch) starts its own ??/&&/|| chain
        boolean savedInCoalesceChain = inCoalesceChain;
        boolean savedInLogicalChain = inLogicalChain;
        boolean resetsChain = minBp <= BP_TERNARY;
        if (resetsChain) {
            inCoalesceChain = false;
            inLogicalChain = false;
        }

        Token startToken = peek();
        Expression left = parsePrefix();

        while (true) {
            Token token = peek();
            TokenType tt = token.type();
            int lbp = switch (tt) {
                case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN -> BP_ASSIGNMENT;
                case QUESTION -> BP_TERNARY;
                case NULLISH -> BP_NULLISH;
                case OR -> BP_OR;
                case AND -> BP_AND;
                case BIT_OR -> BP_BIT_OR;
                case BIT_XOR -> BP_BIT_XOR;
                case BIT_AND -> BP_BIT_AND;
                case EQ, NE, STRICT_EQ, STRICT_NE -> BP_EQUALITY;
                case LT, LE, GT, GE, INSTANCEOF, IN -> BP_RELATIONAL;
                case LEFT_SHIFT, RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> BP_SHIFT;
                case PLUS, MINUS -> BP_ADDITIVE;
                case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
                case DOT, LBRACKET, LPAREN -> BP_POSTFIX;
                default -> -1; // Not an infix operator
            };

            if (lbp < 0 || lbp < minBp) {
                break;
            }

            // An arrow function with a block body cannot be called or indexed on the next line
            if (previous().line() < token.line() && (tt == TokenType.LBRACKET || tt == TokenType.LPAREN)
                && left instanceof ArrowFunctionExpression arrow && !arrow.expression()) {
                break;
            }

            if (tt == TokenType.NULLISH && inLogicalChain || (tt == TokenType.AND || tt == TokenType.OR) && inCoalesceChain) {
                throw new ParseException("Cannot use ?? and && or || together without parentheses", token);
            }
            if (tt == TokenType.NULLISH) {
                inCoalesceChain = true;
            } else if (tt == TokenType.AND || tt == TokenType.OR) {
                inLogicalChain = true;
            }

            advance();
            left = switch (tt) {
                case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN -> infixAssignment(startToken, left, token);
                case QUESTION -> infixTernary(startToken, left);
                case NULLISH, OR, AND -> {
                    Expression right = parseExpr(lbp + 1);
                    Token endToken = previous();
                    yield new LogicalExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), token.lexeme(), left, right);
                }
                case DOT -> infixMember(startToken, left);
                case LBRACKET -> infixComputed(startToken, left);
                case LPAREN -> infixCall(startToken, left);
                default -> {
                    Expression right = parseExpr(lbp + 1);
                    Token endToken = previous();
                    yield new BinaryExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), token.lexeme(), left, right);
                }
            };
        }

        if (resetsChain) {
            inCoalesceChain = savedInCoalesceChain;
            inLogicalChain = savedInLogicalChain;
        }
        return left;
    }

    private Expression parsePrefix() {
        Token token = peek();

        if (token.type() == TokenType.IDENTIFIER && checkAhead(1, TokenType.ARROW)) {
            advance();
            return parseArrowBody(token, List.of(identifier(token)));
        }
        if (token.type() == TokenType.LPAREN && isArrowFunctionParameters()) {
            advance();
            List<Identifier> params = parseParameterList();
            return parseArrowBody(token, params);
        }

        advance();
        return switch (token.type()) {
            case NUMBER, STRING -> new Literal(getStart(token), getEnd(token), token.line(), token.column(), token.endLine(), token.endColumn(), token.literal(), token.lexeme());
            case TRUE, FALSE -> new Literal(getStart(token), getEnd(token), token.line(), token.column(), token.endLine(), token.endColumn(), token.type() == TokenType.TRUE, token.lexeme());
            case NULL -> new Literal(getStart(token), getEnd(token), token.line(), token.column(), token.endLine(), token.endColumn(), null, token.lexeme());
            case THIS -> new ThisExpression(getStart(token), getEnd(token), token.line(), token.column(), token.endLine(), token.endColumn());
            case IDENTIFIER -> identifier(token);
            case LPAREN -> {
                // Parentheses do not produce a node; the inner expression keeps its own range
                Expression expr = parseExpression();
                consume(TokenType.RPAREN, "Expected ')' after expression");
                yield expr;
            }
            case LBRACKET -> prefixArray(token);
            case LBRACE -> prefixObject(token);
            case TEMPLATE_LITERAL, TEMPLATE_HEAD -> prefixTemplate(token);
            case BANG, MINUS, PLUS, TILDE, TYPEOF, VOID -> {
                Expression argument = parseExpr(BP_UNARY);
                Token endToken = previous();
                yield new UnaryExpression(getStart(token), getEnd(endToken), token.line(), token.column(), endToken.endLine(), endToken.endColumn(), token.lexeme(), argument);
            }
            default -> throw new ParseException("Expected expression", token);
        };
    }

    private Expression infixAssignment(Token startToken, Expression left, Token operator) {
        if (!(left instanceof Identifier) && !(left instanceof MemberExpression)) {
            throw new ParseException("Invalid assignment target", startToken);
        }
        Expression right = parseExpr(BP_ASSIGNMENT);
        Token endToken = previous();
        return new AssignmentExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), operator.lexeme(), left, right);
    }

    private Expression infixTernary(Token startToken, Expression test) {
        Expression consequent = parseExpr(BP_ASSIGNMENT);
        consume(TokenType.COLON, "Expected ':' in conditional expression");
        Expression alternate = parseExpr(BP_ASSIGNMENT);
        Token endToken = previous();
        return new ConditionalExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), test, consequent, alternate);
    }

    private Expression infixMember(Token startToken, Expression object) {
        Token propertyToken = peek();
        if (!isIdentifierName(propertyToken)) {
            throw new ParseException("Expected property name after '.'", propertyToken);
        }
        advance();
        Identifier property = identifier(propertyToken);
        return new MemberExpression(getStart(startToken), getEnd(propertyToken), startToken.line(), startToken.column(), propertyToken.endLine(), propertyToken.endColumn(), object, property, false);
    }

    private Expression infixComputed(Token startToken, Expression object) {
        Expression property = parseExpression();
        consume(TokenType.RBRACKET, "Expected ']' after computed member");
        Token endToken = previous();
        return new MemberExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), object, property, true);
    }

    private Expression infixCall(Token startToken, Expression callee) {
        List<Expression> arguments = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            arguments.add(parseExpr(BP_ASSIGNMENT));
            if (!check(TokenType.RPAREN)) {
                consume(TokenType.COMMA, "Expected ',' between arguments");
            }
        }
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        Token endToken = previous();
        return new CallExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), callee, arguments);
    }

    private Expression prefixArray(Token startToken) {
        List<Expression> elements = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            elements.add(parseExpr(BP_ASSIGNMENT));
            if (!check(TokenType.RBRACKET)) {
                consume(TokenType.COMMA, "Expected ',' between array elements");
            }
        }
        consume(TokenType.RBRACKET, "Expected ']' after array elements");
        Token endToken = previous();
        return new ArrayExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), elements);
    }

    private Expression prefixObject(Token startToken) {
        List<Property> properties = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            properties.add(parseProperty());
            if (!check(TokenType.RBRACE)) {
                consume(TokenType.COMMA, "Expected ',' between object properties");
            }
        }
        consume(TokenType.RBRACE, "Expected '}' after object properties");
        Token endToken = previous();
        return new ObjectExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), properties);
    }

    private Property parseProperty() {
        Token keyToken = peek();
        Node key;
        boolean computed = false;

        if (match(TokenType.LBRACKET)) {
            key = parseExpression();
            consume(TokenType.RBRACKET, "Expected ']' after computed property name");
            computed = true;
        } else if (keyToken.type() == TokenType.STRING || keyToken.type() == TokenType.NUMBER) {
            advance();
            key = new Literal(getStart(keyToken), getEnd(keyToken), keyToken.line(), keyToken.column(), keyToken.endLine(), keyToken.endColumn(), keyToken.literal(), keyToken.lexeme());
        } else if (isIdentifierName(keyToken)) {
            advance();
            key = identifier(keyToken);
            if (keyToken.type() == TokenType.IDENTIFIER && (check(TokenType.COMMA) || check(TokenType.RBRACE))) {
                return new Property(getStart(keyToken), getEnd(keyToken), keyToken.line(), keyToken.column(), keyToken.endLine(), keyToken.endColumn(), true, false, key, key, "init");
            }
        } else {
            throw new ParseException("Expected property name", keyToken);
        }

        consume(TokenType.COLON, "Expected ':' after property name");
        Expression value = parseExpr(BP_ASSIGNMENT);
        Token endToken = previous();
        return new Property(getStart(keyToken), getEnd(endToken), keyToken.line(), keyToken.column(), endToken.endLine(), endToken.endColumn(), false, computed, key, value, "init");
    }

    private Expression prefixTemplate(Token startToken) {
        List<Expression> expressions = new ArrayList<>();
        List<TemplateElement> quasis = new ArrayList<>();

        if (startToken.type() == TokenType.TEMPLATE_LITERAL) {
            quasis.add(templateElement(startToken, getStart(startToken) + 1, getEnd(startToken) - 1, true));
            return new TemplateLiteral(getStart(startToken), getEnd(startToken), startToken.line(), startToken.column(), startToken.endLine(), startToken.endColumn(), expressions, quasis);
        }

        // Token endPosition includes the ${ delimiter
        quasis.add(templateElement(startToken, getStart(startToken) + 1, getEnd(startToken) - 2, false));
        while (true) {
            expressions.add(parseExpression());
            Token quasiToken = advance();
            if (quasiToken.type() == TokenType.TEMPLATE_MIDDLE) {
                quasis.add(templateElement(quasiToken, getStart(quasiToken) + 1, getEnd(quasiToken) - 2, false));
            } else if (quasiToken.type() == TokenType.TEMPLATE_TAIL) {
                quasis.add(templateElement(quasiToken, getStart(quasiToken) + 1, getEnd(quasiToken) - 1, true));
                return new TemplateLiteral(getStart(startToken), getEnd(quasiToken), startToken.line(), startToken.column(), quasiToken.endLine(), quasiToken.endColumn(), expressions, quasis);
            } else {
                throw new ParseException("Expected '}' after template substitution", quasiToken);
            }
        }
    }

    private TemplateElement templateElement(Token token, int elemStart, int elemEnd, boolean tail) {
        SourceLocation.Position elemStartPos = lineIndex.positionAt(elemStart);
        SourceLocation.Position elemEndPos = lineIndex.positionAt(elemEnd);
        return new TemplateElement(
            elemStart,
            elemEnd,
            elemStartPos.line(), elemStartPos.column(), elemEndPos.line(), elemEndPos.column(),
            new TemplateElement.TemplateElementValue(token.raw(), (String) token.literal()),
            tail
        );
    }

    private Expression parseArrowBody(Token startToken, List<Identifier> params) {
        consume(TokenType.ARROW, "Expected '=>'");
        if (check(TokenType.LBRACE)) {
            BlockStatement body = parseBlockStatement();
            Token endToken = previous();
            return new ArrowFunctionExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), params, body, false);
        }
        Expression body = parseExpr(BP_ASSIGNMENT);
        Token endToken = previous();
        return new ArrowFunctionExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(), endToken.endLine(), endToken.endColumn(), params, body, true);
    }

    // Looks past the matching ')' for '=>'; current token is '('
    private boolean isArrowFunctionParameters() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.ARROW;
                }
            } else if (type == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    private Identifier identifier(Token token) {
        return new Identifier(getStart(token), getEnd(token), token.line(), token.column(), token.endLine(), token.endColumn(), token.lexeme());
    }

    // Property names after '.' and in object literals may be reserved words
    private boolean isIdentifierName(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type().isKeyword();
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private int getStart(Token token) {
        return token.position();
    }

    private int getEnd(Token token) {
        return token.endPosition();
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }

    private void consume(TokenType type, String message) {
        if (check(type)) {
            advance();
            return;
        }
        throw new ParseException(message, peek());
    }

    // Automatic semicolon insertion: allowed before '}', at end of input, or after a line break
    private void consumeSemicolon(String message) {
        if (check(TokenType.SEMICOLON)) {
            advance();
            return;
        }
        if (check(TokenType.RBRACE) || isAtEnd()) {
            return;
        }
        if (previous().endLine() < peek().line()) {
            return;
        }
        throw new ParseException(message, peek());
    }
}
