package com.jsrefactor;

public enum TokenType {
    // Literals and names
    IDENTIFIER,
    NUMBER,
    STRING,
    TEMPLATE_LITERAL,  // `text` with no substitution
    TEMPLATE_HEAD,     // `text${
    TEMPLATE_MIDDLE,   // }text${
    TEMPLATE_TAIL,     // }text`

    // Keywords
    VAR(true),
    LET(true),
    CONST(true),
    FUNCTION(true),
    RETURN(true),
    IF(true),
    ELSE(true),
    SWITCH(true),
    CASE(true),
    DEFAULT(true),
    BREAK(true),
    THROW(true),
    TRUE(true),
    FALSE(true),
    NULL(true),
    THIS(true),
    TYPEOF(true),
    VOID(true),
    IN(true),
    INSTANCEOF(true),

    // Punctuation
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COMMA,
    DOT,
    QUESTION,
    COLON,
    ARROW,

    // Operators
    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    STAR_ASSIGN,
    SLASH_ASSIGN,
    EQ,
    NE,
    STRICT_EQ,
    STRICT_NE,
    LT,
    GT,
    LE,
    GE,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    BANG,
    TILDE,
    AND,
    OR,
    NULLISH,
    BIT_OR,
    BIT_AND,
    BIT_XOR,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    UNSIGNED_RIGHT_SHIFT,

    EOF;

    private final boolean keyword;

    TokenType() {
        this(false);
    }

    TokenType(boolean keyword) {
        this.keyword = keyword;
    }

    public boolean isKeyword() {
        return keyword;
    }
}
