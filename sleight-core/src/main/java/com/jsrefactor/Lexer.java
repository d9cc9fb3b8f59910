package com.jsrefactor;

import com.jsrefactor.ast.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for the JavaScript subset understood by {@link Parser}.
 * Whitespace is dropped and comments are collected apart from the tokens.
 * Template literals are split into head, middle and tail tokens around
 * their substitutions.
 */
public class Lexer {
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("var", TokenType.VAR),
        Map.entry("let", TokenType.LET),
        Map.entry("const", TokenType.CONST),
        Map.entry("function", TokenType.FUNCTION),
        Map.entry("return", TokenType.RETURN),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("switch", TokenType.SWITCH),
        Map.entry("case", TokenType.CASE),
        Map.entry("default", TokenType.DEFAULT),
        Map.entry("break", TokenType.BREAK),
        Map.entry("throw", TokenType.THROW),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("null", TokenType.NULL),
        Map.entry("this", TokenType.THIS),
        Map.entry("typeof", TokenType.TYPEOF),
        Map.entry("void", TokenType.VOID),
        Map.entry("in", TokenType.IN),
        Map.entry("instanceof", TokenType.INSTANCEOF)
    );

    // Longest operators first so that prefixes never shadow them.
    private static final String[][] PUNCTUATORS = {
        {"===", "STRICT_EQ"}, {"!==", "STRICT_NE"}, {">>>", "UNSIGNED_RIGHT_SHIFT"},
        {"<<", "LEFT_SHIFT"}, {">>", "RIGHT_SHIFT"},
        {"=>", "ARROW"}, {"==", "EQ"}, {"!=", "NE"}, {"<=", "LE"}, {">=", "GE"},
        {"&&", "AND"}, {"||", "OR"}, {"??", "NULLISH"},
        {"+=", "PLUS_ASSIGN"}, {"-=", "MINUS_ASSIGN"}, {"*=", "STAR_ASSIGN"}, {"/=", "SLASH_ASSIGN"},
        {"{", "LBRACE"}, {"}", "RBRACE"}, {"(", "LPAREN"}, {")", "RPAREN"},
        {"[", "LBRACKET"}, {"]", "RBRACKET"}, {";", "SEMICOLON"}, {",", "COMMA"},
        {".", "DOT"}, {"?", "QUESTION"}, {":", "COLON"}, {"=", "ASSIGN"},
        {"<", "LT"}, {">", "GT"}, {"+", "PLUS"}, {"-", "MINUS"}, {"*", "STAR"},
        {"/", "SLASH"}, {"%", "PERCENT"}, {"!", "BANG"}, {"~", "TILDE"},
        {"|", "BIT_OR"}, {"&", "BIT_AND"}, {"^", "BIT_XOR"}
    };

    private final String source;
    private final LineIndex lineIndex;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Comment> comments = new ArrayList<>();
    // Brace depth at which each open template substitution started
    private final Deque<Integer> templateDepths = new ArrayDeque<>();
    private int position = 0;
    private int braceDepth = 0;

    public Lexer(String source) {
        this.source = source;
        this.lineIndex = new LineIndex(source);
    }

    public List<Token> tokenize() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                tokens.add(token(TokenType.EOF, "", null, null, position, position));
                return tokens;
            }
            scanToken();
        }
    }

    /**
     * Comments found by {@link #tokenize()}, in source order.
     */
    public List<Comment> comments() {
        return comments;
    }

    private void scanToken() {
        int start = position;
        char c = source.charAt(position);

        if (isIdentifierStart(c)) {
            scanIdentifier(start);
        } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            scanNumber(start);
        } else if (c == '"' || c == '\'') {
            scanString(start, c);
        } else if (c == '`') {
            position++;
            scanTemplate(start, true);
        } else if (c == '}' && !templateDepths.isEmpty() && templateDepths.peek() == braceDepth) {
            templateDepths.pop();
            position++;
            scanTemplate(start, false);
        } else {
            scanPunctuator(start);
        }
    }

    private void scanIdentifier(int start) {
        while (!isAtEnd() && isIdentifierPart(source.charAt(position))) {
            position++;
        }
        String word = source.substring(start, position);
        TokenType type = KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER);
        tokens.add(token(type, word, null, null, start, position));
    }

    private void scanNumber(int start) {
        double value;
        if (source.charAt(position) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            position += 2;
            int digitsStart = position;
            while (!isAtEnd() && Character.digit(source.charAt(position), 16) >= 0) {
                position++;
            }
            if (digitsStart == position) {
                throw error("Expected hexadecimal digits", start);
            }
            value = (double) Long.parseLong(source.substring(digitsStart, position), 16);
        } else {
            skipDigits();
            if (!isAtEnd() && source.charAt(position) == '.') {
                position++;
                skipDigits();
            }
            if (!isAtEnd() && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
                position++;
                if (!isAtEnd() && (source.charAt(position) == '+' || source.charAt(position) == '-')) {
                    position++;
                }
                int exponentStart = position;
                skipDigits();
                if (exponentStart == position) {
                    throw error("Expected exponent digits", start);
                }
            }
            value = Double.parseDouble(source.substring(start, position));
        }
        if (!isAtEnd() && isIdentifierStart(source.charAt(position))) {
            throw error("Identifier directly after number", position);
        }
        tokens.add(token(TokenType.NUMBER, source.substring(start, position), value, null, start, position));
    }

    private void skipDigits() {
        while (!isAtEnd() && isDigit(source.charAt(position))) {
            position++;
        }
    }

    private void scanString(int start, char quote) {
        position++;
        StringBuilder cooked = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("Unterminated string literal", start);
            }
            char c = source.charAt(position);
            if (c == quote) {
                position++;
                break;
            }
            if (c == '\n' || c == '\r') {
                throw error("Unterminated string literal", start);
            }
            if (c == '\\') {
                readEscape(cooked);
            } else {
                cooked.append(c);
                position++;
            }
        }
        tokens.add(token(TokenType.STRING, source.substring(start, position), cooked.toString(), null, start, position));
    }

    /**
     * Scans template characters up to the closing backtick or the next
     * substitution. {@code start} is the offset of the opening delimiter.
     */
    private void scanTemplate(int start, boolean head) {
        int rawStart = position;
        StringBuilder cooked = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("Unterminated template literal", start);
            }
            char c = source.charAt(position);
            if (c == '`') {
                String raw = source.substring(rawStart, position);
                position++;
                TokenType type = head ? TokenType.TEMPLATE_LITERAL : TokenType.TEMPLATE_TAIL;
                tokens.add(token(type, source.substring(start, position), cooked.toString(), raw, start, position));
                return;
            }
            if (c == '$' && peek(1) == '{') {
                String raw = source.substring(rawStart, position);
                position += 2;
                TokenType type = head ? TokenType.TEMPLATE_HEAD : TokenType.TEMPLATE_MIDDLE;
                tokens.add(token(type, source.substring(start, position), cooked.toString(), raw, start, position));
                templateDepths.push(braceDepth);
                return;
            }
            if (c == '\\') {
                readEscape(cooked);
            } else if (c == '\r') {
                // Template values normalize CRLF and CR to LF
                cooked.append('\n');
                position++;
                if (!isAtEnd() && source.charAt(position) == '\n') {
                    position++;
                }
            } else {
                cooked.append(c);
                position++;
            }
        }
    }

    private void readEscape(StringBuilder cooked) {
        int escapeStart = position;
        position++; // backslash
        if (isAtEnd()) {
            throw error("Unterminated escape sequence", escapeStart);
        }
        char c = source.charAt(position++);
        switch (c) {
            case 'n' -> cooked.append('\n');
            case 't' -> cooked.append('\t');
            case 'r' -> cooked.append('\r');
            case 'b' -> cooked.append('\b');
            case 'f' -> cooked.append('\f');
            case 'v' -> cooked.append('\u000B');
            case '0' -> cooked.append('\0');
            case 'x' -> cooked.append((char) readHex(2, escapeStart));
            case 'u' -> {
                if (!isAtEnd() && source.charAt(position) == '{') {
                    position++;
                    int end = source.indexOf('}', position);
                    if (end < 0) {
                        throw error("Invalid Unicode escape sequence", escapeStart);
                    }
                    int codePoint = parseHex(source.substring(position, end), escapeStart);
                    position = end + 1;
                    cooked.appendCodePoint(codePoint);
                } else {
                    cooked.append((char) readHex(4, escapeStart));
                }
            }
            case '\r' -> {
                // Line continuation
                if (!isAtEnd() && source.charAt(position) == '\n') {
                    position++;
                }
            }
            case '\n', '\u2028', '\u2029' -> {
                // Line continuation
            }
            default -> cooked.append(c);
        }
    }

    private int readHex(int length, int escapeStart) {
        if (position + length > source.length()) {
            throw error("Invalid hexadecimal escape sequence", escapeStart);
        }
        int value = parseHex(source.substring(position, position + length), escapeStart);
        position += length;
        return value;
    }

    private int parseHex(String digits, int escapeStart) {
        try {
            return Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw error("Invalid hexadecimal escape sequence", escapeStart);
        }
    }

    private void scanPunctuator(int start) {
        for (String[] punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator[0], start)) {
                TokenType type = TokenType.valueOf(punctuator[1]);
                position += punctuator[0].length();
                if (type == TokenType.LBRACE) {
                    braceDepth++;
                } else if (type == TokenType.RBRACE) {
                    braceDepth--;
                }
                tokens.add(token(type, punctuator[0], null, null, start, position));
                return;
            }
        }
        throw error("Unexpected character '" + source.charAt(start) + "'", start);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = source.charAt(position);
            if (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF') {
                position++;
            } else if (c == '/' && peek(1) == '/') {
                int start = position;
                while (!isAtEnd() && !isLineTerminator(source.charAt(position))) {
                    position++;
                }
                comments.add(new Comment(source.substring(start, position), start, position));
            } else if (c == '/' && peek(1) == '*') {
                int end = source.indexOf("*/", position + 2);
                if (end < 0) {
                    throw error("Unterminated comment", position);
                }
                comments.add(new Comment(source.substring(position, end + 2), position, end + 2));
                position = end + 2;
            } else {
                return;
            }
        }
    }

    private Token token(TokenType type, String lexeme, Object literal, String raw, int start, int end) {
        SourceLocation.Position from = lineIndex.positionAt(start);
        SourceLocation.Position to = lineIndex.positionAt(end);
        return new Token(type, lexeme, literal, raw, from.line(), from.column(), to.line(), to.column(), start, end);
    }

    private ParseException error(String message, int offset) {
        SourceLocation.Position at = lineIndex.positionAt(offset);
        return new ParseException(message, at.line(), at.column());
    }

    private char peek(int ahead) {
        int index = position + ahead;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
