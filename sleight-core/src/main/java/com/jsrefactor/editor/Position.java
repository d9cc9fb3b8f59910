package com.jsrefactor.editor;

import com.jsrefactor.ast.SourceLocation;

/**
 * A point in a document. Unlike AST locations, both line and character are
 * 0-based, as editors count them.
 */
public record Position(int line, int character) {

    public Position {
        if (line < 0 || character < 0) {
            throw new IllegalArgumentException("Position must not be negative: " + line + ":" + character);
        }
    }

    public static Position fromAst(SourceLocation.Position position) {
        return new Position(position.line() - 1, position.column());
    }

    public boolean isBefore(Position other) {
        return line < other.line || (line == other.line && character < other.character);
    }

    public boolean isAfter(Position other) {
        return other.isBefore(this);
    }

    public Position addLines(int lines) {
        return new Position(line + lines, character);
    }

    public Position removeLines(int lines) {
        return new Position(line - lines, character);
    }

    public Position putAtSameCharacter(Position other) {
        return new Position(line, other.character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
