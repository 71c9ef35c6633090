package io.feydor.abc.tree;

import io.feydor.abc.AbcContext;

/**
 * A lexeme together with its 0-based source position and its run-unique id.
 * Tokens never change once scanned; copies get a new id.
 */
public record Token(TokenType type, String lexeme, int line, int column, int id) implements AbcNode {

    public Token copy(AbcContext context) {
        return new Token(type, lexeme, line, column, context.nextId());
    }

    /** A token that does not come from the source but keeps the position of {@code origin}. */
    public static Token synthesized(TokenType type, String lexeme, Token origin, AbcContext context) {
        return new Token(type, lexeme, origin.line, origin.column, context.nextId());
    }

    public static Token whitespace(int width, AbcContext context) {
        return new Token(TokenType.WHITESPACE, " ".repeat(width), -1, -1, context.nextId());
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitToken(this);
    }

    @Override
    public String toString() {
        return String.format("%s '%s' %d:%d", type, lexeme.replace("\n", "\\n"), line, column);
    }
}
