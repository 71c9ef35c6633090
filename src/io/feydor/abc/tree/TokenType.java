package io.feydor.abc.tree;

/**
 * The lexical categories produced by the {@link io.feydor.abc.parse.Scanner}.
 */
public enum TokenType {
    AMPERSAND,
    ANTISLASH_EOL,
    APOSTROPHE,
    BACKTICK,
    BARLINE,
    COLON,
    COMMA,
    COMMENT,
    DOLLAR,
    DOT,
    EOF,
    EOL,
    ESCAPED_CHAR,
    FLAT,
    FLAT_DBL,
    FLAT_HALF,
    GREATER,
    INFO_STRING,
    INVALID,
    LEFTBRKT,
    LEFT_BRACE,
    LEFTPAREN,
    LEFTPAREN_NUMBER,
    LESS,
    LETTER,
    LETTER_COLON,
    MINUS,
    NATURAL,
    NOTE_LETTER,
    NUMBER,
    PLUS,
    PLUS_COLON,
    RESERVED_CHAR,
    RIGHT_BRACE,
    RIGHT_BRKT,
    RIGHT_PAREN,
    SHARP,
    SHARP_DBL,
    SHARP_HALF,
    SLASH,
    STRING,
    STYLESHEET_DIRECTIVE,
    SYMBOL,
    TILDE,
    WHITESPACE;

    public boolean isAccidental() {
        return switch (this) {
            case SHARP, SHARP_DBL, SHARP_HALF, FLAT, FLAT_DBL, FLAT_HALF, NATURAL -> true;
            default -> false;
        };
    }

    public boolean isOctave() {
        return this == APOSTROPHE || this == COMMA;
    }

    public boolean isBroken() {
        return this == GREATER || this == LESS;
    }

    /** Tokens the tune body resynchronizes on after a malformed construct. */
    public boolean isRecoveryPoint() {
        return this == EOL || this == BARLINE || this == EOF;
    }

    public boolean isCommentLike() {
        return this == COMMENT || this == STYLESHEET_DIRECTIVE;
    }
}
