package io.feydor.abc;

import io.feydor.abc.tree.Token;

/**
 * A recoverable problem found while scanning or parsing. Line and column are 0-based.
 */
public record AbcError(String message, Token token, int line, int column, AbcErrorOrigin origin) {

    public AbcError(String message, Token token, AbcErrorOrigin origin) {
        this(message, token, token.line(), token.column(), origin);
    }

    @Override
    public String toString() {
        return String.format("%d:%d [%s] %s", line + 1, column + 1, origin, message);
    }
}
