package io.feydor.abc.exceptions;

import io.feydor.abc.AbcErrorOrigin;
import io.feydor.abc.tree.Token;

/**
 * This exception is thrown when the file or tune structure is broken and the parse cannot be completed
 */
public class AbcParseException extends RuntimeException {
    private final transient Token token;
    private final AbcErrorOrigin origin;

    public AbcParseException(String msg, Token token, AbcErrorOrigin origin) {
        super(msg);
        this.token = token;
        this.origin = origin;
    }

    public Token getToken() {
        return token;
    }

    public AbcErrorOrigin getOrigin() {
        return origin;
    }
}
