package io.feydor.abc.parse;

import io.feydor.abc.AbcErrorOrigin;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

/**
 * What a construct parser hands back: the parsed value, or where and why it stopped.
 * A failure leaves the caller to resynchronize; nothing is thrown.
 */
public sealed interface ParseResult<T> {

    record Ok<T>(T value) implements ParseResult<T> {}

    record Failure<T>(String message, Token at, TokenType expected, AbcErrorOrigin origin) implements ParseResult<T> {}

    static <T> ParseResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> ParseResult<T> fail(String message, Token at, AbcErrorOrigin origin) {
        return new Failure<>(message, at, null, origin);
    }

    static <T> ParseResult<T> expected(TokenType expected, String message, Token at, AbcErrorOrigin origin) {
        return new Failure<>(message, at, expected, origin);
    }

    /** Re-types a failure so it can be passed up from a nested construct. */
    default <U> ParseResult<U> propagate() {
        if (this instanceof Failure<T> failure) {
            return new Failure<>(failure.message(), failure.at(), failure.expected(), failure.origin());
        }
        throw new IllegalStateException("Only a failure can be propagated");
    }
}
