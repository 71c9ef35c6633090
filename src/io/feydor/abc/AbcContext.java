package io.feydor.abc;

import io.feydor.abc.tree.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State owned by one scan/parse/format run: the id counter every token and node draws from,
 * and the diagnostics collected along the way. Two runs never share a context.
 */
public final class AbcContext {
    private int nextId;
    private final List<AbcError> errors = new ArrayList<>();
    private final List<AbcError> unmodifiableErrors = Collections.unmodifiableList(errors);

    public int nextId() {
        return nextId++;
    }

    public void report(String message, Token token, AbcErrorOrigin origin) {
        errors.add(new AbcError(message, token, origin));
    }

    public List<AbcError> errors() {
        return unmodifiableErrors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
