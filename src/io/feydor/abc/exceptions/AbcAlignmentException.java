package io.feydor.abc.exceptions;

/**
 * This exception is thrown when voice alignment is asked to pad a node that is no longer in its voice
 */
public class AbcAlignmentException extends RuntimeException {
    public AbcAlignmentException(String msg) {
        super(msg);
    }
}
