package io.feydor.abc;

/**
 * Where in the file, or in which construct, a diagnostic was raised.
 */
public enum AbcErrorOrigin {
    SCANNER,
    FILE_HEADER,
    TUNE_HEADER,
    TUNE_BODY,
    BARLINE,
    CHORD,
    DECORATION,
    GRACE_GROUP,
    INLINE_FIELD,
    MULTI_MEASURE_REST,
    NOTE,
    TUPLET
}
