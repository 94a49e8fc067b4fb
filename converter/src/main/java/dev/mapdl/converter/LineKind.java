package dev.mapdl.converter;

/**
 * Lexical category of a single script line.
 */
public enum LineKind {
    BLANK,
    COMMENT_ONLY,
    INLINE_COMMENT,
    COMMAND,
    ASSIGNMENT,
    CONTROL,
    BLOCK_DATA
}
