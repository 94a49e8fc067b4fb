package dev.mapdl.converter;

/**
 * How a multi-line data block finds its end.
 */
public enum BlockKind {
    /** Not a block command. */
    NONE,
    /** Ends on an explicit terminator line ({@code -1} or {@code END PREAD}). */
    FIXED,
    /** Line count computed from the item count on the opening line. */
    COUNTED
}
