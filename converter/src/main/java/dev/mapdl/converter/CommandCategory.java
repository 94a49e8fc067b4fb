package dev.mapdl.converter;

/**
 * Translation category of a command token. Each token maps to exactly one
 * category and the category selects the state transition.
 */
public enum CommandCategory {
    NORMAL(false),
    BLOCK_FIXED(true),
    BLOCK_COUNTED(true),
    BLOCK_END(false),
    BATCHED_WRITE(true),
    CONTROL_LOOP(true),
    CONTROL_LOOP_END(false),
    CONTROL_CONDITIONAL(true),
    CONTROL_BRANCH(false),
    CONTROL_CONDITIONAL_END(false),
    OUTPUT_REDIRECT(true),
    OUTPUT_CLOSE(false),
    FUNCTION_OPEN(false),
    FUNCTION_CLOSE(false),
    FUNCTION_CALL(false),
    REPEAT(true),
    VERIFY(false),
    TITLE(false),
    QUERY(false),
    MUTED(false),
    RAW(false),
    FORBIDDEN(false);

    private final boolean batching;

    CommandCategory(boolean batching) {
        this.batching = batching;
    }

    /** Whether commands of this category must run inside a non-interactive window. */
    public boolean requiresBatching() {
        return batching;
    }
}
