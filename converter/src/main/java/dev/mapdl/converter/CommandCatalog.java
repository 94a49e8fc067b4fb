package dev.mapdl.converter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static command tables. Whole-command entries are consulted first so that
 * {@code *ENDDO} or {@code /OUTRES} never fall through to a shorter prefix;
 * everything else is matched on its first four characters.
 */
public final class CommandCatalog {

    /** Items per record line in a {@code CMBLOCK}. */
    public static final int COMPONENT_RECORD_WIDTH = 8;

    /** Opening line plus format line of a {@code CMBLOCK}. */
    public static final int COMPONENT_HEADER_LINES = 2;

    /** Zero-based field of {@code CMBLOCK} holding the item count. */
    public static final int COMPONENT_COUNT_FIELD = 3;

    private static final Map<String, CommandCategory> EXACT;
    private static final Map<String, CommandCategory> PREFIX;

    static {
        Map<String, CommandCategory> exact = new LinkedHashMap<>();
        exact.put("*DO", CommandCategory.CONTROL_LOOP);
        exact.put("*DOWHILE", CommandCategory.CONTROL_LOOP);
        exact.put("*ENDDO", CommandCategory.CONTROL_LOOP_END);
        exact.put("*IF", CommandCategory.CONTROL_CONDITIONAL);
        exact.put("*ELSEIF", CommandCategory.CONTROL_BRANCH);
        exact.put("*ELSE", CommandCategory.CONTROL_BRANCH);
        exact.put("*ENDIF", CommandCategory.CONTROL_CONDITIONAL_END);
        exact.put("*END", CommandCategory.FUNCTION_CLOSE);
        exact.put("/OUT", CommandCategory.OUTPUT_REDIRECT);
        exact.put("/OUTP", CommandCategory.OUTPUT_REDIRECT);
        exact.put("/OUTPU", CommandCategory.OUTPUT_REDIRECT);
        exact.put("/OUTPUT", CommandCategory.OUTPUT_REDIRECT);
        exact.put("INT1", CommandCategory.RAW);
        exact.put("-1", CommandCategory.BLOCK_END);
        exact.put("END PREAD", CommandCategory.BLOCK_END);
        EXACT = Collections.unmodifiableMap(exact);

        Map<String, CommandCategory> prefix = new LinkedHashMap<>();
        for (String token : new String[] {"NBLO", "EBLO", "BFBL", "BFEB", "PREA", "SFEB"}) {
            prefix.put(token, CommandCategory.BLOCK_FIXED);
        }
        prefix.put("CMBL", CommandCategory.BLOCK_COUNTED);
        prefix.put("*VWR", CommandCategory.BATCHED_WRITE);
        prefix.put("*VRE", CommandCategory.BATCHED_WRITE);
        prefix.put("*MWR", CommandCategory.BATCHED_WRITE);
        prefix.put("*CFO", CommandCategory.OUTPUT_REDIRECT);
        prefix.put("*CFC", CommandCategory.OUTPUT_CLOSE);
        prefix.put("*CRE", CommandCategory.FUNCTION_OPEN);
        prefix.put("*USE", CommandCategory.FUNCTION_CALL);
        prefix.put("*REP", CommandCategory.REPEAT);
        prefix.put("/VER", CommandCategory.VERIFY);
        prefix.put("/TIT", CommandCategory.TITLE);
        prefix.put("*GET", CommandCategory.QUERY);
        prefix.put("/NOP", CommandCategory.MUTED);
        prefix.put("/EOF", CommandCategory.FORBIDDEN);
        prefix.put("*ASK", CommandCategory.FORBIDDEN);
        PREFIX = Collections.unmodifiableMap(prefix);
    }

    private CommandCatalog() {
    }

    public static CommandCategory categoryOf(String command) {
        if (command == null) {
            return CommandCategory.NORMAL;
        }
        String normalized = command.strip().toUpperCase(Locale.ROOT);
        CommandCategory exact = EXACT.get(normalized);
        if (exact != null) {
            return exact;
        }
        String token = normalized.length() > 4 ? normalized.substring(0, 4) : normalized;
        return PREFIX.getOrDefault(token, CommandCategory.NORMAL);
    }

    public static boolean requiresBatching(String command) {
        return categoryOf(command).requiresBatching();
    }

    public static BlockKind blockKind(String command) {
        switch (categoryOf(command)) {
            case BLOCK_FIXED:
                return BlockKind.FIXED;
            case BLOCK_COUNTED:
                return BlockKind.COUNTED;
            default:
                return BlockKind.NONE;
        }
    }

    /**
     * Terminator of a fixed block: {@code -1}, {@code END PREAD}, or the
     * {@code N,R5.3,LOC,-1} trailer written after node records.
     */
    public static boolean isBlockTerminator(ClassifiedLine line) {
        String command = line.command();
        if (categoryOf(command) == CommandCategory.BLOCK_END) {
            return true;
        }
        if (!"N".equals(command)) {
            return false;
        }
        List<String> fields = line.fields();
        for (int i = fields.size() - 1; i > 0; i--) {
            String field = fields.get(i);
            if (!field.isEmpty()) {
                return "-1".equals(field);
            }
        }
        return false;
    }

    /**
     * Number of lines a counted block spans, opening line included:
     * {@code ceil(items / width) + COMPONENT_HEADER_LINES}.
     */
    public static int countedBlockLines(int itemCount) {
        if (itemCount < 0) {
            throw new IllegalArgumentException("item count must not be negative: " + itemCount);
        }
        int records = itemCount / COMPONENT_RECORD_WIDTH;
        if (itemCount % COMPONENT_RECORD_WIDTH != 0) {
            records++;
        }
        return records + COMPONENT_HEADER_LINES;
    }
}
