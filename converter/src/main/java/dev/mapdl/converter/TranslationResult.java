package dev.mapdl.converter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Generated program lines together with the warnings raised while producing them.
 */
public final class TranslationResult {

    private final List<String> lines;
    private final List<TranslationWarning> warnings;
    private final LineEnding lineEnding;
    private final int windowsOpened;
    private final int windowsClosed;

    TranslationResult(List<String> lines,
                      List<TranslationWarning> warnings,
                      LineEnding lineEnding,
                      int windowsOpened,
                      int windowsClosed) {
        this.lines = List.copyOf(lines);
        this.warnings = List.copyOf(warnings);
        this.lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
        this.windowsOpened = windowsOpened;
        this.windowsClosed = windowsClosed;
    }

    public List<String> lines() {
        return lines;
    }

    public List<TranslationWarning> warnings() {
        return warnings;
    }

    public LineEnding lineEnding() {
        return lineEnding;
    }

    /** Number of non-interactive windows opened in the program. */
    public int windowsOpened() {
        return windowsOpened;
    }

    public int windowsClosed() {
        return windowsClosed;
    }

    public String text() {
        return String.join(lineEnding.separator(), lines);
    }

    /** Writes the program, replacing any existing file. */
    public void save(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, text(), StandardCharsets.UTF_8);
    }
}
