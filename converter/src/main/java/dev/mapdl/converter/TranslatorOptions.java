package dev.mapdl.converter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for one converter. Defaults come from the bundled
 * {@code mapdl-converter.properties}; the builder overrides them.
 */
public final class TranslatorOptions {

    static final String DEFAULTS_RESOURCE = "/mapdl-converter.properties";

    private static final Properties DEFAULTS = loadDefaults();

    private final String objectName;
    private final String logLevel;
    private final boolean autoExit;
    private final LineEnding lineEnding;
    private final String execFile;
    private final boolean macrosAsFunctions;
    private final boolean useFunctionNames;
    private final boolean strict;

    private TranslatorOptions(Builder builder) {
        this.objectName = builder.objectName;
        this.logLevel = builder.logLevel;
        this.autoExit = builder.autoExit;
        this.lineEnding = builder.lineEnding;
        this.execFile = builder.execFile;
        this.macrosAsFunctions = builder.macrosAsFunctions;
        this.useFunctionNames = builder.useFunctionNames;
        this.strict = builder.strict;
    }

    public static TranslatorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Version string written into the generated program header. */
    public static String converterVersion() {
        return DEFAULTS.getProperty("converter.version", "unknown");
    }

    /** Name of the facade variable in the generated program. */
    public String objectName() {
        return objectName;
    }

    public String logLevel() {
        return logLevel;
    }

    /** Whether {@code exit()} is appended to the program. */
    public boolean autoExit() {
        return autoExit;
    }

    public LineEnding lineEnding() {
        return lineEnding;
    }

    /** Solver executable passed to {@code launch_mapdl}, or {@code null}. */
    public String execFile() {
        return execFile;
    }

    public boolean macrosAsFunctions() {
        return macrosAsFunctions;
    }

    public boolean useFunctionNames() {
        return useFunctionNames;
    }

    /** Fail instead of closing blocks, functions and windows left open at end of script. */
    public boolean strict() {
        return strict;
    }

    public Builder toBuilder() {
        return new Builder()
            .objectName(objectName)
            .logLevel(logLevel)
            .autoExit(autoExit)
            .lineEnding(lineEnding)
            .execFile(execFile)
            .macrosAsFunctions(macrosAsFunctions)
            .useFunctionNames(useFunctionNames)
            .strict(strict);
    }

    private static Properties loadDefaults() {
        Properties properties = new Properties();
        try (InputStream in = TranslatorOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read " + DEFAULTS_RESOURCE, e);
        }
        return properties;
    }

    private static boolean defaultFlag(String key, boolean fallback) {
        String value = DEFAULTS.getProperty(key);
        return value == null ? fallback : Boolean.parseBoolean(value.strip());
    }

    public static final class Builder {
        private String objectName = DEFAULTS.getProperty("converter.object-name", "mapdl").strip();
        private String logLevel = DEFAULTS.getProperty("converter.loglevel", "WARNING").strip();
        private boolean autoExit = defaultFlag("converter.auto-exit", true);
        private LineEnding lineEnding = LineEnding.system();
        private String execFile;
        private boolean macrosAsFunctions = defaultFlag("converter.macros-as-functions", true);
        private boolean useFunctionNames = defaultFlag("converter.use-function-names", true);
        private boolean strict = defaultFlag("converter.strict", false);

        private Builder() {
        }

        public Builder objectName(String objectName) {
            this.objectName = Objects.requireNonNull(objectName, "objectName");
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel");
            return this;
        }

        public Builder autoExit(boolean autoExit) {
            this.autoExit = autoExit;
            return this;
        }

        public Builder lineEnding(LineEnding lineEnding) {
            this.lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
            return this;
        }

        public Builder execFile(String execFile) {
            this.execFile = execFile;
            return this;
        }

        public Builder macrosAsFunctions(boolean macrosAsFunctions) {
            this.macrosAsFunctions = macrosAsFunctions;
            return this;
        }

        public Builder useFunctionNames(boolean useFunctionNames) {
            this.useFunctionNames = useFunctionNames;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public TranslatorOptions build() {
            return new TranslatorOptions(this);
        }
    }
}
