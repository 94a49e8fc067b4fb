package dev.mapdl.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: converts an APDL input file into a PyMAPDL script.
 */
@CommandLine.Command(
    name = "mapdl-converter",
    description = "Convert an MAPDL input file into a PyMAPDL Python script",
    mixinStandardHelpOptions = true,
    versionProvider = ApdlConverter.VersionProvider.class
)
public final class ApdlConverter implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ApdlConverter.class);

    static final int EXIT_TRANSLATION_ERROR = 1;

    @CommandLine.Parameters(index = "0", description = "APDL input file")
    private Path source;

    @CommandLine.Parameters(index = "1", description = "Python script to write")
    private Path target;

    @CommandLine.Option(names = "--loglevel", description = "Log level passed to launch_mapdl (default: ${DEFAULT-VALUE})")
    private String logLevel = TranslatorOptions.defaults().logLevel();

    @CommandLine.Option(names = "--no-auto-exit", description = "Do not append mapdl.exit()")
    private boolean noAutoExit;

    @CommandLine.Option(names = "--line-ending", converter = LineEndingConverter.class,
        description = "LF or CRLF (default: platform)")
    private LineEnding lineEnding = LineEnding.system();

    @CommandLine.Option(names = "--exec-file", description = "MAPDL executable passed to launch_mapdl")
    private String execFile;

    @CommandLine.Option(names = "--no-macros-as-functions", description = "Keep *CREATE macros as solver commands")
    private boolean noMacrosAsFunctions;

    @CommandLine.Option(names = "--no-function-names", description = "Emit every command through mapdl.run()")
    private boolean noFunctionNames;

    @CommandLine.Option(names = "--strict", description = "Fail on unterminated blocks, macros and loops")
    private boolean strict;

    public static void main(String[] args) {
        System.exit(new CommandLine(new ApdlConverter()).execute(args));
    }

    @Override
    public Integer call() throws IOException {
        TranslatorOptions options = TranslatorOptions.builder()
            .logLevel(logLevel)
            .autoExit(!noAutoExit)
            .lineEnding(lineEnding)
            .execFile(execFile)
            .macrosAsFunctions(!noMacrosAsFunctions)
            .useFunctionNames(!noFunctionNames)
            .strict(strict)
            .build();

        TranslationResult result;
        try {
            result = new ScriptTranslator(options).translateFile(source);
        } catch (TranslationException e) {
            System.err.println("error: " + e.getMessage());
            return EXIT_TRANSLATION_ERROR;
        }

        result.save(target);
        log.info("Wrote {} lines to {} ({} warning(s))", result.lines().size(), target, result.warnings().size());
        return 0;
    }

    public static final class LineEndingConverter implements CommandLine.ITypeConverter<LineEnding> {
        @Override
        public LineEnding convert(String value) {
            try {
                return LineEnding.fromText(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    public static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"mapdl-converter " + TranslatorOptions.converterVersion()};
        }
    }
}
