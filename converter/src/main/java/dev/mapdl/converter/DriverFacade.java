package dev.mapdl.converter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * What the translator knows about the PyMAPDL {@code Mapdl} object the
 * generated program drives: the variable it is bound to and the command names
 * it exposes as methods.
 */
public final class DriverFacade {

    static final String COMMANDS_RESOURCE = "/mapdl-commands.txt";

    private static final Map<String, String> ALIASES = Map.of(
        "/PREP7", "prep7"
    );

    private final String objectName;
    private final Set<String> callables;

    public DriverFacade(String objectName, Collection<String> callables) {
        this.objectName = Objects.requireNonNull(objectName, "objectName");
        Set<String> names = new TreeSet<>();
        for (String name : callables) {
            names.add(name.strip().toLowerCase(Locale.ROOT));
        }
        this.callables = Set.copyOf(names);
    }

    /** Facade bound to {@code objectName} with the bundled command list. */
    public static DriverFacade bundled(String objectName) {
        return new DriverFacade(objectName, BundledCommands.NAMES);
    }

    public String objectName() {
        return objectName;
    }

    public Set<String> callables() {
        return callables;
    }

    public boolean isCallable(String command) {
        return methodFor(command).isPresent();
    }

    /** Method name a command maps to, if the facade exposes one. */
    public Optional<String> methodFor(String command) {
        if (command == null) {
            return Optional.empty();
        }
        String upper = command.strip().toUpperCase(Locale.ROOT);
        String alias = ALIASES.get(upper);
        if (alias != null) {
            return Optional.of(alias);
        }
        String lower = upper.toLowerCase(Locale.ROOT);
        return callables.contains(lower) ? Optional.of(lower) : Optional.empty();
    }

    static Set<String> loadCommandNames(InputStream in) throws IOException {
        Set<String> names = new TreeSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.strip();
                if (name.isEmpty() || name.startsWith("#")) {
                    continue;
                }
                names.add(name.toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    private static final class BundledCommands {
        static final Set<String> NAMES = load();

        private static Set<String> load() {
            InputStream in = DriverFacade.class.getResourceAsStream(COMMANDS_RESOURCE);
            if (in == null) {
                throw new IllegalStateException("missing classpath resource " + COMMANDS_RESOURCE);
            }
            try {
                return Set.copyOf(loadCommandNames(in));
            } catch (IOException e) {
                throw new UncheckedIOException("unable to read " + COMMANDS_RESOURCE, e);
            }
        }
    }
}
