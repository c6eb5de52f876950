package io.journeyguard.cli;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.journeyguard.cli.config.CliConfig;
import io.journeyguard.cli.config.ConfigLoadException;
import io.journeyguard.cli.config.ConfigLoader;
import io.journeyguard.cli.logging.LogbackConfigurator;
import io.journeyguard.cli.report.ReportPrinter;
import io.journeyguard.cli.security.PathAccessException;
import io.journeyguard.cli.security.PathGuard;
import io.journeyguard.core.document.FieldReplacer;
import io.journeyguard.core.document.JourneyWriter;
import io.journeyguard.core.engine.JourneyValidator;
import io.journeyguard.core.engine.ValidationOptions;
import io.journeyguard.core.engine.ValidationOutcome;
import io.journeyguard.core.error.FieldReplacementException;
import io.journeyguard.core.error.JourneyLoadException;
import io.journeyguard.core.error.PersistException;
import io.journeyguard.core.registry.NodeRegistry;
import io.journeyguard.core.registry.RegistryLoader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * The {@code journey-guard} command line: argument parsing, configuration, logging setup, file
 * access checks and command dispatch.
 *
 * <p>
 * Exit codes: {@value #EXIT_CLEAN} no findings, {@value #EXIT_FINDINGS} findings remain,
 * {@value #EXIT_FAILURE} usage, configuration, access or load failure, {@value #EXIT_PERSIST_FAILURE}
 * the repaired document could not be written.
 */
public final class CliApp {

    private static final Logger LOG = LoggerFactory.getLogger(CliApp.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_FAILURE = 2;
    public static final int EXIT_PERSIST_FAILURE = 3;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final JourneyWriter writer = new JourneyWriter();

    public CliApp(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
    }

    /**
     * Runs one command.
     *
     * @param args command-line arguments
     * @return the process exit code
     */
    public int run(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_FAILURE;
        }

        try {
            CliConfig config = ConfigLoader.loadOrDefaults(arguments.configPath(), envLookup);
            LogbackConfigurator.configure(config);
            PathGuard guard = new PathGuard(config.workspaceFolder(), config.userCwd(), config.maxFileBytes());
            return switch (arguments.command()) {
                case VALIDATE -> validate(arguments, config, guard);
                case FIX -> fix(arguments, config, guard);
                case STRINGIFY_FIELD -> stringifyField(arguments, guard);
            };
        } catch (ConfigLoadException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (PathAccessException e) {
            err.println("Security validation failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (JourneyLoadException e) {
            err.println("Failed to load: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (FieldReplacementException e) {
            err.println("Could not replace field '" + e.fieldPath() + "': " + e.getMessage());
            return EXIT_FAILURE;
        } catch (PersistException e) {
            err.println("Failed to save " + e.documentName() + ": " + e.getMessage());
            return EXIT_PERSIST_FAILURE;
        }
    }

    // --- Commands ---

    private int validate(CliArguments arguments, CliConfig config, PathGuard guard) {
        Path file = Path.of(arguments.files().get(0));
        String name = guard.check(file);
        ValidationOptions options = new ValidationOptions(
                config.autoFix() && !arguments.noFix(), config.maxRepairCycles(), arguments.only());
        ValidationOutcome outcome;
        try (MDC.MDCCloseable ignored = LogbackConfigurator.documentContext(name)) {
            outcome = validator(config).validate(file, options);
        }
        new ReportPrinter(out).printValidation(outcome, arguments.only());
        return outcome.isClean() ? EXIT_CLEAN : EXIT_FINDINGS;
    }

    private int fix(CliArguments arguments, CliConfig config, PathGuard guard) {
        Path file = Path.of(arguments.files().get(0));
        String name = guard.check(file);
        ValidationOutcome outcome;
        try (MDC.MDCCloseable ignored = LogbackConfigurator.documentContext(name)) {
            outcome = validator(config).fix(file);
        }
        new ReportPrinter(out).printFixRun(outcome);
        return EXIT_CLEAN;
    }

    private int stringifyField(CliArguments arguments, PathGuard guard) {
        Path inner = Path.of(arguments.files().get(0));
        Path journey = Path.of(arguments.files().get(1));
        String fieldPath = arguments.files().get(2);
        PathGuard.checkFieldPath(fieldPath);
        String innerName = guard.check(inner);
        String journeyName = guard.check(journey);

        JsonNode innerJson;
        String journeyText;
        try {
            innerJson = MAPPER.readTree(inner.toFile());
            journeyText = Files.readString(journey, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            err.println("Inner JSON parsing error in " + innerName
                    + (location == null ? "" : " at line " + location.getLineNr() + ", column " + location.getColumnNr())
                    + ": " + e.getOriginalMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getClass().getSimpleName());
            return EXIT_FAILURE;
        }
        if (innerJson == null || innerJson.isMissingNode()) {
            err.println("Inner JSON file is empty: " + innerName);
            return EXIT_FAILURE;
        }

        String escaped = FieldReplacer.escape(FieldReplacer.stringify(innerJson));
        String updated = FieldReplacer.replace(journeyText, fieldPath, escaped);
        writer.writeText(journey, updated);
        out.println("Updated field " + fieldPath + " in " + journeyName + " with the content of " + innerName);

        try {
            MAPPER.readTree(updated);
            out.println("Result is valid JSON");
        } catch (JsonProcessingException e) {
            LOG.debug("Replaced journey text does not parse: document={}", journeyName, e);
            out.println("Warning: Result may not be valid JSON: " + e.getOriginalMessage());
        }
        return EXIT_CLEAN;
    }

    private static JourneyValidator validator(CliConfig config) {
        RegistryLoader loader = new RegistryLoader();
        NodeRegistry registry = config.registryPath() == null
                ? loader.loadDefault()
                : loader.load(Path.of(config.registryPath()));
        return JourneyValidator.create(registry);
    }
}
