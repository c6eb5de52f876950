package io.journeyguard.cli;

import io.journeyguard.core.model.Category;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parsed command line.
 *
 * @param command    the sub-command
 * @param files      positional arguments, in order
 * @param noFix      {@code --no-fix} was given
 * @param only       the {@code --only} category, or {@code null}
 * @param configPath the {@code --config} path, or {@code null}
 */
record CliArguments(Command command, List<String> files, boolean noFix, Category only, Path configPath) {

    enum Command {
        VALIDATE("validate", 1),
        FIX("fix", 1),
        STRINGIFY_FIELD("stringify-field", 3);

        private final String name;
        private final int arity;

        Command(String name, int arity) {
            this.name = name;
            this.arity = arity;
        }

        static Command of(String name) {
            for (Command command : values()) {
                if (command.name.equals(name)) {
                    return command;
                }
            }
            throw new IllegalArgumentException("Unknown command: " + name);
        }
    }

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage:",
            "  journey-guard validate <journey.json> [--no-fix] [--only <category>] [--config <path>]",
            "  journey-guard fix <journey.json> [--config <path>]",
            "  journey-guard stringify-field <inner.json> <journey.json> <field-path> [--config <path>]",
            "",
            "Categories: " + Arrays.stream(Category.values()).map(Category::id).collect(Collectors.joining(", ")));

    /**
     * Parses the command line.
     *
     * @throws IllegalArgumentException on an unknown command or option, a missing option value or
     *     the wrong number of positional arguments
     */
    static CliArguments parse(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("Missing command");
        }
        Command command = Command.of(args[0]);
        List<String> files = new ArrayList<>();
        boolean noFix = false;
        Category only = null;
        Path configPath = null;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--no-fix" -> noFix = true;
                case "--only" -> {
                    String id = value(args, ++i, arg);
                    only = Category.fromId(id)
                            .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + id));
                }
                case "--config" -> configPath = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    files.add(arg);
                }
            }
        }

        if (files.size() != command.arity) {
            throw new IllegalArgumentException(
                    command.name + " expects " + command.arity + " argument(s), got " + files.size());
        }
        if (command != Command.VALIDATE && (noFix || only != null)) {
            throw new IllegalArgumentException("--no-fix and --only apply to validate only");
        }
        return new CliArguments(command, List.copyOf(files), noFix, only, configPath);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires an argument");
        }
        return args[index];
    }
}
