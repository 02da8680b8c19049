package json.validator.cli;

import json.validator.JsonValidatorConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Parsed command line.
///
/// @param config  validator settings: system properties overridden by flags
/// @param tokens  print each file's token stream before validating it
/// @param verbose report valid files too
/// @param help    print usage and exit
/// @param files   the files to validate, in command-line order
record CliOptions(JsonValidatorConfig config, boolean tokens, boolean verbose, boolean help, List<Path> files) {

    static final String USAGE =
        "Usage: json-validator [--max-depth N] [--reject-duplicate-keys] [--tokens] [--verbose] FILE...";

    CliOptions {
        Objects.requireNonNull(config, "config must not be null");
        files = List.copyOf(files);
    }

    /// Parses `args`.
    /// @throws IllegalArgumentException for an unknown flag, a bad flag value or no files
    static CliOptions parse(String[] args) {
        Objects.requireNonNull(args, "args must not be null");
        var config = JsonValidatorConfig.fromSystemProperties();
        boolean tokens = false;
        boolean verbose = false;
        final var files = new ArrayList<Path>();
        boolean onlyFiles = false;

        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if (onlyFiles || !arg.startsWith("-")) {
                files.add(Path.of(arg));
                continue;
            }
            switch (arg) {
                case "--" -> onlyFiles = true;
                case "-h", "--help" -> {
                    return new CliOptions(config, false, false, true, List.of());
                }
                case "--tokens" -> tokens = true;
                case "-v", "--verbose" -> verbose = true;
                case "--reject-duplicate-keys" -> config = config.withRejectDuplicateKeys(true);
                case "--max-depth" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--max-depth needs a value");
                    }
                    config = config.withMaxDepth(parseDepth(args[++i]));
                }
                default -> {
                    if (arg.startsWith("--max-depth=")) {
                        config = config.withMaxDepth(parseDepth(arg.substring("--max-depth=".length())));
                    } else {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                }
            }
        }
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No files given");
        }
        return new CliOptions(config, tokens, verbose, false, files);
    }

    private static int parseDepth(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--max-depth must be an integer but was '" + value + "'", e);
        }
    }
}
