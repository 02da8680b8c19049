package json.validator.cli;

import json.validator.JsonValidator;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/// CLI entry point: validates JSON files and reports the verdict through the
/// exit status.
///
/// Usage:
/// `java -jar json-validator-cli.jar [--max-depth N] [--reject-duplicate-keys] [--tokens] [--verbose] FILE...`
///
/// Each file is validated on its own; with several files the runs happen in
/// parallel and the output is printed in command-line order. Valid files are
/// silent unless `--verbose` is given. Errors go to stderr as
/// `FILE:LINE:COLUMN: KIND: detail`. See [ExitStatus] for the exit codes.
public final class JsonValidatorCli {

    private static final Logger LOG = Logger.getLogger(JsonValidatorCli.class.getName());

    private JsonValidatorCli() {
    }

    public static void main(String[] args) {
        CliLogging.configure();
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err).code());
    }

    static ExitStatus run(String[] args, PrintWriter out, PrintWriter err) {
        final CliOptions options;
        try {
            options = CliOptions.parse(args == null ? new String[0] : args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            err.flush();
            return ExitStatus.USAGE;
        }
        if (options.help()) {
            out.println(CliOptions.USAGE);
            out.flush();
            return ExitStatus.VALID;
        }

        final var validator = JsonValidator.create(options.config());
        LOG.fine(() -> "Validating " + options.files().size() + " file(s) with " + options.config());

        if (options.tokens()) {
            for (Path file : options.files()) {
                dumpTokens(file, out);
            }
        }

        final List<FileVerdict> verdicts = (options.files().size() > 1
            ? options.files().parallelStream()
            : options.files().stream())
            .map(file -> validate(validator, file))
            .toList();

        var status = ExitStatus.VALID;
        for (FileVerdict verdict : verdicts) {
            status = status.worst(verdict.status());
            if (verdict.status() == ExitStatus.VALID) {
                if (options.verbose()) {
                    out.println(verdict.describe());
                }
            } else {
                err.println(verdict.describe());
            }
        }
        out.flush();
        err.flush();
        return status;
    }

    static FileVerdict validate(JsonValidator validator, Path file) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            LOG.warning(() -> "Cannot read " + file + ": " + e);
            return FileVerdict.unreadable(file, e);
        }
        return FileVerdict.validated(file, validator.validate(bytes));
    }

    private static void dumpTokens(Path file, PrintWriter out) {
        out.println("== " + file);
        try {
            // lenient decoding here, malformed bytes are reported by validation
            TokenDump.print(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), out);
        } catch (IOException e) {
            // reported again, with the exit status, by the validation pass
            out.println("error: cannot read file: " + e.getMessage());
        }
    }
}
