package json.validator.cli;

import json.validator.JsonValidationResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/// Outcome for one file on the command line: either a validation result or the
/// I/O failure that prevented validation.
record FileVerdict(Path file, JsonValidationResult result, IOException readFailure) {

    FileVerdict {
        Objects.requireNonNull(file, "file must not be null");
        if ((result == null) == (readFailure == null)) {
            throw new IllegalArgumentException("exactly one of result and readFailure must be set");
        }
    }

    static FileVerdict validated(Path file, JsonValidationResult result) {
        return new FileVerdict(file, result, null);
    }

    static FileVerdict unreadable(Path file, IOException failure) {
        return new FileVerdict(file, null, failure);
    }

    ExitStatus status() {
        if (readFailure != null) {
            return ExitStatus.IO_ERROR;
        }
        return result.isValid() ? ExitStatus.VALID : ExitStatus.INVALID;
    }

    /// {@return the diagnostic line for this file, `FILE:LINE:COLUMN: KIND: detail`}
    String describe() {
        if (readFailure != null) {
            return file + ": cannot read file: " + readFailure.getMessage();
        }
        if (result.isValid()) {
            return file + ": valid";
        }
        final var error = result.error();
        return file + ":" + error.position().line() + ":" + error.position().column()
            + ": " + error.kind() + ": " + error.detail();
    }
}
