package json.validator.cli;

/// Process exit status of the command-line tool.
public enum ExitStatus {
    /// Every file is valid JSON.
    VALID(0),
    /// At least one file could not be read and none was invalid.
    IO_ERROR(1),
    /// At least one file is not valid JSON.
    INVALID(2),
    /// The command line itself was wrong.
    USAGE(64);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /// {@return the more severe of the two statuses for a batch of files}
    ExitStatus worst(ExitStatus other) {
        return severity() >= other.severity() ? this : other;
    }

    private int severity() {
        return switch (this) {
            case VALID -> 0;
            case IO_ERROR -> 1;
            case INVALID -> 2;
            case USAGE -> 3;
        };
    }
}
