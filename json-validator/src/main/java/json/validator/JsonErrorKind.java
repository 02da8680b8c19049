package json.validator;

/// Classification of the first error that made a document invalid.
///
/// The first four kinds are raised while scanning characters, the rest while
/// matching tokens against the grammar. Both end up in the same
/// [JsonValidationError].
public enum JsonErrorKind {
    UNEXPECTED_CHARACTER(true),
    INVALID_STRING(true),
    INVALID_NUMBER(true),
    INVALID_ENCODING(true),

    UNEXPECTED_TOKEN(false),
    EXPECTED_TOKEN(false),
    EXPECTED_STRING(false),
    UNEXPECTED_EOF(false),
    TRAILING_DATA(false),
    TOO_DEEP(false),
    DUPLICATE_KEY(false);

    private final boolean lexical;

    JsonErrorKind(boolean lexical) {
        this.lexical = lexical;
    }

    /// {@return true if the error was detected by the tokenizer}
    public boolean isLexical() {
        return lexical;
    }
}
