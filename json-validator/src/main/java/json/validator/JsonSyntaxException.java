package json.validator;

import java.util.Objects;

/// Thrown by [JsonTokenizer] and the grammar parser when the source is not
/// well-formed JSON. [JsonValidator] catches it and hands the carried
/// [JsonValidationError] back as a [JsonValidationResult]; callers that use
/// the tokenizer directly see the exception.
public class JsonSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient JsonValidationError error;

    /// Creates an exception without source context in its message.
    public JsonSyntaxException(JsonValidationError error) {
        super(Objects.requireNonNull(error, "error must not be null").message());
        this.error = error;
    }

    /// Creates an exception whose message quotes the character at the error position.
    public JsonSyntaxException(JsonValidationError error, char[] source) {
        super(formatMessage(Objects.requireNonNull(error, "error must not be null"), source));
        this.error = error;
    }

    /// {@return the error this exception reports}
    public JsonValidationError error() {
        return error;
    }

    private static String formatMessage(JsonValidationError error, char[] source) {
        final var sb = new StringBuilder(error.message());
        final int offset = error.position().offset();
        if (source != null && offset < source.length) {
            final char c = source[offset];
            sb.append(" (near ");
            if (c < 0x20 || Character.isSurrogate(c)) {
                sb.append(String.format("U+%04X", (int) c));
            } else {
                sb.append('\'').append(c).append('\'');
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
