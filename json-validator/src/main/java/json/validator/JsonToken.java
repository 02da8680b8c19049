package json.validator;

import java.util.Objects;

/// An immutable lexical token together with where it starts in the source.
///
/// `text` is the decoded value for [JsonTokenType#STRING], the raw lexeme for
/// [JsonTokenType#NUMBER], the fixed spelling for punctuation and keywords and
/// the empty string for [JsonTokenType#END_OF_INPUT].
public record JsonToken(JsonTokenType type, String text, JsonPosition position) {

    public JsonToken {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    /// {@return a description of this token for diagnostics, e.g. `number 42`}
    public String describe() {
        return switch (type) {
            case STRING -> "string \"" + abbreviate(text) + "\"";
            case NUMBER -> "number " + abbreviate(text);
            default -> type.description();
        };
    }

    private static String abbreviate(String s) {
        return s.length() <= 32 ? s : s.substring(0, 29) + "...";
    }

    @Override
    public String toString() {
        return type == JsonTokenType.STRING || type == JsonTokenType.NUMBER
            ? type + "(" + text + ") @ " + position
            : type + " @ " + position;
    }
}
