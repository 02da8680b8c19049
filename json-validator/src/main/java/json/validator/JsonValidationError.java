package json.validator;

import java.util.Objects;

/// The single error that made a document invalid.
///
/// @param kind     what went wrong
/// @param position where the offending character or token starts
/// @param detail   short explanation, e.g. `leading zeros are not allowed`
/// @param expected what the grammar required at `position`, or null
/// @param found    what was actually there, or null
public record JsonValidationError(JsonErrorKind kind, JsonPosition position, String detail,
                                  String expected, String found) {

    public JsonValidationError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(position, "position must not be null");
        if (detail == null || detail.isEmpty()) {
            throw new IllegalArgumentException("Error detail cannot be null or empty");
        }
    }

    /// Creates an error without expected/found descriptions.
    public static JsonValidationError of(JsonErrorKind kind, JsonPosition position, String detail) {
        return new JsonValidationError(kind, position, detail, null, null);
    }

    /// Creates an error that names what the grammar wanted and what it got.
    public static JsonValidationError expected(JsonErrorKind kind, JsonPosition position,
                                               String expected, String found) {
        return new JsonValidationError(kind, position, "expected " + expected + " but found " + found,
            expected, found);
    }

    /// {@return the error rendered as `KIND: detail at line L, column C`}
    public String message() {
        return kind + ": " + detail + " at line " + position.line() + ", column " + position.column();
    }

    @Override
    public String toString() {
        return message();
    }
}
