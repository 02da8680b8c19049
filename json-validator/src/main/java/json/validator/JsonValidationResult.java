package json.validator;

import java.util.Objects;
import java.util.Optional;

/// Verdict of validating one document.
///
/// When `isValid()` is true `error()` is null.
/// When `isValid()` is false exactly one [JsonValidationError] is present.
public record JsonValidationResult(boolean isValid, JsonValidationError error) {

    private static final JsonValidationResult SUCCESS = new JsonValidationResult(true, null);

    public JsonValidationResult {
        if (isValid && error != null) {
            throw new IllegalArgumentException("a valid result cannot carry an error");
        }
        if (!isValid && error == null) {
            throw new IllegalArgumentException("an invalid result must carry an error");
        }
    }

    public static JsonValidationResult success() {
        return SUCCESS;
    }

    public static JsonValidationResult failure(JsonValidationError error) {
        return new JsonValidationResult(false, Objects.requireNonNull(error, "error must not be null"));
    }

    /// {@return the error, empty for a valid document}
    public Optional<JsonValidationError> errorIfAny() {
        return Optional.ofNullable(error);
    }
}
