package json.validator;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;

/// Decides whether a document is well-formed JSON as defined by RFC 8259.
///
/// Each call tokenizes and checks the document in one pass and stops at the
/// first error. Nothing is built or kept: the answer is a
/// [JsonValidationResult] that is either valid or carries exactly one
/// [JsonValidationError] with its kind and line/column.
///
/// Instances are immutable and thread safe. Every call works on its own
/// tokenizer, so independent documents can be validated concurrently with one
/// shared validator.
///
/// ## Example Usage
/// ```java
/// JsonValidator validator = JsonValidator.create();
/// JsonValidationResult result = validator.validate("{\"a\": 1,}");
/// if (!result.isValid()) {
///     System.err.println(result.error().message());
///     // UNEXPECTED_TOKEN: trailing comma before '}' at line 1, column 9
/// }
/// ```
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
public final class JsonValidator {

    private static final Logger LOG = Logger.getLogger(JsonValidator.class.getName());

    private static final JsonValidator DEFAULT = new JsonValidator(JsonValidatorConfig.defaults());

    private final JsonValidatorConfig config;

    private JsonValidator(JsonValidatorConfig config) {
        this.config = config;
    }

    /// {@return a validator with [JsonValidatorConfig#defaults()]}
    public static JsonValidator create() {
        return DEFAULT;
    }

    /// {@return a validator with the given settings}
    /// @throws NullPointerException if `config` is null
    public static JsonValidator create(JsonValidatorConfig config) {
        return new JsonValidator(Objects.requireNonNull(config, "config must not be null"));
    }

    /// Shorthand for `JsonValidator.create().validate(text).isValid()`.
    public static boolean isValid(String text) {
        return DEFAULT.validate(text).isValid();
    }

    /// {@return the settings this validator applies}
    public JsonValidatorConfig config() {
        return config;
    }

    /// Validates a document held in a `String`.
    /// @throws NullPointerException if `text` is null
    public JsonValidationResult validate(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return run(text.toCharArray());
    }

    /// Validates a document held in a `char[]`. The array is copied first so
    /// that later changes by the caller cannot affect the run.
    /// @throws NullPointerException if `text` is null
    public JsonValidationResult validate(char[] text) {
        Objects.requireNonNull(text, "text must not be null");
        return run(Arrays.copyOf(text, text.length));
    }

    /// Validates a UTF-8 encoded document. Bytes that are not valid UTF-8 make
    /// the document invalid with [JsonErrorKind#INVALID_ENCODING]; the error
    /// offset is then a byte offset.
    /// @throws NullPointerException if `bytes` is null
    public JsonValidationResult validate(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        final char[] chars;
        try {
            chars = Utf8SourceDecoder.decode(bytes);
        } catch (JsonSyntaxException e) {
            LOG.fine(() -> "Invalid: " + e.getMessage());
            return JsonValidationResult.failure(e.error());
        }
        return run(chars);
    }

    private JsonValidationResult run(char[] source) {
        LOG.fine(() -> "Validating " + source.length + " chars with " + config);
        try {
            JsonGrammarParser.parseDocument(new JsonTokenizer(source), config);
        } catch (JsonSyntaxException e) {
            LOG.fine(() -> "Invalid: " + e.getMessage());
            return JsonValidationResult.failure(e.error());
        }
        LOG.fine("Valid");
        return JsonValidationResult.success();
    }
}
