package json.validator;

import java.util.Locale;
import java.util.logging.Logger;

/// Settings for a [JsonValidator].
///
/// @param maxDepth            deepest nesting of objects and arrays that is accepted,
///                            between 1 and [#MAX_DEPTH_LIMIT]
/// @param rejectDuplicateKeys whether an object that repeats a member name is invalid
public record JsonValidatorConfig(int maxDepth, boolean rejectDuplicateKeys) {

    private static final Logger LOG = Logger.getLogger(JsonValidatorConfig.class.getName());

    /// System property overriding [#DEFAULT_MAX_DEPTH].
    public static final String MAX_DEPTH_PROPERTY = "json.validator.maxDepth";

    /// System property that turns on duplicate member name rejection.
    public static final String REJECT_DUPLICATE_KEYS_PROPERTY = "json.validator.rejectDuplicateKeys";

    public static final int DEFAULT_MAX_DEPTH = 512;

    /// Upper bound for `maxDepth`. Every nesting level costs two stack frames
    /// in the recursive descent and this keeps a full-depth run inside a
    /// default thread stack.
    public static final int MAX_DEPTH_LIMIT = 1024;

    private static final JsonValidatorConfig DEFAULTS = new JsonValidatorConfig(DEFAULT_MAX_DEPTH, false);

    public JsonValidatorConfig {
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
                "maxDepth must be between 1 and " + MAX_DEPTH_LIMIT + " but was " + maxDepth);
        }
    }

    /// {@return the default settings: depth 512, duplicate names allowed}
    public static JsonValidatorConfig defaults() {
        return DEFAULTS;
    }

    /// Reads [#MAX_DEPTH_PROPERTY] and [#REJECT_DUPLICATE_KEYS_PROPERTY],
    /// falling back to the defaults for properties that are not set.
    ///
    /// @throws IllegalArgumentException if a property is set to a malformed or out of range value
    public static JsonValidatorConfig fromSystemProperties() {
        int maxDepth = DEFAULT_MAX_DEPTH;
        final String depthProp = System.getProperty(MAX_DEPTH_PROPERTY);
        if (depthProp != null && !depthProp.isBlank()) {
            try {
                maxDepth = Integer.parseInt(depthProp.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    MAX_DEPTH_PROPERTY + " must be an integer but was '" + depthProp + "'", e);
            }
        }
        boolean rejectDuplicates = false;
        final String dupProp = System.getProperty(REJECT_DUPLICATE_KEYS_PROPERTY);
        if (dupProp != null && !dupProp.isBlank()) {
            rejectDuplicates = parseBoolean(REJECT_DUPLICATE_KEYS_PROPERTY, dupProp);
        }
        final var config = new JsonValidatorConfig(maxDepth, rejectDuplicates);
        LOG.config(() -> "Validator configuration from system properties: " + config);
        return config;
    }

    /// {@return a copy with the given depth limit}
    public JsonValidatorConfig withMaxDepth(int depth) {
        return new JsonValidatorConfig(depth, rejectDuplicateKeys);
    }

    /// {@return a copy with duplicate name rejection switched on or off}
    public JsonValidatorConfig withRejectDuplicateKeys(boolean reject) {
        return new JsonValidatorConfig(maxDepth, reject);
    }

    private static boolean parseBoolean(String name, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(name + " must be true or false but was '" + value + "'");
        };
    }
}
