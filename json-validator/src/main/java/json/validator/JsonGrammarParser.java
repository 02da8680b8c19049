package json.validator;

import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/// Recursive descent over the token stream of one document.
///
/// One method per grammar rule:
/// ```
/// value  := object | array | string | number | true | false | null
/// object := '{' ( member ( ',' member )* )? '}'
/// member := string ':' value
/// array  := '[' ( value ( ',' value )* )? ']'
/// ```
/// Tokens are pulled from the [JsonTokenizer] as the rules need them. Nesting
/// is bounded by [JsonValidatorConfig#maxDepth] and checked before descending,
/// so the Java stack never grows past that bound.
final class JsonGrammarParser {

    private static final Logger LOG = Logger.getLogger(JsonGrammarParser.class.getName());

    private final JsonTokenizer tokenizer;
    private final JsonValidatorConfig config;

    private JsonGrammarParser(JsonTokenizer tokenizer, JsonValidatorConfig config) {
        this.tokenizer = tokenizer;
        this.config = config;
    }

    /// Checks that the tokenizer's source holds exactly one JSON value.
    /// @throws JsonSyntaxException at the first lexical or grammar error
    static void parseDocument(JsonTokenizer tokenizer, JsonValidatorConfig config) {
        new JsonGrammarParser(tokenizer, config).parseRoot();
    }

    private void parseRoot() {
        final var first = tokenizer.peek();
        if (first.type() == JsonTokenType.END_OF_INPUT) {
            throw error(JsonValidationError.of(JsonErrorKind.UNEXPECTED_EOF, first.position(),
                "empty document, expected a value"));
        }
        parseValue(0, false);
        if (tokenizer.hasMoreInput()) {
            final var at = tokenizer.remainderPosition();
            final char c = tokenizer.source()[at.offset()];
            throw error(JsonValidationError.of(JsonErrorKind.TRAILING_DATA, at,
                "unexpected " + JsonTokenizer.describe(c) + " after the root value"));
        }
    }

    private void parseValue(int depth, boolean memberValue) {
        final var token = tokenizer.next();
        if (!token.type().startsValue()) {
            if (token.type() == JsonTokenType.END_OF_INPUT) {
                throw unexpectedEof(token, "a value");
            }
            if (memberValue) {
                throw error(JsonValidationError.expected(JsonErrorKind.EXPECTED_TOKEN, token.position(),
                    "value", token.describe()));
            }
            throw error(JsonValidationError.of(JsonErrorKind.UNEXPECTED_TOKEN, token.position(),
                "unexpected " + token.describe() + ", expected a value"));
        }
        switch (token.type()) {
            case OBJECT_OPEN -> parseObject(token, depth + 1);
            case ARRAY_OPEN -> parseArray(token, depth + 1);
            default -> {
                // scalar, nothing more to match
            }
        }
    }

    private void parseObject(JsonToken open, int depth) {
        enter(open, depth);
        final Set<String> names = config.rejectDuplicateKeys() ? new HashSet<>() : null;

        var token = tokenizer.next();
        if (token.type() == JsonTokenType.OBJECT_CLOSE) {
            return;
        }
        boolean afterComma = false;
        while (true) {
            if (token.type() == JsonTokenType.END_OF_INPUT) {
                throw unexpectedEof(token, "a member name");
            }
            if (afterComma && token.type() == JsonTokenType.OBJECT_CLOSE) {
                throw trailingComma(token);
            }
            if (token.type() != JsonTokenType.STRING) {
                throw error(JsonValidationError.expected(JsonErrorKind.EXPECTED_STRING, token.position(),
                    "a string member name", token.describe()));
            }
            if (names != null && !names.add(token.text())) {
                throw error(JsonValidationError.of(JsonErrorKind.DUPLICATE_KEY, token.position(),
                    "duplicate member name \"" + token.text() + "\""));
            }

            final var colon = tokenizer.next();
            if (colon.type() == JsonTokenType.END_OF_INPUT) {
                throw unexpectedEof(colon, "':'");
            }
            if (colon.type() != JsonTokenType.COLON) {
                throw error(JsonValidationError.expected(JsonErrorKind.EXPECTED_TOKEN, colon.position(),
                    "':'", colon.describe()));
            }

            parseValue(depth, true);

            final var separator = tokenizer.next();
            switch (separator.type()) {
                case COMMA -> {
                    token = tokenizer.next();
                    afterComma = true;
                }
                case OBJECT_CLOSE -> {
                    return;
                }
                case END_OF_INPUT -> throw unexpectedEof(separator, "',' or '}'");
                default -> throw error(JsonValidationError.expected(JsonErrorKind.EXPECTED_TOKEN,
                    separator.position(), "',' or '}'", separator.describe()));
            }
        }
    }

    private void parseArray(JsonToken open, int depth) {
        enter(open, depth);

        if (tokenizer.peek().type() == JsonTokenType.ARRAY_CLOSE) {
            tokenizer.next();
            return;
        }
        while (true) {
            parseValue(depth, false);

            final var separator = tokenizer.next();
            switch (separator.type()) {
                case COMMA -> {
                    final var following = tokenizer.peek();
                    if (following.type() == JsonTokenType.ARRAY_CLOSE) {
                        throw trailingComma(following);
                    }
                }
                case ARRAY_CLOSE -> {
                    return;
                }
                case END_OF_INPUT -> throw unexpectedEof(separator, "',' or ']'");
                default -> throw error(JsonValidationError.expected(JsonErrorKind.EXPECTED_TOKEN,
                    separator.position(), "',' or ']'", separator.describe()));
            }
        }
    }

    private void enter(JsonToken open, int depth) {
        if (depth > config.maxDepth()) {
            throw error(JsonValidationError.of(JsonErrorKind.TOO_DEEP, open.position(),
                "nesting depth exceeds the limit of " + config.maxDepth()));
        }
    }

    private JsonSyntaxException trailingComma(JsonToken closer) {
        return error(JsonValidationError.of(JsonErrorKind.UNEXPECTED_TOKEN, closer.position(),
            "trailing comma before " + closer.describe()));
    }

    private JsonSyntaxException unexpectedEof(JsonToken end, String expected) {
        return error(JsonValidationError.expected(JsonErrorKind.UNEXPECTED_EOF, end.position(),
            expected, end.describe()));
    }

    private JsonSyntaxException error(JsonValidationError error) {
        LOG.fine(() -> "Grammar error " + error.kind() + " at " + error.position() + ": " + error.detail());
        return new JsonSyntaxException(error, tokenizer.source());
    }
}
