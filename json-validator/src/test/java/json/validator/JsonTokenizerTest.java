package json.validator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static json.validator.JsonTokenType.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for JsonTokenizer - lexical rules only, no grammar.
class JsonTokenizerTest extends JsonValidatorTestBase {

    private static List<JsonToken> tokens(String text) {
        final var tokenizer = new JsonTokenizer(text);
        final var result = new ArrayList<JsonToken>();
        JsonToken token;
        do {
            token = tokenizer.next();
            result.add(token);
        } while (token.type() != END_OF_INPUT);
        return result;
    }

    private static List<JsonTokenType> types(String text) {
        return tokens(text).stream().map(JsonToken::type).toList();
    }

    private static JsonValidationError lexError(String text) {
        final var tokenizer = new JsonTokenizer(text);
        try {
            while (tokenizer.next().type() != END_OF_INPUT) {
                // drain
            }
        } catch (JsonSyntaxException e) {
            return e.error();
        }
        throw new AssertionError("expected a lexical error for: " + text);
    }

    // ========== Token types ==========

    @Test
    void testAllTokenTypes() {
        assertThat(types("{\"a\": [1, -2.5e+3, true, false, null]}")).containsExactly(
            OBJECT_OPEN, STRING, COLON, ARRAY_OPEN, NUMBER, COMMA, NUMBER, COMMA,
            TRUE, COMMA, FALSE, COMMA, NULL, ARRAY_CLOSE, OBJECT_CLOSE, END_OF_INPUT);
    }

    @Test
    void testTokenizerIgnoresGrammar() {
        // structurally nonsense but lexically fine
        assertThat(types("}:, ] [ {")).containsExactly(
            OBJECT_CLOSE, COLON, COMMA, ARRAY_CLOSE, ARRAY_OPEN, OBJECT_OPEN, END_OF_INPUT);
    }

    @Test
    void testEmptyInputIsOnlyEndOfInput() {
        assertThat(types("")).containsExactly(END_OF_INPUT);
        assertThat(types(" \t\r\n")).containsExactly(END_OF_INPUT);
    }

    @Test
    void testEndOfInputRepeats() {
        final var tokenizer = new JsonTokenizer("1");
        assertThat(tokenizer.next().type()).isEqualTo(NUMBER);
        final var end = tokenizer.next();
        assertThat(end.type()).isEqualTo(END_OF_INPUT);
        assertThat(tokenizer.next()).isEqualTo(end);
    }

    // ========== Positions ==========

    @Test
    void testPositionsAcrossLineBreaks() {
        final var tokens = tokens("[\n  1,\r\n 2]");
        assertThat(tokens.get(0).position()).isEqualTo(new JsonPosition(0, 1, 1));
        assertThat(tokens.get(1).position()).isEqualTo(new JsonPosition(4, 2, 3));
        assertThat(tokens.get(2).position()).isEqualTo(new JsonPosition(5, 2, 4));
        assertThat(tokens.get(3).position()).isEqualTo(new JsonPosition(9, 3, 2));
        assertThat(tokens.get(4).position()).isEqualTo(new JsonPosition(10, 3, 3));
        assertThat(tokens.get(5).position()).isEqualTo(new JsonPosition(11, 3, 4));
    }

    @Test
    void testLoneCarriageReturnIsALineBreak() {
        final var tokens = tokens("1\r2");
        assertThat(tokens.get(1).position()).isEqualTo(new JsonPosition(2, 2, 1));
    }

    // ========== Strings ==========

    @Test
    void testStringEscapesAreDecoded() {
        final var token = tokens("\"\\\"\\\\\\/\\b\\f\\n\\r\\t\\u0041\\u00e9\\u00C9\"").get(0);
        assertThat(token.type()).isEqualTo(STRING);
        assertThat(token.text()).isEqualTo("\"\\/\b\f\n\r\tA\u00e9\u00c9");
    }

    @Test
    void testEscapedSurrogatesAreAccepted() {
        final var token = tokens("\"\\uD834\\uDD1E \\uDEAD\"").get(0);
        assertThat(token.text()).hasSize(4);
        assertThat(token.text().codePointAt(0)).isEqualTo(0x1D11E);
    }

    @Test
    void testNonAsciiCharactersPassThrough() {
        assertThat(tokens("\"h\u00e9llo \u4e16\u754c \ud83d\ude00\"").get(0).text())
            .isEqualTo("h\u00e9llo \u4e16\u754c \ud83d\ude00");
    }

    @Test
    void testUnterminatedString() {
        final var error = lexError("\"abc");
        assertThat(error.kind()).isEqualTo(JsonErrorKind.INVALID_STRING);
        assertThat(error.position()).isEqualTo(new JsonPosition(0, 1, 1));
        assertThat(error.detail()).isEqualTo("unterminated string");
    }

    @Test
    void testShortUnicodeEscape() {
        final var error = lexError("\"\\u12\"");
        assertThat(error.kind()).isEqualTo(JsonErrorKind.INVALID_STRING);
        assertThat(error.position().offset()).isEqualTo(1);
        assertThat(error.detail()).contains("four hex digits");
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"\\x\"", "\"\\a\"", "\"\\U0041\"", "\"\\u00G1\"", "\"\\'\"", "\"abc\\", "\"\\u12"})
    void testInvalidEscapes(String text) {
        LOG.info(() -> "invalid escape: " + text);
        assertThat(lexError(text).kind()).isEqualTo(JsonErrorKind.INVALID_STRING);
    }

    @Test
    void testRawControlCharacterInString() {
        final var error = lexError("\"a\tb\"");
        assertThat(error.kind()).isEqualTo(JsonErrorKind.INVALID_STRING);
        assertThat(error.position().offset()).isEqualTo(2);
        assertThat(error.detail()).contains("U+0009");
    }

    @Test
    void testRawNewlineInString() {
        assertThat(lexError("\"a\nb\"").kind()).isEqualTo(JsonErrorKind.INVALID_STRING);
    }

    @Test
    void testDeleteCharacterIsAllowedInString() {
        assertThat(tokens("\"\u007f\"").get(0).text()).isEqualTo("\u007f");
    }

    @Test
    void testUnpairedSurrogatesInString() {
        final String loneHigh = "\"a" + (char) 0xD800 + "b\"";
        final String loneLow = "\"" + (char) 0xDC00 + "\"";
        assertThat(lexError(loneHigh).kind()).isEqualTo(JsonErrorKind.INVALID_ENCODING);
        assertThat(lexError(loneHigh).position().offset()).isEqualTo(2);
        assertThat(lexError(loneLow).kind()).isEqualTo(JsonErrorKind.INVALID_ENCODING);
    }

    // ========== Numbers ==========

    @ParameterizedTest
    @ValueSource(strings = {"0", "-0", "12", "1.5", "-0.25", "1e10", "1E-2", "2e+7", "-0.0e+0",
        "123456789012345678901234567890", "1.7976931348623157e309"})
    void testValidNumbers(String text) {
        final var token = tokens(text).get(0);
        assertThat(token.type()).isEqualTo(NUMBER);
        assertThat(token.text()).isEqualTo(text);
    }

    @ParameterizedTest
    @ValueSource(strings = {"01", "-01", "00", "-", "1.", "1e", "1e+", "1E-", ".5", "+1", "-.5",
        "1.2.3", "1-2", "--1", "1.e5", "1ee5", "0.1e1.0"})
    void testInvalidNumbers(String text) {
        LOG.info(() -> "invalid number: " + text);
        assertThat(lexError(text).kind()).isEqualTo(JsonErrorKind.INVALID_NUMBER);
    }

    @Test
    void testLeadingZeroReportsTheZero() {
        final var error = lexError("[ 012]");
        assertThat(error.kind()).isEqualTo(JsonErrorKind.INVALID_NUMBER);
        assertThat(error.position()).isEqualTo(new JsonPosition(2, 1, 3));
        assertThat(error.detail()).isEqualTo("leading zeros are not allowed");
    }

    @Test
    void testMissingFractionDigitReportsPositionInsideNumber() {
        final var error = lexError("12.");
        assertThat(error.position()).isEqualTo(new JsonPosition(3, 1, 4));
        assertThat(error.detail()).isEqualTo("expected digit after decimal point");
    }

    @Test
    void testNumberStopsAtNonNumberCharacter() {
        assertThat(types("12,3]")).containsExactly(NUMBER, COMMA, NUMBER, ARRAY_CLOSE, END_OF_INPUT);
    }

    // ========== Keywords ==========

    @Test
    void testKeywordsAreWholeTokens() {
        assertThat(types("true false null")).containsExactly(TRUE, FALSE, NULL, END_OF_INPUT);
        assertThat(types("[true,null]")).containsExactly(ARRAY_OPEN, TRUE, COMMA, NULL, ARRAY_CLOSE, END_OF_INPUT);
    }

    @Test
    void testKeywordFollowedByLetter() {
        final var error = lexError("truex");
        assertThat(error.kind()).isEqualTo(JsonErrorKind.UNEXPECTED_CHARACTER);
        assertThat(error.position().offset()).isEqualTo(4);
    }

    @ParameterizedTest
    @ValueSource(strings = {"tru", "nul", "fals", "True", "NULL", "nil", "trUe", "null1", "false_"})
    void testMisspeltKeywords(String text) {
        LOG.info(() -> "misspelt keyword: " + text);
        assertThat(lexError(text).kind()).isEqualTo(JsonErrorKind.UNEXPECTED_CHARACTER);
    }

    // ========== Unexpected characters ==========

    @ParameterizedTest
    @ValueSource(strings = {"@", "'a'", "undefined", "NaN", "Infinity", "\u00a0", "\f", "\u000b", "/* */", "#"})
    void testUnexpectedCharacters(String text) {
        LOG.info(() -> "unexpected character in: " + text);
        final var error = lexError(text);
        assertThat(error.kind()).isEqualTo(JsonErrorKind.UNEXPECTED_CHARACTER);
        assertThat(error.position().offset()).isZero();
    }

    @Test
    void testByteOrderMarkIsNotWhitespace() {
        assertThat(lexError("\ufeff{}").kind()).isEqualTo(JsonErrorKind.UNEXPECTED_CHARACTER);
    }

    // ========== Cursor behaviour ==========

    @Test
    void testPeekDoesNotConsume() {
        final var tokenizer = new JsonTokenizer("[1]");
        final var peeked = tokenizer.peek();
        assertThat(tokenizer.peek()).isSameAs(peeked);
        assertThat(tokenizer.next()).isSameAs(peeked);
        assertThat(tokenizer.next().type()).isEqualTo(NUMBER);
    }

    @Test
    void testResetReproducesTheSameTokens() {
        final var text = "{\"k\": [1.5e3, \"v\\n\", null]}\n";
        final var tokenizer = new JsonTokenizer(text);
        final var first = new ArrayList<JsonToken>();
        JsonToken token;
        while ((token = tokenizer.next()).type() != END_OF_INPUT) {
            first.add(token);
        }
        tokenizer.reset();
        final var second = new ArrayList<JsonToken>();
        while ((token = tokenizer.next()).type() != END_OF_INPUT) {
            second.add(token);
        }
        assertThat(second).isEqualTo(first);
        assertThat(first).hasSize(11);
    }

    @Test
    void testRemainderStartsAtPendingLookahead() {
        final var tokenizer = new JsonTokenizer("1 2");
        tokenizer.next();
        assertThat(tokenizer.remainderPosition()).isEqualTo(new JsonPosition(1, 1, 2));
        final var pending = tokenizer.peek();
        assertThat(tokenizer.position().offset()).isEqualTo(3);
        assertThat(tokenizer.hasMoreInput()).isTrue();
        assertThat(tokenizer.remainderPosition()).isEqualTo(pending.position());
        assertThat(tokenizer.remainderPosition()).isEqualTo(new JsonPosition(2, 1, 3));
    }

    @Test
    void testRemainderAtEndOfInput() {
        final var tokenizer = new JsonTokenizer("[]  ");
        tokenizer.next();
        tokenizer.next();
        assertThat(tokenizer.hasMoreInput()).isFalse();
        assertThat(tokenizer.remainderPosition().offset()).isEqualTo(4);
    }

    @Test
    void testOnlyValueTokensStartValues() {
        assertThat(List.of(JsonTokenType.values()).stream().filter(JsonTokenType::startsValue).toList())
            .containsExactlyInAnyOrder(OBJECT_OPEN, ARRAY_OPEN, STRING, NUMBER, TRUE, FALSE, NULL);
    }

    @Test
    void testErrorMessageQuotesTheOffendingCharacter() {
        assertThatThrownBy(() -> new JsonTokenizer("  @").next())
            .isInstanceOf(JsonSyntaxException.class)
            .hasMessageContaining("UNEXPECTED_CHARACTER")
            .hasMessageContaining("line 1, column 3")
            .hasMessageContaining("near '@'");
    }

    @Test
    void testNullTextIsRejected() {
        assertThatThrownBy(() -> new JsonTokenizer((String) null))
            .isInstanceOf(NullPointerException.class);
    }
}
