package json.validator;

import java.util.Objects;
import java.util.logging.Logger;

/// Pull-based scanner that turns JSON text into [JsonToken]s one at a time.
///
/// The tokenizer enforces the lexical rules of RFC 8259 only: it knows what a
/// string, number or keyword looks like but not where they may appear. It keeps
/// at most one token of lookahead, so memory use does not grow with the input.
///
/// Lexical errors are thrown as [JsonSyntaxException] at the first offending
/// character. After [JsonTokenType#END_OF_INPUT] has been returned every further
/// call returns it again.
public final class JsonTokenizer {

    private static final Logger LOG = Logger.getLogger(JsonTokenizer.class.getName());

    private final char[] source;

    private int pos;
    private int line;
    private int lineStart;
    private JsonToken peeked;

    /// Creates a tokenizer over the given text.
    /// @throws NullPointerException if `text` is null
    public JsonTokenizer(String text) {
        this(Objects.requireNonNull(text, "text must not be null").toCharArray());
    }

    /// Creates a tokenizer that takes ownership of `source`; the caller must not modify it afterwards.
    JsonTokenizer(char[] source) {
        this.source = source;
        reset();
    }

    /// Rewinds to the start of the source. The tokens produced afterwards are
    /// identical to the ones produced the first time.
    public void reset() {
        pos = 0;
        line = 1;
        lineStart = 0;
        peeked = null;
    }

    /// {@return the next token without consuming it}
    /// @throws JsonSyntaxException if the next token is lexically invalid
    public JsonToken peek() {
        if (peeked == null) {
            peeked = scan();
        }
        return peeked;
    }

    /// {@return the next token, consuming it}
    /// @throws JsonSyntaxException if the next token is lexically invalid
    public JsonToken next() {
        final var token = peek();
        if (token.type() != JsonTokenType.END_OF_INPUT) {
            peeked = null;
        }
        return token;
    }

    /// {@return the position of the next character that has not been scanned yet}
    public JsonPosition position() {
        return positionAt(pos);
    }

    /// Skips whitespace and reports whether any characters are left. Used to
    /// detect trailing data without scanning, so leftovers that would not
    /// even lex are still reported as trailing data.
    boolean hasMoreInput() {
        if (peeked != null) {
            return peeked.type() != JsonTokenType.END_OF_INPUT;
        }
        skipWhitespace();
        return pos < source.length;
    }

    /// Where the unconsumed input starts: the pending lookahead token if there
    /// is one, otherwise the cursor. Call after [#hasMoreInput()].
    JsonPosition remainderPosition() {
        return peeked != null ? peeked.position() : position();
    }

    char[] source() {
        return source;
    }

    private JsonToken scan() {
        skipWhitespace();
        final var start = position();
        if (pos >= source.length) {
            return token(JsonTokenType.END_OF_INPUT, "", start);
        }
        final char c = source[pos];
        return switch (c) {
            case '{' -> single(JsonTokenType.OBJECT_OPEN, start);
            case '}' -> single(JsonTokenType.OBJECT_CLOSE, start);
            case '[' -> single(JsonTokenType.ARRAY_OPEN, start);
            case ']' -> single(JsonTokenType.ARRAY_CLOSE, start);
            case ':' -> single(JsonTokenType.COLON, start);
            case ',' -> single(JsonTokenType.COMMA, start);
            case '"' -> scanString(start);
            case 't' -> scanKeyword("true", JsonTokenType.TRUE, start);
            case 'f' -> scanKeyword("false", JsonTokenType.FALSE, start);
            case 'n' -> scanKeyword("null", JsonTokenType.NULL, start);
            case '-', '+', '.', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> scanNumber(start);
            default -> throw error(JsonErrorKind.UNEXPECTED_CHARACTER, start, "unexpected character " + describe(c));
        };
    }

    private JsonToken single(JsonTokenType type, JsonPosition start) {
        final var text = String.valueOf(source[pos]);
        pos++;
        return token(type, text, start);
    }

    private JsonToken token(JsonTokenType type, String text, JsonPosition start) {
        final var token = new JsonToken(type, text, start);
        LOG.finer(() -> "Scanned " + token);
        return token;
    }

    private void skipWhitespace() {
        while (pos < source.length) {
            final char c = source[pos];
            if (c == ' ' || c == '\t') {
                pos++;
            } else if (c == '\n') {
                pos++;
                line++;
                lineStart = pos;
            } else if (c == '\r') {
                pos++;
                if (pos < source.length && source[pos] == '\n') {
                    pos++;
                }
                line++;
                lineStart = pos;
            } else {
                return;
            }
        }
    }

    private JsonToken scanString(JsonPosition start) {
        pos++; // opening quote
        final var value = new StringBuilder();
        while (true) {
            if (pos >= source.length) {
                throw error(JsonErrorKind.INVALID_STRING, start, "unterminated string");
            }
            final char c = source[pos];
            if (c == '"') {
                pos++;
                return token(JsonTokenType.STRING, value.toString(), start);
            }
            if (c == '\\') {
                scanEscape(value);
            } else if (c < 0x20) {
                throw error(JsonErrorKind.INVALID_STRING, positionAt(pos),
                    "unescaped control character " + describe(c) + " in string");
            } else if (Character.isHighSurrogate(c)) {
                if (pos + 1 >= source.length || !Character.isLowSurrogate(source[pos + 1])) {
                    throw error(JsonErrorKind.INVALID_ENCODING, positionAt(pos), "unpaired high surrogate in string");
                }
                value.append(c).append(source[pos + 1]);
                pos += 2;
            } else if (Character.isLowSurrogate(c)) {
                throw error(JsonErrorKind.INVALID_ENCODING, positionAt(pos), "unpaired low surrogate in string");
            } else {
                value.append(c);
                pos++;
            }
        }
    }

    private void scanEscape(StringBuilder value) {
        final var escapeStart = positionAt(pos);
        pos++; // backslash
        if (pos >= source.length) {
            throw error(JsonErrorKind.INVALID_STRING, escapeStart, "unterminated escape sequence");
        }
        final char c = source[pos++];
        switch (c) {
            case '"' -> value.append('"');
            case '\\' -> value.append('\\');
            case '/' -> value.append('/');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'n' -> value.append('\n');
            case 'r' -> value.append('\r');
            case 't' -> value.append('\t');
            case 'u' -> {
                int codeUnit = 0;
                for (int i = 0; i < 4; i++) {
                    final int digit = pos < source.length ? hexValue(source[pos]) : -1;
                    if (digit < 0) {
                        throw error(JsonErrorKind.INVALID_STRING, escapeStart,
                            "unicode escape needs exactly four hex digits");
                    }
                    codeUnit = (codeUnit << 4) | digit;
                    pos++;
                }
                value.append((char) codeUnit);
            }
            default -> throw error(JsonErrorKind.INVALID_STRING, escapeStart,
                "invalid escape sequence '\\" + (c < 0x20 ? String.format("U+%04X", (int) c) : String.valueOf(c)) + "'");
        }
    }

    private JsonToken scanKeyword(String keyword, JsonTokenType type, JsonPosition start) {
        for (int i = 0; i < keyword.length(); i++) {
            if (pos >= source.length || source[pos] != keyword.charAt(i)) {
                throw error(JsonErrorKind.UNEXPECTED_CHARACTER, positionAt(pos),
                    "invalid literal, expected '" + keyword + "'");
            }
            pos++;
        }
        if (pos < source.length && isWordPart(source[pos])) {
            throw error(JsonErrorKind.UNEXPECTED_CHARACTER, positionAt(pos),
                "unexpected character " + describe(source[pos]) + " after '" + keyword + "'");
        }
        return token(type, keyword, start);
    }

    /// Consumes the longest run of characters that can occur in a number and
    /// then checks it against `-?(0|[1-9][0-9]*)(\.[0-9]+)?([eE][+-]?[0-9]+)?`.
    private JsonToken scanNumber(JsonPosition start) {
        final int begin = pos;
        while (pos < source.length && isNumberPart(source[pos])) {
            pos++;
        }
        final var lexeme = new String(source, begin, pos - begin);
        final int end = lexeme.length();
        int i = 0;
        if (lexeme.charAt(i) == '-') {
            i++;
        }
        if (i == end || !isDigit(lexeme.charAt(i))) {
            throw numberError(start, i, i == 0 ? "number must start with a digit or '-'" : "expected digit after '-'");
        }
        if (lexeme.charAt(i) == '0') {
            i++;
            if (i < end && isDigit(lexeme.charAt(i))) {
                throw numberError(start, i - 1, "leading zeros are not allowed");
            }
        } else {
            i = skipDigits(lexeme, i);
        }
        if (i < end && lexeme.charAt(i) == '.') {
            i++;
            if (i == end || !isDigit(lexeme.charAt(i))) {
                throw numberError(start, i, "expected digit after decimal point");
            }
            i = skipDigits(lexeme, i);
        }
        if (i < end && (lexeme.charAt(i) == 'e' || lexeme.charAt(i) == 'E')) {
            i++;
            if (i < end && (lexeme.charAt(i) == '+' || lexeme.charAt(i) == '-')) {
                i++;
            }
            if (i == end || !isDigit(lexeme.charAt(i))) {
                throw numberError(start, i, "expected digit in exponent");
            }
            i = skipDigits(lexeme, i);
        }
        if (i != end) {
            throw numberError(start, i, "unexpected character '" + lexeme.charAt(i) + "' in number");
        }
        return token(JsonTokenType.NUMBER, lexeme, start);
    }

    private JsonSyntaxException numberError(JsonPosition start, int index, String detail) {
        // numbers never span lines
        final var at = new JsonPosition(start.offset() + index, start.line(), start.column() + index);
        return error(JsonErrorKind.INVALID_NUMBER, at, detail);
    }

    private static int skipDigits(String s, int i) {
        while (i < s.length() && isDigit(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private JsonPosition positionAt(int offset) {
        return new JsonPosition(offset, line, offset - lineStart + 1);
    }

    private JsonSyntaxException error(JsonErrorKind kind, JsonPosition at, String detail) {
        LOG.fine(() -> "Lexical error " + kind + " at " + at + ": " + detail);
        return new JsonSyntaxException(JsonValidationError.of(kind, at, detail), source);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static boolean isNumberPart(char c) {
        return isDigit(c) || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    static String describe(char c) {
        if (c < 0x20 || c == 0x7F || Character.isSurrogate(c)) {
            return String.format("U+%04X", (int) c);
        }
        return "'" + c + "'";
    }
}
