package json.validator;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.logging.Logger;

/// Strict UTF-8 decoding of a byte source. Malformed or unmappable input is
/// reported, never replaced with U+FFFD.
final class Utf8SourceDecoder {

    private static final Logger LOG = Logger.getLogger(Utf8SourceDecoder.class.getName());

    private Utf8SourceDecoder() {
    }

    /// Decodes the whole input.
    ///
    /// @throws JsonSyntaxException with [JsonErrorKind#INVALID_ENCODING] at the
    ///         byte offset of the first malformed sequence
    static char[] decode(byte[] bytes) {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

        final ByteBuffer in = ByteBuffer.wrap(bytes);
        // UTF-8 never decodes to more chars than it has bytes
        final CharBuffer out = CharBuffer.allocate(bytes.length);

        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            final int byteOffset = in.position();
            out.flip();
            final var at = positionAfter(out, byteOffset);
            LOG.fine(() -> "Malformed UTF-8 at byte " + byteOffset);
            throw new JsonSyntaxException(JsonValidationError.of(JsonErrorKind.INVALID_ENCODING, at,
                "malformed UTF-8 sequence of " + result.length() + " byte(s) at byte offset " + byteOffset));
        }
        out.flip();
        return Arrays.copyOf(out.array(), out.limit());
    }

    /// Line and column of the char following the decoded prefix, with the byte offset kept as offset.
    private static JsonPosition positionAfter(CharBuffer decoded, int byteOffset) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < decoded.limit(); i++) {
            final char c = decoded.get(i);
            if (c == '\n' && i > 0 && decoded.get(i - 1) == '\r') {
                continue;
            }
            if (c == '\n' || c == '\r') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new JsonPosition(byteOffset, line, column);
    }
}
