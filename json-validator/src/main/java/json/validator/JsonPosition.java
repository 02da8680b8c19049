package json.validator;

/// A location in the validated source.
///
/// `offset` is the 0-based index of the char in the source buffer. When the
/// source was handed over as bytes and could not be decoded it is the byte
/// offset of the first malformed sequence instead. `line` and `column` are
/// 1-based.
public record JsonPosition(int offset, int line, int column) {

    /// The position of the first character of any source.
    public static final JsonPosition START = new JsonPosition(0, 1, 1);

    public JsonPosition {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based: " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column + " (offset " + offset + ")";
    }
}
