package json.validator;

/// The lexical categories of RFC 8259 JSON text.
public enum JsonTokenType {
    OBJECT_OPEN("'{'"),
    OBJECT_CLOSE("'}'"),
    ARRAY_OPEN("'['"),
    ARRAY_CLOSE("']'"),
    COLON("':'"),
    COMMA("','"),
    STRING("string"),
    NUMBER("number"),
    TRUE("'true'"),
    FALSE("'false'"),
    NULL("'null'"),
    END_OF_INPUT("end of input");

    private final String description;

    JsonTokenType(String description) {
        this.description = description;
    }

    /// {@return a short human-readable name used in diagnostics}
    public String description() {
        return description;
    }

    /// {@return true if a token of this type can start a JSON value}
    public boolean startsValue() {
        return switch (this) {
            case OBJECT_OPEN, ARRAY_OPEN, STRING, NUMBER, TRUE, FALSE, NULL -> true;
            default -> false;
        };
    }
}
