package json.validator.cli;

import json.validator.JsonSyntaxException;
import json.validator.JsonToken;
import json.validator.JsonTokenType;
import json.validator.JsonTokenizer;

import java.io.PrintWriter;

/// Prints the token stream of a document, one token per line, in the form
/// `LINE:COLUMN TYPE [text]`. Stops at the end of input or at the first
/// lexical error, which is printed in place of the next token.
final class TokenDump {

    private TokenDump() {
    }

    /// {@return the number of tokens printed, not counting the end of input}
    static int print(String text, PrintWriter out) {
        final var tokenizer = new JsonTokenizer(text);
        int count = 0;
        try {
            JsonToken token;
            while ((token = tokenizer.next()).type() != JsonTokenType.END_OF_INPUT) {
                out.println(format(token));
                count++;
            }
            out.println(format(token));
        } catch (JsonSyntaxException e) {
            out.println("error: " + e.getMessage());
        }
        out.flush();
        return count;
    }

    static String format(JsonToken token) {
        final var where = token.position().line() + ":" + token.position().column();
        return switch (token.type()) {
            case STRING -> where + " " + token.type() + " \"" + token.text() + "\"";
            case NUMBER -> where + " " + token.type() + " " + token.text();
            default -> where + " " + token.type();
        };
    }
}
