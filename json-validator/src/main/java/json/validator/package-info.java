/// Strict validation of JSON text as defined by RFC 8259.
///
/// [json.validator.JsonValidator] is the entry point. It pulls
/// [json.validator.JsonToken]s from a [json.validator.JsonTokenizer] and
/// matches them against the JSON grammar by recursive descent, stopping at the
/// first error. The outcome is a [json.validator.JsonValidationResult].
///
/// ## Error kinds
///
/// | Kind | Raised when |
/// |------|-------------|
/// | `UNEXPECTED_CHARACTER` | a character cannot start a token, or a keyword is misspelt |
/// | `INVALID_STRING` | bad escape, raw control character or missing closing quote |
/// | `INVALID_NUMBER` | a number does not match `-?(0\|[1-9][0-9]*)(\.[0-9]+)?([eE][+-]?[0-9]+)?` |
/// | `INVALID_ENCODING` | malformed UTF-8 bytes, or an unpaired surrogate inside a string |
/// | `UNEXPECTED_TOKEN` | a token that no rule allows here, including a trailing comma |
/// | `EXPECTED_TOKEN` | a missing `:`, member value, `,` or closer |
/// | `EXPECTED_STRING` | an object member name that is not a string |
/// | `UNEXPECTED_EOF` | the input ends before the root value is complete |
/// | `TRAILING_DATA` | anything but whitespace after the root value |
/// | `TOO_DEEP` | nesting beyond [json.validator.JsonValidatorConfig#maxDepth()] |
/// | `DUPLICATE_KEY` | a repeated member name, when duplicate rejection is on |
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
package json.validator;
