package turtlefmt.writer;

import java.util.regex.Pattern;
import org.eclipse.rdf4j.common.text.ASCIIUtil;
import turtlefmt.writer.TurtleFormatException.ErrorKind;

/**
 * Canonical lexical forms of IRIs, strings and local names, and the Turtle grammar of bare
 * numeric literals.
 */
public final class LexicalNormalizer {
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    private static final Pattern DECIMAL = Pattern.compile("[+-]?[0-9]*\\.[0-9]+");

    private static final Pattern DOUBLE =
            Pattern.compile("[+-]?([0-9]+\\.[0-9]*|\\.[0-9]+|[0-9]+)[eE][+-]?[0-9]+");

    private static final String ILLEGAL_IRI_CHARACTERS = "<>\"{}|^`\\";

    private static final String LOCAL_ESCAPED_PUNCTUATION = "~!$&'()*+,;=/?#@%";

    /**
     * A string body ready to be written between {@code "} or {@code """} delimiters.
     */
    public record QuotedString(String body, boolean longForm) {
        @Override
        public String toString() {
            var quotes = longForm ? "\"\"\"" : "\"";

            return quotes + body + quotes;
        }
    }

    private LexicalNormalizer() {}

    public static boolean isBoolean(String value) {
        return "true".equals(value) || "false".equals(value);
    }

    public static boolean isInteger(String value) {
        return INTEGER.matcher(value).matches();
    }

    public static boolean isDecimal(String value) {
        return DECIMAL.matcher(value).matches();
    }

    public static boolean isDouble(String value) {
        return DOUBLE.matcher(value).matches();
    }

    /**
     * Decodes the escapes of an IRI reference (the text between {@code <} and {@code >}) and
     * rejects it if the result contains a character IRIs may not carry.
     */
    public static String normalizeIri(String raw) {
        var decoded = decodeEscapes(raw);

        decoded.codePoints().forEach(c -> {
            if (c <= 0x20 || ILLEGAL_IRI_CHARACTERS.indexOf(c) != -1) {
                throw new TurtleFormatException(ErrorKind.ILLEGAL_IRI_CHARACTER,
                        "The character " + describe(c) + " is not allowed in IRIs");
            }
        });

        return decoded;
    }

    /**
     * Normalizes a quoted string token, delimiters included. Single quoted forms are rewritten
     * with double quotes.
     */
    public static QuotedString normalizeString(String raw) {
        if (raw.startsWith("\"\"\"") || raw.startsWith("'''")) {
            return new QuotedString(encodeLongString(decodeEscapes(raw.substring(3,
                    raw.length() - 3))), true);
        }

        return new QuotedString(encodeString(decodeEscapes(raw.substring(1, raw.length() - 1))),
                false);
    }

    static String encodeString(String value) {
        var sb = new StringBuilder(value.length());

        value.codePoints().forEach(c -> {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\r' -> sb.append("\\r");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.appendCodePoint(c);
            }
        });

        return sb.toString();
    }

    static String encodeLongString(String value) {
        int end = value.length();

        while (end > 0 && value.charAt(end - 1) == '"') {
            end--;
        }

        var sb = new StringBuilder(value.length() + 8);
        int previousQuotes = 0;

        for (int i = 0; i < end;) {
            int c = value.codePointAt(i);
            i += Character.charCount(c);

            if (c == '"') {
                // a third quote in a row would close the string
                if (previousQuotes >= 2) {
                    sb.append("\\\"");
                    previousQuotes = 0;
                } else {
                    sb.append('"');
                    previousQuotes++;
                }
            } else if (c == '\\') {
                sb.append("\\\\");
                previousQuotes = 0;
            } else {
                sb.appendCodePoint(c);
                previousQuotes = 0;
            }
        }

        sb.append("\\\"".repeat(value.length() - end));

        return sb.toString();
    }

    /**
     * Rewrites the local part of a prefixed name with the minimal set of escapes: punctuation
     * stays escaped, {@code _} never is, {@code .} and {@code -} only in first position, and a
     * final {@code .} always is.
     */
    public static String normalizeLocalName(String local) {
        var sb = new StringBuilder(local.length());
        boolean inEscape = false;

        for (int i = 0; i < local.length();) {
            int c = local.codePointAt(i);
            i += Character.charCount(c);

            if (inEscape) {
                if (c == '_') {
                    sb.append('_');
                } else if (c == '.' || c == '-') {
                    if (sb.length() == 0) {
                        sb.append('\\');
                    }

                    sb.append((char) c);
                } else if (LOCAL_ESCAPED_PUNCTUATION.indexOf(c) != -1) {
                    sb.append('\\').append((char) c);
                } else {
                    throw new TurtleFormatException(ErrorKind.ILLEGAL_LOCAL_NAME_ESCAPE,
                            "Unexpected escape character \\" + new String(Character.toChars(c)));
                }

                inEscape = false;
            } else if (c == '\\') {
                inEscape = true;
            } else {
                sb.appendCodePoint(c);
            }
        }

        if (inEscape) {
            throw new TurtleFormatException(ErrorKind.ILLEGAL_LOCAL_NAME_ESCAPE,
                    "Unterminated escape at the end of local name " + local);
        }

        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '.'
                && !(sb.length() >= 2 && sb.charAt(sb.length() - 2) == '\\')) {
            sb.setLength(sb.length() - 1);
            sb.append("\\.");
        }

        return sb.toString();
    }

    /**
     * Decodes {@code ECHAR} and {@code UCHAR} escapes into the characters they stand for.
     */
    public static String decodeEscapes(String raw) {
        if (raw.indexOf('\\') == -1) {
            return raw;
        }

        var sb = new StringBuilder(raw.length());

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);

            if (c != '\\') {
                sb.append(c);
                continue;
            }

            if (i + 1 >= raw.length()) {
                throw new TurtleFormatException(ErrorKind.INVALID_STRING_ESCAPE,
                        "The escape sequence at the end of '" + raw + "' is incomplete");
            }

            char escaped = raw.charAt(++i);

            switch (escaped) {
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 'f' -> sb.append('\f');
                case '"' -> sb.append('"');
                case '\'' -> sb.append('\'');
                case '\\' -> sb.append('\\');
                case 'u', 'U' -> {
                    int length = escaped == 'u' ? 4 : 8;
                    sb.appendCodePoint(decodeUchar(raw, i - 1, length));
                    i += length;
                }
                default -> throw new TurtleFormatException(ErrorKind.INVALID_STRING_ESCAPE,
                        "The escaped character '\\" + escaped + "' is not valid");
            }
        }

        return sb.toString();
    }

    private static int decodeUchar(String raw, int escapeStart, int length) {
        int end = escapeStart + 2 + length;
        var sequence = raw.substring(escapeStart, Math.min(end, raw.length()));

        if (end > raw.length()) {
            throw new TurtleFormatException(ErrorKind.INVALID_UNICODE_ESCAPE,
                    "The escaped unicode character '" + sequence + "' is incomplete");
        }

        var digits = sequence.substring(2);

        if (!digits.chars().allMatch(ASCIIUtil::isHex)) {
            throw new TurtleFormatException(ErrorKind.INVALID_UNICODE_ESCAPE,
                    "The escaped unicode character '" + sequence + "' is not hexadecimal");
        }

        long codePoint = Long.parseLong(digits, 16);

        if (codePoint > Character.MAX_CODE_POINT
                || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
            throw new TurtleFormatException(ErrorKind.INVALID_UNICODE_ESCAPE,
                    "The escaped unicode character '" + sequence
                            + "' is not encoding a valid unicode character");
        }

        return (int) codePoint;
    }

    private static String describe(int c) {
        if (c <= 0x20) {
            return String.format("U+%04X", c);
        }

        return "'" + new String(Character.toChars(c)) + "'";
    }
}
