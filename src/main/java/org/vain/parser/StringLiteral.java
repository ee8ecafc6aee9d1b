package org.vain.parser;

import java.util.Locale;

/**
 * Decoding and encoding of string literals, following Vim's {@code expr-quote}
 * and {@code literal-string} rules.
 * <p>
 * Single-quoted strings only know {@code ''} for a quote. Double-quoted strings
 * know backslash escapes: {@code \b \e \f \n \r \t \\ \"}, {@code \x} with up to
 * two hex digits, <code>&#92;u</code> with up to four, octal with up to three
 * digits and special keys {@code \<Key>}. An unknown escape stands for the
 * escaped character.
 * <p>
 * Key notation decodes to the byte the key sends: {@code \<C-W>} is 0x17,
 * {@code \<Esc>} is 0x1b. Keys without a single-byte code (function keys,
 * cursor keys, Shift or Alt combinations) are kept as text.
 */
public final class StringLiteral {

    private StringLiteral() {
    }

    /**
     * Returns the value of a quoted literal.
     *
     * @param literal the literal including its quotes
     * @return the decoded value
     * @throws IllegalArgumentException if the literal is not properly quoted
     */
    public static String eval(String literal) {
        if (literal.length() < 2) {
            throw new IllegalArgumentException("missing quote");
        }
        char quote = literal.charAt(0);
        if ((quote != '\'' && quote != '"') || literal.charAt(literal.length() - 1) != quote) {
            throw new IllegalArgumentException("missing quote");
        }
        String body = literal.substring(1, literal.length() - 1);
        if (quote == '\'') {
            return body.replace("''", "'");
        }
        return evalDoubleQuoted(body);
    }

    private static String evalDoubleQuoted(String body) {
        StringBuilder result = new StringBuilder();
        int i = 0;
        int len = body.length();
        while (i < len) {
            char c = body.charAt(i++);
            if (c != '\\') {
                result.append(c);
                continue;
            }
            if (i >= len) {
                throw new IllegalArgumentException("missing quote");
            }
            char e = body.charAt(i++);
            switch (e) {
                case 'b':
                    result.append('\b');
                    break;
                case 'e':
                    result.append('\u001B');
                    break;
                case 'f':
                    result.append('\f');
                    break;
                case 'n':
                    result.append('\n');
                    break;
                case 'r':
                    result.append('\r');
                    break;
                case 't':
                    result.append('\t');
                    break;
                case 'x':
                case 'X':
                case 'u':
                case 'U': {
                    int max = (e == 'x' || e == 'X') ? 2 : 4;
                    int start = i;
                    while (i < len && i - start < max && Character.digit(body.charAt(i), 16) >= 0) {
                        i++;
                    }
                    if (i == start) {
                        // "\x" is "x"
                        result.append(e);
                    } else {
                        result.appendCodePoint(Integer.parseInt(body.substring(start, i), 16));
                    }
                    break;
                }
                case '0':
                case '1':
                case '2':
                case '3':
                case '4':
                case '5':
                case '6':
                case '7': {
                    int start = i - 1;
                    while (i < len && i - start < 3 && body.charAt(i) >= '0' && body.charAt(i) <= '7') {
                        i++;
                    }
                    result.append((char) Integer.parseInt(body.substring(start, i), 8));
                    break;
                }
                case '<': {
                    int close = body.indexOf('>', i);
                    int code = close < 0 ? -1 : keyCode(body.substring(i, close));
                    if (close < 0) {
                        result.append('<');
                    } else if (code < 0) {
                        result.append(body, i - 1, close + 1);
                        i = close + 1;
                    } else {
                        result.append((char) code);
                        i = close + 1;
                    }
                    break;
                }
                default:
                    result.append(e);
            }
        }
        return result.toString();
    }

    /**
     * Returns the byte sent by the key named inside {@code <...>}, or -1 when
     * the key has no single-byte code.
     */
    static int keyCode(String name) {
        if (name.length() == 3 && (name.charAt(0) == 'C' || name.charAt(0) == 'c') && name.charAt(1) == '-') {
            char key = name.charAt(2);
            if (key == '?') {
                return 0x7F;
            }
            char upper = Character.toUpperCase(key);
            if (upper >= '@' && upper <= '_') {
                return upper & 0x1F;
            }
            return -1;
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "esc":
                return 0x1B;
            case "cr":
            case "return":
            case "enter":
                return '\r';
            case "nl":
            case "lf":
            case "linefeed":
                return '\n';
            case "tab":
                return '\t';
            case "bs":
            case "backspace":
                return '\b';
            case "space":
                return ' ';
            case "lt":
                return '<';
            case "bslash":
                return '\\';
            case "bar":
                return '|';
            default:
                return -1;
        }
    }

    /**
     * Returns a literal whose value is {@code value}.
     * Single quotes are used unless the value holds control characters.
     */
    public static String uneval(String value) {
        boolean printable = true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                printable = false;
                break;
            }
        }
        if (printable) {
            return "'" + value.replace("'", "''") + "'";
        }
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }
}
