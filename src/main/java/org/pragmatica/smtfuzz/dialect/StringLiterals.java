package org.pragmatica.smtfuzz.dialect;

/**
 * Escaping rules for string literals, per dialect.
 *
 * <p>{@link #decode} receives the raw text between the opening and closing
 * quotes exactly as the lexer found it; {@link #encode} produces the complete
 * quoted literal. For every dialect {@code decode(body(encode(v))) == v}.
 * Malformed escape sequences decode to their literal characters.
 */
public final class StringLiterals {
    private static final int MAX_BRACED_HEX_DIGITS = 5;
    private static final int MAX_BRACED_CODE_POINT = 0xFFFFF;

    private StringLiterals() {}

    public static String encode(String value, Dialect dialect) {
        var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        switch (dialect) {
            case SMT20 -> encodeBackslash(value, sb);
            case SMT25 -> encodeHex(value, sb);
            case SMT26 -> encodeUnicode(value, sb);
        }
        return sb.append('"').toString();
    }

    public static String decode(String body, Dialect dialect) {
        return switch (dialect) {
            case SMT20 -> decodeBackslash(body);
            case SMT25 -> decodeHex(body);
            case SMT26 -> decodeUnicode(body);
        };
    }

    /**
     * Whether the lexer must treat {@code \"} as an escaped quote rather than {@code ""}.
     */
    public static boolean usesBackslashQuotes(Dialect dialect) {
        return dialect == Dialect.SMT20;
    }

    private static void encodeBackslash(String value, StringBuilder sb) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case 0x0B -> sb.append("\\v");
                case '\f' -> sb.append("\\f");
                case 0x07 -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                default -> appendByteOrChar(c, sb);
            }
        }
    }

    private static void encodeHex(String value, StringBuilder sb) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\"\"");
                case '\\' -> sb.append("\\\\");
                default -> appendByteOrChar(c, sb);
            }
        }
    }

    private static void appendByteOrChar(char c, StringBuilder sb) {
        if (c < 0x20 || (c >= 0x7F && c <= 0xFF)) {
            sb.append(String.format("\\x%02x", (int) c));
        } else {
            sb.append(c);
        }
    }

    private static void encodeUnicode(String value, StringBuilder sb) {
        value.codePoints()
             .forEach(cp -> {
                 if (cp == '"') {
                     sb.append("\"\"");
                 } else if (cp > MAX_BRACED_CODE_POINT) {
                     appendBraced(Character.highSurrogate(cp), sb);
                     appendBraced(Character.lowSurrogate(cp), sb);
                 } else if (cp == '\\' || cp < 0x20 || cp > 0x7E) {
                     appendBraced(cp, sb);
                 } else {
                     sb.append((char) cp);
                 }
             });
    }

    private static void appendBraced(int cp, StringBuilder sb) {
        sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
    }

    private static String decodeBackslash(String body) {
        var sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char escaped = body.charAt(i + 1);
            int named = namedEscape(escaped);
            if (named >= 0) {
                sb.append((char) named);
                i += 2;
            } else if (escaped == '"') {
                sb.append('"');
                i += 2;
            } else if (escaped == 'x' && isHex(body, i + 2, 2)) {
                sb.append((char) Integer.parseInt(body.substring(i + 2, i + 4), 16));
                i += 4;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static String decodeHex(String body) {
        var sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '"' && i + 1 < body.length() && body.charAt(i + 1) == '"') {
                sb.append('"');
                i += 2;
                continue;
            }
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char escaped = body.charAt(i + 1);
            int named = namedEscape(escaped);
            if (named >= 0) {
                sb.append((char) named);
                i += 2;
            } else if (escaped == 'x' && isHex(body, i + 2, 2)) {
                sb.append((char) Integer.parseInt(body.substring(i + 2, i + 4), 16));
                i += 4;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static String decodeUnicode(String body) {
        var sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '"' && i + 1 < body.length() && body.charAt(i + 1) == '"') {
                sb.append('"');
                i += 2;
                continue;
            }
            if (c == '\\' && i + 1 < body.length() && body.charAt(i + 1) == 'u') {
                int consumed = decodeUnicodeEscape(body, i, sb);
                if (consumed > 0) {
                    i += consumed;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /**
     * Decode a braced (1 to 5 hex digits) or four-digit unicode escape at {@code start}; returns the characters consumed, or 0.
     */
    private static int decodeUnicodeEscape(String body, int start, StringBuilder sb) {
        int digitsStart = start + 2;
        if (digitsStart < body.length() && body.charAt(digitsStart) == '{') {
            int close = body.indexOf('}', digitsStart);
            int digits = close - digitsStart - 1;
            if (close < 0 || digits < 1 || digits > MAX_BRACED_HEX_DIGITS || !isHex(body, digitsStart + 1, digits)) {
                return 0;
            }
            int cp = Integer.parseInt(body.substring(digitsStart + 1, close), 16);
            if (!Character.isValidCodePoint(cp)) {
                return 0;
            }
            sb.appendCodePoint(cp);
            return close + 1 - start;
        }
        if (isHex(body, digitsStart, 4)) {
            sb.append((char) Integer.parseInt(body.substring(digitsStart, digitsStart + 4), 16));
            return 6;
        }
        return 0;
    }

    private static int namedEscape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case 'v' -> 0x0B;
            case 'f' -> '\f';
            case 'a' -> 0x07;
            case 'b' -> '\b';
            case '\\' -> '\\';
            default -> -1;
        };
    }

    private static boolean isHex(String text, int from, int count) {
        if (from + count > text.length()) {
            return false;
        }
        for (int i = from; i < from + count; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
