package org.pragmatica.latex.util;

/**
 * Text helpers for listings. Lengths are counted in code points.
 */
public final class Texts {
    private static final String ELLIPSIS = "[...]";

    private Texts() {}

    /**
     * Quoted literal in the style of Python's {@code repr}: single quotes unless the text contains
     * a single quote and no double quote, backslash escapes for the quote in use, backslashes,
     * and characters that are not printable.
     */
    public static String quote(String text) {
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        var sb = new StringBuilder(text.length() + 2);
        sb.append(quote);
        text.codePoints().forEach(cp -> {
            switch (cp) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (cp == quote) {
                        sb.append('\\').append(quote);
                    } else if (isPrintable(cp)) {
                        sb.appendCodePoint(cp);
                    } else if (cp <= 0xff) {
                        sb.append(String.format("\\x%02x", cp));
                    } else if (cp <= 0xffff) {
                        sb.append(String.format("\\u%04x", cp));
                    } else {
                        sb.append(String.format("\\U%08x", cp));
                    }
                }
            }
        });
        return sb.append(quote).toString();
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        return switch (Character.getType(cp)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                 Character.UNASSIGNED, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                 Character.SPACE_SEPARATOR -> false;
            default -> true;
        };
    }

    /**
     * Quoted prefix of at most {@code limit} code points, followed by {@code [...]} when the text is longer.
     */
    public static String truncatedQuote(String text, int limit) {
        if (length(text) <= limit) {
            return quote(text);
        }
        return quote(prefix(text, limit)) + ELLIPSIS;
    }

    /**
     * Text shortened to its first and last {@code half} code points around {@code [...]}
     * when longer than twice {@code half}.
     */
    public static String elide(String text, int half) {
        int length = length(text);
        if (length <= 2 * half) {
            return text;
        }
        return prefix(text, half) + ELLIPSIS + text.substring(text.offsetByCodePoints(0, length - half));
    }

    /**
     * First {@code count} code points of the text, or the whole text if shorter.
     */
    public static String prefix(String text, int count) {
        if (length(text) <= count) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, count));
    }

    public static int length(String text) {
        return text.codePointCount(0, text.length());
    }
}
