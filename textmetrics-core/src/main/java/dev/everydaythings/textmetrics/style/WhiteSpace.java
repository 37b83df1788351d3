package dev.everydaythings.textmetrics.style;

import java.util.regex.Pattern;

/**
 * The CSS {@code white-space} modes and how each one normalizes text
 * before layout.
 */
public enum WhiteSpace {

    /** Collapse every whitespace run, newlines included, to one space and trim. */
    NORMAL,
    /** Same collapsing as {@link #NORMAL}; wrapping is the caller's concern. */
    NOWRAP,
    /** Preserve text as-is. */
    PRE,
    /** Preserve text as-is. */
    PRE_WRAP,
    /** Preserve text as-is. */
    BREAK_SPACES,
    /** Collapse spaces and tabs, keep newlines, drop spaces around newlines. */
    PRE_LINE;

    /** Whitespace as the browser's {@code \s} and {@code trim()} understand it. */
    static final String CLASS = "\\t\\n\\x0B\\f\\r \\u00A0\\u1680\\u2000-\\u200A\\u2028\\u2029\\u202F\\u205F\\u3000\\uFEFF";

    private static final Pattern RUNS = Pattern.compile("[" + CLASS + "]+");
    private static final Pattern LINE_FEEDS = Pattern.compile("[\\r\\n]");
    private static final Pattern INLINE_RUNS = Pattern.compile("[" + CLASS.replace("\\n", "").replace("\\r", "") + "]+");
    private static final Pattern SPACES_AROUND_LF = Pattern.compile(" ?\\n ?");
    private static final Pattern EDGES = Pattern.compile("^[" + CLASS + "]+|[" + CLASS + "]+$");

    /** Mode for a CSS value; unknown or missing values mean {@link #NORMAL}. */
    public static WhiteSpace of(String css) {
        if (css == null) return NORMAL;
        switch (css.trim()) {
            case "nowrap":
                return NOWRAP;
            case "pre":
                return PRE;
            case "pre-wrap":
                return PRE_WRAP;
            case "break-spaces":
                return BREAK_SPACES;
            case "pre-line":
                return PRE_LINE;
            default:
                return NORMAL;
        }
    }

    /** Normalize {@code text} for this mode; null becomes the empty string. */
    public String normalize(String text) {
        if (text == null) return "";
        switch (this) {
            case PRE:
            case PRE_WRAP:
            case BREAK_SPACES:
                return text;
            case PRE_LINE: {
                String s = text.replace("\r\n", "\n").replace('\r', '\n');
                s = INLINE_RUNS.matcher(s).replaceAll(" ");
                s = SPACES_AROUND_LF.matcher(s).replaceAll("\n");
                return trimSpaces(s);
            }
            default:
                return trim(RUNS.matcher(LINE_FEEDS.matcher(text).replaceAll(" ")).replaceAll(" "));
        }
    }

    /** Collapse whitespace runs to single spaces and trim. */
    public static String collapse(String text) {
        return trim(RUNS.matcher(text).replaceAll(" "));
    }

    /** Trim whitespace the way {@code String.prototype.trim} does. */
    public static String trim(String text) {
        return EDGES.matcher(text).replaceAll("");
    }

    private static String trimSpaces(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == ' ') start++;
        while (end > start && s.charAt(end - 1) == ' ') end--;
        return s.substring(start, end);
    }
}
