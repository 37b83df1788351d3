package dev.everydaythings.textmetrics.layout;

/** The {@code word-break} policies and the breaker implementing each. */
public enum WordBreak {
    NORMAL(new DefaultLineBreaker()),
    BREAK_ALL(new BreakAllLineBreaker());

    private final LineBreaker breaker;

    WordBreak(LineBreaker breaker) {
        this.breaker = breaker;
    }

    /** Policy for a CSS value; only {@code break-all} changes behavior. */
    public static WordBreak of(String css) {
        return css != null && "break-all".equals(css.trim()) ? BREAK_ALL : NORMAL;
    }

    public LineBreaker breaker() {
        return breaker;
    }
}
