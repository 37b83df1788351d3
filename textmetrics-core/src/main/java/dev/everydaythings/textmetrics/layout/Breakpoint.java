package dev.everydaythings.textmetrics.layout;

/**
 * A break opportunity found while scanning text.
 *
 * @param codePoint the boundary character
 * @param category  its break category, never null
 */
public record Breakpoint(int codePoint, BreakCategory category) {

    /** The boundary character as a string. */
    public String text() {
        return new String(Character.toChars(codePoint));
    }

    /** Whether the boundary character is drawn when it ends up inside a line. */
    public boolean isRendered() {
        switch (category) {
            case BA:
            case BB:
            case B2:
                return true;
            default:
                return false;
        }
    }
}
