package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.style.SpacingAddOn;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-granular line packing ({@code word-break: break-all}).
 *
 * <p>Every code point is a potential break. A line is closed as soon as the
 * next character would overflow it, but a line always takes at least one
 * character. Collapsible whitespace is skipped at line starts and after
 * another collapsible character. Widths are rounded up before comparison.
 */
public final class BreakAllLineBreaker implements LineBreaker {

    @Override
    public List<String> breakLines(String text, double maxWidthPx, SpacingAddOn spacing, TextMeasurer measurer) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        double max = LineBreaker.limit(maxWidthPx);

        int[] codePoints = text.codePoints().toArray();
        StringBuilder line = new StringBuilder();
        int last = -1;

        for (int i = 0; i < codePoints.length; i++) {
            int cp = codePoints[i];
            BreakCategory type = CharacterClassifier.classify(cp);

            if (type == BreakCategory.BK) {
                lines.add(line.toString());
                line.setLength(0);
                last = -1;
                continue;
            }

            if (type == BreakCategory.BAI && (line.length() == 0 || CharacterClassifier.isCollapsible(last))) {
                continue;
            }

            String chr = new String(Character.toChars(cp));
            String candidate = line + chr;
            if (type == BreakCategory.SHY) {
                // would the character after the soft hyphen still fit?
                String next = i + 1 < codePoints.length ? new String(Character.toChars(codePoints[i + 1])) : "";
                candidate = line + chr + next;
            }
            double width = Math.ceil(measurer.measure(candidate) + spacing.widthOf(candidate));

            if (width > max && line.length() != 0) {
                if (type == BreakCategory.SHY) {
                    lines.add(line + "-");
                    line.setLength(0);
                    last = -1;
                } else if (type == BreakCategory.BA) {
                    lines.add(line + chr);
                    line.setLength(0);
                    last = -1;
                } else if (type == BreakCategory.BAI) {
                    lines.add(line.toString());
                    line.setLength(0);
                    last = -1;
                } else {
                    lines.add(line.toString());
                    line.setLength(0);
                    line.appendCodePoint(cp);
                    last = cp;
                }
            } else if (type != BreakCategory.SHY) {
                line.appendCodePoint(cp);
                last = cp;
            }
        }

        if (line.length() != 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}
