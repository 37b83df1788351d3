package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.style.SpacingAddOn;

import java.util.ArrayList;
import java.util.List;

/**
 * Word-aware greedy line packing ({@code word-break: normal}).
 *
 * <p>Text is first cut into parts at every break opportunity. Parts are then
 * appended to the current line while the line, its boundary character and
 * the next part fit; when they do not, the line is closed according to the
 * category of the boundary between them:
 *
 * <table>
 *   <caption>Split behavior per category</caption>
 *   <tr><th>Category</th><th>Current line</th><th>Next line starts with</th></tr>
 *   <tr><td>SHY</td><td>ends with {@code -}</td><td>next part</td></tr>
 *   <tr><td>BA</td><td>ends with the boundary</td><td>next part</td></tr>
 *   <tr><td>BAI</td><td>boundary dropped</td><td>next part</td></tr>
 *   <tr><td>BB</td><td>boundary dropped</td><td>boundary + next part</td></tr>
 *   <tr><td>B2</td><td colspan="2">boundary goes wherever it fits, else on a line of its own</td></tr>
 *   <tr><td>BK</td><td colspan="2">always breaks, before any measurement</td></tr>
 * </table>
 *
 * <p>Widths are rounded to the nearest pixel before comparison.
 */
public final class DefaultLineBreaker implements LineBreaker {

    @Override
    public List<String> breakLines(String text, double maxWidthPx, SpacingAddOn spacing, TextMeasurer measurer) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        double max = LineBreaker.limit(maxWidthPx);

        Segmentation segmentation = Segmentation.scan(text);
        List<String> parts = segmentation.parts();
        List<Breakpoint> breakpoints = segmentation.breakpoints();
        if (parts.isEmpty()) {
            return lines;
        }

        String line = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            String part = parts.get(i);
            if (CharacterClassifier.isCollapsibleRun(parts.get(i - 1)) && CharacterClassifier.isCollapsibleRun(part)) {
                continue;
            }

            Breakpoint breakpoint = breakpoints.get(i - 1);
            if (breakpoint.category() == BreakCategory.BK) {
                lines.add(line);
                line = part;
                continue;
            }

            // the soft hyphen is only drawn when the line breaks at it
            String chr = breakpoint.category() == BreakCategory.SHY ? "" : breakpoint.text();
            String candidate = line + chr + part;
            long width = Math.round(measurer.measure(candidate) + spacing.widthOf(candidate));
            if (width <= max) {
                line = candidate;
                continue;
            }

            switch (breakpoint.category()) {
                case SHY:
                    lines.add(line + "-");
                    line = part;
                    break;
                case BA:
                    lines.add(line + chr);
                    line = part;
                    break;
                case BAI:
                    lines.add(line);
                    line = part;
                    break;
                case BB:
                    lines.add(line);
                    line = chr + part;
                    break;
                case B2:
                    if (fits(line + chr, max, spacing, measurer)) {
                        lines.add(line + chr);
                        line = part;
                    } else if (fits(chr + part, max, spacing, measurer)) {
                        lines.add(line);
                        line = chr + part;
                    } else {
                        lines.add(line);
                        lines.add(chr);
                        line = part;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected break category " + breakpoint.category());
            }
        }

        if (!line.isEmpty()) {
            lines.add(line);
        }
        return lines;
    }

    private static boolean fits(String candidate, double max, SpacingAddOn spacing, TextMeasurer measurer) {
        return measurer.measure(candidate) + spacing.widthOf(candidate) <= max;
    }
}
