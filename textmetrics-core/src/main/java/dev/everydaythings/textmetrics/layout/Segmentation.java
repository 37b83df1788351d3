package dev.everydaythings.textmetrics.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text split into parts without internal break opportunities.
 *
 * <p>{@code breakpoints.get(i)} separates {@code parts.get(i)} from
 * {@code parts.get(i + 1)}. Collapsible whitespace met while the current
 * part is still empty is dropped, so leading and repeated spaces never
 * produce breakpoints.
 *
 * @param parts       text parts in reading order
 * @param breakpoints boundaries between consecutive parts
 */
public record Segmentation(List<String> parts, List<Breakpoint> breakpoints) {

    public static Segmentation scan(String text) {
        List<String> parts = new ArrayList<>();
        List<Breakpoint> breakpoints = new ArrayList<>();
        StringBuilder part = new StringBuilder();

        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);

            BreakCategory category = CharacterClassifier.classify(cp);
            if (category == BreakCategory.BAI && part.length() == 0) {
                continue;
            }
            if (category != null) {
                breakpoints.add(new Breakpoint(cp, category));
                parts.add(part.toString());
                part.setLength(0);
            } else {
                part.appendCodePoint(cp);
            }
        }

        if (part.length() > 0) {
            parts.add(part.toString());
        } else if (!breakpoints.isEmpty() && breakpoints.size() == parts.size()
                && breakpoints.get(breakpoints.size() - 1).isRendered()) {
            // trailing visible boundary: give it an empty part to attach to
            parts.add("");
        }

        return new Segmentation(Collections.unmodifiableList(parts), Collections.unmodifiableList(breakpoints));
    }
}
