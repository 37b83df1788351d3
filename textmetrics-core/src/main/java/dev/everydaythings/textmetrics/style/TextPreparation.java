package dev.everydaythings.textmetrics.style;

import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the handful of markup fragments that carry line-break meaning
 * into their Unicode equivalents.
 *
 * <ul>
 *   <li>{@code <wbr>} → U+200B zero width space</li>
 *   <li>{@code <br>}, {@code <br/>} → U+000A line feed</li>
 *   <li>{@code &shy;} → U+00AD soft hyphen</li>
 *   <li>{@code &mdash;} → U+2014 em dash</li>
 * </ul>
 *
 * <p>Other entities are left alone; a warning is logged so callers know to
 * decode their text before measuring it.
 */
public final class TextPreparation {

    private static final Logger log = Logger.getLogger(TextPreparation.class.getName());

    private static final Pattern WBR = Pattern.compile("<wbr>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BR = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHY = Pattern.compile("&shy;", Pattern.CASE_INSENSITIVE);
    private static final Pattern MDASH = Pattern.compile("&mdash;", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY =
            Pattern.compile("&#(\\d+)(;?)|&#[xX]([a-fA-F\\d]+)(;?)|&([\\da-zA-Z]+);");

    private TextPreparation() {
    }

    public static String prepare(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = WBR.matcher(text).replaceAll("\u200B");
        // "<br<br>>" only becomes a tag once the inner one is replaced
        Matcher br = BR.matcher(s);
        while (br.find()) {
            s = br.replaceAll("\n");
            br = BR.matcher(s);
        }
        s = SHY.matcher(s).replaceAll("\u00AD");
        s = MDASH.matcher(s).replaceAll("\u2014");

        Matcher m = ENTITY.matcher(s);
        if (m.find()) {
            String entity = m.group();
            log.warning(() -> "Found encoded HTML entity '" + entity
                    + "'; decode the text before measuring it");
        }
        return s;
    }
}
