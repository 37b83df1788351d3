package dev.everydaythings.textmetrics.layout;

import java.util.Arrays;

/**
 * Maps a code point to its {@link BreakCategory}.
 *
 * <p>Each category is backed by a sorted table of code points. Tables are
 * consulted in {@link BreakCategory} declaration order and the first hit
 * wins. Code points outside every table have no category.
 */
public final class CharacterClassifier {

    // B2: Break Opportunity Before and After - http://www.unicode.org/reports/tr14/#B2
    private static final int[] B2 = table(0x2014);

    // BA: Break After, removed on break - http://www.unicode.org/reports/tr14/#BA
    private static final int[] BAI = table(
            // Spaces
            0x0020, 0x1680, 0x2000, 0x2001, 0x2002, 0x2003, 0x2004, 0x2005, 0x2006,
            0x2008, 0x2009, 0x200A, 0x205F, 0x3000,
            // Tab
            0x0009,
            // ZW: Zero Width Space - http://www.unicode.org/reports/tr14/#ZW
            0x200B,
            // Mandatory breaks not interpreted by html
            0x2028, 0x2029);

    private static final int[] SHY = table(0x00AD);

    // BA: Break After, kept on break
    private static final int[] BA = table(
            // Hyphens
            0x058A, 0x2010, 0x2012, 0x2013,
            // Visible word dividers
            0x05BE, 0x0F0B, 0x1361, 0x17D8, 0x17DA, 0x2027, 0x007C,
            // Historic word separators
            0x16EB, 0x16EC, 0x16ED, 0x2056, 0x2058, 0x2059, 0x205A, 0x205B, 0x205D, 0x205E,
            0x2E19, 0x2E2A, 0x2E2B, 0x2E2C, 0x2E2D, 0x2E30,
            0x10100, 0x10101, 0x10102, 0x1039F, 0x103D0, 0x1091F, 0x12470);

    // BB: Break Before - http://www.unicode.org/reports/tr14/#BB
    private static final int[] BB = table(0x00B4, 0x1FFD);

    // BK: Mandatory Break - http://www.unicode.org/reports/tr14/#BK
    private static final int[] BK = table(0x000A);

    private static final int[][] TABLES = {B2, BAI, SHY, BA, BB, BK};
    private static final BreakCategory[] CATEGORIES = BreakCategory.values();

    private CharacterClassifier() {
    }

    /**
     * @return the category of {@code codePoint}, or null if it offers no break opportunity
     */
    public static BreakCategory classify(int codePoint) {
        for (int i = 0; i < TABLES.length; i++) {
            if (Arrays.binarySearch(TABLES[i], codePoint) >= 0) {
                return CATEGORIES[i];
            }
        }
        return null;
    }

    /** Whether {@code codePoint} is collapsible whitespace ({@link BreakCategory#BAI}). */
    public static boolean isCollapsible(int codePoint) {
        return classify(codePoint) == BreakCategory.BAI;
    }

    /** Whether {@code text} is non-empty and made only of collapsible whitespace. */
    public static boolean isCollapsibleRun(String text) {
        return !text.isEmpty() && text.codePoints().allMatch(CharacterClassifier::isCollapsible);
    }

    private static int[] table(int... codePoints) {
        int[] sorted = codePoints.clone();
        Arrays.sort(sorted);
        return sorted;
    }
}
