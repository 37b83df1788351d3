package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.style.SpacingAddOn;
import dev.everydaythings.textmetrics.style.SpacingModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultLineBreakerTest {

    /** 10px per code point, soft hyphens invisible. */
    static final TextMeasurer TEN_PX = text -> 10.0 * text.codePoints().filter(cp -> cp != 0x00AD).count();

    private final LineBreaker breaker = new DefaultLineBreaker();

    private List<String> lines(String text, double max) {
        return breaker.breakLines(text, max, SpacingAddOn.NONE, TEN_PX);
    }

    @Test
    void breaksAtSpaceAndDropsIt() {
        assertThat(lines("Hello World", 50)).containsExactly("Hello", "World");
    }

    @Test
    void keepsFittingTextOnOneLine() {
        assertThat(lines("Hello World", 110)).containsExactly("Hello World");
    }

    @Test
    void emDashGoesWhereItFits() {
        assertThat(lines("abc\u2014def", 40)).containsExactly("abc\u2014", "def");
        assertThat(lines("abcd\u2014ef", 30)).containsExactly("abcd", "\u2014ef");
        assertThat(lines("abc\u2014def", 30)).containsExactly("abc", "\u2014", "def");
    }

    @Test
    void softHyphenRendersOnlyAtBreak() {
        List<String> lines = lines("super\u00ADcalifragilistic", 100);
        assertThat(lines).containsExactly("super-", "califragilistic");
        assertThat(lines).noneMatch(line -> line.contains("\u00AD"));

        assertThat(lines("super\u00ADman", 100)).containsExactly("superman");
    }

    @Test
    void hyphenStaysOnFirstLine() {
        assertThat(lines("well\u2010known", 60)).containsExactly("well\u2010", "known");
    }

    @Test
    void breakBeforeMovesBoundaryToNextLine() {
        assertThat(lines("ab\u00B4cd", 30)).containsExactly("ab", "\u00B4cd");
    }

    @Test
    void newlineAlwaysBreaks() {
        assertThat(lines("ab\ncd", Double.NaN)).containsExactly("ab", "cd");
        assertThat(lines("ab\ncd", 1000)).containsExactly("ab", "cd");
    }

    @Test
    void nanWidthIsUnbounded() {
        assertThat(lines("a b c d e f g", Double.NaN)).containsExactly("a b c d e f g");
    }

    @Test
    void overlongPartStaysWhole() {
        assertThat(lines("a extraordinary b", 50)).containsExactly("a", "extraordinary", "b");
    }

    @Test
    void trailingHyphenIsKept() {
        assertThat(lines("abc\u2010", 100)).containsExactly("abc\u2010");
    }

    @Test
    void repeatedSpacesDoNotProduceEmptyLines() {
        assertThat(lines("ab    cd", 20)).containsExactly("ab", "cd");
    }

    @Test
    void zeroWidthSpaceIsABreakOpportunity() {
        assertThat(lines("abc\u200Bdef", 40)).containsExactly("abc", "def");
    }

    @Test
    void widthsAreRoundedBeforeComparison() {
        TextMeasurer slightlyWide = text -> 10.4 * text.length();
        // 52px
        assertThat(breaker.breakLines("ab cd", 50, SpacingAddOn.NONE, slightlyWide)).containsExactly("ab", "cd");
        // 4.9px rounds to 5
        TextMeasurer tiny = text -> 0.98 * text.length();
        assertThat(breaker.breakLines("ab cd", 5, SpacingAddOn.NONE, tiny)).containsExactly("ab cd");
    }

    @Test
    void spacingCountsTowardsWidth() {
        SpacingAddOn letters = SpacingModel.build(null, "5px");
        // "ab cd" is 50px of glyphs plus 25px of letter spacing
        assertThat(breaker.breakLines("ab cd", 60, letters, TEN_PX)).containsExactly("ab", "cd");
        assertThat(breaker.breakLines("ab cd", 75, letters, TEN_PX)).containsExactly("ab cd");
    }

    @Test
    void handlesSupplementaryCodePoints() {
        // U+10100 AEGEAN WORD SEPARATOR LINE is a visible break-after
        assertThat(lines("ab\uD800\uDD00cd", 30)).containsExactly("ab\uD800\uDD00", "cd");
    }

    @Test
    void emptyTextHasNoLines() {
        assertThat(lines("", 100)).isEmpty();
    }
}
