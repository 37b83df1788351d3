package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.style.SpacingAddOn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.everydaythings.textmetrics.layout.DefaultLineBreakerTest.TEN_PX;
import static org.assertj.core.api.Assertions.assertThat;

class BreakAllLineBreakerTest {

    private final LineBreaker breaker = new BreakAllLineBreaker();

    private List<String> lines(String text, double max) {
        return breaker.breakLines(text, max, SpacingAddOn.NONE, TEN_PX);
    }

    @Test
    void breaksBetweenAnyCharacters() {
        assertThat(lines("abcdef", 30)).containsExactly("abc", "def");
        assertThat(lines("abcdefg", 30)).containsExactly("abc", "def", "g");
    }

    @Test
    void dropsSpaceAtBreak() {
        assertThat(lines("ab cd", 20)).containsExactly("ab", "cd");
    }

    @Test
    void skipsLeadingAndRepeatedSpaces() {
        assertThat(lines("  ab  cd", 100)).containsExactly("ab cd");
    }

    @Test
    void softHyphenBreaksWithVisibleHyphen() {
        assertThat(lines("ab\u00ADcd", 20)).containsExactly("ab-", "cd");
    }

    @Test
    void softHyphenIsInvisibleWhenNotBroken() {
        assertThat(lines("ab\u00ADcd", 40)).containsExactly("abcd");
    }

    @Test
    void hyphenStaysOnLineItEnds() {
        assertThat(lines("ab\u2010cd", 20)).containsExactly("ab\u2010", "cd");
    }

    @Test
    void newlineAlwaysBreaks() {
        assertThat(lines("ab\ncd", Double.NaN)).containsExactly("ab", "cd");
    }

    @Test
    void takesAtLeastOneCharacterPerLine() {
        assertThat(lines("abc", 5)).containsExactly("a", "b", "c");
    }

    @Test
    void widthsAreRoundedUp() {
        TextMeasurer slightlyWide = text -> 10.01 * text.length();
        assertThat(breaker.breakLines("abcd", 30, SpacingAddOn.NONE, slightlyWide))
                .containsExactly("ab", "cd");
    }

    @Test
    void keepsSurrogatePairsTogether() {
        assertThat(lines("\uD83D\uDE00\uD83D\uDE01\uD83D\uDE02", 20))
                .containsExactly("\uD83D\uDE00\uD83D\uDE01", "\uD83D\uDE02");
    }
}
