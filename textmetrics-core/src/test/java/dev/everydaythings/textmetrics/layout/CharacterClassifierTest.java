package dev.everydaythings.textmetrics.layout;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CharacterClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "2014, B2",
            "0020, BAI",
            "0009, BAI",
            "200B, BAI",
            "00AD, SHY",
            "2012, BA",
            "2010, BA",
            "00B4, BB",
            "1FFD, BB",
            "000A, BK",
            "10100, BA",
            "12470, BA",
    })
    void classifiesKnownCodePoints(String hex, BreakCategory expected) {
        assertEquals(expected, CharacterClassifier.classify(Integer.parseInt(hex, 16)));
    }

    @Test
    void lettersHaveNoCategory() {
        assertNull(CharacterClassifier.classify('a'));
        assertNull(CharacterClassifier.classify('Z'));
        assertNull(CharacterClassifier.classify('-'));
        assertNull(CharacterClassifier.classify(0x1F600));
    }

    @Test
    void collapsibleRuns() {
        assertThat(CharacterClassifier.isCollapsibleRun("  \t")).isTrue();
        assertThat(CharacterClassifier.isCollapsibleRun(" a ")).isFalse();
        assertThat(CharacterClassifier.isCollapsibleRun("")).isFalse();
    }

    @Property
    void classificationIsStable(@ForAll @IntRange(min = 0, max = Character.MAX_CODE_POINT) int codePoint) {
        assertEquals(CharacterClassifier.classify(codePoint), CharacterClassifier.classify(codePoint));
    }

    @Property
    void collapsibleMeansBai(@ForAll @IntRange(min = 0, max = 0x3000) int codePoint) {
        assertEquals(CharacterClassifier.classify(codePoint) == BreakCategory.BAI,
                CharacterClassifier.isCollapsible(codePoint));
    }
}
