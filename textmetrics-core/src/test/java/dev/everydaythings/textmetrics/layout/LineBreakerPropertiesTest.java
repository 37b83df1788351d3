package dev.everydaythings.textmetrics.layout;

import dev.everydaythings.textmetrics.style.SpacingAddOn;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

import java.util.List;

import static dev.everydaythings.textmetrics.layout.DefaultLineBreakerTest.TEN_PX;
import static org.assertj.core.api.Assertions.assertThat;

class LineBreakerPropertiesTest {

    @Property
    void wordsSurviveWrapping(@ForAll @Size(min = 1, max = 20) List<@AlphaChars @StringLength(min = 1, max = 8) String> words,
                              @ForAll @IntRange(min = 10, max = 200) int maxWidth) {
        String text = String.join(" ", words);
        List<String> lines = new DefaultLineBreaker().breakLines(text, maxWidth, SpacingAddOn.NONE, TEN_PX);

        assertThat(String.join(" ", lines)).isEqualTo(text);
    }

    @Property
    void onlySingleWordsOverflow(@ForAll @Size(min = 1, max = 20) List<@AlphaChars @StringLength(min = 1, max = 8) String> words,
                                 @ForAll @IntRange(min = 10, max = 200) int maxWidth) {
        String text = String.join(" ", words);
        List<String> lines = new DefaultLineBreaker().breakLines(text, maxWidth, SpacingAddOn.NONE, TEN_PX);

        for (String line : lines) {
            if (TEN_PX.measure(line) > maxWidth) {
                assertThat(line).doesNotContain(" ");
            }
        }
    }

    @Property
    void breakAllKeepsEveryCharacter(@ForAll @AlphaChars @StringLength(min = 1, max = 60) String text,
                                     @ForAll @IntRange(min = 1, max = 200) int maxWidth) {
        List<String> lines = new BreakAllLineBreaker().breakLines(text, maxWidth, SpacingAddOn.NONE, TEN_PX);

        assertThat(String.join("", lines)).isEqualTo(text);
        for (String line : lines) {
            assertThat(TEN_PX.measure(line) <= maxWidth || line.length() == 1).isTrue();
        }
    }
}
