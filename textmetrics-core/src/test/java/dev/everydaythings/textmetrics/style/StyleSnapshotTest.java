package dev.everydaythings.textmetrics.style;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StyleSnapshotTest {

    @Test
    void normalizesKeysToKebabCase() {
        StyleSnapshot style = StyleSnapshot.of(Map.of("fontSize", "12px", "letterSpacing", "1px"));
        assertThat(style.asMap()).containsOnlyKeys("font-size", "letter-spacing");
        assertEquals("12px", style.get("fontSize"));
        assertEquals("12px", style.get("font-size"));
    }

    @Test
    void laterLayersWin() {
        StyleSnapshot merged = StyleSnapshot.layered()
                .layer(StyleSnapshot.DEFAULTS)
                .layer(Map.of("font-size", "12px"))
                .layer(Map.of("fontSize", "14px", "fontWeight", "bold"))
                .build();
        assertEquals("14px", merged.get("font-size"));
        assertEquals("bold", merged.get("font-weight"));
        assertEquals("Helvetica, Arial, sans-serif", merged.get("font-family"));
    }

    @Test
    void emptyValuesDoNotShadowLowerLayers() {
        Map<String, Object> blank = new HashMap<>();
        blank.put("font-size", "");
        blank.put("font-weight", null);
        StyleSnapshot merged = StyleSnapshot.layered()
                .layer(StyleSnapshot.DEFAULTS)
                .layer(blank)
                .build();
        assertEquals("16px", merged.get("font-size"));
        assertEquals("400", merged.get("font-weight"));
    }

    @Test
    void formatsNumbers() {
        StyleSnapshot style = StyleSnapshot.of(Map.of("width", 120.0, "line-height", 1.5, "z", 3));
        assertEquals("120", style.get("width"));
        assertEquals("1.5", style.get("line-height"));
        assertEquals("3", style.get("z"));
    }

    @Test
    void withReplacesOneProperty() {
        StyleSnapshot style = StyleSnapshot.DEFAULTS.with("fontSize", "20px");
        assertEquals("20px", style.get("font-size"));
        assertEquals("16px", StyleSnapshot.DEFAULTS.get("font-size"));
    }

    @Test
    void missingKeyIsNull() {
        assertNull(StyleSnapshot.EMPTY.get("font-size"));
        assertFalse(StyleSnapshot.EMPTY.has("fontSize"));
        assertTrue(StyleSnapshot.DEFAULTS.has("fontSize"));
        assertEquals("x", StyleSnapshot.EMPTY.get("font-size", "x"));
    }
}
