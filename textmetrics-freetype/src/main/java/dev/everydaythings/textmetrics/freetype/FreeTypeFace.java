package dev.everydaythings.textmetrics.freetype;

import org.lwjgl.PointerBuffer;
import org.lwjgl.system.MemoryStack;
import org.lwjgl.util.freetype.FT_Face;
import org.lwjgl.util.freetype.FT_GlyphSlot;
import org.lwjgl.util.freetype.FT_Vector;
import org.lwjgl.util.freetype.FreeType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * One font face loaded through LWJGL's FreeType binding.
 *
 * <p>Advances and kerning are read unscaled, in font units, and cached per
 * glyph; callers scale them by {@code sizePx / unitsPerEm}. A face owns a
 * single FreeType glyph slot, so every query is synchronized on the face.
 *
 * @see FreeTypeFontManager
 */
public class FreeTypeFace {

    private static final Logger log = Logger.getLogger(FreeTypeFace.class.getName());

    private long ftLibHandle;
    private FT_Face ftFace;

    /** Font data buffer: MUST stay alive as long as the face is open.
     *  FreeType keeps an internal pointer to this memory. */
    private ByteBuffer fontDataBuffer;

    private final int unitsPerEm;
    private final String familyName;
    private final String styleName;
    private final boolean bold;
    private final boolean italic;
    private final boolean hasKerning;

    /** Unscaled advance widths keyed by glyph index. */
    private final Map<Integer, Long> advances = new HashMap<>();

    private FreeTypeFace(long ftLibHandle, FT_Face ftFace, ByteBuffer fontDataBuffer) {
        this.ftLibHandle = ftLibHandle;
        this.ftFace = ftFace;
        this.fontDataBuffer = fontDataBuffer;
        this.unitsPerEm = Math.max(1, ftFace.units_per_EM() & 0xFFFF);
        String family = ftFace.family_nameString();
        this.familyName = family != null ? family : "";
        String style = ftFace.style_nameString();
        this.styleName = style != null ? style : "";
        long flags = ftFace.style_flags();
        this.bold = (flags & FreeType.FT_STYLE_FLAG_BOLD) != 0;
        this.italic = (flags & FreeType.FT_STYLE_FLAG_ITALIC) != 0;
        this.hasKerning = FreeType.FT_HAS_KERNING(ftFace);
    }

    /**
     * Open a face from raw TTF/OTF bytes (the first face of a collection).
     *
     * @throws FontLoadException if FreeType cannot be initialized or rejects the data
     */
    public static FreeTypeFace load(byte[] fontData) {
        ByteBuffer buffer = ByteBuffer.allocateDirect(fontData.length)
                .order(ByteOrder.nativeOrder());
        buffer.put(fontData);
        buffer.flip();

        try (MemoryStack stack = MemoryStack.stackPush()) {
            PointerBuffer libPtr = stack.mallocPointer(1);
            int result = FreeType.FT_Init_FreeType(libPtr);
            if (result != 0) {
                throw new FontLoadException("Failed to init FreeType: " + result);
            }
            long lib = libPtr.get(0);

            PointerBuffer facePtr = stack.mallocPointer(1);
            result = FreeType.FT_New_Memory_Face(lib, buffer, 0, facePtr);
            if (result != 0) {
                FreeType.FT_Done_FreeType(lib);
                throw new FontLoadException("FreeType rejected font data (" + fontData.length + " bytes): " + result);
            }

            FreeTypeFace face = new FreeTypeFace(lib, FT_Face.create(facePtr.get(0)), buffer);
            log.fine(() -> String.format("Loaded face %s %s: unitsPerEm=%d, kerning=%b",
                    face.familyName, face.styleName, face.unitsPerEm, face.hasKerning));
            return face;
        }
    }

    // ==================================================================================
    // Metrics
    // ==================================================================================

    /** Glyph index of {@code codepoint}, 0 when the font has no mapping for it. */
    public synchronized int glyphIndex(int codepoint) {
        requireOpen();
        return FreeType.FT_Get_Char_Index(ftFace, codepoint);
    }

    public boolean hasGlyph(int codepoint) {
        return glyphIndex(codepoint) != 0;
    }

    /**
     * Unscaled horizontal advance of a glyph in font units.
     *
     * @throws FontLoadException if FreeType cannot load the glyph
     */
    public synchronized long advance(int glyphIndex) {
        requireOpen();
        Long cached = advances.get(glyphIndex);
        if (cached != null) {
            return cached;
        }
        int result = FreeType.FT_Load_Glyph(ftFace, glyphIndex, FreeType.FT_LOAD_NO_SCALE);
        if (result != 0) {
            throw new FontLoadException("Failed to load glyph " + glyphIndex + " of " + familyName + ": " + result);
        }
        FT_GlyphSlot slot = ftFace.glyph();
        long advance = slot != null ? slot.advance().x() : 0;
        advances.put(glyphIndex, advance);
        return advance;
    }

    /** Unscaled horizontal kerning between two glyphs in font units; 0 without a kern table. */
    public synchronized long kerning(int leftGlyph, int rightGlyph) {
        requireOpen();
        if (!hasKerning || leftGlyph == 0 || rightGlyph == 0) {
            return 0;
        }
        try (MemoryStack stack = MemoryStack.stackPush()) {
            FT_Vector kern = FT_Vector.malloc(stack);
            if (FreeType.FT_Get_Kerning(ftFace, leftGlyph, rightGlyph, FreeType.FT_KERNING_UNSCALED, kern) != 0) {
                return 0;
            }
            return kern.x();
        }
    }

    /** Font units per em (e.g. 2048 for TrueType, 1000 for CFF). */
    public int unitsPerEm() {
        return unitsPerEm;
    }

    /** Family name from the font's name table, e.g. {@code "DejaVu Sans"}. */
    public String familyName() {
        return familyName;
    }

    /** Style name from the font's name table, e.g. {@code "Bold Oblique"}. */
    public String styleName() {
        return styleName;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    @Override
    public String toString() {
        return familyName + (styleName.isEmpty() ? "" : " " + styleName);
    }

    // ==================================================================================
    // Cleanup
    // ==================================================================================

    /**
     * Release the FreeType face and library. The face cannot be used afterwards.
     */
    public synchronized void destroy() {
        if (ftFace != null) {
            FreeType.FT_Done_Face(ftFace);
            ftFace = null;
        }
        if (ftLibHandle != 0) {
            FreeType.FT_Done_FreeType(ftLibHandle);
            ftLibHandle = 0;
        }
        fontDataBuffer = null;
        advances.clear();
    }

    private void requireOpen() {
        if (ftFace == null) {
            throw new IllegalStateException("Face " + this + " has been destroyed");
        }
    }
}
