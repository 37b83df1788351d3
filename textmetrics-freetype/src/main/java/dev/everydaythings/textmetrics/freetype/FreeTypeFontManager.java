package dev.everydaythings.textmetrics.freetype;

import dev.everydaythings.textmetrics.MissingCapabilityException;
import dev.everydaythings.textmetrics.style.FontDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registry of FreeType faces with family lookup and a glyph fallback chain.
 *
 * <p>Faces are registered under a logical name and appended to the fallback
 * chain. A {@link FontDescriptor} picks its primary face by walking its
 * family list: each entry may be a logical name, a face family name (both
 * case-insensitive) or one of the generic families {@code sans-serif},
 * {@code serif}, {@code monospace}, {@code system-ui}. Code points the
 * primary face lacks are measured with the first face in the chain that has
 * them, like browser font fallback.
 *
 * @see FreeTypeFace
 * @see FreeTypeMetricsProvider
 */
public class FreeTypeFontManager {

    private static final Logger log = Logger.getLogger(FreeTypeFontManager.class.getName());

    /** System property naming an extra directory of fonts to register at startup. */
    public static final String FONTS_DIR_PROPERTY = "textmetrics.fonts.dir";

    public static final String SANS = "sans";
    public static final String SERIF = "serif";
    public static final String MONO = "mono";
    public static final String FALLBACK = "fallback";

    private final Map<String, List<FreeTypeFace>> faces = new ConcurrentHashMap<>();

    /** Ordered fallback chain: first face with the glyph wins. */
    private final List<FreeTypeFace> fallbackChain = new CopyOnWriteArrayList<>();

    // ==================================================================================
    // Font Registration
    // ==================================================================================

    /**
     * Register a font from raw TTF/OTF bytes under a logical name.
     * The face is appended to the fallback chain.
     *
     * @param name     logical name for lookup (e.g. "sans", "headline")
     * @param fontData raw font file bytes
     * @return the loaded face
     * @throws FontLoadException if FreeType rejects the data
     */
    public FreeTypeFace registerFont(String name, byte[] fontData) {
        FreeTypeFace face = FreeTypeFace.load(fontData);
        faces.computeIfAbsent(key(name), k -> new CopyOnWriteArrayList<>()).add(face);
        fallbackChain.add(face);
        log.info(() -> String.format("Registered font: %s as '%s' (chain position %d)",
                face, name, fallbackChain.size()));
        return face;
    }

    /**
     * Register a font file.
     *
     * @throws FontLoadException if the file cannot be read or parsed
     */
    public FreeTypeFace registerFont(String name, Path file) {
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new FontLoadException("Failed to read font file: " + file, e);
        }
        return registerFont(name, data);
    }

    /**
     * Register a font from a classpath resource.
     *
     * @return the loaded face, or null if the resource does not exist
     */
    public FreeTypeFace registerResource(String name, String resourcePath) {
        byte[] data = loadResource(resourcePath);
        if (data == null) {
            log.warning(() -> "Font resource not found: " + resourcePath);
            return null;
        }
        return registerFont(name, data);
    }

    /**
     * Register every {@code .ttf}, {@code .otf} and {@code .ttc} file in
     * {@code dir} under its face family name. Unreadable files are skipped.
     *
     * @return number of faces registered
     */
    public int registerDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.fine(() -> "Not a font directory: " + dir);
            return 0;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(FreeTypeFontManager::isFontFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to list font directory " + dir, e);
            return 0;
        }
        int count = 0;
        for (Path file : files) {
            try {
                byte[] data = Files.readAllBytes(file);
                FreeTypeFace face = FreeTypeFace.load(data);
                faces.computeIfAbsent(key(face.familyName()), k -> new CopyOnWriteArrayList<>()).add(face);
                fallbackChain.add(face);
                count++;
            } catch (IOException | FontLoadException e) {
                log.log(Level.FINE, "Skipping font " + file, e);
            }
        }
        int registered = count;
        log.info(() -> String.format("Registered %d fonts from %s", registered, dir));
        return registered;
    }

    /**
     * Load default fonts from well-known system locations:
     * <ol>
     *   <li>Sans serif regular, then bold (DejaVu Sans, Liberation Sans, FreeSans, Arial)</li>
     *   <li>Serif (DejaVu Serif, Liberation Serif, FreeSerif, Times New Roman)</li>
     *   <li>Monospace (DejaVu Sans Mono, Liberation Mono, FreeMono, Courier New)</li>
     *   <li>Broad symbol coverage for fallback (Noto Sans Symbols 2, Unifont, Arial Unicode)</li>
     *   <li>{@code ~/.local/share/fonts} and the directory named by {@value #FONTS_DIR_PROPERTY}</li>
     * </ol>
     *
     * <p>The first sans face found is the default for unknown families.
     */
    public void loadDefaultFonts() {
        loadFirstAvailable(SANS,
                "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                "/usr/share/fonts/TTF/DejaVuSans.ttf",
                "/usr/share/fonts/dejavu/DejaVuSans.ttf",
                "/usr/share/fonts/truetype/liberation/LiberationSans-Regular.ttf",
                "/usr/share/fonts/liberation-sans/LiberationSans-Regular.ttf",
                "/usr/share/fonts/truetype/freefont/FreeSans.ttf",
                "/System/Library/Fonts/Supplemental/Arial.ttf",
                "/Library/Fonts/Arial.ttf",
                "C:/Windows/Fonts/arial.ttf");
        loadFirstAvailable(SANS,
                "/usr/share/fonts/truetype/dejavu/DejaVuSans-Bold.ttf",
                "/usr/share/fonts/TTF/DejaVuSans-Bold.ttf",
                "/usr/share/fonts/dejavu/DejaVuSans-Bold.ttf",
                "/usr/share/fonts/truetype/liberation/LiberationSans-Bold.ttf",
                "/usr/share/fonts/liberation-sans/LiberationSans-Bold.ttf",
                "/usr/share/fonts/truetype/freefont/FreeSansBold.ttf",
                "/System/Library/Fonts/Supplemental/Arial Bold.ttf",
                "C:/Windows/Fonts/arialbd.ttf");
        loadFirstAvailable(SERIF,
                "/usr/share/fonts/truetype/dejavu/DejaVuSerif.ttf",
                "/usr/share/fonts/TTF/DejaVuSerif.ttf",
                "/usr/share/fonts/truetype/liberation/LiberationSerif-Regular.ttf",
                "/usr/share/fonts/truetype/freefont/FreeSerif.ttf",
                "/System/Library/Fonts/Supplemental/Times New Roman.ttf",
                "C:/Windows/Fonts/times.ttf");
        loadFirstAvailable(MONO,
                "/usr/share/fonts/truetype/dejavu/DejaVuSansMono.ttf",
                "/usr/share/fonts/TTF/DejaVuSansMono.ttf",
                "/usr/share/fonts/truetype/liberation/LiberationMono-Regular.ttf",
                "/usr/share/fonts/truetype/freefont/FreeMono.ttf",
                "/System/Library/Fonts/Supplemental/Courier New.ttf",
                "C:/Windows/Fonts/cour.ttf");
        loadFirstAvailable(FALLBACK,
                "/usr/share/fonts/truetype/noto/NotoSansSymbols2-Regular.ttf",
                "/usr/share/fonts/noto/NotoSansSymbols2-Regular.ttf",
                "/usr/share/fonts/truetype/unifont/unifont.ttf",
                "/usr/share/fonts/opentype/unifont/unifont.otf",
                "/System/Library/Fonts/Supplemental/Arial Unicode.ttf",
                "C:/Windows/Fonts/seguisym.ttf");

        String home = System.getProperty("user.home", "");
        if (!home.isEmpty()) {
            registerDirectory(Paths.get(home, ".local", "share", "fonts"));
        }
        String extra = System.getProperty(FONTS_DIR_PROPERTY);
        if (extra != null && !extra.isBlank()) {
            registerDirectory(Paths.get(extra));
        }

        if (fallbackChain.isEmpty()) {
            log.warning("No fonts found for text measurement");
        } else {
            log.info(() -> "Font fallback chain: " + fallbackChain.size() + " faces");
        }
    }

    private void loadFirstAvailable(String name, String... paths) {
        for (String path : paths) {
            Path file = Paths.get(path);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                registerFont(name, file);
                log.fine(() -> String.format("Font '%s': %s", name, path));
                return;
            } catch (FontLoadException e) {
                log.log(Level.FINE, "Font '" + name + "' unusable at " + path + ", trying next", e);
            }
        }
        log.fine(() -> String.format("No font found for '%s', tried %d paths", name, paths.length));
    }

    // ==================================================================================
    // Face Resolution
    // ==================================================================================

    /**
     * Primary face for a descriptor: the first family in its list that
     * resolves, preferring a face whose bold/italic flags match.
     *
     * @throws MissingCapabilityException if no font has been registered
     */
    public FreeTypeFace resolveFace(FontDescriptor font) {
        if (fallbackChain.isEmpty()) {
            throw new MissingCapabilityException("No fonts registered for text measurement");
        }
        for (String family : font.families()) {
            List<FreeTypeFace> candidates = candidates(family);
            if (!candidates.isEmpty()) {
                return bestStyleMatch(candidates, font);
            }
        }
        List<FreeTypeFace> defaults = faces.get(SANS);
        if (defaults != null && !defaults.isEmpty()) {
            return bestStyleMatch(defaults, font);
        }
        return fallbackChain.get(0);
    }

    private List<FreeTypeFace> candidates(String family) {
        String k = key(family);
        switch (k) {
            case "sans-serif":
            case "system-ui":
                k = SANS;
                break;
            case "monospace":
                k = MONO;
                break;
            default:
                break;
        }
        List<FreeTypeFace> byName = faces.get(k);
        if (byName != null && !byName.isEmpty()) {
            return byName;
        }
        List<FreeTypeFace> byFamily = new ArrayList<>();
        for (FreeTypeFace face : fallbackChain) {
            if (key(face.familyName()).equals(k)) {
                byFamily.add(face);
            }
        }
        return byFamily;
    }

    private static FreeTypeFace bestStyleMatch(List<FreeTypeFace> candidates, FontDescriptor font) {
        FreeTypeFace best = candidates.get(0);
        int bestScore = -1;
        for (FreeTypeFace face : candidates) {
            int score = (face.isBold() == font.isBold() ? 2 : 0) + (face.isItalic() == font.isItalic() ? 1 : 0);
            if (score > bestScore) {
                best = face;
                bestScore = score;
            }
        }
        return best;
    }

    // ==================================================================================
    // Measurement
    // ==================================================================================

    /**
     * Measure text width in pixels: glyph advances of the primary face,
     * kerning between adjacent glyphs of the same face, and fallback faces
     * for code points the primary face lacks. Code points no face has
     * contribute nothing.
     */
    public double measureWidth(FontDescriptor font, String text) {
        FreeTypeFace primary = resolveFace(font);
        double size = font.sizePx();
        double width = 0;

        FreeTypeFace previousFace = null;
        int previousGlyph = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);

            FreeTypeFace face = primary;
            int glyph = primary.glyphIndex(cp);
            if (glyph == 0) {
                face = null;
                for (FreeTypeFace fallback : fallbackChain) {
                    int g = fallback.glyphIndex(cp);
                    if (g != 0) {
                        face = fallback;
                        glyph = g;
                        break;
                    }
                }
            }
            if (face == null) {
                previousFace = null;
                previousGlyph = 0;
                continue;
            }

            double scale = size / face.unitsPerEm();
            width += face.advance(glyph) * scale;
            if (face == previousFace) {
                width += face.kerning(previousGlyph, glyph) * scale;
            }
            previousFace = face;
            previousGlyph = glyph;
        }
        return width;
    }

    // ==================================================================================
    // Access
    // ==================================================================================

    /** Faces registered under a logical name, in registration order. */
    public List<FreeTypeFace> faces(String name) {
        List<FreeTypeFace> list = faces.get(key(name));
        return list != null ? List.copyOf(list) : List.of();
    }

    /** The full fallback chain. */
    public List<FreeTypeFace> fallbackChain() {
        return List.copyOf(fallbackChain);
    }

    public boolean isEmpty() {
        return fallbackChain.isEmpty();
    }

    // ==================================================================================
    // Cleanup
    // ==================================================================================

    public void destroy() {
        for (FreeTypeFace face : fallbackChain) {
            face.destroy();
        }
        faces.clear();
        fallbackChain.clear();
    }

    // ==================================================================================
    // Private
    // ==================================================================================

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isFontFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".ttf") || name.endsWith(".otf") || name.endsWith(".ttc");
    }

    private byte[] loadResource(String resourcePath) {
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            if (in == null) return null;
            return in.readAllBytes();
        } catch (IOException e) {
            throw new FontLoadException("Failed to read font resource: " + resourcePath, e);
        }
    }
}
