/**
 * FreeType-backed text measurement.
 *
 * <p>Loads TTF/OTF fonts through LWJGL's FreeType binding and reports string
 * widths from unscaled glyph advances and kerning, scaled to the requested
 * pixel size. Plugs into {@link dev.everydaythings.textmetrics.TextMetrics}
 * as its {@link dev.everydaythings.textmetrics.MetricsProvider}.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (FreeTypeMetricsProvider provider = FreeTypeMetricsProvider.withDefaultFonts()) {
 *     TextMetrics metrics = TextMetrics.create(provider);
 *     double width = metrics.width("Hello, world!");
 *     List<String> lines = metrics.lines("The quick brown fox",
 *             TextMetricsOptions.builder().width(80).build(), TextMetricsOptions.EMPTY);
 * }
 * }</pre>
 *
 * <h2>Font Resolution</h2>
 * <p>A CSS family list such as {@code "Helvetica, Arial, sans-serif"} is walked
 * left to right. Each entry matches a logical registration name or a face's
 * family name, ignoring case and quotes. Generic families map to the faces
 * {@link FreeTypeFontManager#loadDefaultFonts()} discovered. Within a family,
 * the face whose bold/italic flags match the descriptor wins.
 *
 * <h2>Fallback</h2>
 * <p>Code points the chosen face has no glyph for are measured with the first
 * face in the fallback chain (registration order) that has one. Kerning only
 * applies between neighbours from the same face.
 *
 * <h2>Native Libraries</h2>
 * <p>The LWJGL natives for the build platform are selected by a Maven profile.
 * Faces are not thread-confined; each serializes its own glyph slot.
 *
 * @see FreeTypeFontManager
 * @see FreeTypeMetricsProvider
 */
package dev.everydaythings.textmetrics.freetype;
