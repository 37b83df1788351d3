/*
 * Copyright (C) 2024 textmetrics-java contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.everydaythings.textmetrics.examples;

import dev.everydaythings.textmetrics.TextMetrics;
import dev.everydaythings.textmetrics.TextMetricsOptions;
import dev.everydaythings.textmetrics.freetype.FreeTypeMetricsProvider;

import java.util.List;
import java.util.OptionalInt;

/**
 * Measures a sentence with system fonts, wraps it to a column and finds the
 * largest font size that keeps it on one line.
 *
 * Usage:
 *   hello-metrics [text] [width-px]
 */
public class HelloMetrics {

    private static final String DEFAULT_TEXT =
            "The quick brown fox jumps over the lazy dog, twice-removed.";
    private static final double DEFAULT_WIDTH = 200;

    public static void main(String[] args) {
        String text = args.length > 0 ? args[0] : DEFAULT_TEXT;
        double width = args.length > 1 ? Double.parseDouble(args[1]) : DEFAULT_WIDTH;

        try (FreeTypeMetricsProvider provider = FreeTypeMetricsProvider.withDefaultFonts()) {
            if (provider.fonts().isEmpty()) {
                System.err.println("No system fonts found; set -Dtextmetrics.fonts.dir=<dir>");
                System.exit(1);
            }
            System.out.println("Fallback chain: " + provider.fonts().fallbackChain());

            TextMetrics metrics = TextMetrics.create(provider,
                    TextMetricsOptions.builder().fontFamily("sans-serif").fontSize(16).build());

            System.out.printf("Text:  \"%s\"%n", text);
            System.out.printf("Width: %.2f px%n", metrics.width(text));

            TextMetricsOptions column = TextMetricsOptions.builder()
                    .width(width)
                    .lineHeight("1.25")
                    .build();
            List<String> lines = metrics.lines(text, column, TextMetricsOptions.EMPTY);
            System.out.printf("Wrapped to %.0f px (%d lines, %d px tall):%n",
                    width, lines.size(), metrics.height(text, column, TextMetricsOptions.EMPTY));
            for (String line : lines) {
                System.out.println("  | " + line);
            }

            TextMetricsOptions brokenAll = column.toBuilder().set("word-break", "break-all").build();
            System.out.println("With word-break: break-all:");
            for (String line : metrics.lines(text, brokenAll, TextMetricsOptions.EMPTY)) {
                System.out.println("  | " + line);
            }

            OptionalInt fit = metrics.maxFontSize(text, column, TextMetricsOptions.EMPTY);
            if (fit.isPresent()) {
                System.out.printf("Largest single-line font size for %.0f px: %d px%n", width, fit.getAsInt());
            } else {
                System.out.println("Text does not fit at any size");
            }
        }
    }
}
