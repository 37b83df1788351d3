package dev.everydaythings.textmetrics;

import dev.everydaythings.textmetrics.style.StyleSnapshot;

/**
 * A host element together with the capabilities that read it. Missing
 * capabilities are reported when they are first needed.
 */
final class ElementBinding<E> {

    private final E handle;
    private final StyleSource<? super E> styleSource;
    private final TextSource<? super E> textSource;

    ElementBinding(E handle, StyleSource<? super E> styleSource, TextSource<? super E> textSource) {
        this.handle = handle;
        this.styleSource = styleSource;
        this.textSource = textSource;
    }

    StyleSnapshot style() {
        if (styleSource == null) {
            throw new MissingCapabilityException("No StyleSource available to read the element style");
        }
        StyleSnapshot style = styleSource.resolve(handle);
        return style != null ? style : StyleSnapshot.EMPTY;
    }

    double boxWidth() {
        if (styleSource == null) {
            throw new MissingCapabilityException("No StyleSource available to read the element width");
        }
        return styleSource.boxWidth(handle);
    }

    String text() {
        if (textSource == null) {
            throw new MissingCapabilityException("No TextSource available to read the element text");
        }
        String text = textSource.read(handle);
        return text != null ? text : "";
    }
}
