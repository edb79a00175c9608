package org.driptable.service.columns;

import java.util.regex.Pattern;

/**
 * A bare non-negative integer is a pixel size and gets a {@code px} suffix; any other value is
 * passed through as text.
 */
public final class WidthNormalizer {

    private static final Pattern BARE_INTEGER = Pattern.compile("^[0-9]+$");

    private WidthNormalizer() {
    }

    public static String normalize(Object width) {
        if (width == null) {
            return null;
        }
        String text = String.valueOf(width).trim();
        if (BARE_INTEGER.matcher(text).matches()) {
            return text + "px";
        }
        return text;
    }
}
