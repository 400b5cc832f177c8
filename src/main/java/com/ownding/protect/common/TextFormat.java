package com.ownding.protect.common;

public final class TextFormat {

    private TextFormat() {}

    /**
     * Right-pads {@code value} with spaces, or truncates it, to exactly {@code width} characters.
     */
    public static String padded(String value, int width) {
        if (value.length() >= width) {
            return value.substring(0, width);
        }
        return value + " ".repeat(width - value.length());
    }
}
