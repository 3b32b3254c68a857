package com.analyzemyteam.timelinesync.domain;

/**
 * RGBA colour, each channel 0-255.
 */
public record MarkerColor(int red, int green, int blue, int alpha) {

    public MarkerColor {
        red = clampChannel(red);
        green = clampChannel(green);
        blue = clampChannel(blue);
        alpha = clampChannel(alpha);
    }

    public static MarkerColor rgb(int red, int green, int blue) {
        return new MarkerColor(red, green, blue, 255);
    }

    public MarkerColor withAlpha(int newAlpha) {
        return new MarkerColor(red, green, blue, newAlpha);
    }

    /** {@code #RRGGBBAA} */
    public String toHex() {
        return String.format("#%02X%02X%02X%02X", red, green, blue, alpha);
    }

    public static MarkerColor fromHex(String hex) {
        String h = hex.startsWith("#") ? hex.substring(1) : hex;
        if (h.length() != 6 && h.length() != 8) {
            throw new IllegalArgumentException("Expected #RRGGBB or #RRGGBBAA, got: " + hex);
        }
        int r = Integer.parseInt(h.substring(0, 2), 16);
        int g = Integer.parseInt(h.substring(2, 4), 16);
        int b = Integer.parseInt(h.substring(4, 6), 16);
        int a = h.length() == 8 ? Integer.parseInt(h.substring(6, 8), 16) : 255;
        return new MarkerColor(r, g, b, a);
    }

    private static int clampChannel(int v) {
        return Math.max(0, Math.min(255, v));
    }
}
