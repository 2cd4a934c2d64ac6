package com.sdsketch.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Color in the sketch notation {@code R-G-B}, e.g. {@code 0-255-0}. */
public final class RgbColor {
    private static final Pattern RGB = Pattern.compile("(\\d{1,3})-(\\d{1,3})-(\\d{1,3})");

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor GREEN = new RgbColor(0, 255, 0);
    public static final RgbColor LINE_GREEN = new RgbColor(0, 192, 0);
    public static final RgbColor PURPLE = new RgbColor(128, 0, 128);

    private final int red;
    private final int green;
    private final int blue;

    public RgbColor(int red, int green, int blue) {
        this.red = checkComponent(red, "red");
        this.green = checkComponent(green, "green");
        this.blue = checkComponent(blue, "blue");
    }

    /** Returns {@code null} when the text is not an {@code R-G-B} triple (for example {@code -1--1--1}). */
    public static RgbColor parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = RGB.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        int r = Integer.parseInt(matcher.group(1));
        int g = Integer.parseInt(matcher.group(2));
        int b = Integer.parseInt(matcher.group(3));
        if (r > 255 || g > 255 || b > 255) {
            return null;
        }
        return new RgbColor(r, g, b);
    }

    public static boolean isRgb(String text) {
        return parse(text) != null;
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    private static int checkComponent(int value, String name) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " out of range: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RgbColor)) {
            return false;
        }
        RgbColor other = (RgbColor) obj;
        return red == other.red && green == other.green && blue == other.blue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(red, green, blue);
    }

    @Override
    public String toString() {
        return red + "-" + green + "-" + blue;
    }
}
