package com.sdsketch.layout;

import java.util.Properties;

/**
 * Tunables of the layout engine. Defaults match the authoring tool's usual canvas; any of them
 * can be overridden through {@code sdsketch.layout.*} properties.
 */
public final class LayoutOptions {
    public static final String PREFIX = "sdsketch.layout.";

    private static final LayoutOptions DEFAULTS = new LayoutOptions(50, 200, 10, 100, 100, 2400, 50, 950, 300);

    private final int padding;
    private final int minSpacing;
    private final int margin;
    private final int maxIterations;
    private final int canvasMinX;
    private final int canvasMaxX;
    private final int canvasMinY;
    private final int canvasMaxY;
    private final int valveSnapRadius;

    public LayoutOptions(
            int padding,
            int minSpacing,
            int margin,
            int maxIterations,
            int canvasMinX,
            int canvasMaxX,
            int canvasMinY,
            int canvasMaxY,
            int valveSnapRadius) {
        if (canvasMinX > canvasMaxX || canvasMinY > canvasMaxY) {
            throw new IllegalArgumentException("Canvas bounds are inverted");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.padding = padding;
        this.minSpacing = minSpacing;
        this.margin = margin;
        this.maxIterations = maxIterations;
        this.canvasMinX = canvasMinX;
        this.canvasMaxX = canvasMaxX;
        this.canvasMinY = canvasMinY;
        this.canvasMaxY = canvasMaxY;
        this.valveSnapRadius = valveSnapRadius;
    }

    public static LayoutOptions defaults() {
        return DEFAULTS;
    }

    public static LayoutOptions fromProperties(Properties properties) {
        return new LayoutOptions(
                intProperty(properties, "padding", DEFAULTS.padding),
                intProperty(properties, "minSpacing", DEFAULTS.minSpacing),
                intProperty(properties, "margin", DEFAULTS.margin),
                intProperty(properties, "maxIterations", DEFAULTS.maxIterations),
                intProperty(properties, "canvasMinX", DEFAULTS.canvasMinX),
                intProperty(properties, "canvasMaxX", DEFAULTS.canvasMaxX),
                intProperty(properties, "canvasMinY", DEFAULTS.canvasMinY),
                intProperty(properties, "canvasMaxY", DEFAULTS.canvasMaxY),
                intProperty(properties, "valveSnapRadius", DEFAULTS.valveSnapRadius));
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    /** Clearance added around each variable when it is treated as an obstacle. */
    public int getPadding() {
        return padding;
    }

    public int getMinSpacing() {
        return minSpacing;
    }

    public int getMargin() {
        return margin;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getCanvasMinX() {
        return canvasMinX;
    }

    public int getCanvasMaxX() {
        return canvasMaxX;
    }

    public int getCanvasMinY() {
        return canvasMinY;
    }

    public int getCanvasMaxY() {
        return canvasMaxY;
    }

    public int getValveSnapRadius() {
        return valveSnapRadius;
    }
}
