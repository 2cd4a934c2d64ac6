package com.sdsketch.loader.record;

import com.sdsketch.model.RgbColor;

/** A {@code 10,} line. */
public final class VariableRecord {
    private final SourceLocation location;
    private final int id;
    private final String name;
    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final int shapeCode;
    private final RgbColor borderColor;
    private final RgbColor fillColor;

    public VariableRecord(
            SourceLocation location,
            int id,
            String name,
            int x,
            int y,
            int width,
            int height,
            int shapeCode,
            RgbColor borderColor,
            RgbColor fillColor) {
        this.location = location;
        this.id = id;
        this.name = name;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.shapeCode = shapeCode;
        this.borderColor = borderColor;
        this.fillColor = fillColor;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getId() {
        return id;
    }

    /** Unquoted name. */
    public String getName() {
        return name;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getShapeCode() {
        return shapeCode;
    }

    public RgbColor getBorderColor() {
        return borderColor;
    }

    public RgbColor getFillColor() {
        return fillColor;
    }
}
