package com.sdsketch.loader.record;

/** A {@code 12,} line whose shape code marks it as a cloud. */
public final class CloudRecord {
    private final SourceLocation location;
    private final int id;
    private final int shapeCode;
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public CloudRecord(SourceLocation location, int id, int shapeCode, int x, int y, int width, int height) {
        this.location = location;
        this.id = id;
        this.shapeCode = shapeCode;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getId() {
        return id;
    }

    public int getShapeCode() {
        return shapeCode;
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
}
