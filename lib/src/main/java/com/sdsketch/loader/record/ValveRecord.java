package com.sdsketch.loader.record;

/** An {@code 11,} line. */
public final class ValveRecord {
    private final SourceLocation location;
    private final int id;
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public ValveRecord(SourceLocation location, int id, int x, int y, int width, int height) {
        this.location = location;
        this.id = id;
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
