package com.sdsketch.model;

/** External source or sink of a flow, read from a {@code 12,} record with shape code 48. */
public final class Cloud {
    public static final int CLOUD_SHAPE_CODE = 48;

    private final int id;
    private final int shapeCode;
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public Cloud(int id, int shapeCode, int x, int y, int width, int height) {
        this.id = id;
        this.shapeCode = shapeCode;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
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
