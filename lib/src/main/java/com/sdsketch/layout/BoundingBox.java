package com.sdsketch.layout;

import com.sdsketch.model.Variable;

/** Padded rectangle around a variable, tagged with the variable id. Y grows downwards. */
public final class BoundingBox {
    private final int id;
    private final double left;
    private final double right;
    private final double top;
    private final double bottom;

    public BoundingBox(int id, double left, double right, double top, double bottom) {
        this.id = id;
        this.left = left;
        this.right = right;
        this.top = top;
        this.bottom = bottom;
    }

    public static BoundingBox around(Variable variable, int padding) {
        return around(variable.getId(), variable.getX(), variable.getY(), variable.getWidth(), variable.getHeight(),
                padding);
    }

    public static BoundingBox around(int id, double centerX, double centerY, double width, double height, int padding) {
        return new BoundingBox(
                id,
                centerX - width / 2 - padding,
                centerX + width / 2 + padding,
                centerY - height / 2 - padding,
                centerY + height / 2 + padding);
    }

    public int getId() {
        return id;
    }

    public double getLeft() {
        return left;
    }

    public double getRight() {
        return right;
    }

    public double getTop() {
        return top;
    }

    public double getBottom() {
        return bottom;
    }

    public boolean contains(Coordinate point) {
        return left <= point.getX() && point.getX() <= right && top <= point.getY() && point.getY() <= bottom;
    }

    @Override
    public String toString() {
        return "#" + id + "[" + left + "," + top + " - " + right + "," + bottom + "]";
    }
}
