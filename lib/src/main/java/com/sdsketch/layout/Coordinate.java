package com.sdsketch.layout;

import com.sdsketch.model.Point;

/** Fractional canvas position used while routing; truncated to a {@link Point} for output. */
public final class Coordinate {
    private final double x;
    private final double y;

    public Coordinate(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public static Coordinate of(Point point) {
        return new Coordinate(point.getX(), point.getY());
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public Point truncate() {
        return new Point((int) x, (int) y);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
