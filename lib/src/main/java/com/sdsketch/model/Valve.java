package com.sdsketch.model;

/** Visual control point of a flow, read from an {@code 11,} record. */
public final class Valve {
    private final int id;
    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final String flowName;

    public Valve(int id, int x, int y, int width, int height, String flowName) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.flowName = flowName;
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

    public Point getPosition() {
        return new Point(x, y);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /** Name of the flow variable this valve controls, or {@code null} if it could not be resolved. */
    public String getFlowName() {
        return flowName;
    }

    public Valve withFlowName(String name) {
        return new Valve(id, x, y, width, height, name);
    }

    public Valve withPosition(int newX, int newY) {
        return new Valve(id, newX, newY, width, height, flowName);
    }
}
