package com.sdsketch.model;

import java.util.Objects;

/**
 * A named node of the sketch. Instances are immutable; layout and color tagging produce copies.
 */
public final class Variable {
    public static final int DEFAULT_WIDTH = 60;
    public static final int DEFAULT_HEIGHT = 26;

    private final int id;
    private final String name;
    private final VariableKind kind;
    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final RgbColor borderColor;
    private final RgbColor fillColor;
    private final Equation equation;

    public Variable(
            int id,
            String name,
            VariableKind kind,
            int x,
            int y,
            int width,
            int height,
            RgbColor borderColor,
            RgbColor fillColor,
            Equation equation) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.borderColor = borderColor;
        this.fillColor = fillColor;
        this.equation = equation;
    }

    public Variable(int id, String name, VariableKind kind, int x, int y, int width, int height) {
        this(id, name, kind, x, y, width, height, null, null, null);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public VariableKind getKind() {
        return kind;
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

    public RgbColor getBorderColor() {
        return borderColor;
    }

    public RgbColor getFillColor() {
        return fillColor;
    }

    public boolean isColored() {
        return borderColor != null;
    }

    /** The parsed equation block for this variable, or {@code null} when none was found. */
    public Equation getEquation() {
        return equation;
    }

    public Variable withPosition(int newX, int newY) {
        return new Variable(id, name, kind, newX, newY, width, height, borderColor, fillColor, equation);
    }

    public Variable withBorderColor(RgbColor color) {
        return new Variable(id, name, kind, x, y, width, height, color, fillColor, equation);
    }

    public Variable withName(String newName) {
        return new Variable(
                id, newName, kind, x, y, width, height, borderColor, fillColor,
                equation == null ? null : equation.withName(newName));
    }

    public Variable withEquation(Equation newEquation) {
        return new Variable(id, name, kind, x, y, width, height, borderColor, fillColor, newEquation);
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + "#" + id + "[" + name + "]";
    }
}
