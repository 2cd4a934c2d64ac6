package com.sdsketch.patch;

import com.sdsketch.model.Point;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.Objects;

/** A variable to add. Position is optional; size defaults to the authoring tool's box. */
public final class NewVariable {
    private final String name;
    private final VariableKind kind;
    private final Point position;
    private final int width;
    private final int height;
    private final String units;
    private final String description;

    public NewVariable(
            String name, VariableKind kind, Point position, int width, int height, String units, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.position = position;
        this.width = width;
        this.height = height;
        this.units = units == null ? "" : units;
        this.description = description == null ? "" : description;
    }

    public static NewVariable of(String name, VariableKind kind) {
        return new NewVariable(name, kind, null, Variable.DEFAULT_WIDTH, Variable.DEFAULT_HEIGHT, "", "");
    }

    public NewVariable at(int x, int y) {
        return new NewVariable(name, kind, new Point(x, y), width, height, units, description);
    }

    public NewVariable withDescription(String newDescription) {
        return new NewVariable(name, kind, position, width, height, units, newDescription);
    }

    public String getName() {
        return name;
    }

    public VariableKind getKind() {
        return kind;
    }

    /** Requested centre, or {@code null} to let the patcher place it. */
    public Point getPosition() {
        return position;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public String getUnits() {
        return units;
    }

    public String getDescription() {
        return description;
    }
}
