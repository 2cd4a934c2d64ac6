package com.sdsketch.model;

import java.util.List;
import java.util.Objects;

/**
 * A parsed equation block: {@code name = expression ~ units ~ description |}. Dependencies are
 * only populated for {@code A FUNCTION OF( ... )} expressions.
 */
public final class Equation {
    private final String name;
    private final String expression;
    private final String units;
    private final String description;
    private final List<Dependency> dependencies;

    public Equation(String name, String expression, String units, String description, List<Dependency> dependencies) {
        this.name = Objects.requireNonNull(name, "name");
        this.expression = expression == null ? "" : expression;
        this.units = units == null ? "" : units;
        this.description = description == null ? "" : description;
        this.dependencies = List.copyOf(dependencies);
    }

    public static Equation functionOf(String name, List<Dependency> dependencies) {
        return new Equation(name, "", "", "", dependencies);
    }

    public String getName() {
        return name;
    }

    public String getExpression() {
        return expression;
    }

    public String getUnits() {
        return units;
    }

    public String getDescription() {
        return description;
    }

    public List<Dependency> getDependencies() {
        return dependencies;
    }

    public Equation withName(String newName) {
        return new Equation(newName, expression, units, description, dependencies);
    }
}
