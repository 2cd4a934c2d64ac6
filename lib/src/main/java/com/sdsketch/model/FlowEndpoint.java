package com.sdsketch.model;

import java.util.Locale;
import java.util.Objects;

/** One end of a flow: a stock (by name), a cloud (by id) or an element that is neither. */
public final class FlowEndpoint {

    public enum Kind {
        STOCK,
        CLOUD,
        OTHER;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final int id;
    private final String name;

    public FlowEndpoint(Kind kind, int id, String name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = id;
        this.name = name;
    }

    public static FlowEndpoint stock(Variable variable) {
        return new FlowEndpoint(Kind.STOCK, variable.getId(), variable.getName());
    }

    public static FlowEndpoint cloud(int id) {
        return new FlowEndpoint(Kind.CLOUD, id, null);
    }

    public static FlowEndpoint other(int id, String name) {
        return new FlowEndpoint(Kind.OTHER, id, name);
    }

    public Kind getKind() {
        return kind;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return kind.label() + ":" + (name != null ? name : String.valueOf(id));
    }
}
