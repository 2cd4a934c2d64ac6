package com.sdsketch.model;

import java.util.Objects;

/** One entry of an {@code A FUNCTION OF( ... )} argument list. */
public final class Dependency {
    private final String name;
    private final boolean negative;

    public Dependency(String name, boolean negative) {
        this.name = Objects.requireNonNull(name, "name");
        this.negative = negative;
    }

    public String getName() {
        return name;
    }

    public boolean isNegative() {
        return negative;
    }

    /** Polarity implied by the sign prefix; an unsigned dependency counts as positive. */
    public Polarity getPolarity() {
        return negative ? Polarity.NEGATIVE : Polarity.POSITIVE;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Dependency)) {
            return false;
        }
        Dependency other = (Dependency) obj;
        return negative == other.negative && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, negative);
    }

    @Override
    public String toString() {
        return (negative ? "-" : "") + name;
    }
}
