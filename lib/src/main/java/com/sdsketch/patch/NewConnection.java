package com.sdsketch.patch;

import com.sdsketch.model.Polarity;
import java.util.Objects;

/** An arrow to add, by variable name. Names may refer to existing or newly added variables. */
public final class NewConnection {
    private final String from;
    private final String to;
    private final Polarity polarity;

    public NewConnection(String from, String to, Polarity polarity) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.polarity = polarity == null ? Polarity.POSITIVE : polarity;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    @Override
    public String toString() {
        return from + " -> " + to + " (" + polarity + ")";
    }
}
