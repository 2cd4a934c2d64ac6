package com.sdsketch.model;

import java.util.Locale;

/** Where a connection came from. Equation-derived links are not drawn as influence arrows. */
public enum Provenance {
    FROM_EQUATION("equation"),
    FROM_SKETCH("sketch"),
    FROM_ENHANCEMENT("enhancement");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Provenance fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (Provenance provenance : values()) {
                if (provenance.label.equals(normalized)) {
                    return provenance;
                }
            }
        }
        return FROM_SKETCH;
    }
}
