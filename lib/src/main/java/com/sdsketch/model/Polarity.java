package com.sdsketch.model;

import java.util.Locale;

public enum Polarity {
    POSITIVE,
    NEGATIVE,
    UNDECLARED;

    /** Sketch arrows carry the polarity as a character code: 43 is '+', 45 is '-'. */
    public static Polarity fromArrowCode(String code) {
        if ("43".equals(code)) {
            return POSITIVE;
        }
        if ("45".equals(code)) {
            return NEGATIVE;
        }
        return UNDECLARED;
    }

    /** Interchange spelling: "positive", "negative", "undeclared". */
    public String relationship() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Polarity fromRelationship(String relationship) {
        if (relationship == null) {
            return UNDECLARED;
        }
        switch (relationship.trim().toLowerCase(Locale.ROOT)) {
            case "positive":
                return POSITIVE;
            case "negative":
                return NEGATIVE;
            default:
                return UNDECLARED;
        }
    }
}
