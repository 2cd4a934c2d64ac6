package com.sdsketch.patch;

import com.sdsketch.model.RgbColor;
import java.util.Locale;

/** Highlight applied to records added by a patch. */
public enum ColorScheme {
    THEORY(RgbColor.GREEN, RgbColor.LINE_GREEN),
    ARCHETYPE(RgbColor.PURPLE, RgbColor.PURPLE),
    NONE(null, null);

    private final RgbColor border;
    private final RgbColor line;

    ColorScheme(RgbColor border, RgbColor line) {
        this.border = border;
        this.line = line;
    }

    /** Border for new variables, or {@code null} for the uncolored record form. */
    public RgbColor getBorder() {
        return border;
    }

    /** Line color for new connections, or {@code null} for the standard record form. */
    public RgbColor getLine() {
        return line;
    }

    public static ColorScheme fromName(String name) {
        if (name == null || name.isBlank()) {
            return THEORY;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
