package com.sdsketch.loader;

/** The two spellings of the sketch section delimiters found in the wild. */
public enum SketchMarkers {
    STANDARD("\\\\\\---///", "///---\\\\\\"),
    ALTERNATE("--///", "///---\\");

    static final String HEADER_SUFFIX = " Sketch information - do not modify anything except names";
    static final String END_TOKEN = "///---";

    private final String opening;
    private final String closing;

    SketchMarkers(String opening, String closing) {
        this.opening = opening;
        this.closing = closing;
    }

    public String getOpening() {
        return opening;
    }

    public String getClosing() {
        return closing;
    }

    /** Full sketch header line, without terminator. */
    public String headerLine() {
        return opening + HEADER_SUFFIX;
    }

    /** Whether {@code line} opens a sketch section, in either spelling. */
    public static boolean isOpeningLine(String line) {
        return line.contains(STANDARD.opening) || line.contains(ALTERNATE.opening);
    }

    public static boolean isClosingLine(String line) {
        return line.contains(END_TOKEN);
    }

    public static SketchMarkers detect(String openingLine) {
        return openingLine.contains(STANDARD.opening) ? STANDARD : ALTERNATE;
    }

    public static SketchMarkers fromName(String name) {
        if (name == null || name.isBlank() || "std".equalsIgnoreCase(name) || "standard".equalsIgnoreCase(name)) {
            return STANDARD;
        }
        if ("alt".equalsIgnoreCase(name) || "alternate".equalsIgnoreCase(name)) {
            return ALTERNATE;
        }
        throw new IllegalArgumentException("Unknown marker style: " + name);
    }
}
