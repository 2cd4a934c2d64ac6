package com.sdsketch.loader;

import java.util.Arrays;
import java.util.List;

/**
 * A sketch file cut into its equation section, the first sketch view's record lines and the
 * footer. Line indexes are 0-based positions in {@link #getLines()}.
 */
public final class MdlSections {
    private final String sourceName;
    private final List<String> lines;
    private final int markerLine;
    private final int sketchEndLine;
    private final SketchMarkers markers;

    private MdlSections(String sourceName, List<String> lines, int markerLine, int sketchEndLine) {
        this.sourceName = sourceName;
        this.lines = lines;
        this.markerLine = markerLine;
        this.sketchEndLine = sketchEndLine;
        this.markers = SketchMarkers.detect(lines.get(markerLine));
    }

    public static MdlSections split(String sourceName, String text) throws MdlFormatException {
        List<String> lines = Arrays.asList(text.split("\r?\n", -1));
        int marker = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (SketchMarkers.isOpeningLine(lines.get(i))) {
                marker = i;
                break;
            }
        }
        if (marker < 0) {
            throw new MdlFormatException("sketch section", "No sketch section found in " + sourceName);
        }
        int end = lines.size();
        for (int i = marker + 1; i < lines.size(); i++) {
            if (SketchMarkers.isClosingLine(lines.get(i))) {
                end = i;
                break;
            }
        }
        return new MdlSections(sourceName, List.copyOf(lines), marker, end);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getLines() {
        return lines;
    }

    public int getMarkerLine() {
        return markerLine;
    }

    /** Index of the first {@code ///---} line after the marker, or the line count when absent. */
    public int getSketchEndLine() {
        return sketchEndLine;
    }

    public SketchMarkers getMarkers() {
        return markers;
    }

    public String getEquationsText() {
        return String.join("\n", lines.subList(0, markerLine));
    }

    public List<String> getSketchLines() {
        return lines.subList(markerLine + 1, sketchEndLine);
    }

    public List<String> getFooterLines() {
        return lines.subList(sketchEndLine, lines.size());
    }
}
