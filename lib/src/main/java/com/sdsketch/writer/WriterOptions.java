package com.sdsketch.writer;

import com.sdsketch.loader.SketchMarkers;
import java.util.Properties;

/** Output knobs for {@link MdlWriter}. */
public final class WriterOptions {
    public static final String MARKERS_PROPERTY = "sdsketch.writer.markers";
    public static final String CONTROL_PROPERTY = "sdsketch.writer.control";

    private static final WriterOptions DEFAULTS = new WriterOptions(SketchMarkers.STANDARD, false);

    private final SketchMarkers markers;
    private final boolean withControl;

    private WriterOptions(SketchMarkers markers, boolean withControl) {
        this.markers = markers;
        this.withControl = withControl;
    }

    public static WriterOptions defaults() {
        return DEFAULTS;
    }

    /** Reads {@code sdsketch.writer.markers} ({@code std}/{@code alt}) and {@code sdsketch.writer.control}. */
    public static WriterOptions fromProperties(Properties properties) {
        return new WriterOptions(
                SketchMarkers.fromName(properties.getProperty(MARKERS_PROPERTY)),
                Boolean.parseBoolean(properties.getProperty(CONTROL_PROPERTY, "false")));
    }

    public WriterOptions withMarkers(SketchMarkers newMarkers) {
        return new WriterOptions(newMarkers, withControl);
    }

    public WriterOptions withControl(boolean control) {
        return new WriterOptions(markers, control);
    }

    public SketchMarkers getMarkers() {
        return markers;
    }

    public boolean isWithControl() {
        return withControl;
    }
}
