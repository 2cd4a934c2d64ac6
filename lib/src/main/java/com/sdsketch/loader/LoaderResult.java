package com.sdsketch.loader;

import com.sdsketch.model.Equation;
import com.sdsketch.model.StructuralModel;
import java.util.List;

/** Outcome of loading a sketch file: the model, every equation block read, and the diagnostics. */
public final class LoaderResult {
    private final StructuralModel model;
    private final List<Equation> equations;
    private final List<LoaderMessage> messages;
    private final SketchMarkers markers;

    public LoaderResult(
            StructuralModel model, List<Equation> equations, List<LoaderMessage> messages, SketchMarkers markers) {
        this.model = model;
        this.equations = List.copyOf(equations);
        this.messages = List.copyOf(messages);
        this.markers = markers;
    }

    public StructuralModel getModel() {
        return model;
    }

    public List<Equation> getEquations() {
        return equations;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    /** Every message is a warning; fatal problems are thrown as {@link LoaderException}. */
    public List<LoaderMessage> getWarnings() {
        return messages;
    }

    /** Marker spelling found in the source, so a rewrite can keep it. */
    public SketchMarkers getMarkers() {
        return markers;
    }
}
