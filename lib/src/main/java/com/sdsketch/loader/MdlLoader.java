package com.sdsketch.loader;

import com.sdsketch.loader.record.SketchRecords;
import com.sdsketch.loader.semantic.ModelBuilder;
import com.sdsketch.model.Equation;
import com.sdsketch.model.StructuralModel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/** Entry point for reading sketch files into a {@link StructuralModel}. */
public final class MdlLoader {
    private static final Logger LOGGER = Logger.getLogger(MdlLoader.class.getName());

    public LoaderResult load(Path path) throws LoaderException {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoaderException("Unable to read " + path, e);
        }
        return parse(path.getFileName().toString(), text);
    }

    public LoaderResult parse(String sourceName, String text) throws MdlFormatException {
        MdlSections sections = MdlSections.split(sourceName, text);
        List<LoaderMessage> messages = new ArrayList<>();
        List<Equation> equations = new EquationReader(messages).read(sourceName, sections.getEquationsText());
        SketchRecords records = new SketchRecordReader(messages).read(sections);
        StructuralModel model = new ModelBuilder(sourceName, messages).build(records, equations);
        LOGGER.fine(() -> String.format(
                "%s: %d variables, %d valves, %d clouds, %d connections, %d warnings",
                sourceName,
                model.getVariables().size(),
                model.getValves().size(),
                model.getClouds().size(),
                model.getConnections().size(),
                messages.size()));
        return new LoaderResult(model, equations, messages, sections.getMarkers());
    }
}
