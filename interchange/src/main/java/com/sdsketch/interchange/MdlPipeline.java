package com.sdsketch.interchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sdsketch.layout.DiagramRelayout;
import com.sdsketch.layout.LayoutOptions;
import com.sdsketch.loader.LoaderException;
import com.sdsketch.loader.LoaderResult;
import com.sdsketch.loader.MdlLoader;
import com.sdsketch.model.Point;
import com.sdsketch.model.StructuralModel;
import com.sdsketch.patch.PatchRequest;
import com.sdsketch.patch.PatchResult;
import com.sdsketch.patch.SurgicalPatcher;
import com.sdsketch.writer.MdlWriter;
import com.sdsketch.writer.WriterOptions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

/**
 * File-level operations: every call reads its inputs once and writes its outputs once, UTF-8.
 * I/O and JSON failures surface as {@link LoaderException}.
 */
public final class MdlPipeline {
    private static final Logger LOGGER = Logger.getLogger(MdlPipeline.class.getName());

    private final MdlLoader loader = new MdlLoader();
    private final JsonInterchange interchange;

    public MdlPipeline() {
        this(new JsonInterchange());
    }

    public MdlPipeline(JsonInterchange interchange) {
        this.interchange = interchange;
    }

    public LoaderResult load(Path mdl) throws LoaderException {
        return loader.load(mdl);
    }

    /** Parses {@code mdl} and writes the three interchange documents into {@code outputDir}. */
    public LoaderResult exportJson(Path mdl, Path outputDir) throws LoaderException {
        LoaderResult result = loader.load(mdl);
        ModelDocuments documents = interchange.toDocuments(result.getModel());
        try {
            Files.createDirectories(outputDir);
            write(outputDir.resolve(ModelDocuments.VARIABLES_FILE), interchange.toJson(documents.getVariables()));
            write(outputDir.resolve(ModelDocuments.CONNECTIONS_FILE), interchange.toJson(documents.getConnections()));
            write(outputDir.resolve(ModelDocuments.PLUMBING_FILE), interchange.toJson(documents.getPlumbing()));
        } catch (IOException e) {
            throw new LoaderException("Unable to write interchange documents to " + outputDir, e);
        }
        LOGGER.info(() -> "Exported " + mdl + " to " + outputDir);
        return result;
    }

    /**
     * Generates a sketch file from interchange documents.
     *
     * @param plumbingJson may be {@code null}
     */
    public void generate(Path variablesJson, Path connectionsJson, Path plumbingJson, Path output, WriterOptions options)
            throws LoaderException {
        ModelDocuments documents = new ModelDocuments(
                readJson(variablesJson), readJson(connectionsJson), plumbingJson == null ? null : readJson(plumbingJson));
        StructuralModel model;
        try {
            model = interchange.fromDocuments(documents);
        } catch (IllegalArgumentException e) {
            throw new LoaderException("Invalid interchange documents: " + e.getMessage(), e);
        }
        write(output, new MdlWriter().write(model, options));
    }

    /** Loads {@code input} and writes it back through the writer, keeping its marker spelling. */
    public LoaderResult regenerate(Path input, Path output, WriterOptions options) throws LoaderException {
        LoaderResult result = loader.load(input);
        write(output, new MdlWriter().write(result.getModel(), options.withMarkers(result.getMarkers())));
        return result;
    }

    public PatchResult patch(Path input, Path output, PatchRequest request) throws LoaderException {
        String text = read(input);
        PatchResult result = new SurgicalPatcher().patch(input.getFileName().toString(), text, request);
        write(output, result.getText());
        return result;
    }

    public DiagramRelayout.Result relayout(Path input, Path output, Map<String, Point> positions, LayoutOptions options)
            throws LoaderException {
        String text = read(input);
        DiagramRelayout.Result result =
                new DiagramRelayout(options).relayout(input.getFileName().toString(), text, positions);
        write(output, result.getText());
        return result;
    }

    private JsonNode readJson(Path path) throws LoaderException {
        try {
            return interchange.parse(read(path));
        } catch (JsonProcessingException e) {
            throw new LoaderException("Invalid JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String read(Path path) throws LoaderException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoaderException("Unable to read " + path, e);
        }
    }

    private static void write(Path path, String text) throws LoaderException {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoaderException("Unable to write " + path, e);
        }
    }
}
