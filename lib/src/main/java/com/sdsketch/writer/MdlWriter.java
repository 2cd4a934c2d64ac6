package com.sdsketch.writer;

import com.sdsketch.model.Cloud;
import com.sdsketch.model.Connection;
import com.sdsketch.model.Dependency;
import com.sdsketch.model.Equation;
import com.sdsketch.model.FlowPipe;
import com.sdsketch.model.IdAllocator;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.Provenance;
import com.sdsketch.model.StructuralModel;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Regenerates a complete sketch file from a {@link StructuralModel}. Output uses {@code \n} line
 * terminators and is deterministic for a given model.
 */
public final class MdlWriter {
    private static final Logger LOGGER = Logger.getLogger(MdlWriter.class.getName());
    private static final String FUNCTION_OF = "A FUNCTION OF";

    public String write(StructuralModel model) {
        return write(model, WriterOptions.defaults());
    }

    public String write(StructuralModel model, WriterOptions options) {
        StringBuilder out = new StringBuilder();
        out.append(LegacyText.ENCODING_HEADER).append('\n');
        appendEquations(out, model);
        if (options.isWithControl()) {
            out.append(LegacyText.CONTROL_BLOCK);
        }
        line(out, options.getMarkers().headerLine());
        LegacyText.VIEW_HEADER.forEach(header -> line(out, header));
        appendSketch(out, model);
        line(out, options.getMarkers().getClosing());
        LegacyText.FOOTER.forEach(footer -> line(out, footer));
        return out.toString();
    }

    private void appendEquations(StringBuilder out, StructuralModel model) {
        List<Variable> sorted = new ArrayList<>(model.getVariables());
        sorted.sort(Comparator.comparing(Variable::getName));
        for (Variable variable : sorted) {
            Equation equation = variable.getEquation();
            out.append(LegacyText.equationBlock(
                    NameQuoting.quote(variable.getName()),
                    dependencyList(variable, model),
                    equation == null ? "" : equation.getUnits(),
                    equation == null ? "" : equation.getDescription()));
        }
    }

    /**
     * Argument list for a variable's equation: the parsed {@code A FUNCTION OF} arguments when there
     * are any, otherwise the sources of its inbound connections. A stock also lists the flows it
     * feeds, negated, so its outflows survive regeneration.
     */
    static String dependencyList(Variable variable, StructuralModel model) {
        List<String> items = new ArrayList<>();
        Equation equation = variable.getEquation();
        if (equation != null && equation.getExpression().contains(FUNCTION_OF)) {
            for (Dependency dependency : equation.getDependencies()) {
                items.add((dependency.isNegative() ? "-" : "") + NameQuoting.quote(dependency.getName()));
            }
        } else {
            for (Connection connection : model.getConnections()) {
                if (connection.getToId() != variable.getId()) {
                    continue;
                }
                String source = model.findVariable(connection.getFromId())
                        .map(Variable::getName)
                        .orElse(connection.getFromName());
                if (source == null) {
                    continue;
                }
                items.add((connection.getPolarity() == Polarity.NEGATIVE ? "-" : "") + NameQuoting.quote(source));
            }
            if (variable.getKind() == VariableKind.STOCK) {
                for (Connection connection : model.getConnections()) {
                    if (connection.getFromId() != variable.getId()) {
                        continue;
                    }
                    model.findVariable(connection.getToId())
                            .filter(target -> target.getKind() == VariableKind.FLOW)
                            .ifPresent(flow -> items.add("-" + NameQuoting.quote(flow.getName())));
                }
            }
        }
        return String.join(",", items);
    }

    private void appendSketch(StringBuilder out, StructuralModel model) {
        List<FlowPipe> pipes = model.getFlowPipes();
        Set<FlowPipe> emitted = new HashSet<>();
        for (Element element : elements(model)) {
            if (element.valve != null) {
                for (FlowPipe pipe : pipes) {
                    if (pipe.isPipe() && pipe.touches(element.id) && emitted.add(pipe)) {
                        line(out, SketchLineFormatter.connection(
                                pipe.getId(), pipe.getFromId(), pipe.getToId(), pipe.getParams(), pipe.getPoints()));
                    }
                }
            }
            line(out, element.line);
        }

        IdAllocator ids = IdAllocator.startingAfter(model.maxElementId());
        for (Connection link : model.getInfluenceLinks()) {
            if (link.getSketchId() != null) {
                ids.reserve(link.getSketchId());
            }
        }
        pipes.forEach(pipe -> ids.reserve(pipe.getId()));

        for (Connection link : model.getInfluenceLinks()) {
            if (link.getProvenance() == Provenance.FROM_EQUATION) {
                continue;
            }
            if (model.findVariable(link.getFromId()).isEmpty() || model.findVariable(link.getToId()).isEmpty()) {
                LOGGER.warning(() -> "Skipping link with unknown endpoint: " + link);
                continue;
            }
            int id = link.getSketchId() != null ? link.getSketchId() : ids.allocate();
            if (link.getColor() != null) {
                line(out, SketchLineFormatter.coloredConnection(
                        id, link.getFromId(), link.getToId(), link.getColor(), link.getWaypoints()));
            } else {
                line(out, SketchLineFormatter.connection(
                        id, link.getFromId(), link.getToId(), link.getArrowParams(), link.getWaypoints()));
            }
        }

        for (FlowPipe pipe : pipes) {
            if (!emitted.contains(pipe)) {
                line(out, SketchLineFormatter.connection(
                        pipe.getId(), pipe.getFromId(), pipe.getToId(), pipe.getParams(), pipe.getPoints()));
            }
        }
    }

    private static List<Element> elements(StructuralModel model) {
        List<Element> elements = new ArrayList<>();
        for (Variable variable : model.getVariables()) {
            elements.add(new Element(variable.getId(), 0, SketchLineFormatter.variable(variable), null));
        }
        for (Valve valve : model.getValves()) {
            elements.add(new Element(valve.getId(), 1, SketchLineFormatter.valve(valve), valve));
        }
        for (Cloud cloud : model.getClouds()) {
            elements.add(new Element(cloud.getId(), 2, SketchLineFormatter.cloud(cloud), null));
        }
        elements.sort(Comparator.<Element>comparingInt(element -> element.id).thenComparingInt(element -> element.order));
        return elements;
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }

    private static final class Element {
        private final int id;
        private final int order;
        private final String line;
        private final Valve valve;

        Element(int id, int order, String line, Valve valve) {
            this.id = id;
            this.order = order;
            this.line = line;
            this.valve = valve;
        }
    }
}
