package com.sdsketch.loader.semantic;

import com.sdsketch.loader.LoaderMessage;
import com.sdsketch.loader.record.CloudRecord;
import com.sdsketch.loader.record.ConnectionRecord;
import com.sdsketch.loader.record.SketchRecords;
import com.sdsketch.loader.record.ValveRecord;
import com.sdsketch.loader.record.VariableRecord;
import com.sdsketch.model.Cloud;
import com.sdsketch.model.Connection;
import com.sdsketch.model.Equation;
import com.sdsketch.model.Flow;
import com.sdsketch.model.FlowPipe;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.Provenance;
import com.sdsketch.model.StructuralModel;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link StructuralModel} from sketch records and equation blocks. Every build gets a
 * fresh {@link ParserState}; recoverable problems are appended to the message list.
 */
public final class ModelBuilder {
    private final String sourceName;
    private final List<LoaderMessage> messages;

    public ModelBuilder(String sourceName, List<LoaderMessage> messages) {
        this.sourceName = sourceName;
        this.messages = messages;
    }

    public StructuralModel build(SketchRecords records, List<Equation> equations) {
        ParserState state = new ParserState(sourceName, messages);
        equations.forEach(state::addEquation);
        for (VariableRecord record : records.getVariables()) {
            addVariable(state, record);
        }
        state.attachEquations();
        for (ValveRecord record : records.getValves()) {
            state.addValve(new Valve(
                    record.getId(), record.getX(), record.getY(), record.getWidth(), record.getHeight(), null));
        }
        for (CloudRecord record : records.getClouds()) {
            state.addCloud(new Cloud(
                    record.getId(), record.getShapeCode(), record.getX(), record.getY(),
                    record.getWidth(), record.getHeight()));
        }

        List<ConnectionRecord> arrows = records.getConnections();
        new ValveResolver(state).resolveAll(arrows);

        ConnectionMerger merger = new ConnectionMerger(state);
        List<FlowPipe> pipes = new ArrayList<>();
        List<Connection> influenceLinks = new ArrayList<>();
        for (ConnectionRecord arrow : arrows) {
            int from = arrow.getFromId();
            int to = arrow.getToId();
            if (isPlumbing(state, from) || isPlumbing(state, to)) {
                pipes.add(new FlowPipe(arrow.getId(), from, to, arrow.getParams(), arrow.getPoints()));
            } else if (state.hasVariable(from) && state.hasVariable(to)) {
                influenceLinks.add(influenceLink(state, merger, arrow));
            }
        }
        List<Flow> flows = new FlowAssembler(state).assemble(pipes);
        List<Connection> connections = merger.merge(arrows);

        return new StructuralModel(
                state.variables(), state.valves(), state.clouds(), flows, pipes, influenceLinks, connections);
    }

    private static void addVariable(ParserState state, VariableRecord record) {
        if (state.hasVariable(record.getId())) {
            state.warn(record.getLocation(), "Duplicate variable id " + record.getId() + " ('"
                    + record.getName() + "'); skipping");
            return;
        }
        String name = record.getName();
        if (state.isNameTaken(name)) {
            name = uniqueName(state, record.getName());
            state.warn(record.getLocation(), "Duplicate variable name '" + record.getName() + "' renamed to '"
                    + name + "'");
        }
        state.addVariable(
                new Variable(
                        record.getId(),
                        name,
                        VariableKind.fromShapeCode(record.getShapeCode()),
                        record.getX(),
                        record.getY(),
                        record.getWidth(),
                        record.getHeight(),
                        record.getBorderColor(),
                        record.getFillColor(),
                        null),
                record.getName());
    }

    private static String uniqueName(ParserState state, String name) {
        int suffix = 1;
        while (state.isNameTaken(name + "_" + suffix)) {
            suffix++;
        }
        return name + "_" + suffix;
    }

    private static boolean isPlumbing(ParserState state, int id) {
        return state.isValve(id) || state.isCloud(id);
    }

    private static Connection influenceLink(ParserState state, ConnectionMerger merger, ConnectionRecord arrow) {
        Variable from = state.variable(arrow.getFromId());
        Variable to = state.variable(arrow.getToId());
        Polarity polarity = arrow.getParams().getPolarity();
        if (polarity == Polarity.UNDECLARED) {
            polarity = merger.equationPolarity(from, to);
        }
        return new Connection(
                arrow.getId(),
                from.getId(),
                to.getId(),
                from.getName(),
                to.getName(),
                polarity,
                arrow.getPoints(),
                arrow.getColor(),
                Provenance.FROM_SKETCH,
                arrow.getParams());
    }
}
