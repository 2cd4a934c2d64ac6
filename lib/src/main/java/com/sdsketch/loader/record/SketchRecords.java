package com.sdsketch.loader.record;

import java.util.List;

/** Typed records of the first sketch view, in file order. */
public final class SketchRecords {
    private final List<VariableRecord> variables;
    private final List<ValveRecord> valves;
    private final List<CloudRecord> clouds;
    private final List<ConnectionRecord> connections;

    public SketchRecords(
            List<VariableRecord> variables,
            List<ValveRecord> valves,
            List<CloudRecord> clouds,
            List<ConnectionRecord> connections) {
        this.variables = List.copyOf(variables);
        this.valves = List.copyOf(valves);
        this.clouds = List.copyOf(clouds);
        this.connections = List.copyOf(connections);
    }

    public List<VariableRecord> getVariables() {
        return variables;
    }

    public List<ValveRecord> getValves() {
        return valves;
    }

    public List<CloudRecord> getClouds() {
        return clouds;
    }

    public List<ConnectionRecord> getConnections() {
        return connections;
    }
}
