package com.sdsketch.model;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical in-memory form of a sketch file.
 *
 * <p>{@link #getInfluenceLinks()} are the variable-to-variable arrows exactly as drawn (plus any
 * enhancement links) and are what the writer regenerates. {@link #getConnections()} is the merged
 * causal view in which valves are resolved to their flow variables and stock/flow pairs derived
 * from equations are added.
 */
public final class StructuralModel {
    private final List<Variable> variables;
    private final List<Valve> valves;
    private final List<Cloud> clouds;
    private final List<Flow> flows;
    private final List<FlowPipe> flowPipes;
    private final List<Connection> influenceLinks;
    private final List<Connection> connections;
    private final Map<Integer, Variable> variablesById;
    private final Map<String, Variable> variablesByName;

    public StructuralModel(
            List<Variable> variables,
            List<Valve> valves,
            List<Cloud> clouds,
            List<Flow> flows,
            List<FlowPipe> flowPipes,
            List<Connection> influenceLinks,
            List<Connection> connections) {
        this.variables = List.copyOf(variables);
        this.valves = List.copyOf(valves);
        this.clouds = List.copyOf(clouds);
        this.flows = List.copyOf(flows);
        this.flowPipes = List.copyOf(flowPipes);
        this.influenceLinks = List.copyOf(influenceLinks);
        this.connections = List.copyOf(connections);
        Map<Integer, Variable> byId = new HashMap<>();
        Map<String, Variable> byName = new LinkedHashMap<>();
        for (Variable variable : this.variables) {
            byId.put(variable.getId(), variable);
            byName.putIfAbsent(variable.getName(), variable);
        }
        this.variablesById = byId;
        this.variablesByName = byName;
    }

    /** Model made of variables and influence links only, the shape produced by the suggestion layer. */
    public static StructuralModel of(List<Variable> variables, List<Connection> influenceLinks) {
        return new StructuralModel(variables, List.of(), List.of(), List.of(), List.of(), influenceLinks, influenceLinks);
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public List<Valve> getValves() {
        return valves;
    }

    public List<Cloud> getClouds() {
        return clouds;
    }

    public List<Flow> getFlows() {
        return flows;
    }

    public List<FlowPipe> getFlowPipes() {
        return flowPipes;
    }

    public List<Connection> getInfluenceLinks() {
        return influenceLinks;
    }

    public List<Connection> getConnections() {
        return connections;
    }

    public Optional<Variable> findVariable(int id) {
        return Optional.ofNullable(variablesById.get(id));
    }

    public Optional<Variable> findVariable(String name) {
        return Optional.ofNullable(variablesByName.get(name));
    }

    /** Largest id used by any sketch element (variables, valves and clouds). */
    public int maxElementId() {
        int max = 0;
        for (Variable variable : variables) {
            max = Math.max(max, variable.getId());
        }
        for (Valve valve : valves) {
            max = Math.max(max, valve.getId());
        }
        for (Cloud cloud : clouds) {
            max = Math.max(max, cloud.getId());
        }
        return max;
    }

    public StructuralModel withVariables(List<Variable> newVariables) {
        return new StructuralModel(newVariables, valves, clouds, flows, flowPipes, influenceLinks, connections);
    }

    public StructuralModel withInfluenceLinks(List<Connection> newLinks) {
        return new StructuralModel(variables, valves, clouds, flows, flowPipes, newLinks, connections);
    }
}
