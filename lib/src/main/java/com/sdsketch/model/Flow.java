package com.sdsketch.model;

import java.util.Objects;

/** Derived plumbing: material moves from {@code from} through a valve to {@code to}. */
public final class Flow {
    private final int valveId;
    private final String flowName;
    private final FlowEndpoint from;
    private final FlowEndpoint to;

    public Flow(int valveId, String flowName, FlowEndpoint from, FlowEndpoint to) {
        this.valveId = valveId;
        this.flowName = flowName;
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public int getValveId() {
        return valveId;
    }

    public String getFlowName() {
        return flowName;
    }

    public FlowEndpoint getFrom() {
        return from;
    }

    public FlowEndpoint getTo() {
        return to;
    }

    @Override
    public String toString() {
        return from + " -> valve#" + valveId + " -> " + to;
    }
}
