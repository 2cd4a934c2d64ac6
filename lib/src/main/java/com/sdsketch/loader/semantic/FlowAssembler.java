package com.sdsketch.loader.semantic;

import com.sdsketch.model.Dependency;
import com.sdsketch.model.Flow;
import com.sdsketch.model.FlowEndpoint;
import com.sdsketch.model.FlowPipe;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/** Builds {@code source -> valve -> sink} flows from the pipes attached to each valve. */
final class FlowAssembler {
    private static final Logger LOGGER = Logger.getLogger(FlowAssembler.class.getName());

    private final ParserState state;

    FlowAssembler(ParserState state) {
        this.state = state;
    }

    List<Flow> assemble(List<FlowPipe> pipes) {
        List<Flow> flows = new ArrayList<>();
        List<Valve> valves = state.valves();
        valves.sort(Comparator.comparingInt(Valve::getId));
        for (Valve valve : valves) {
            List<FlowPipe> attached = new ArrayList<>();
            for (FlowPipe pipe : pipes) {
                if (pipe.isPipe() && pipe.touches(valve.getId())) {
                    attached.add(pipe);
                }
            }
            if (attached.size() != 2) {
                LOGGER.fine(() -> "Valve " + valve.getId() + " has " + attached.size() + " pipes; no flow built");
                continue;
            }
            FlowPipe first = attached.get(0);
            FlowPipe second = attached.get(1);
            FlowEndpoint a = endpoint(otherEnd(first, valve.getId()));
            FlowEndpoint b = endpoint(otherEnd(second, valve.getId()));
            boolean swap;
            if (first.getParams().isSourcePipe() != second.getParams().isSourcePipe()) {
                swap = second.getParams().isSourcePipe();
            } else {
                swap = drainsInto(a, valve.getFlowName()) || drainedBy(b, valve.getFlowName());
            }
            flows.add(swap
                    ? new Flow(valve.getId(), valve.getFlowName(), b, a)
                    : new Flow(valve.getId(), valve.getFlowName(), a, b));
        }
        return flows;
    }

    private static int otherEnd(FlowPipe pipe, int valveId) {
        return pipe.getFromId() == valveId ? pipe.getToId() : pipe.getFromId();
    }

    private FlowEndpoint endpoint(int id) {
        if (state.isCloud(id)) {
            return FlowEndpoint.cloud(id);
        }
        Variable variable = state.variable(id);
        if (variable != null && variable.getKind() == VariableKind.STOCK) {
            return FlowEndpoint.stock(variable);
        }
        return FlowEndpoint.other(id, variable == null ? null : variable.getName());
    }

    /** The stock lists the flow positively, so the flow ends there. */
    private boolean drainsInto(FlowEndpoint endpoint, String flowName) {
        Dependency dependency = stockDependency(endpoint, flowName);
        return dependency != null && !dependency.isNegative();
    }

    /** The stock lists the flow negatively, so the flow starts there. */
    private boolean drainedBy(FlowEndpoint endpoint, String flowName) {
        Dependency dependency = stockDependency(endpoint, flowName);
        return dependency != null && dependency.isNegative();
    }

    private Dependency stockDependency(FlowEndpoint endpoint, String flowName) {
        if (flowName == null || endpoint.getKind() != FlowEndpoint.Kind.STOCK) {
            return null;
        }
        Variable stock = state.variable(endpoint.getId());
        if (stock == null || stock.getEquation() == null) {
            return null;
        }
        for (Dependency dependency : stock.getEquation().getDependencies()) {
            Variable referenced = state.variableForEquationName(dependency.getName());
            if (referenced != null && flowName.equals(referenced.getName())) {
                return dependency;
            }
        }
        return null;
    }
}
