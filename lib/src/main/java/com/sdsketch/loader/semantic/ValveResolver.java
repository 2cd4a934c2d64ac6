package com.sdsketch.loader.semantic;

import com.sdsketch.loader.record.ConnectionRecord;
import com.sdsketch.model.Dependency;
import com.sdsketch.model.Equation;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Works out which flow variable each valve controls. A valve record carries no name, so the flow
 * is inferred from the stocks its pipes touch and the flows those stocks' equations list.
 */
final class ValveResolver {
    private static final Logger LOGGER = Logger.getLogger(ValveResolver.class.getName());

    private final ParserState state;

    ValveResolver(ParserState state) {
        this.state = state;
    }

    void resolveAll(List<ConnectionRecord> arrows) {
        List<Valve> valves = state.valves();
        valves.sort(Comparator.comparingInt(Valve::getId));
        for (Valve valve : valves) {
            Variable flow = resolve(valve, arrows);
            if (flow != null) {
                state.resolveValve(valve.getId(), flow);
            } else {
                state.warn(null, "Valve " + valve.getId() + " could not be matched to a flow variable");
            }
        }
    }

    private Variable resolve(Valve valve, List<ConnectionRecord> arrows) {
        Variable direct = state.variable(valve.getId());
        if (direct != null && direct.getKind() == VariableKind.FLOW) {
            return direct;
        }
        List<Set<Variable>> flowSets = new ArrayList<>();
        for (Variable stock : adjacentStocks(valve.getId(), arrows)) {
            Set<Variable> flows = flowsListedBy(stock);
            if (!flows.isEmpty()) {
                flowSets.add(flows);
            }
        }
        if (!flowSets.isEmpty()) {
            Set<Variable> candidates = new LinkedHashSet<>(flowSets.get(0));
            for (Set<Variable> other : flowSets.subList(1, flowSets.size())) {
                candidates.retainAll(other);
            }
            if (candidates.isEmpty()) {
                candidates = flowSets.get(0);
            }
            return closest(valve, candidates);
        }
        Variable next = state.variable(valve.getId() + 1);
        if (next != null && next.getKind() == VariableKind.FLOW) {
            LOGGER.fine(() -> "Valve " + valve.getId() + " matched to following flow " + next.getName());
            return next;
        }
        return null;
    }

    private Set<Variable> adjacentStocks(int valveId, List<ConnectionRecord> arrows) {
        Set<Variable> stocks = new LinkedHashSet<>();
        for (ConnectionRecord arrow : arrows) {
            int other;
            if (arrow.getFromId() == valveId) {
                other = arrow.getToId();
            } else if (arrow.getToId() == valveId) {
                other = arrow.getFromId();
            } else {
                continue;
            }
            Variable variable = state.variable(other);
            if (variable != null && variable.getKind() == VariableKind.STOCK) {
                stocks.add(variable);
            }
        }
        return stocks;
    }

    private Set<Variable> flowsListedBy(Variable stock) {
        Set<Variable> flows = new LinkedHashSet<>();
        Equation equation = stock.getEquation();
        if (equation == null) {
            return flows;
        }
        for (Dependency dependency : equation.getDependencies()) {
            Variable variable = state.variableForEquationName(dependency.getName());
            if (variable != null && variable.getKind() == VariableKind.FLOW) {
                flows.add(variable);
            }
        }
        return flows;
    }

    /** Picks the candidate nearest the valve, weighting the dominant axis double; ties go to the lowest id. */
    static Variable closest(Valve valve, Set<Variable> candidates) {
        Variable best = null;
        int bestScore = Integer.MAX_VALUE;
        for (Variable candidate : candidates) {
            int dx = Math.abs(valve.getX() - candidate.getX());
            int dy = Math.abs(valve.getY() - candidate.getY());
            int score = Math.min(dx, dy) + 2 * Math.max(dx, dy);
            if (best == null || score < bestScore || (score == bestScore && candidate.getId() < best.getId())) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }
}
