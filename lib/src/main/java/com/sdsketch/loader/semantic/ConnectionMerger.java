package com.sdsketch.loader.semantic;

import com.sdsketch.loader.record.ConnectionRecord;
import com.sdsketch.model.Connection;
import com.sdsketch.model.Dependency;
import com.sdsketch.model.Equation;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.Provenance;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the merged causal view: drawn arrows with valves replaced by their flow variables,
 * then stock/flow pairs implied by stock equations. Drawn arrows win on a duplicate {@code (from, to)}.
 */
final class ConnectionMerger {
    private final ParserState state;

    ConnectionMerger(ParserState state) {
        this.state = state;
    }

    List<Connection> merge(List<ConnectionRecord> arrows) {
        Map<String, Connection> merged = new LinkedHashMap<>();
        for (ConnectionRecord arrow : arrows) {
            Connection connection = fromSketch(arrow);
            if (connection != null) {
                merged.putIfAbsent(connection.key(), connection);
            }
        }
        for (Variable stock : state.variables()) {
            if (stock.getKind() != VariableKind.STOCK || stock.getEquation() == null) {
                continue;
            }
            for (Dependency dependency : stock.getEquation().getDependencies()) {
                Variable flow = state.variableForEquationName(dependency.getName());
                if (flow == null) {
                    state.warn(null, "Stock '" + stock.getName() + "' references unknown variable '"
                            + dependency.getName() + "'");
                    continue;
                }
                if (flow.getKind() != VariableKind.FLOW) {
                    continue;
                }
                Connection connection = dependency.isNegative()
                        ? Connection.between(stock, flow, Polarity.UNDECLARED, Provenance.FROM_EQUATION)
                        : Connection.between(flow, stock, Polarity.UNDECLARED, Provenance.FROM_EQUATION);
                merged.putIfAbsent(connection.key(), connection);
            }
        }
        return new ArrayList<>(merged.values());
    }

    private Connection fromSketch(ConnectionRecord arrow) {
        Variable from = endpoint(arrow.getFromId());
        Variable to = endpoint(arrow.getToId());
        if (from == null || to == null) {
            if (isUnknown(arrow.getFromId()) || isUnknown(arrow.getToId())) {
                state.warn(arrow.getLocation(), "Connection " + arrow.getId() + " references unknown element "
                        + (isUnknown(arrow.getFromId()) ? arrow.getFromId() : arrow.getToId()));
            }
            return null;
        }
        if (from.getId() == to.getId()) {
            return null;
        }
        if (arrow.getParams().isFlowPipe()) {
            Variable[] oriented = orientPipe(from, to);
            from = oriented[0];
            to = oriented[1];
        }
        Polarity polarity = arrow.getParams().getPolarity();
        if (polarity == Polarity.UNDECLARED) {
            polarity = equationPolarity(from, to);
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

    /** Variable at a sketch id, looking through valves to the flow they control. */
    private Variable endpoint(int id) {
        if (state.isValve(id)) {
            Integer flowId = state.flowForValve(id);
            return flowId == null ? null : state.variable(flowId);
        }
        return state.variable(id);
    }

    private boolean isUnknown(int id) {
        return !state.isValve(id) && !state.isCloud(id) && !state.hasVariable(id);
    }

    /** Sign with which {@code to}'s equation lists {@code from}, or UNDECLARED when it does not. */
    Polarity equationPolarity(Variable from, Variable to) {
        Equation equation = to.getEquation();
        if (equation == null) {
            return Polarity.UNDECLARED;
        }
        for (Dependency dependency : equation.getDependencies()) {
            Variable referenced = state.variableForEquationName(dependency.getName());
            if (referenced != null && referenced.getId() == from.getId()) {
                return dependency.getPolarity();
            }
        }
        return Polarity.UNDECLARED;
    }

    private Variable[] orientPipe(Variable a, Variable b) {
        Variable stock = a.getKind() == VariableKind.STOCK ? a : b.getKind() == VariableKind.STOCK ? b : null;
        Variable flow = a.getKind() == VariableKind.FLOW ? a : b.getKind() == VariableKind.FLOW ? b : null;
        if (stock == null || flow == null || stock == flow || stock.getEquation() == null) {
            return new Variable[] {a, b};
        }
        for (Dependency dependency : stock.getEquation().getDependencies()) {
            Variable referenced = state.variableForEquationName(dependency.getName());
            if (referenced != null && referenced.getId() == flow.getId()) {
                return dependency.isNegative() ? new Variable[] {stock, flow} : new Variable[] {flow, stock};
            }
        }
        return new Variable[] {a, b};
    }
}
