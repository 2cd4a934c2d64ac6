package com.sdsketch.loader.semantic;

import com.sdsketch.loader.LoaderMessage;
import com.sdsketch.loader.record.SourceLocation;
import com.sdsketch.model.Cloud;
import com.sdsketch.model.Equation;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/** Mutable lookup tables of a single model build. Never shared between builds. */
final class ParserState {
    private static final Logger LOGGER = Logger.getLogger(ParserState.class.getName());

    private final String sourceName;
    private final List<LoaderMessage> messages;
    private final Map<String, Equation> equations = new LinkedHashMap<>();
    private final Map<Integer, Variable> variablesById = new LinkedHashMap<>();
    private final Map<String, Variable> variablesByName = new HashMap<>();
    private final Map<String, Variable> equationIndex = new HashMap<>();
    private final Map<Integer, Valve> valves = new LinkedHashMap<>();
    private final Map<Integer, Cloud> clouds = new LinkedHashMap<>();
    private final Map<Integer, Integer> valveToFlow = new LinkedHashMap<>();

    ParserState(String sourceName, List<LoaderMessage> messages) {
        this.sourceName = sourceName;
        this.messages = messages;
    }

    String getSourceName() {
        return sourceName;
    }

    List<LoaderMessage> getMessages() {
        return messages;
    }

    void warn(SourceLocation location, String message) {
        int line = location == null ? 0 : location.getLine();
        LOGGER.warning(() -> sourceName + (line > 0 ? ":" + line : "") + ": " + message);
        messages.add(LoaderMessage.warning(message, sourceName, line));
    }

    void addEquation(Equation equation) {
        Equation previous = equations.putIfAbsent(equation.getName(), equation);
        if (previous != null) {
            warn(null, "Duplicate equation for '" + equation.getName() + "'; keeping the first");
        }
    }

    Equation equation(String name) {
        return equations.get(name);
    }

    boolean isNameTaken(String name) {
        return variablesByName.containsKey(name);
    }

    boolean hasVariable(int id) {
        return variablesById.containsKey(id);
    }

    void addVariable(Variable variable, String originalName) {
        variablesById.put(variable.getId(), variable);
        variablesByName.put(variable.getName(), variable);
        Variable indexed = equationIndex.get(originalName);
        if (indexed == null || rank(variable.getKind()) < rank(indexed.getKind())) {
            equationIndex.put(originalName, variable);
        }
    }

    /** Attaches each equation to the variable its name resolves to. */
    void attachEquations() {
        for (Equation equation : equations.values()) {
            Variable target = equationIndex.get(equation.getName());
            if (target == null) {
                continue;
            }
            Variable attached = target.withEquation(equation.withName(target.getName()));
            variablesById.put(attached.getId(), attached);
            variablesByName.put(attached.getName(), attached);
            equationIndex.replaceAll((name, variable) -> variable.getId() == attached.getId() ? attached : variable);
        }
    }

    Variable variable(int id) {
        return variablesById.get(id);
    }

    Variable variableNamed(String name) {
        return variablesByName.get(name);
    }

    /** Variable an equation name refers to; flows win over stocks, stocks over auxiliaries. */
    Variable variableForEquationName(String name) {
        return equationIndex.get(name);
    }

    List<Variable> variables() {
        return new ArrayList<>(variablesById.values());
    }

    void addValve(Valve valve) {
        valves.put(valve.getId(), valve);
    }

    boolean isValve(int id) {
        return valves.containsKey(id);
    }

    Valve valve(int id) {
        return valves.get(id);
    }

    List<Valve> valves() {
        return new ArrayList<>(valves.values());
    }

    void addCloud(Cloud cloud) {
        clouds.put(cloud.getId(), cloud);
    }

    boolean isCloud(int id) {
        return clouds.containsKey(id);
    }

    List<Cloud> clouds() {
        return new ArrayList<>(clouds.values());
    }

    void resolveValve(int valveId, Variable flow) {
        valveToFlow.put(valveId, flow.getId());
        valves.put(valveId, valves.get(valveId).withFlowName(flow.getName()));
    }

    /** Flow variable id for a resolved valve, or {@code null}. */
    Integer flowForValve(int valveId) {
        return valveToFlow.get(valveId);
    }

    private static int rank(VariableKind kind) {
        switch (kind) {
            case FLOW:
                return 0;
            case STOCK:
                return 1;
            default:
                return 2;
        }
    }
}
