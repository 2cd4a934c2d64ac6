package com.sdsketch.interchange;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * The three interchange documents describing one diagram: {@code variables.json},
 * {@code connections.json} and the optional {@code plumbing.json}.
 */
public final class ModelDocuments {
    public static final String VARIABLES_FILE = "variables.json";
    public static final String CONNECTIONS_FILE = "connections.json";
    public static final String PLUMBING_FILE = "plumbing.json";

    private final JsonNode variables;
    private final JsonNode connections;
    private final JsonNode plumbing;

    public ModelDocuments(JsonNode variables, JsonNode connections, JsonNode plumbing) {
        this.variables = Objects.requireNonNull(variables, "variables");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.plumbing = plumbing;
    }

    public JsonNode getVariables() {
        return variables;
    }

    public JsonNode getConnections() {
        return connections;
    }

    /** Valves, clouds, flows and pipe geometry; {@code null} for a diagram without stock/flow plumbing. */
    public JsonNode getPlumbing() {
        return plumbing;
    }
}
