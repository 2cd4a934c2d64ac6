package com.sdsketch.interchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sdsketch.model.ArrowParams;
import com.sdsketch.model.Cloud;
import com.sdsketch.model.Connection;
import com.sdsketch.model.Equation;
import com.sdsketch.model.Flow;
import com.sdsketch.model.FlowEndpoint;
import com.sdsketch.model.FlowPipe;
import com.sdsketch.model.Point;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.Provenance;
import com.sdsketch.model.RgbColor;
import com.sdsketch.model.StructuralModel;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Converts between {@link StructuralModel} and the JSON interchange documents, using Jackson's
 * tree model so field names match the documents exactly.
 */
public final class JsonInterchange {
    private static final Logger LOGGER = Logger.getLogger(JsonInterchange.class.getName());

    private final ObjectMapper mapper;

    public JsonInterchange() {
        this(new ObjectMapper());
    }

    public JsonInterchange(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public String toJson(JsonNode document) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    public JsonNode parse(String json) throws JsonProcessingException {
        return mapper.readTree(json);
    }

    public ModelDocuments toDocuments(StructuralModel model) {
        return new ModelDocuments(variablesDocument(model), connectionsDocument(model), plumbingDocument(model));
    }

    ObjectNode variablesDocument(StructuralModel model) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode array = root.putArray("variables");
        for (Variable variable : model.getVariables()) {
            ObjectNode node = array.addObject();
            node.put("id", variable.getId());
            node.put("name", variable.getName());
            node.put("type", variable.getKind().getDisplayName());
            node.put("x", variable.getX());
            node.put("y", variable.getY());
            node.put("width", variable.getWidth());
            node.put("height", variable.getHeight());
            if (variable.isColored()) {
                ObjectNode color = node.putObject("color");
                color.put("border", variable.getBorderColor().toString());
                if (variable.getFillColor() != null) {
                    color.put("fill", variable.getFillColor().toString());
                }
            }
            Equation equation = variable.getEquation();
            if (equation != null) {
                if (!equation.getUnits().isEmpty()) {
                    node.put("units", equation.getUnits());
                }
                if (!equation.getDescription().isEmpty()) {
                    node.put("description", equation.getDescription());
                }
            }
        }
        return root;
    }

    ObjectNode connectionsDocument(StructuralModel model) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode array = root.putArray("connections");
        for (Connection connection : model.getConnections()) {
            ObjectNode node = array.addObject();
            if (connection.getSketchId() != null) {
                node.put("id", connection.getSketchId());
            }
            node.put("from_var", connection.getFromName());
            node.put("to_var", connection.getToName());
            node.put("relationship", connection.getPolarity().relationship());
            if (connection.getColor() != null) {
                node.putObject("color").put("line", connection.getColor().toString());
            }
            if (!connection.getWaypoints().isEmpty()) {
                putPoints(node.putArray("points"), connection.getWaypoints());
            }
            node.put("source", connection.getProvenance().getLabel());
        }
        return root;
    }

    ObjectNode plumbingDocument(StructuralModel model) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode valves = root.putArray("valves");
        for (Valve valve : model.getValves()) {
            ObjectNode node = valves.addObject();
            node.put("id", valve.getId());
            if (valve.getFlowName() != null) {
                node.put("var_name", valve.getFlowName());
            } else {
                node.putNull("var_name");
            }
            node.put("x", valve.getX());
            node.put("y", valve.getY());
            node.put("w", valve.getWidth());
            node.put("h", valve.getHeight());
        }
        ArrayNode clouds = root.putArray("clouds");
        for (Cloud cloud : model.getClouds()) {
            ObjectNode node = clouds.addObject();
            node.put("id", cloud.getId());
            node.put("code", cloud.getShapeCode());
            node.put("x", cloud.getX());
            node.put("y", cloud.getY());
            node.put("w", cloud.getWidth());
            node.put("h", cloud.getHeight());
        }
        ArrayNode flows = root.putArray("flows");
        for (Flow flow : model.getFlows()) {
            ObjectNode node = flows.addObject();
            node.put("valve_id", flow.getValveId());
            putEndpoint(node.putObject("from"), flow.getFrom());
            putEndpoint(node.putObject("to"), flow.getTo());
        }
        ArrayNode linkPoints = root.putArray("link_points");
        for (Connection link : model.getInfluenceLinks()) {
            if (!link.getWaypoints().isEmpty()) {
                ObjectNode node = linkPoints.addObject();
                node.put("from_id", link.getFromId());
                node.put("to_id", link.getToId());
                putPoints(node.putArray("points"), link.getWaypoints());
            }
        }
        ArrayNode pipes = root.putArray("flow_connections");
        for (FlowPipe pipe : model.getFlowPipes()) {
            ObjectNode node = pipes.addObject();
            node.put("id", pipe.getId());
            node.put("from_id", pipe.getFromId());
            node.put("to_id", pipe.getToId());
            ObjectNode params = node.putObject("params");
            params.put("field3", pipe.getParams().getShape());
            params.put("field4", pipe.getParams().getHidden());
            params.put("field5", pipe.getParams().getPolarityCode());
            params.put("field6", pipe.getParams().getThickness());
            if (!pipe.getPoints().isEmpty()) {
                putPoints(node.putArray("points"), pipe.getPoints());
            }
        }
        return root;
    }

    /**
     * Builds a model for regeneration. Variable names and ids must be unique; connections may name
     * variables that do not exist, in which case they are skipped with a warning.
     *
     * @throws IllegalArgumentException on duplicate variable names or ids
     */
    public StructuralModel fromDocuments(ModelDocuments documents) {
        List<Variable> variables = readVariables(documents.getVariables());
        Map<String, Variable> byName = new HashMap<>();
        for (Variable variable : variables) {
            byName.put(variable.getName(), variable);
        }
        JsonNode plumbing = documents.getPlumbing();
        Map<String, List<Point>> linkPoints = readLinkPoints(plumbing);

        List<Connection> connections = new ArrayList<>();
        for (JsonNode node : documents.getConnections().path("connections")) {
            String fromName = node.path("from_var").asText(null);
            String toName = node.path("to_var").asText(null);
            Variable from = fromName == null ? null : byName.get(fromName);
            Variable to = toName == null ? null : byName.get(toName);
            if (from == null || to == null) {
                LOGGER.warning(() -> "Skipping connection " + fromName + " -> " + toName + ": unknown variable");
                continue;
            }
            List<Point> points = readPoints(node.path("points"));
            if (points.isEmpty()) {
                points = linkPoints.getOrDefault(from.getId() + "_" + to.getId(), List.of());
            }
            RgbColor color = RgbColor.parse(node.path("color").path("line").asText(""));
            connections.add(new Connection(
                    node.hasNonNull("id") ? node.get("id").asInt() : null,
                    from.getId(),
                    to.getId(),
                    from.getName(),
                    to.getName(),
                    Polarity.fromRelationship(node.path("relationship").asText(null)),
                    points,
                    color,
                    Provenance.fromLabel(node.path("source").asText(null)),
                    readParams(node.path("params"))));
        }

        List<Valve> valves = new ArrayList<>();
        List<Cloud> clouds = new ArrayList<>();
        List<Flow> flows = new ArrayList<>();
        List<FlowPipe> pipes = new ArrayList<>();
        if (plumbing != null) {
            for (JsonNode node : plumbing.path("valves")) {
                valves.add(new Valve(
                        node.path("id").asInt(),
                        node.path("x").asInt(),
                        node.path("y").asInt(),
                        node.path("w").asInt(),
                        node.path("h").asInt(),
                        node.path("var_name").asText(null)));
            }
            for (JsonNode node : plumbing.path("clouds")) {
                clouds.add(new Cloud(
                        node.path("id").asInt(),
                        node.path("code").asInt(Cloud.CLOUD_SHAPE_CODE),
                        node.path("x").asInt(),
                        node.path("y").asInt(),
                        node.path("w").asInt(),
                        node.path("h").asInt()));
            }
            Map<Integer, String> valveFlows = new HashMap<>();
            valves.forEach(valve -> valveFlows.put(valve.getId(), valve.getFlowName()));
            for (JsonNode node : plumbing.path("flows")) {
                int valveId = node.path("valve_id").asInt();
                flows.add(new Flow(
                        valveId,
                        valveFlows.get(valveId),
                        readEndpoint(node.path("from"), byName),
                        readEndpoint(node.path("to"), byName)));
            }
            for (JsonNode node : plumbing.path("flow_connections")) {
                int fromId = node.path("from_id").asInt();
                int toId = node.path("to_id").asInt();
                List<Point> points = readPoints(node.path("points"));
                if (points.isEmpty()) {
                    points = linkPoints.getOrDefault(fromId + "_" + toId, List.of());
                }
                ArrowParams params = readParams(node.path("params"));
                pipes.add(new FlowPipe(
                        node.path("id").asInt(), fromId, toId, params == null ? ArrowParams.STANDARD : params, points));
            }
        }
        // connections exported from a pipe keep the pipe's id; the pipe record already draws them
        Set<Integer> pipeIds = new HashSet<>();
        pipes.forEach(pipe -> pipeIds.add(pipe.getId()));
        List<Connection> links = new ArrayList<>();
        for (Connection connection : connections) {
            if (connection.getSketchId() == null || !pipeIds.contains(connection.getSketchId())) {
                links.add(connection);
            }
        }
        return new StructuralModel(variables, valves, clouds, flows, pipes, links, connections);
    }

    private List<Variable> readVariables(JsonNode document) {
        List<Variable> variables = new ArrayList<>();
        Map<String, Integer> nameCounts = new LinkedHashMap<>();
        Map<Integer, Integer> idCounts = new LinkedHashMap<>();
        for (JsonNode node : document.path("variables")) {
            String name = node.path("name").asText();
            int id = node.path("id").asInt();
            nameCounts.merge(name, 1, Integer::sum);
            idCounts.merge(id, 1, Integer::sum);
            JsonNode color = node.path("color");
            String units = node.path("units").asText("");
            String description = node.path("description").asText("");
            Equation equation = units.isEmpty() && description.isEmpty()
                    ? null
                    : new Equation(name, "", units, description, List.of());
            VariableKind kind = VariableKind.fromDisplayName(node.path("type").asText(null));
            if (kind == VariableKind.CLOUD) {
                throw new IllegalArgumentException(
                        "Variable '" + name + "' has type Cloud; clouds are listed in plumbing.json");
            }
            variables.add(new Variable(
                    id,
                    name,
                    kind,
                    node.path("x").asInt(),
                    node.path("y").asInt(),
                    node.path("width").asInt(Variable.DEFAULT_WIDTH),
                    node.path("height").asInt(Variable.DEFAULT_HEIGHT),
                    RgbColor.parse(color.path("border").asText("")),
                    RgbColor.parse(color.path("fill").asText("")),
                    equation));
        }
        TreeSet<String> duplicateNames = new TreeSet<>();
        nameCounts.forEach((name, count) -> {
            if (count > 1) {
                duplicateNames.add(name);
            }
        });
        if (!duplicateNames.isEmpty()) {
            throw new IllegalArgumentException("Duplicate variable names: " + duplicateNames);
        }
        TreeSet<Integer> duplicateIds = new TreeSet<>();
        idCounts.forEach((id, count) -> {
            if (count > 1) {
                duplicateIds.add(id);
            }
        });
        if (!duplicateIds.isEmpty()) {
            throw new IllegalArgumentException("Duplicate variable ids: " + duplicateIds);
        }
        return variables;
    }

    private static Map<String, List<Point>> readLinkPoints(JsonNode plumbing) {
        Map<String, List<Point>> points = new HashMap<>();
        if (plumbing == null) {
            return points;
        }
        for (JsonNode node : plumbing.path("link_points")) {
            points.put(node.path("from_id").asInt() + "_" + node.path("to_id").asInt(), readPoints(node.path("points")));
        }
        return points;
    }

    private static List<Point> readPoints(JsonNode array) {
        List<Point> points = new ArrayList<>();
        for (JsonNode pair : array) {
            if (pair.isArray() && pair.size() >= 2) {
                points.add(new Point(pair.get(0).asInt(), pair.get(1).asInt()));
            } else if (pair.isObject()) {
                points.add(new Point(pair.path("x").asInt(), pair.path("y").asInt()));
            }
        }
        return points;
    }

    private static void putPoints(ArrayNode array, List<Point> points) {
        for (Point point : points) {
            array.addArray().add(point.getX()).add(point.getY());
        }
    }

    private static ArrowParams readParams(JsonNode params) {
        if (params.isMissingNode() || params.isNull()) {
            return null;
        }
        return new ArrowParams(
                params.path("field3").asText(ArrowParams.STANDARD.getShape()),
                params.path("field4").asText(ArrowParams.STANDARD.getHidden()),
                params.path("field5").asText(ArrowParams.STANDARD.getPolarityCode()),
                params.path("field6").asText(ArrowParams.STANDARD.getThickness()));
    }

    private static void putEndpoint(ObjectNode node, FlowEndpoint endpoint) {
        node.put("kind", endpoint.getKind().label());
        if (endpoint.getKind() == FlowEndpoint.Kind.STOCK && endpoint.getName() != null) {
            node.put("ref", endpoint.getName());
        } else {
            node.put("ref", endpoint.getId());
        }
    }

    private static FlowEndpoint readEndpoint(JsonNode node, Map<String, Variable> byName) {
        String kind = node.path("kind").asText("other").toLowerCase(Locale.ROOT);
        JsonNode ref = node.path("ref");
        Variable named = ref.isTextual() ? byName.get(ref.asText()) : null;
        int id = named != null ? named.getId() : ref.asInt();
        switch (kind) {
            case "stock":
                return new FlowEndpoint(FlowEndpoint.Kind.STOCK, id, named != null ? named.getName() : null);
            case "cloud":
                return FlowEndpoint.cloud(id);
            default:
                return FlowEndpoint.other(id, named != null ? named.getName() : null);
        }
    }
}
