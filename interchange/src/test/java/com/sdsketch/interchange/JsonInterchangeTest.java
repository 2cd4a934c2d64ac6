package com.sdsketch.interchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.sdsketch.loader.LoaderResult;
import com.sdsketch.loader.MdlLoader;
import com.sdsketch.model.Connection;
import com.sdsketch.model.Point;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.StructuralModel;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import com.sdsketch.writer.MdlWriter;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class JsonInterchangeTest {
    private final JsonInterchange interchange = new JsonInterchange();

    @Test
    void exportsVariables() throws Exception {
        JsonNode variables = interchange.toDocuments(workforce()).getVariables().path("variables");

        assertEquals(8, variables.size());
        JsonNode first = variables.get(0);
        assertEquals(1, first.path("id").asInt());
        assertEquals("Potential Contributors", first.path("name").asText());
        assertEquals("Stock", first.path("type").asText());
        assertEquals(200, first.path("x").asInt());

        JsonNode burnout = find(variables, "name", "Burnout");
        assertEquals("255-0-0", burnout.path("color").path("border").asText());
        assertEquals("0-0-0", burnout.path("color").path("fill").asText());
        JsonNode stock = find(variables, "name", "Core Developer");
        assertEquals("People", stock.path("units").asText());
        assertEquals("Developers with commit rights.", stock.path("description").asText());
        assertFalse(stock.has("color"));
    }

    @Test
    void exportsMergedConnections() throws Exception {
        JsonNode connections = interchange.toDocuments(workforce()).getConnections().path("connections");

        assertEquals(8, connections.size());
        JsonNode negative = find(connections, "id", "22");
        assertEquals("Mentoring Capacity", negative.path("from_var").asText());
        assertEquals("Burnout", negative.path("to_var").asText());
        assertEquals("negative", negative.path("relationship").asText());
        assertEquals("sketch", negative.path("source").asText());
        assertEquals(2, negative.path("points").size());
        assertEquals(600, negative.path("points").get(1).get(0).asInt());
    }

    @Test
    void exportsPlumbing() throws Exception {
        JsonNode plumbing = interchange.toDocuments(workforce()).getPlumbing();

        assertEquals("Joining Rate", plumbing.path("valves").get(0).path("var_name").asText());
        assertEquals(48, plumbing.path("clouds").get(0).path("code").asInt());
        JsonNode joining = plumbing.path("flows").get(0);
        assertEquals("stock", joining.path("from").path("kind").asText());
        assertEquals("Potential Contributors", joining.path("from").path("ref").asText());
        JsonNode leaving = plumbing.path("flows").get(1);
        assertEquals("cloud", leaving.path("to").path("kind").asText());
        assertEquals(7, leaving.path("to").path("ref").asInt());
        assertEquals(1, plumbing.path("link_points").size());
        assertEquals(4, plumbing.path("flow_connections").size());
        assertEquals("100", plumbing.path("flow_connections").get(0).path("params").path("field3").asText());
    }

    @Test
    void documentsRegenerateTheSameDiagram() throws Exception {
        StructuralModel original = workforce();
        ModelDocuments exported = interchange.toDocuments(original);
        ModelDocuments reread = new ModelDocuments(
                interchange.parse(interchange.toJson(exported.getVariables())),
                interchange.parse(interchange.toJson(exported.getConnections())),
                interchange.parse(interchange.toJson(exported.getPlumbing())));

        StructuralModel rebuilt = interchange.fromDocuments(reread);
        assertEquals(5, rebuilt.getInfluenceLinks().size());

        LoaderResult reloaded = new MdlLoader().parse("regenerated.mdl", new MdlWriter().write(rebuilt));
        assertTrue(reloaded.getWarnings().isEmpty(), () -> reloaded.getWarnings().toString());
        assertEquals(keys(original), keys(reloaded.getModel()));
        assertEquals(original.getFlows().toString(), reloaded.getModel().getFlows().toString());
        assertEquals(
                original.getVariables().stream().map(Variable::getPosition).collect(Collectors.toList()),
                reloaded.getModel().getVariables().stream().map(Variable::getPosition).collect(Collectors.toList()));
    }

    @Test
    void buildsModelWithoutPlumbing() throws Exception {
        JsonNode variables = interchange.parse(String.join("\n",
                "{\"variables\": [",
                "  {\"id\": 1, \"name\": \"Demand\", \"type\": \"Auxiliary\", \"x\": 100, \"y\": 100},",
                "  {\"id\": 2, \"name\": \"Backlog\", \"type\": \"Stock\", \"x\": 300, \"y\": 100,",
                "   \"color\": {\"border\": \"0-255-0\"}}",
                "]}"));
        JsonNode connections = interchange.parse(String.join("\n",
                "{\"connections\": [",
                "  {\"from_var\": \"Demand\", \"to_var\": \"Backlog\", \"relationship\": \"negative\",",
                "   \"points\": [[200, 50]], \"source\": \"enhancement\"},",
                "  {\"from_var\": \"Demand\", \"to_var\": \"Missing\", \"relationship\": \"positive\"}",
                "]}"));
        StructuralModel model = interchange.fromDocuments(new ModelDocuments(variables, connections, null));

        assertEquals(VariableKind.STOCK, model.findVariable("Backlog").orElseThrow().getKind());
        assertEquals(Variable.DEFAULT_WIDTH, model.findVariable(1).orElseThrow().getWidth());
        assertEquals(1, model.getConnections().size());
        Connection connection = model.getConnections().get(0);
        assertEquals(Polarity.NEGATIVE, connection.getPolarity());
        assertEquals(List.of(new Point(200, 50)), connection.getWaypoints());
        assertTrue(model.getValves().isEmpty());
    }

    @Test
    void rejectsDuplicateNamesAndIds() throws Exception {
        JsonNode noConnections = interchange.parse("{\"connections\": []}");
        JsonNode sameName = interchange.parse(
                "{\"variables\": [{\"id\": 1, \"name\": \"A\"}, {\"id\": 2, \"name\": \"A\"}]}");
        JsonNode sameId = interchange.parse(
                "{\"variables\": [{\"id\": 1, \"name\": \"A\"}, {\"id\": 1, \"name\": \"B\"}]}");

        IllegalArgumentException names = assertThrows(IllegalArgumentException.class,
                () -> interchange.fromDocuments(new ModelDocuments(sameName, noConnections, null)));
        assertTrue(names.getMessage().contains("[A]"));
        assertThrows(IllegalArgumentException.class,
                () -> interchange.fromDocuments(new ModelDocuments(sameId, noConnections, null)));
    }

    @Test
    void rejectsCloudVariables() throws Exception {
        JsonNode variables = interchange.parse(
                "{\"variables\": [{\"id\": 1, \"name\": \"Sink\", \"type\": \"Cloud\"}]}");
        JsonNode noConnections = interchange.parse("{\"connections\": []}");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> interchange.fromDocuments(new ModelDocuments(variables, noConnections, null)));
        assertTrue(error.getMessage().contains("Sink"));
    }

    private static StructuralModel workforce() throws Exception {
        return new MdlLoader().parse("workforce.mdl", Fixtures.workforceModel()).getModel();
    }

    private static JsonNode find(JsonNode array, String field, String value) {
        for (JsonNode node : array) {
            if (value.equals(node.path(field).asText())) {
                return node;
            }
        }
        throw new AssertionError("No element with " + field + "=" + value);
    }

    private static Set<String> keys(StructuralModel model) {
        return model.getConnections().stream().map(Connection::key).collect(Collectors.toSet());
    }
}
