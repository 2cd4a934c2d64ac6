package com.sdsketch.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sdsketch.loader.LoaderResult;
import com.sdsketch.loader.MdlLoader;
import com.sdsketch.loader.SketchMarkers;
import com.sdsketch.model.Connection;
import com.sdsketch.model.Point;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.Provenance;
import com.sdsketch.model.RgbColor;
import com.sdsketch.model.StructuralModel;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import com.sdsketch.testing.TestResources;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class MdlWriterTest {
    private final MdlWriter writer = new MdlWriter();
    private final MdlLoader loader = new MdlLoader();

    @Test
    void regeneratedFileLoadsToTheSameStructure() throws Exception {
        StructuralModel original = loader.parse("workforce.mdl", TestResources.workforceModel()).getModel();
        LoaderResult reloaded = loader.parse("regenerated.mdl", writer.write(original));
        StructuralModel copy = reloaded.getModel();

        assertTrue(reloaded.getWarnings().isEmpty(), () -> reloaded.getWarnings().toString());
        assertEquals(describe(original.getVariables()), describe(copy.getVariables()));
        assertEquals(valves(original), valves(copy));
        assertEquals(keys(original), keys(copy));
        assertEquals(original.getFlows().toString(), copy.getFlows().toString());
        assertEquals(
                new RgbColor(255, 0, 0), copy.findVariable("Burnout").orElseThrow().getBorderColor());
        assertEquals(
                Polarity.NEGATIVE,
                copy.getConnections().stream()
                        .filter(connection -> "10_9".equals(connection.key()))
                        .findFirst()
                        .orElseThrow()
                        .getPolarity());
    }

    @Test
    void pipesAreWrittenBeforeTheirValve() throws Exception {
        StructuralModel model = loader.parse("workforce.mdl", TestResources.workforceModel()).getModel();
        String text = writer.write(model);

        int valve = text.indexOf("\n11,2,0,350,300,");
        assertTrue(valve > 0);
        assertTrue(text.indexOf("\n1,13,2,1,100,0,0,22,") < valve);
        assertTrue(text.indexOf("\n1,14,2,4,4,0,0,22,") < valve);
        assertTrue(text.indexOf("\n10,1,Potential Contributors,") < text.indexOf("\n1,13,"));
        assertTrue(text.contains("\n12,7,48,800,300,10,8,0,3,0,0,-1,0,0,0,0,0,0,0,0,0\n"));
        assertTrue(text.contains("\n1,22,10,9,0,0,45,22,0,192,0,-1--1--1,,1|(520,300)(600,200)|\n"));
    }

    @Test
    void writesGeneratedModel() {
        Variable driver = new Variable(1, "Driver", VariableKind.AUXILIARY, 100, 100, 60, 26);
        Variable peak = new Variable(2, "Rate, Peak", VariableKind.AUXILIARY, 100, 300, 60, 26);
        Variable level = new Variable(3, "Level", VariableKind.STOCK, 400, 200, 60, 26)
                .withBorderColor(RgbColor.GREEN);
        Connection negative = Connection.between(driver, level, Polarity.NEGATIVE, Provenance.FROM_ENHANCEMENT);
        Connection colored = new Connection(
                null, 2, 3, "Rate, Peak", "Level", Polarity.POSITIVE,
                List.of(new Point(250, 300)), RgbColor.LINE_GREEN, Provenance.FROM_ENHANCEMENT, null);
        String text = writer.write(StructuralModel.of(List.of(driver, peak, level), List.of(negative, colored)));
        List<String> lines = List.of(text.split("\n", -1));

        assertEquals("{UTF-8}", lines.get(0));
        assertTrue(text.contains("Level  = A FUNCTION OF( -Driver,\"Rate, Peak\")\n\t~\t\n\t~\t\t|\n\n"));
        assertTrue(text.indexOf("Driver  = A FUNCTION OF( )") < text.indexOf("Level  = "));
        assertTrue(lines.contains("10,2,\"Rate, Peak\",100,300,60,26,8,3,0,0,-1,0,0,0,0,0,0,0,0,0"));
        assertTrue(lines.contains("10,3,Level,400,200,60,26,3,3,0,1,-1,1,0,0,0-255-0,0-0-0,|||0-0-0,0,0,0,0,0,0"));
        assertTrue(lines.contains("1,4,1,3,0,0,0,22,0,192,0,-1--1--1,,1|(0,0)|"));
        assertTrue(lines.contains("1,5,2,3,0,0,0,0,1,64,0,0-192-0,|||0-0-0,1|(250,300)|"));
        assertEquals(List.of(":L<%^E!@", "5:Time", "19:67,0", "24:0", "25:0", "26:0", ""),
                lines.subList(lines.size() - 7, lines.size()));
        assertFalse(text.contains(".Control"));
    }

    @Test
    void allocatedIdsStayAbovePreservedOnes() {
        Variable a = new Variable(1, "A", VariableKind.AUXILIARY, 100, 100, 60, 26);
        Variable b = new Variable(2, "B", VariableKind.AUXILIARY, 300, 100, 60, 26);
        Connection kept = Connection.between(a, b, Polarity.POSITIVE, Provenance.FROM_SKETCH).withSketchId(40);
        Connection added = Connection.between(b, a, Polarity.POSITIVE, Provenance.FROM_ENHANCEMENT);
        String text = writer.write(StructuralModel.of(List.of(a, b), List.of(kept, added)));

        assertTrue(text.contains("\n1,40,1,2,"));
        assertTrue(text.contains("\n1,41,2,1,"));
    }

    @Test
    void equationDerivedLinksAreNotDrawn() {
        Variable flow = new Variable(1, "Inflow", VariableKind.FLOW, 100, 100, 60, 26);
        Variable stock = new Variable(2, "Stock", VariableKind.STOCK, 300, 100, 60, 26);
        Connection implied = Connection.between(flow, stock, Polarity.UNDECLARED, Provenance.FROM_EQUATION);
        String text = writer.write(StructuralModel.of(List.of(flow, stock), List.of(implied)));

        assertFalse(text.contains("\n1,"));
        assertTrue(text.contains("Stock  = A FUNCTION OF( Inflow)"));
    }

    @Test
    void honoursMarkerAndControlOptions() throws Exception {
        StructuralModel model = loader.parse("workforce.mdl", TestResources.workforceModel()).getModel();
        WriterOptions options = WriterOptions.defaults().withMarkers(SketchMarkers.ALTERNATE).withControl(true);
        String text = writer.write(model, options);

        assertTrue(text.contains("\n--/// Sketch information - do not modify anything except names\n"));
        assertTrue(text.contains("\n///---\\\n"));
        assertTrue(text.indexOf("\t.Control") < text.indexOf("--///"));
        assertEquals(SketchMarkers.ALTERNATE, loader.parse("alt.mdl", text).getMarkers());
    }

    @Test
    void readsOptionsFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(WriterOptions.MARKERS_PROPERTY, "alt");
        properties.setProperty(WriterOptions.CONTROL_PROPERTY, "true");
        WriterOptions options = WriterOptions.fromProperties(properties);

        assertEquals(SketchMarkers.ALTERNATE, options.getMarkers());
        assertTrue(options.isWithControl());
        assertEquals(SketchMarkers.STANDARD, WriterOptions.fromProperties(new Properties()).getMarkers());
    }

    private static List<String> describe(List<Variable> variables) {
        return variables.stream()
                .map(v -> v.getId() + ":" + v.getName() + ":" + v.getKind() + ":" + v.getX() + "," + v.getY()
                        + ":" + v.getWidth() + "x" + v.getHeight())
                .sorted()
                .collect(Collectors.toList());
    }

    private static Set<String> valves(StructuralModel model) {
        return model.getValves().stream()
                .map(valve -> valve.getId() + ":" + valve.getFlowName() + ":" + valve.getPosition())
                .collect(Collectors.toSet());
    }

    private static Set<String> keys(StructuralModel model) {
        return model.getConnections().stream().map(Connection::key).collect(Collectors.toSet());
    }
}
