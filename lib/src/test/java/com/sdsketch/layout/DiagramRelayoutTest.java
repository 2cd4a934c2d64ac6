package com.sdsketch.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sdsketch.loader.MdlFormatException;
import com.sdsketch.model.Point;
import com.sdsketch.testing.TestResources;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DiagramRelayoutTest {
    private final DiagramRelayout relayout = new DiagramRelayout();

    @Test
    void movesVariablesAndRecentresValves() throws Exception {
        String original = TestResources.workforceModel();
        Map<String, Point> positions = new LinkedHashMap<>();
        positions.put("Potential Contributors", new Point(200, 300));
        positions.put("Core Developer", new Point(600, 300));
        DiagramRelayout.Result result = relayout.relayout("workforce.mdl", original, positions);
        String text = result.getText();

        assertEquals(2, result.getVariablesMoved());
        assertEquals(1, result.getValvesMoved());
        assertEquals(5, result.getArrowsStripped());
        assertTrue(result.isConverged());
        assertTrue(text.contains("\n10,4,Core Developer,600,300,40,20,3,3,0,0,0,0,0,0,0,0,0,0,0,0\n"));
        assertTrue(text.contains("\n11,2,0,400,300,6,8,34,3,0,0,1,0,0,0,0,0,0,0,0,0\n"));
        assertTrue(text.contains("\n11,5,0,650,300,6,8,34,3,0,0,1,0,0,0,0,0,0,0,0,0\n"));
        assertTrue(text.contains("\n1,22,10,9,0,0,45,22,0,0,0,-1--1--1,,1|(0,0)|\n"));

        int marker = original.indexOf("\\\\\\---///");
        assertEquals(original.substring(0, marker), text.substring(0, marker));
        assertEquals(original.substring(original.indexOf("///---\\\\\\")), text.substring(text.indexOf("///---\\\\\\")));
    }

    @Test
    void crowdedTargetsAreSpreadFirst() throws Exception {
        Map<String, Point> positions = new LinkedHashMap<>();
        positions.put("Attractiveness", new Point(350, 150));
        positions.put("Burnout", new Point(360, 150));
        positions.put("Workload, Peak (max)", new Point(900, 700));
        String text = relayout.relayout("workforce.mdl", TestResources.workforceModel(), positions).getText();

        assertTrue(text.contains("\n10,8,Attractiveness,350,150,"));
        assertTrue(text.contains("\n10,9,Burnout,560,150,"));
        assertTrue(text.contains("\n10,12,\"Workload, Peak (max)\",900,700,"));
    }

    @Test
    void requiresSketchSection() {
        assertThrows(MdlFormatException.class, () -> relayout.relayout("x.mdl", "{UTF-8}\n", Map.of()));
    }
}
