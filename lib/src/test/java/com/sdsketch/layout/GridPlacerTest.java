package com.sdsketch.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.sdsketch.model.Point;
import com.sdsketch.model.VariableKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class GridPlacerTest {

    @Test
    void placesRightOfExistingDiagramByKind() {
        List<Point> placed = GridPlacer.place(
                List.of(new Point(200, 300), new Point(800, 450)),
                List.of(VariableKind.STOCK, VariableKind.FLOW, VariableKind.AUXILIARY, VariableKind.STOCK));

        assertEquals(
                List.of(new Point(1300, 300), new Point(1550, 200), new Point(1800, 400), new Point(1300, 450)),
                placed);
    }

    @Test
    void emptyDiagramStartsAtGap() {
        assertEquals(List.of(new Point(500, 400)), GridPlacer.place(List.of(), List.of(VariableKind.AUXILIARY)));
    }
}
