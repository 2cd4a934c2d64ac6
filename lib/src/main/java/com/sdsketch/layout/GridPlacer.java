package com.sdsketch.layout;

import com.sdsketch.model.Point;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Default spots for new variables: a three-column grid to the right of the existing diagram,
 * with flows on the top row band, stocks in the middle and auxiliaries below.
 */
public final class GridPlacer {
    static final int GAP_RIGHT = 500;
    static final int COLUMN_WIDTH = 250;
    static final int ROW_HEIGHT = 150;
    static final int COLUMNS = 3;

    private GridPlacer() {}

    /** Position for each kind, in order; index {@code i} lands in column {@code i % 3}, row {@code i / 3}. */
    public static List<Point> place(Collection<Point> existing, List<VariableKind> kinds) {
        int maxX = 0;
        for (Point point : existing) {
            maxX = Math.max(maxX, point.getX());
        }
        int originX = maxX + GAP_RIGHT;
        List<Point> placed = new ArrayList<>(kinds.size());
        for (int i = 0; i < kinds.size(); i++) {
            int x = originX + (i % COLUMNS) * COLUMN_WIDTH;
            int y = baseY(kinds.get(i)) + (i / COLUMNS) * ROW_HEIGHT;
            placed.add(new Point(x, y));
        }
        return placed;
    }

    private static int baseY(VariableKind kind) {
        switch (kind) {
            case STOCK:
                return 300;
            case FLOW:
                return 200;
            default:
                return 400;
        }
    }
}
