package com.sdsketch.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sdsketch.model.Point;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OverlapResolverTest {
    private final OverlapResolver resolver = new OverlapResolver();

    @Test
    void coincidentNodesSeparateAlongX() {
        Map<String, Point> positions = new LinkedHashMap<>();
        positions.put("a", new Point(500, 500));
        positions.put("b", new Point(500, 500));
        OverlapResolver.Result<String> result = resolver.resolve(positions);

        assertTrue(result.isConverged());
        assertEquals(1, result.getIterations());
        assertEquals(new Point(500, 500), result.getPositions().get("a"));
        assertEquals(new Point(710, 500), result.getPositions().get("b"));
    }

    @Test
    void convergedLayoutsKeepMinimumSpacing() {
        Map<Integer, Point> positions = new LinkedHashMap<>();
        positions.put(1, new Point(1000, 500));
        positions.put(2, new Point(1010, 500));
        positions.put(3, new Point(1000, 510));
        positions.put(4, new Point(990, 495));
        OverlapResolver.Result<Integer> result = resolver.resolve(positions);

        assertTrue(result.isConverged());
        List<Point> points = new ArrayList<>(result.getPositions().values());
        for (int i = 0; i < points.size(); i++) {
            for (int j = i + 1; j < points.size(); j++) {
                assertTrue(points.get(i).distanceTo(points.get(j)) >= 200, points.get(i) + " vs " + points.get(j));
            }
        }
    }

    @Test
    void fixedNodesNeverMove() {
        Map<String, Point> positions = new LinkedHashMap<>();
        positions.put("new", new Point(550, 500));
        positions.put("existing", new Point(500, 500));
        OverlapResolver.Result<String> result = resolver.resolve(positions, Set.of("existing"));

        assertEquals(new Point(500, 500), result.getPositions().get("existing"));
        assertEquals(new Point(710, 500), result.getPositions().get("new"));
    }

    @Test
    void reportsNonConvergenceOnCrampedCanvas() {
        LayoutOptions cramped = new LayoutOptions(50, 200, 10, 5, 100, 150, 50, 100, 300);
        Map<String, Point> positions = new LinkedHashMap<>();
        positions.put("a", new Point(120, 70));
        positions.put("b", new Point(130, 80));
        positions.put("c", new Point(140, 90));
        OverlapResolver.Result<String> result = new OverlapResolver(cramped).resolve(positions);

        assertFalse(result.isConverged());
        assertEquals(5, result.getIterations());
        for (Point point : result.getPositions().values()) {
            assertTrue(point.getX() >= 100 && point.getX() <= 150);
            assertTrue(point.getY() >= 50 && point.getY() <= 100);
        }
    }
}
