package com.sdsketch.layout;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class GeometryTest {
    private static final BoundingBox BOX = new BoundingBox(1, 100, 200, 100, 200);

    @Test
    void crossingSegmentsIntersect() {
        assertTrue(Geometry.segmentsIntersect(
                new Coordinate(0, 0), new Coordinate(10, 10), new Coordinate(0, 10), new Coordinate(10, 0)));
        assertTrue(Geometry.segmentsIntersect(
                new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(10, -5), new Coordinate(10, 5)));
        assertFalse(Geometry.segmentsIntersect(
                new Coordinate(0, 0), new Coordinate(4, 4), new Coordinate(0, 10), new Coordinate(10, 0)));
    }

    @Test
    void parallelSegmentsNeverIntersect() {
        assertFalse(Geometry.segmentsIntersect(
                new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(0, 0), new Coordinate(10, 0)));
        assertFalse(Geometry.segmentsIntersect(
                new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(0, 5), new Coordinate(10, 5)));
    }

    @Test
    void segmentAgainstBox() {
        assertTrue(Geometry.segmentIntersectsBox(new Coordinate(150, 150), new Coordinate(500, 500), BOX));
        assertTrue(Geometry.segmentIntersectsBox(new Coordinate(0, 150), new Coordinate(500, 150), BOX));
        assertFalse(Geometry.segmentIntersectsBox(new Coordinate(0, 50), new Coordinate(500, 50), BOX));
    }

    @Test
    void pathIsClearChecksEverySegment() {
        List<Coordinate> around = List.of(
                new Coordinate(0, 150), new Coordinate(0, 300), new Coordinate(300, 300), new Coordinate(300, 150));
        List<Coordinate> through = List.of(new Coordinate(0, 150), new Coordinate(300, 150));

        assertTrue(Geometry.pathIsClear(around, List.of(BOX)));
        assertFalse(Geometry.pathIsClear(through, List.of(BOX)));
        assertTrue(Geometry.pathIsClear(through, List.of()));
    }
}
