package com.sdsketch.layout;

import java.util.List;

/** Segment tests used by the router. */
public final class Geometry {
    private static final double PARALLEL_EPSILON = 1e-10;

    private Geometry() {}

    /** True when either endpoint lies in the box or the segment crosses one of its four edges. */
    public static boolean segmentIntersectsBox(Coordinate p1, Coordinate p2, BoundingBox box) {
        if (box.contains(p1) || box.contains(p2)) {
            return true;
        }
        Coordinate topLeft = new Coordinate(box.getLeft(), box.getTop());
        Coordinate topRight = new Coordinate(box.getRight(), box.getTop());
        Coordinate bottomLeft = new Coordinate(box.getLeft(), box.getBottom());
        Coordinate bottomRight = new Coordinate(box.getRight(), box.getBottom());
        return segmentsIntersect(p1, p2, topLeft, bottomLeft)
                || segmentsIntersect(p1, p2, topRight, bottomRight)
                || segmentsIntersect(p1, p2, topLeft, topRight)
                || segmentsIntersect(p1, p2, bottomLeft, bottomRight);
    }

    /** Parametric intersection of {@code p1-p2} and {@code p3-p4}; parallel segments never intersect. */
    public static boolean segmentsIntersect(Coordinate p1, Coordinate p2, Coordinate p3, Coordinate p4) {
        double x1 = p1.getX();
        double y1 = p1.getY();
        double x2 = p2.getX();
        double y2 = p2.getY();
        double x3 = p3.getX();
        double y3 = p3.getY();
        double x4 = p4.getX();
        double y4 = p4.getY();
        double denominator = (x1 - x2) * (y3 - y4) - (y1 - y2) * (x3 - x4);
        if (Math.abs(denominator) < PARALLEL_EPSILON) {
            return false;
        }
        double t = ((x1 - x3) * (y3 - y4) - (y1 - y3) * (x3 - x4)) / denominator;
        double u = -((x1 - x2) * (y1 - y3) - (y1 - y2) * (x1 - x3)) / denominator;
        return t >= 0 && t <= 1 && u >= 0 && u <= 1;
    }

    /** True when no segment of {@code path} touches any obstacle. */
    public static boolean pathIsClear(List<Coordinate> path, List<BoundingBox> obstacles) {
        for (int i = 0; i + 1 < path.size(); i++) {
            for (BoundingBox box : obstacles) {
                if (segmentIntersectsBox(path.get(i), path.get(i + 1), box)) {
                    return false;
                }
            }
        }
        return true;
    }
}
