package com.sdsketch.layout;

import java.util.List;

/** One candidate path shape. Strategies are tried in order until one yields a clear path. */
@FunctionalInterface
public interface RoutingStrategy {

    /** Waypoints between {@code from} and {@code to}, or {@code null} when the shape does not apply. */
    List<Coordinate> waypoints(Coordinate from, Coordinate to);

    /** Horizontal, vertical, horizontal through column {@code midX + offset}. */
    static RoutingStrategy hvh(double offset) {
        return (from, to) -> {
            double x = (from.getX() + to.getX()) / 2 + offset;
            return List.of(new Coordinate(x, from.getY()), new Coordinate(x, to.getY()));
        };
    }

    /** Vertical, horizontal, vertical through row {@code midY + offset}. */
    static RoutingStrategy vhv(double offset) {
        return (from, to) -> {
            double y = (from.getY() + to.getY()) / 2 + offset;
            return List.of(new Coordinate(from.getX(), y), new Coordinate(to.getX(), y));
        };
    }

    /** A single waypoint pushed sideways from the midpoint. */
    static RoutingStrategy perpendicular(double distance) {
        return (from, to) -> {
            double dx = to.getX() - from.getX();
            double dy = to.getY() - from.getY();
            double length = Math.sqrt(dx * dx + dy * dy);
            if (length == 0) {
                return null;
            }
            double midX = (from.getX() + to.getX()) / 2;
            double midY = (from.getY() + to.getY()) / 2;
            return List.of(new Coordinate(midX - dy / length * distance, midY + dx / length * distance));
        };
    }
}
