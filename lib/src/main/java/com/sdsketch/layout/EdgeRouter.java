package com.sdsketch.layout;

import com.sdsketch.model.Connection;
import com.sdsketch.model.Point;
import com.sdsketch.model.Variable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Manhattan-style arrow routing around padded variable boxes. Each arrow walks an ordered list of
 * path shapes and keeps the first one whose segments are clear of every obstacle other than its
 * own endpoints.
 */
public final class EdgeRouter {
    private static final Logger LOGGER = Logger.getLogger(EdgeRouter.class.getName());

    private static final double[] HVH_OFFSETS = {200, -200, 400, -400};
    private static final double[] VHV_OFFSETS = {150, -150, 300, -300};
    private static final double[] PERPENDICULAR_OFFSETS = {100, -100, 200, -200};

    private final LayoutOptions options;
    private final List<Attempt> attempts;

    public EdgeRouter() {
        this(LayoutOptions.defaults());
    }

    public EdgeRouter(LayoutOptions options) {
        this.options = options;
        List<Attempt> list = new ArrayList<>();
        list.add(new Attempt(RouteState.TRYING_STRAIGHT, (from, to) -> List.of()));
        list.add(new Attempt(RouteState.TRYING_HVH, RoutingStrategy.hvh(0)));
        list.add(new Attempt(RouteState.TRYING_VHV, RoutingStrategy.vhv(0)));
        for (double offset : HVH_OFFSETS) {
            list.add(new Attempt(RouteState.TRYING_OFFSET_HVH, RoutingStrategy.hvh(offset)));
        }
        for (double offset : VHV_OFFSETS) {
            list.add(new Attempt(RouteState.TRYING_OFFSET_VHV, RoutingStrategy.vhv(offset)));
        }
        for (double offset : PERPENDICULAR_OFFSETS) {
            list.add(new Attempt(RouteState.TRYING_PERPENDICULAR, RoutingStrategy.perpendicular(offset)));
        }
        this.attempts = List.copyOf(list);
    }

    public LayoutOptions getOptions() {
        return options;
    }

    /**
     * Routes one arrow. Boxes whose id equals {@code fromId} or {@code toId} are not obstacles;
     * pass {@code null} ids to treat every box as one.
     */
    public Route findWaypoints(
            Coordinate from, Coordinate to, List<BoundingBox> obstacles, Integer fromId, Integer toId) {
        List<BoundingBox> filtered = new ArrayList<>();
        for (BoundingBox box : obstacles) {
            boolean endpoint = (fromId != null && box.getId() == fromId) || (toId != null && box.getId() == toId);
            if (!endpoint) {
                filtered.add(box);
            }
        }
        for (Attempt attempt : attempts) {
            List<Coordinate> waypoints = attempt.strategy.waypoints(from, to);
            if (waypoints == null) {
                continue;
            }
            List<Coordinate> path = new ArrayList<>(waypoints.size() + 2);
            path.add(from);
            path.addAll(waypoints);
            path.add(to);
            if (Geometry.pathIsClear(path, filtered)) {
                LOGGER.fine(() -> "Arrow " + fromId + "->" + toId + " routed by " + attempt.state);
                return new Route(truncate(waypoints), attempt.state);
            }
        }
        LOGGER.warning(() -> "Arrow " + fromId + "->" + toId + ": every path is blocked, forcing an H-V-H route");
        return new Route(truncate(RoutingStrategy.hvh(0).waypoints(from, to)), RouteState.FORCED_FALLBACK);
    }

    /** Routes every connection whose endpoints are both known, keyed {@code from_to}. */
    public Map<String, Route> routeAll(List<Variable> variables, List<Connection> connections) {
        List<BoundingBox> obstacles = new ArrayList<>();
        Map<Integer, Variable> byId = new HashMap<>();
        for (Variable variable : variables) {
            obstacles.add(BoundingBox.around(variable, options.getPadding()));
            byId.put(variable.getId(), variable);
        }
        Map<String, Route> routes = new LinkedHashMap<>();
        for (Connection connection : connections) {
            Variable from = byId.get(connection.getFromId());
            Variable to = byId.get(connection.getToId());
            if (from == null || to == null) {
                continue;
            }
            routes.put(
                    connection.key(),
                    findWaypoints(
                            Coordinate.of(from.getPosition()),
                            Coordinate.of(to.getPosition()),
                            obstacles,
                            from.getId(),
                            to.getId()));
        }
        return routes;
    }

    private static List<Point> truncate(List<Coordinate> coordinates) {
        List<Point> points = new ArrayList<>(coordinates.size());
        for (Coordinate coordinate : coordinates) {
            points.add(coordinate.truncate());
        }
        return points;
    }

    private static final class Attempt {
        private final RouteState state;
        private final RoutingStrategy strategy;

        Attempt(RouteState state, RoutingStrategy strategy) {
            this.state = state;
            this.strategy = strategy;
        }
    }
}
