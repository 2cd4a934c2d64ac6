package com.sdsketch.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sdsketch.model.Connection;
import com.sdsketch.model.Point;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.Provenance;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EdgeRouterTest {
    private final EdgeRouter router = new EdgeRouter();

    @Test
    void clearLineNeedsNoWaypoints() {
        Route route = router.findWaypoints(
                new Coordinate(100, 100), new Coordinate(500, 100), List.of(), null, null);

        assertTrue(route.isStraight());
        assertEquals(RouteState.TRYING_STRAIGHT, route.getResolvedBy());
        assertEquals(RouteState.ROUTED, route.getState());
    }

    @Test
    void endpointBoxesAreNotObstacles() {
        List<BoundingBox> boxes = List.of(
                BoundingBox.around(1, 100, 100, 60, 26, 50),
                BoundingBox.around(2, 500, 100, 60, 26, 50));

        assertTrue(router.findWaypoints(new Coordinate(100, 100), new Coordinate(500, 100), boxes, 1, 2)
                .isStraight());
        assertFalse(router.findWaypoints(new Coordinate(100, 100), new Coordinate(500, 100), boxes, null, null)
                .isStraight());
    }

    @Test
    void blockedLineEscalatesToOffsetRoute() {
        List<BoundingBox> boxes = List.of(BoundingBox.around(3, 300, 100, 60, 26, 50));
        Route route = router.findWaypoints(new Coordinate(100, 100), new Coordinate(500, 100), boxes, 1, 2);

        assertEquals(RouteState.TRYING_OFFSET_VHV, route.getResolvedBy());
        assertEquals(List.of(new Point(100, 250), new Point(500, 250)), route.getWaypoints());
        assertFalse(route.isDegraded());
    }

    @Test
    void forcedFallbackWhenEverythingIsBlocked() {
        List<BoundingBox> boxes = List.of(new BoundingBox(9, -1000, 2000, -1000, 2000));
        Route route = router.findWaypoints(new Coordinate(100, 100), new Coordinate(501, 300), boxes, 1, 2);

        assertTrue(route.isDegraded());
        assertEquals(RouteState.FORCED_FALLBACK, route.getState());
        assertEquals(List.of(new Point(300, 100), new Point(300, 300)), route.getWaypoints());
    }

    @Test
    void routesEveryConnectionWithKnownEndpoints() {
        Variable left = new Variable(1, "Left", VariableKind.AUXILIARY, 100, 100, 60, 26);
        Variable right = new Variable(2, "Right", VariableKind.AUXILIARY, 500, 100, 60, 26);
        Variable middle = new Variable(3, "Middle", VariableKind.AUXILIARY, 300, 100, 60, 26);
        List<Connection> connections = List.of(
                Connection.between(left, right, Polarity.POSITIVE, Provenance.FROM_ENHANCEMENT),
                Connection.between(left, middle, Polarity.POSITIVE, Provenance.FROM_ENHANCEMENT),
                new Connection(null, 1, 99, "Left", "Ghost", Polarity.POSITIVE, List.of(), null,
                        Provenance.FROM_ENHANCEMENT, null));

        Map<String, Route> routes = router.routeAll(List.of(left, right, middle), connections);

        assertEquals(List.of("1_2", "1_3"), List.copyOf(routes.keySet()));
        assertFalse(routes.get("1_2").isStraight());
        assertTrue(routes.get("1_3").isStraight());
    }

    @Test
    void perpendicularStrategySkipsZeroLengthArrows() {
        RoutingStrategy strategy = RoutingStrategy.perpendicular(100);

        assertEquals(null, strategy.waypoints(new Coordinate(5, 5), new Coordinate(5, 5)));
        Coordinate waypoint = strategy.waypoints(new Coordinate(0, 0), new Coordinate(100, 0)).get(0);
        assertEquals(50, waypoint.getX(), 1e-9);
        assertEquals(100, waypoint.getY(), 1e-9);
    }
}
