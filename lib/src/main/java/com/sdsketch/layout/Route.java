package com.sdsketch.layout;

import com.sdsketch.model.Point;
import java.util.List;

/** Outcome of routing one arrow. */
public final class Route {
    private final List<Point> waypoints;
    private final RouteState resolvedBy;

    public Route(List<Point> waypoints, RouteState resolvedBy) {
        this.waypoints = List.copyOf(waypoints);
        this.resolvedBy = resolvedBy;
    }

    public List<Point> getWaypoints() {
        return waypoints;
    }

    /** The strategy state that produced the path, {@link RouteState#FORCED_FALLBACK} when none was clear. */
    public RouteState getResolvedBy() {
        return resolvedBy;
    }

    public RouteState getState() {
        return isDegraded() ? RouteState.FORCED_FALLBACK : RouteState.ROUTED;
    }

    public boolean isStraight() {
        return waypoints.isEmpty();
    }

    /** The forced path may still cross obstacles. */
    public boolean isDegraded() {
        return resolvedBy == RouteState.FORCED_FALLBACK;
    }

    @Override
    public String toString() {
        return resolvedBy + " " + waypoints;
    }
}
