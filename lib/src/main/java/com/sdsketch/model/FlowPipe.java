package com.sdsketch.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code 1,} record that touches a valve or a cloud. Kept verbatim so that regeneration keeps the
 * valve/cloud adjacency intact.
 */
public final class FlowPipe {
    private final int id;
    private final int fromId;
    private final int toId;
    private final ArrowParams params;
    private final List<Point> points;

    public FlowPipe(int id, int fromId, int toId, ArrowParams params, List<Point> points) {
        this.id = id;
        this.fromId = fromId;
        this.toId = toId;
        this.params = Objects.requireNonNull(params, "params");
        this.points = points == null ? List.of() : List.copyOf(points);
    }

    public int getId() {
        return id;
    }

    public int getFromId() {
        return fromId;
    }

    public int getToId() {
        return toId;
    }

    public ArrowParams getParams() {
        return params;
    }

    public List<Point> getPoints() {
        return points;
    }

    public boolean isPipe() {
        return params.isFlowPipe();
    }

    public boolean touches(int elementId) {
        return fromId == elementId || toId == elementId;
    }
}
