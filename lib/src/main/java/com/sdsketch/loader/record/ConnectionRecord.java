package com.sdsketch.loader.record;

import com.sdsketch.model.ArrowParams;
import com.sdsketch.model.Point;
import com.sdsketch.model.RgbColor;
import java.util.List;

/** A {@code 1,} line: an arrow between two sketch elements, possibly a flow pipe. */
public final class ConnectionRecord {
    private final SourceLocation location;
    private final int id;
    private final int fromId;
    private final int toId;
    private final ArrowParams params;
    private final List<Point> points;
    private final RgbColor color;

    public ConnectionRecord(
            SourceLocation location,
            int id,
            int fromId,
            int toId,
            ArrowParams params,
            List<Point> points,
            RgbColor color) {
        this.location = location;
        this.id = id;
        this.fromId = fromId;
        this.toId = toId;
        this.params = params;
        this.points = List.copyOf(points);
        this.color = color;
    }

    public SourceLocation getLocation() {
        return location;
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

    public RgbColor getColor() {
        return color;
    }
}
