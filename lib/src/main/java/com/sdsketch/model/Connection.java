package com.sdsketch.model;

import java.util.List;
import java.util.Objects;

/**
 * A causal link between two variables. {@code sketchId} and {@code arrowParams} are only present
 * for links that were read from (or will be written to) a {@code 1,} record.
 */
public final class Connection {
    private final Integer sketchId;
    private final int fromId;
    private final int toId;
    private final String fromName;
    private final String toName;
    private final Polarity polarity;
    private final List<Point> waypoints;
    private final RgbColor color;
    private final Provenance provenance;
    private final ArrowParams arrowParams;

    public Connection(
            Integer sketchId,
            int fromId,
            int toId,
            String fromName,
            String toName,
            Polarity polarity,
            List<Point> waypoints,
            RgbColor color,
            Provenance provenance,
            ArrowParams arrowParams) {
        this.sketchId = sketchId;
        this.fromId = fromId;
        this.toId = toId;
        this.fromName = fromName;
        this.toName = toName;
        this.polarity = Objects.requireNonNull(polarity, "polarity");
        this.waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
        this.color = color;
        this.provenance = Objects.requireNonNull(provenance, "provenance");
        this.arrowParams = arrowParams;
    }

    public static Connection between(Variable from, Variable to, Polarity polarity, Provenance provenance) {
        return new Connection(
                null, from.getId(), to.getId(), from.getName(), to.getName(), polarity, List.of(), null, provenance, null);
    }

    public Integer getSketchId() {
        return sketchId;
    }

    public int getFromId() {
        return fromId;
    }

    public int getToId() {
        return toId;
    }

    public String getFromName() {
        return fromName;
    }

    public String getToName() {
        return toName;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    public List<Point> getWaypoints() {
        return waypoints;
    }

    public RgbColor getColor() {
        return color;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public ArrowParams getArrowParams() {
        return arrowParams;
    }

    public String key() {
        return fromId + "_" + toId;
    }

    public Connection withPolarity(Polarity newPolarity) {
        return new Connection(
                sketchId, fromId, toId, fromName, toName, newPolarity, waypoints, color, provenance, arrowParams);
    }

    public Connection withWaypoints(List<Point> newWaypoints) {
        return new Connection(
                sketchId, fromId, toId, fromName, toName, polarity, newWaypoints, color, provenance, arrowParams);
    }

    public Connection withSketchId(Integer newSketchId) {
        return new Connection(
                newSketchId, fromId, toId, fromName, toName, polarity, waypoints, color, provenance, arrowParams);
    }

    @Override
    public String toString() {
        return (fromName != null ? fromName : String.valueOf(fromId))
                + " -> "
                + (toName != null ? toName : String.valueOf(toId))
                + " (" + polarity + ", " + provenance.getLabel() + ")";
    }
}
