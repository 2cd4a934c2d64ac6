package com.sdsketch.layout;

import com.sdsketch.loader.FieldTokenizer;
import com.sdsketch.loader.LineBuffer;
import com.sdsketch.loader.MdlFormatException;
import com.sdsketch.loader.MdlSections;
import com.sdsketch.loader.SketchRecordReader;
import com.sdsketch.model.Point;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Moves variables of an existing sketch file to new positions in place. Valves are re-centred
 * between their two nearest variables and arrow bend points are dropped, since they no longer fit
 * the moved nodes. Lines other than the edited records are left untouched.
 */
public final class DiagramRelayout {
    private static final Logger LOGGER = Logger.getLogger(DiagramRelayout.class.getName());
    private static final String NO_POINTS = "1|(0,0)|";

    private final LayoutOptions options;

    public DiagramRelayout() {
        this(LayoutOptions.defaults());
    }

    public DiagramRelayout(LayoutOptions options) {
        this.options = options;
    }

    /** Applies {@code positions} (keyed by variable name) after spreading out crowded entries. */
    public Result relayout(String sourceName, String text, Map<String, Point> positions) throws MdlFormatException {
        MdlSections sections = MdlSections.split(sourceName, text);
        OverlapResolver.Result<String> spread = new OverlapResolver(options).resolve(new LinkedHashMap<>(positions));
        Map<String, Point> target = spread.getPositions();

        LineBuffer buffer = LineBuffer.of(text);
        int first = sections.getMarkerLine() + 1;
        int end = Math.min(sections.getSketchEndLine(), buffer.size());
        int variablesMoved = 0;
        int valvesMoved = 0;
        int arrowsStripped = 0;
        for (int i = first; i < end; i++) {
            String line = buffer.get(i);
            String trimmed = line.trim();
            if (trimmed.startsWith("10,")) {
                List<String> fields = FieldTokenizer.split(line);
                Point point = fields.size() > 4 ? target.get(FieldTokenizer.unquote(fields.get(2))) : null;
                if (point != null) {
                    fields.set(3, String.valueOf(point.getX()));
                    fields.set(4, String.valueOf(point.getY()));
                    buffer.set(i, String.join(",", fields));
                    variablesMoved++;
                }
            } else if (trimmed.startsWith("11,")) {
                String moved = recentreValve(line, target);
                if (moved != null) {
                    buffer.set(i, moved);
                    valvesMoved++;
                }
            } else if (trimmed.startsWith("1,")) {
                List<String> fields = FieldTokenizer.split(line);
                String last = fields.get(fields.size() - 1);
                if (last.contains("|(") && !SketchRecordReader.parsePoints(last).isEmpty()) {
                    fields.set(fields.size() - 1, NO_POINTS);
                    buffer.set(i, String.join(",", fields));
                    arrowsStripped++;
                }
            }
        }
        int moved = variablesMoved;
        int valves = valvesMoved;
        int arrows = arrowsStripped;
        LOGGER.fine(() -> sourceName + ": moved " + moved + " variables, " + valves + " valves, stripped "
                + arrows + " arrows");
        return new Result(buffer.render(), variablesMoved, valvesMoved, arrowsStripped, spread.isConverged());
    }

    private String recentreValve(String line, Map<String, Point> positions) {
        List<String> fields = FieldTokenizer.split(line);
        if (fields.size() < 5) {
            return null;
        }
        Point valve;
        try {
            valve = new Point(Integer.parseInt(fields.get(3).trim()), Integer.parseInt(fields.get(4).trim()));
        } catch (NumberFormatException e) {
            LOGGER.warning(() -> "Leaving valve with non-numeric position in place: " + line);
            return null;
        }
        List<Point> nearby = new ArrayList<>();
        for (Point point : positions.values()) {
            if (valve.distanceTo(point) < options.getValveSnapRadius()) {
                nearby.add(point);
            }
        }
        if (nearby.size() < 2) {
            return null;
        }
        nearby.sort(Comparator.comparingDouble(valve::distanceTo));
        Point a = nearby.get(0);
        Point b = nearby.get(1);
        fields.set(3, String.valueOf((a.getX() + b.getX()) / 2));
        fields.set(4, String.valueOf((a.getY() + b.getY()) / 2));
        return String.join(",", fields);
    }

    /** Rewritten text plus counts of the edits made. */
    public static final class Result {
        private final String text;
        private final int variablesMoved;
        private final int valvesMoved;
        private final int arrowsStripped;
        private final boolean converged;

        Result(String text, int variablesMoved, int valvesMoved, int arrowsStripped, boolean converged) {
            this.text = text;
            this.variablesMoved = variablesMoved;
            this.valvesMoved = valvesMoved;
            this.arrowsStripped = arrowsStripped;
            this.converged = converged;
        }

        public String getText() {
            return text;
        }

        public int getVariablesMoved() {
            return variablesMoved;
        }

        public int getValvesMoved() {
            return valvesMoved;
        }

        public int getArrowsStripped() {
            return arrowsStripped;
        }

        public boolean isConverged() {
            return converged;
        }
    }
}
