package com.sdsketch.patch;

import com.sdsketch.loader.FieldTokenizer;
import com.sdsketch.loader.MdlFormatException;
import com.sdsketch.loader.SketchMarkers;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Anchors and id high-water marks of an existing file, found in one pass over its lines. Line
 * indexes are 0-based; -1 means the anchor was not found.
 */
final class InsertionPoints {
    private static final Logger LOGGER = Logger.getLogger(InsertionPoints.class.getName());
    private static final String BANNER = "*****";
    private static final String CONTROL_GROUP = ".Control";

    private int equationLine = -1;
    private int markerLine = -1;
    private int lastVariableLine = -1;
    private int lastConnectionLine = -1;
    private int maxVariableId;
    private int maxConnectionId;
    private final Map<String, Integer> idsByName = new LinkedHashMap<>();
    private final List<Variable> variables = new ArrayList<>();

    private InsertionPoints() {}

    static InsertionPoints scan(String sourceName, List<String> lines) throws MdlFormatException {
        InsertionPoints points = new InsertionPoints();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (points.markerLine < 0) {
                if (points.equationLine < 0
                        && line.contains(BANNER)
                        && i + 1 < lines.size()
                        && lines.get(i + 1).contains(CONTROL_GROUP)) {
                    points.equationLine = i;
                } else if (SketchMarkers.isOpeningLine(line)) {
                    points.markerLine = i;
                    if (points.equationLine < 0) {
                        points.equationLine = i;
                    }
                }
                continue;
            }
            if (SketchMarkers.isClosingLine(line)) {
                break;
            }
            points.readSketchLine(line.trim(), i);
        }
        if (points.markerLine < 0) {
            throw new MdlFormatException("sketch section", "No sketch section found in " + sourceName);
        }
        return points;
    }

    private void readSketchLine(String line, int index) {
        boolean variable = line.startsWith("10,");
        boolean connection = line.startsWith("1,");
        if (!variable && !connection && !line.startsWith("11,") && !line.startsWith("12,")) {
            return;
        }
        List<String> fields = FieldTokenizer.split(line);
        int id;
        try {
            id = Integer.parseInt(fields.get(1).trim());
        } catch (NumberFormatException | IndexOutOfBoundsException e) {
            LOGGER.fine(() -> "Ignoring sketch line " + (index + 1) + " without a numeric id");
            return;
        }
        if (connection) {
            lastConnectionLine = index;
            maxConnectionId = Math.max(maxConnectionId, id);
            return;
        }
        maxVariableId = Math.max(maxVariableId, id);
        if (variable) {
            lastVariableLine = index;
            if (fields.size() < 3) {
                LOGGER.warning(() -> "Variable record on line " + (index + 1) + " has no name; skipping it");
                return;
            }
            String name = FieldTokenizer.unquote(fields.get(2));
            idsByName.putIfAbsent(name, id);
            if (fields.size() > 7) {
                try {
                    variables.add(new Variable(
                            id,
                            name,
                            VariableKind.fromShapeCode(Integer.parseInt(fields.get(7).trim())),
                            Integer.parseInt(fields.get(3).trim()),
                            Integer.parseInt(fields.get(4).trim()),
                            Integer.parseInt(fields.get(5).trim()),
                            Integer.parseInt(fields.get(6).trim())));
                } catch (NumberFormatException e) {
                    // still an anchor and a name; only its geometry is unusable
                    LOGGER.fine(() -> "Variable " + name + " has a non-numeric position or size");
                }
            }
        }
    }

    int getEquationLine() {
        return equationLine;
    }

    int getMarkerLine() {
        return markerLine;
    }

    int getLastVariableLine() {
        return lastVariableLine;
    }

    int getLastConnectionLine() {
        return lastConnectionLine;
    }

    /** Highest id among variable, valve and cloud records. */
    int getMaxVariableId() {
        return maxVariableId;
    }

    int getMaxConnectionId() {
        return maxConnectionId;
    }

    Map<String, Integer> getIdsByName() {
        return idsByName;
    }

    /** Existing variables whose geometry could be read. */
    List<Variable> getVariables() {
        return variables;
    }
}
