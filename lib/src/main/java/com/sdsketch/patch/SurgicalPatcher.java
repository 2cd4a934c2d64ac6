package com.sdsketch.patch;

import com.sdsketch.layout.BoundingBox;
import com.sdsketch.layout.Coordinate;
import com.sdsketch.layout.EdgeRouter;
import com.sdsketch.layout.GridPlacer;
import com.sdsketch.layout.OverlapResolver;
import com.sdsketch.layout.Route;
import com.sdsketch.loader.LineBuffer;
import com.sdsketch.loader.LoaderMessage;
import com.sdsketch.loader.MdlFormatException;
import com.sdsketch.model.ArrowParams;
import com.sdsketch.model.IdAllocator;
import com.sdsketch.model.Point;
import com.sdsketch.model.Polarity;
import com.sdsketch.model.Variable;
import com.sdsketch.model.VariableKind;
import com.sdsketch.writer.NameQuoting;
import com.sdsketch.writer.SketchLineFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Adds variables and connections to an existing sketch file by inserting lines, leaving every
 * original line byte-identical. New equations go before the {@code .Control} group (or the sketch
 * marker), new {@code 10,} records after the last variable record and new {@code 1,} records after
 * the last arrow.
 */
public final class SurgicalPatcher {
    private static final Logger LOGGER = Logger.getLogger(SurgicalPatcher.class.getName());

    public PatchResult patch(String sourceName, String text, PatchRequest request) throws MdlFormatException {
        LineBuffer buffer = LineBuffer.of(text);
        InsertionPoints points = InsertionPoints.scan(sourceName, buffer.lines());
        if (!request.getVariables().isEmpty() && points.getLastVariableLine() < 0) {
            throw new MdlFormatException("variable record", "No 10, record to insert after in " + sourceName);
        }
        if (!request.getConnections().isEmpty() && points.getLastConnectionLine() < 0) {
            throw new MdlFormatException("connection record", "No 1, record to insert after in " + sourceName);
        }
        Session session = new Session(sourceName, points, request);
        List<Variable> added = session.addVariables();
        List<String> connectionLines = session.addConnections(added);
        List<String> equationLines = session.equationLines(added);
        List<String> variableLines = new ArrayList<>();
        for (Variable variable : added) {
            variableLines.add(SketchLineFormatter.variable(variable));
        }

        int variableAt = points.getLastVariableLine() + 1;
        int connectionAt = points.getLastConnectionLine() + 1;
        buffer.insert(points.getEquationLine(), equationLines);
        if (!variableLines.isEmpty()) {
            buffer.insert(variableAt + equationLines.size(), variableLines);
        }
        if (!connectionLines.isEmpty()) {
            int shift = equationLines.size() + (variableAt <= connectionAt ? variableLines.size() : 0);
            buffer.insert(connectionAt + shift, connectionLines);
        }
        LOGGER.fine(() -> sourceName + ": added " + added.size() + " variables and " + connectionLines.size()
                + " connections");
        return new PatchResult(
                buffer.render(), session.assignedIds, session.connectionIds, session.renames, session.messages);
    }

    /** Counters and lookups of one patch call. */
    private static final class Session {
        private final String sourceName;
        private final InsertionPoints points;
        private final PatchRequest request;
        private final IdAllocator variableIds;
        private final IdAllocator connectionIdAllocator;
        private final Map<String, Integer> assignedIds = new LinkedHashMap<>();
        private final Map<String, String> renames = new LinkedHashMap<>();
        private final Map<String, Variable> byRequestedName = new HashMap<>();
        private final List<Integer> connectionIds = new ArrayList<>();
        private final List<LoaderMessage> messages = new ArrayList<>();

        Session(String sourceName, InsertionPoints points, PatchRequest request) {
            this.sourceName = sourceName;
            this.points = points;
            this.request = request;
            this.variableIds = IdAllocator.startingAfter(points.getMaxVariableId());
            this.connectionIdAllocator = IdAllocator.startingAfter(points.getMaxConnectionId());
        }

        List<Variable> addVariables() {
            List<NewVariable> requested = request.getVariables();
            Map<Integer, Point> positions = place(requested);
            Set<String> taken = new HashSet<>(points.getIdsByName().keySet());
            List<Variable> added = new ArrayList<>();
            for (int i = 0; i < requested.size(); i++) {
                NewVariable wanted = requested.get(i);
                String name = wanted.getName();
                if (taken.contains(name)) {
                    name = freeName(wanted.getName(), taken);
                    renames.putIfAbsent(wanted.getName(), name);
                    warn("Variable '" + wanted.getName() + "' already exists; added as '" + name + "'");
                }
                taken.add(name);
                Point position = positions.get(i);
                Variable variable = new Variable(
                        variableIds.allocate(),
                        name,
                        wanted.getKind(),
                        position.getX(),
                        position.getY(),
                        wanted.getWidth(),
                        wanted.getHeight(),
                        request.getColorScheme().getBorder(),
                        null,
                        null);
                assignedIds.put(name, variable.getId());
                byRequestedName.putIfAbsent(wanted.getName(), variable);
                added.add(variable);
            }
            return added;
        }

        /** Final centre of each requested variable, by request index. */
        private Map<Integer, Point> place(List<NewVariable> requested) {
            List<Point> existing = new ArrayList<>();
            for (Variable variable : points.getVariables()) {
                existing.add(variable.getPosition());
            }
            List<Integer> unplaced = new ArrayList<>();
            List<VariableKind> kinds = new ArrayList<>();
            for (int i = 0; i < requested.size(); i++) {
                if (requested.get(i).getPosition() == null) {
                    unplaced.add(i);
                    kinds.add(requested.get(i).getKind());
                }
            }
            List<Point> grid = GridPlacer.place(existing, kinds);

            // keys: existing variables as -(index + 1), requested variables by request index
            Map<Integer, Point> layout = new LinkedHashMap<>();
            Set<Integer> fixed = new HashSet<>();
            for (int i = 0; i < existing.size(); i++) {
                layout.put(-(i + 1), existing.get(i));
                fixed.add(-(i + 1));
            }
            for (int i = 0; i < requested.size(); i++) {
                if (requested.get(i).getPosition() != null) {
                    layout.put(i, requested.get(i).getPosition());
                    fixed.add(i);
                }
            }
            for (int k = 0; k < unplaced.size(); k++) {
                layout.put(unplaced.get(k), grid.get(k));
            }
            if (unplaced.isEmpty()) {
                return layout;
            }
            return new OverlapResolver(request.getLayoutOptions()).resolve(layout, fixed).getPositions();
        }

        List<String> addConnections(List<Variable> added) {
            Map<Integer, Variable> geometry = new HashMap<>();
            List<BoundingBox> obstacles = new ArrayList<>();
            int padding = request.getLayoutOptions().getPadding();
            for (Variable variable : points.getVariables()) {
                geometry.putIfAbsent(variable.getId(), variable);
                obstacles.add(BoundingBox.around(variable, padding));
            }
            for (Variable variable : added) {
                geometry.put(variable.getId(), variable);
                obstacles.add(BoundingBox.around(variable, padding));
            }
            EdgeRouter router = new EdgeRouter(request.getLayoutOptions());

            List<String> lines = new ArrayList<>();
            for (NewConnection connection : request.getConnections()) {
                Integer fromId = resolve(connection.getFrom());
                Integer toId = resolve(connection.getTo());
                if (fromId == null || toId == null) {
                    warn("Skipping connection " + connection + ": "
                            + (fromId == null ? connection.getFrom() : connection.getTo()) + " not found");
                    continue;
                }
                List<Point> waypoints = List.of();
                Variable from = geometry.get(fromId);
                Variable to = geometry.get(toId);
                if (request.isRouteConnections() && from != null && to != null) {
                    Route route = router.findWaypoints(
                            Coordinate.of(from.getPosition()), Coordinate.of(to.getPosition()), obstacles, fromId, toId);
                    waypoints = route.getWaypoints();
                }
                int id = connectionIdAllocator.allocate();
                connectionIds.add(id);
                if (request.getColorScheme().getLine() != null) {
                    lines.add(SketchLineFormatter.coloredConnection(
                            id, fromId, toId, request.getColorScheme().getLine(), waypoints));
                } else {
                    lines.add(SketchLineFormatter.connection(id, fromId, toId, ArrowParams.STANDARD, waypoints));
                }
            }
            return lines;
        }

        List<String> equationLines(List<Variable> added) {
            List<String> lines = new ArrayList<>();
            List<NewVariable> requested = request.getVariables();
            for (int i = 0; i < added.size(); i++) {
                Variable variable = added.get(i);
                NewVariable wanted = requested.get(i);
                List<String> dependencies = new ArrayList<>();
                for (NewConnection connection : request.getConnections()) {
                    if (!connection.getTo().equals(wanted.getName()) && !connection.getTo().equals(variable.getName())) {
                        continue;
                    }
                    Variable source = byRequestedName.get(connection.getFrom());
                    String name = source != null ? source.getName() : connection.getFrom();
                    String sign = connection.getPolarity() == Polarity.NEGATIVE ? "-" : "";
                    dependencies.add(sign + NameQuoting.quote(name));
                }
                lines.add(NameQuoting.quote(variable.getName()) + "  = A FUNCTION OF( "
                        + String.join(",", dependencies) + ")");
                lines.add("\t~\t" + wanted.getUnits());
                lines.add("\t~\t" + wanted.getDescription() + "\t|");
                lines.add("");
            }
            return lines;
        }

        private Integer resolve(String name) {
            Variable added = byRequestedName.get(name);
            if (added != null) {
                return added.getId();
            }
            return points.getIdsByName().get(name);
        }

        private static String freeName(String name, Set<String> taken) {
            int suffix = 1;
            while (taken.contains(name + "_" + suffix)) {
                suffix++;
            }
            return name + "_" + suffix;
        }

        private void warn(String message) {
            LOGGER.warning(() -> sourceName + ": " + message);
            messages.add(LoaderMessage.warning(message, sourceName, 0));
        }
    }
}
