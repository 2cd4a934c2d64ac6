package com.sdsketch.loader;

import com.sdsketch.loader.record.CloudRecord;
import com.sdsketch.loader.record.ConnectionRecord;
import com.sdsketch.loader.record.SketchRecords;
import com.sdsketch.loader.record.SourceLocation;
import com.sdsketch.loader.record.ValveRecord;
import com.sdsketch.loader.record.VariableRecord;
import com.sdsketch.model.ArrowParams;
import com.sdsketch.model.Cloud;
import com.sdsketch.model.Point;
import com.sdsketch.model.RgbColor;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the sketch lines of the first view into typed records. Lines that are not element or
 * arrow records (view headers, {@code *View} titles, font settings) are ignored; malformed records
 * are skipped with a warning.
 */
public final class SketchRecordReader {
    private static final Logger LOGGER = Logger.getLogger(SketchRecordReader.class.getName());
    private static final Pattern POINT = Pattern.compile("\\((-?\\d+),(-?\\d+)\\)");

    private final List<LoaderMessage> messages;

    public SketchRecordReader(List<LoaderMessage> messages) {
        this.messages = messages;
    }

    public SketchRecords read(MdlSections sections) {
        List<VariableRecord> variables = new ArrayList<>();
        List<ValveRecord> valves = new ArrayList<>();
        List<CloudRecord> clouds = new ArrayList<>();
        List<ConnectionRecord> connections = new ArrayList<>();
        List<String> lines = sections.getSketchLines();
        int firstLineNo = sections.getMarkerLine() + 2;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            SourceLocation location = new SourceLocation(sections.getSourceName(), firstLineNo + i);
            try {
                if (line.startsWith("10,")) {
                    variables.add(readVariable(line, location));
                } else if (line.startsWith("11,")) {
                    valves.add(readValve(line, location));
                } else if (line.startsWith("12,")) {
                    CloudRecord cloud = readCloud(line, location);
                    if (cloud != null) {
                        clouds.add(cloud);
                    }
                } else if (line.startsWith("1,")) {
                    connections.add(readConnection(line, location));
                }
            } catch (MalformedRecordException e) {
                warn(location, e.getMessage());
            }
        }
        return new SketchRecords(variables, valves, clouds, connections);
    }

    private VariableRecord readVariable(String line, SourceLocation location) throws MalformedRecordException {
        List<String> fields = FieldTokenizer.split(line);
        require(fields, 8, "variable");
        RgbColor border = null;
        RgbColor fill = null;
        if (fields.size() > 16 && ("1".equals(fields.get(10).trim()) || fields.size() >= 24)) {
            border = RgbColor.parse(fields.get(15).trim());
            fill = RgbColor.parse(fields.get(16).trim());
        }
        return new VariableRecord(
                location,
                integer(fields, 1),
                FieldTokenizer.unquote(fields.get(2)),
                integer(fields, 3),
                integer(fields, 4),
                integer(fields, 5),
                integer(fields, 6),
                integer(fields, 7),
                border,
                fill);
    }

    private ValveRecord readValve(String line, SourceLocation location) throws MalformedRecordException {
        List<String> fields = FieldTokenizer.split(line);
        require(fields, 7, "valve");
        return new ValveRecord(
                location,
                integer(fields, 1),
                integer(fields, 3),
                integer(fields, 4),
                integer(fields, 5),
                integer(fields, 6));
    }

    private CloudRecord readCloud(String line, SourceLocation location) throws MalformedRecordException {
        List<String> fields = FieldTokenizer.split(line);
        require(fields, 7, "cloud");
        int code = integer(fields, 2);
        if (code != Cloud.CLOUD_SHAPE_CODE) {
            // comments and other annotations share the 12, prefix
            LOGGER.fine(() -> location + ": skipping non-cloud 12, record with code " + code);
            return null;
        }
        return new CloudRecord(
                location,
                integer(fields, 1),
                code,
                integer(fields, 3),
                integer(fields, 4),
                integer(fields, 5),
                integer(fields, 6));
    }

    private ConnectionRecord readConnection(String line, SourceLocation location) throws MalformedRecordException {
        List<String> fields = FieldTokenizer.split(line);
        require(fields, 4, "connection");
        ArrowParams params =
                new ArrowParams(
                        field(fields, 4, ArrowParams.STANDARD.getShape()),
                        field(fields, 5, ArrowParams.STANDARD.getHidden()),
                        field(fields, 6, ArrowParams.STANDARD.getPolarityCode()),
                        field(fields, 7, ArrowParams.STANDARD.getThickness()));
        RgbColor color = null;
        if (fields.size() > 11 && "1".equals(fields.get(8).trim()) && "64".equals(fields.get(9).trim())) {
            color = RgbColor.parse(fields.get(11).trim());
        }
        return new ConnectionRecord(
                location,
                integer(fields, 1),
                integer(fields, 2),
                integer(fields, 3),
                params,
                parsePoints(fields.get(fields.size() - 1)),
                color);
    }

    /** Points of a {@code 1|(x,y)(x,y)|} field; the {@code (0,0)} placeholder means no points. */
    public static List<Point> parsePoints(String field) {
        int first = field.indexOf('|');
        int last = field.lastIndexOf('|');
        if (first < 0 || last <= first) {
            return List.of();
        }
        List<Point> points = new ArrayList<>();
        Matcher matcher = POINT.matcher(field.substring(first + 1, last));
        while (matcher.find()) {
            points.add(new Point(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
        }
        if (points.size() == 1 && points.get(0).getX() == 0 && points.get(0).getY() == 0) {
            return List.of();
        }
        return points;
    }

    private void warn(SourceLocation location, String message) {
        LOGGER.warning(() -> location + ": " + message);
        messages.add(LoaderMessage.warning(message, location.getSourceName(), location.getLine()));
    }

    private static void require(List<String> fields, int minimum, String kind) throws MalformedRecordException {
        if (fields.size() < minimum) {
            throw new MalformedRecordException(
                    "Skipping " + kind + " record with " + fields.size() + " fields (need " + minimum + ")");
        }
    }

    private static int integer(List<String> fields, int index) throws MalformedRecordException {
        String value = fields.get(index).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Skipping record with non-numeric field " + index + ": '" + value + "'");
        }
    }

    private static String field(List<String> fields, int index, String fallback) {
        return index < fields.size() ? fields.get(index).trim() : fallback;
    }

    private static final class MalformedRecordException extends Exception {
        MalformedRecordException(String message) {
            super(message);
        }
    }
}
