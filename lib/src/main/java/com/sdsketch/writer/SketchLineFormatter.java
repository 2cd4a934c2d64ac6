package com.sdsketch.writer;

import com.sdsketch.model.ArrowParams;
import com.sdsketch.model.Cloud;
import com.sdsketch.model.Point;
import com.sdsketch.model.RgbColor;
import com.sdsketch.model.Valve;
import com.sdsketch.model.Variable;
import java.util.List;

/** Formats single sketch records, without line terminators. */
public final class SketchLineFormatter {

    private SketchLineFormatter() {}

    public static String variable(Variable variable) {
        String prefix = "10," + variable.getId() + "," + NameQuoting.quote(variable.getName()) + ","
                + variable.getX() + "," + variable.getY() + ","
                + variable.getWidth() + "," + variable.getHeight() + ","
                + variable.getKind().getShapeCode() + ",3,0,";
        if (variable.isColored()) {
            RgbColor fill = variable.getFillColor() != null ? variable.getFillColor() : RgbColor.BLACK;
            return prefix + "1,-1,1,0,0," + variable.getBorderColor() + "," + fill + ",|||0-0-0,0,0,0,0,0,0";
        }
        return prefix + "0,-1,0,0,0,0,0,0,0,0,0";
    }

    public static String valve(Valve valve) {
        return "11," + valve.getId() + ",0," + valve.getX() + "," + valve.getY() + ","
                + valve.getWidth() + "," + valve.getHeight() + ",34,3,0,0,1,0,0,0,0,0,0,0,0,0";
    }

    public static String cloud(Cloud cloud) {
        return "12," + cloud.getId() + "," + cloud.getShapeCode() + "," + cloud.getX() + "," + cloud.getY() + ","
                + cloud.getWidth() + "," + cloud.getHeight() + ",0,3,0,0,-1,0,0,0,0,0,0,0,0,0";
    }

    /** Arrow with explicit fields 4 to 7, the form used for both default and preserved parameters. */
    public static String connection(int id, int fromId, int toId, ArrowParams params, List<Point> points) {
        ArrowParams fields = params != null ? params : ArrowParams.STANDARD;
        return "1," + id + "," + fromId + "," + toId + "," + fields + ",0,192,0,-1--1--1,,1" + polyline(points);
    }

    public static String coloredConnection(int id, int fromId, int toId, RgbColor color, List<Point> points) {
        return "1," + id + "," + fromId + "," + toId + ",0,0,0,0,1,64,0," + color + ",|||0-0-0,1" + polyline(points);
    }

    public static String polyline(List<Point> points) {
        if (points == null || points.isEmpty()) {
            return "|(0,0)|";
        }
        StringBuilder builder = new StringBuilder("|");
        for (Point point : points) {
            builder.append(point);
        }
        return builder.append('|').toString();
    }
}
