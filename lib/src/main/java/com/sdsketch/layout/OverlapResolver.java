package com.sdsketch.layout;

import com.sdsketch.model.Point;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Pushes variable centres apart until every pair is at least {@code minSpacing} apart or the
 * iteration cap is hit. The later node of a crowded pair moves; fixed nodes never move.
 */
public final class OverlapResolver {
    private static final Logger LOGGER = Logger.getLogger(OverlapResolver.class.getName());

    private final LayoutOptions options;

    public OverlapResolver() {
        this(LayoutOptions.defaults());
    }

    public OverlapResolver(LayoutOptions options) {
        this.options = options;
    }

    public <K> Result<K> resolve(Map<K, Point> positions) {
        return resolve(positions, Set.of());
    }

    /** Iteration order of {@code positions} decides which node of a pair moves. */
    public <K> Result<K> resolve(Map<K, Point> positions, Set<K> fixed) {
        Map<K, Point> current = new LinkedHashMap<>(positions);
        List<K> keys = new ArrayList<>(current.keySet());
        int minSpacing = options.getMinSpacing();
        int iteration = 0;
        boolean converged = false;
        while (iteration < options.getMaxIterations()) {
            boolean overlap = false;
            for (int i = 0; i < keys.size(); i++) {
                for (int j = i + 1; j < keys.size(); j++) {
                    K first = keys.get(i);
                    K second = keys.get(j);
                    boolean firstFixed = fixed.contains(first);
                    boolean secondFixed = fixed.contains(second);
                    if (firstFixed && secondFixed) {
                        continue;
                    }
                    Point anchor = current.get(secondFixed ? second : first);
                    Point moving = current.get(secondFixed ? first : second);
                    double distance = anchor.distanceTo(moving);
                    if (distance >= minSpacing) {
                        continue;
                    }
                    overlap = true;
                    double dx = 1;
                    double dy = 0;
                    if (distance > 0) {
                        dx = (moving.getX() - anchor.getX()) / distance;
                        dy = (moving.getY() - anchor.getY()) / distance;
                    }
                    double push = minSpacing - distance + options.getMargin();
                    double x = clamp(moving.getX() + dx * push, options.getCanvasMinX(), options.getCanvasMaxX());
                    double y = clamp(moving.getY() + dy * push, options.getCanvasMinY(), options.getCanvasMaxY());
                    current.put(secondFixed ? first : second, new Point((int) x, (int) y));
                }
            }
            if (!overlap) {
                converged = true;
                break;
            }
            iteration++;
        }
        if (!converged) {
            LOGGER.warning("Overlaps remain after " + options.getMaxIterations() + " iterations");
        } else {
            int iterations = iteration;
            LOGGER.fine(() -> "Overlaps resolved after " + iterations + " iterations");
        }
        return new Result<>(current, iteration, converged);
    }

    private static double clamp(double value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Adjusted positions, in the input's iteration order. */
    public static final class Result<K> {
        private final Map<K, Point> positions;
        private final int iterations;
        private final boolean converged;

        Result(Map<K, Point> positions, int iterations, boolean converged) {
            this.positions = positions;
            this.iterations = iterations;
            this.converged = converged;
        }

        public Map<K, Point> getPositions() {
            return positions;
        }

        public int getIterations() {
            return iterations;
        }

        /** False when the iteration cap was hit with pairs still too close. */
        public boolean isConverged() {
            return converged;
        }
    }
}
