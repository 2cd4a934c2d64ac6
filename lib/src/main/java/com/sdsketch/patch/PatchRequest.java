package com.sdsketch.patch;

import com.sdsketch.layout.LayoutOptions;
import java.util.List;
import java.util.Properties;

/** Additions to splice into an existing sketch file. */
public final class PatchRequest {
    public static final String COLOR_SCHEME_PROPERTY = "sdsketch.patch.colorScheme";
    public static final String ROUTE_PROPERTY = "sdsketch.patch.routeConnections";

    private final List<NewVariable> variables;
    private final List<NewConnection> connections;
    private final ColorScheme colorScheme;
    private final boolean routeConnections;
    private final LayoutOptions layoutOptions;

    public PatchRequest(
            List<NewVariable> variables,
            List<NewConnection> connections,
            ColorScheme colorScheme,
            boolean routeConnections,
            LayoutOptions layoutOptions) {
        this.variables = List.copyOf(variables);
        this.connections = List.copyOf(connections);
        this.colorScheme = colorScheme == null ? ColorScheme.NONE : colorScheme;
        this.routeConnections = routeConnections;
        this.layoutOptions = layoutOptions == null ? LayoutOptions.defaults() : layoutOptions;
    }

    public static PatchRequest of(List<NewVariable> variables, List<NewConnection> connections) {
        return new PatchRequest(variables, connections, ColorScheme.THEORY, false, LayoutOptions.defaults());
    }

    /** Reads the color scheme, routing flag and layout options from {@code properties}. */
    public static PatchRequest fromProperties(
            List<NewVariable> variables, List<NewConnection> connections, Properties properties) {
        return new PatchRequest(
                variables,
                connections,
                ColorScheme.fromName(properties.getProperty(COLOR_SCHEME_PROPERTY)),
                Boolean.parseBoolean(properties.getProperty(ROUTE_PROPERTY, "false")),
                LayoutOptions.fromProperties(properties));
    }

    public PatchRequest withColorScheme(ColorScheme scheme) {
        return new PatchRequest(variables, connections, scheme, routeConnections, layoutOptions);
    }

    public PatchRequest withRouting(boolean route) {
        return new PatchRequest(variables, connections, colorScheme, route, layoutOptions);
    }

    public List<NewVariable> getVariables() {
        return variables;
    }

    public List<NewConnection> getConnections() {
        return connections;
    }

    public ColorScheme getColorScheme() {
        return colorScheme;
    }

    public boolean isRouteConnections() {
        return routeConnections;
    }

    public LayoutOptions getLayoutOptions() {
        return layoutOptions;
    }
}
