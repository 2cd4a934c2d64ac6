package com.sdsketch.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class LayoutOptionsTest {

    @Test
    void defaults() {
        LayoutOptions options = LayoutOptions.defaults();
        assertEquals(50, options.getPadding());
        assertEquals(200, options.getMinSpacing());
        assertEquals(10, options.getMargin());
        assertEquals(100, options.getMaxIterations());
        assertEquals(2400, options.getCanvasMaxX());
        assertEquals(950, options.getCanvasMaxY());
        assertEquals(300, options.getValveSnapRadius());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty("sdsketch.layout.padding", "20");
        properties.setProperty("sdsketch.layout.canvasMaxX", " 4000 ");
        LayoutOptions options = LayoutOptions.fromProperties(properties);

        assertEquals(20, options.getPadding());
        assertEquals(4000, options.getCanvasMaxX());
        assertEquals(200, options.getMinSpacing());
    }

    @Test
    void rejectsBadValues() {
        Properties properties = new Properties();
        properties.setProperty("sdsketch.layout.margin", "wide");
        assertThrows(IllegalArgumentException.class, () -> LayoutOptions.fromProperties(properties));

        Properties inverted = new Properties();
        inverted.setProperty("sdsketch.layout.canvasMinY", "1000");
        assertThrows(IllegalArgumentException.class, () -> LayoutOptions.fromProperties(inverted));
    }
}
