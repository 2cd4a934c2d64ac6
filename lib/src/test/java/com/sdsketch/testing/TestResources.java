package com.sdsketch.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads fixtures from the test classpath. */
public final class TestResources {
    private TestResources() {}

    public static String read(String resource) {
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String workforceModel() {
        return read("models/workforce.mdl");
    }

    /** Minimal sketch file around the given record lines, with {@code \n} terminators. */
    public static String sketchFile(String equations, String... records) {
        StringBuilder text = new StringBuilder("{UTF-8}\n").append(equations);
        text.append("\\\\\\---/// Sketch information - do not modify anything except names\n");
        text.append("V300  Do not put anything below this section - it will be ignored\n");
        text.append("*View 1\n");
        for (String record : records) {
            text.append(record).append('\n');
        }
        text.append("///---\\\\\\\n");
        text.append(":L<%^E!@\n");
        return text.toString();
    }
}
