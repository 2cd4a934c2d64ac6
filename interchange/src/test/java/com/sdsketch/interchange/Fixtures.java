package com.sdsketch.interchange;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

final class Fixtures {
    private Fixtures() {}

    static String workforceModel() {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("models/workforce.mdl")) {
            if (in == null) {
                throw new IllegalStateException("Missing models/workforce.mdl on the test classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
