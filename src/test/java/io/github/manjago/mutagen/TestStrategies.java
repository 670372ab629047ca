package io.github.manjago.mutagen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Strategy snippets shared by tests.
 */
public final class TestStrategies {

    private TestStrategies() {}

    /**
     * Three-factor momentum strategy with config values, exit parameters and a sim() call.
     */
    public static String momentum() {
        return resource("/strategies/momentum_trend.py");
    }

    public static String resource(String name) {
        try (InputStream in = TestStrategies.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
