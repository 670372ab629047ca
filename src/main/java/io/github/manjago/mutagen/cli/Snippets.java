package io.github.manjago.mutagen.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Snippet file I/O; "-" stands for stdin.
 */
final class Snippets {

    static final String STDIN = "-";

    private Snippets() {
    }

    static String read(Path file) throws IOException {
        if (STDIN.equals(file.toString())) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
