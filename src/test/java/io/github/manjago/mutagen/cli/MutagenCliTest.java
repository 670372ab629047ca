package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.TestStrategies;
import io.github.manjago.mutagen.security.SecurityValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MutagenCliTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("validate accepts the sample strategy")
    void validateClean() throws Exception {
        Path file = write("strategy.py", TestStrategies.momentum());

        assertEquals(0, MutagenCli.commandLine().execute("validate", file.toString()));
    }

    @Test
    @DisplayName("validate rejects imports")
    void validateImport() throws Exception {
        Path file = write("bad.py", "import os\nposition = 1\n");

        assertEquals(1, MutagenCli.commandLine().execute("validate", file.toString()));
    }

    @Test
    @DisplayName("mutate writes a safe exit-mutated snippet")
    void mutateExit() throws Exception {
        Path file = write("strategy.py", TestStrategies.momentum());
        Path out = dir.resolve("mutated.py");

        int code = MutagenCli.commandLine().execute("mutate", file.toString(),
            "--exit", "stop_loss_pct", "-s", "42", "-o", out.toString());

        assertEquals(0, code);
        String mutated = Files.readString(out);
        assertTrue(new SecurityValidator().validate(mutated).success());
        assertTrue(mutated.contains("stop_loss_pct = "));
    }

    @Test
    @DisplayName("mutate refuses --tier together with --exit")
    void mutateConflict() throws Exception {
        Path file = write("strategy.py", TestStrategies.momentum());

        assertEquals(2, MutagenCli.commandLine().execute("mutate", file.toString(), "--tier", "1", "--exit"));
    }

    @Test
    @DisplayName("unknown tier is a usage error")
    void badTier() throws Exception {
        Path file = write("strategy.py", TestStrategies.momentum());

        assertEquals(2, MutagenCli.commandLine().execute("mutate", file.toString(), "--tier", "7"));
    }

    @Test
    @DisplayName("info prints the configuration")
    void info() {
        assertEquals(0, MutagenCli.commandLine().execute("info"));
    }
}
