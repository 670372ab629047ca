package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.MutagenConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Configuration options shared by the commands.
 */
public class ConfigOptions {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-s", "--seed"}, description = "Random seed (0 = clock)")
    private Long seed;

    /**
     * reference.conf, overlaid by the config file, then by --seed.
     */
    MutagenConfig load() {
        MutagenConfig base = configFile != null
            ? MutagenConfig.fromFile(configFile)
            : MutagenConfig.defaults();
        if (seed == null) {
            return base;
        }
        return base.toBuilder().randomSeed(seed).build();
    }
}
