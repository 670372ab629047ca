package io.github.manjago.mutagen.tier1;

import io.github.manjago.mutagen.exit.ExitParameter;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.Stmt;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable configuration of a strategy: its top-level numeric assignments,
 * in source order, excluding exit parameters. The first assignment of a
 * name wins.
 */
public record StrategyConfig(List<ConfigEntry> entries) {

    public StrategyConfig {
        entries = List.copyOf(entries);
    }

    public static StrategyConfig extract(Script script) {
        Map<String, ConfigEntry> found = new LinkedHashMap<>();
        for (Stmt stmt : script.body()) {
            if (!(stmt instanceof Stmt.Assign assign) || assign.targetName() == null) {
                continue;
            }
            String name = assign.targetName();
            if (ExitParameter.isExitKey(name) || found.containsKey(name)) {
                continue;
            }
            if (assign.value() instanceof Expr.Num num && num.hasSpan()) {
                found.put(name, new ConfigEntry(name, num));
            }
        }
        return new StrategyConfig(new ArrayList<>(found.values()));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Nullable
    public ConfigEntry find(String name) {
        for (ConfigEntry entry : entries) {
            if (entry.name().equals(name)) {
                return entry;
            }
        }
        return null;
    }

    public List<String> keys() {
        return entries.stream().map(ConfigEntry::name).toList();
    }
}
