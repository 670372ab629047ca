package io.github.manjago.mutagen.exec;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Variable scope. Function calls get a child scope of the globals;
 * lookups fall through to the parent, assignments are always local.
 */
public final class Environment {

    private final Map<String, Object> values = new HashMap<>();
    @Nullable
    private final Environment parent;

    public Environment(@Nullable Environment parent) {
        this.parent = parent;
    }

    public boolean contains(String name) {
        return values.containsKey(name) || (parent != null && parent.contains(name));
    }

    public Object lookup(String name, int line) {
        if (values.containsKey(name)) {
            return values.get(name);
        }
        if (parent != null) {
            return parent.lookup(name, line);
        }
        throw new EvaluationException("Name '" + name + "' is not defined", line);
    }

    public void define(String name, Object value) {
        values.put(name, value);
    }

    /**
     * Value bound in this scope only, null when unbound.
     */
    @Nullable
    public Object local(String name) {
        return values.get(name);
    }

    public Map<String, Object> locals() {
        return Map.copyOf(values.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)));
    }
}
