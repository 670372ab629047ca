package io.github.manjago.mutagen.exit;

import io.github.manjago.mutagen.snippet.Literals;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A successfully rewritten exit parameter.
 *
 * @param clamped whether the perturbed value fell outside the bounds and was pulled back
 */
public record ParameterChange(ExitParameter parameter, double oldValue, double newValue, boolean clamped) {

    /**
     * Metadata entries reported in mutation results.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("parameter", parameter.key());
        m.put("old_value", oldValue);
        m.put("new_value", newValue);
        m.put("clamped", clamped);
        return m;
    }

    @Override
    public String toString() {
        return String.format("%s: %s -> %s%s", parameter.key(),
            Literals.formatNumber(oldValue, false), Literals.formatNumber(newValue, parameter.isInteger()),
            clamped ? " (clamped)" : "");
    }
}
