package io.github.manjago.mutagen.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metrics travel from the isolated process on stdout, framed by markers so
 * log lines around them do not matter:
 * <pre>
 * __SIGNAL_JSON_START__{"sharpe_ratio":1.2,...}__SIGNAL_JSON_END__
 * </pre>
 */
public final class SignalCodec {

    public static final String START = "__SIGNAL_JSON_START__";
    public static final String END = "__SIGNAL_JSON_END__";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Double>> METRICS = new TypeReference<>() {};

    private SignalCodec() {
    }

    public static String encode(Map<String, Double> metrics) {
        try {
            return START + JSON.writeValueAsString(new TreeMap<>(metrics)) + END;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Extract the last framed signal from process output.
     *
     * @throws IsolationException when no complete signal is present or it is not a metrics object
     */
    public static Map<String, Double> decode(String output) throws IsolationException {
        int start = output.lastIndexOf(START);
        if (start < 0) {
            throw new IsolationException("No signal marker in isolated output");
        }
        int from = start + START.length();
        int end = output.indexOf(END, from);
        if (end < 0) {
            throw new IsolationException("Unterminated signal in isolated output");
        }
        try {
            Map<String, Double> metrics = JSON.readValue(output.substring(from, end), METRICS);
            if (metrics == null) {
                throw new IsolationException("Empty signal in isolated output");
            }
            if (metrics.containsValue(null)) {
                throw new IsolationException("Signal contains null metrics");
            }
            return Map.copyOf(metrics);
        } catch (JsonProcessingException e) {
            throw new IsolationException("Malformed signal: " + e.getOriginalMessage(), e);
        }
    }
}
