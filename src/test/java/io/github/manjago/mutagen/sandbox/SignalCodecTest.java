package io.github.manjago.mutagen.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalCodecTest {

    @Test
    @DisplayName("encoded metrics are framed and sorted")
    void encode() {
        String frame = SignalCodec.encode(Map.of("win_rate", 0.5, "sharpe_ratio", 1.0));

        assertEquals("__SIGNAL_JSON_START__{\"sharpe_ratio\":1.0,\"win_rate\":0.5}__SIGNAL_JSON_END__", frame);
    }

    @Test
    @DisplayName("surrounding log lines are ignored")
    void decodeWithNoise() throws Exception {
        String output = "INFO starting\n" + SignalCodec.encode(Map.of("total_return", 0.12)) + "\nINFO done\n";

        assertEquals(Map.of("total_return", 0.12), SignalCodec.decode(output));
    }

    @Test
    @DisplayName("the last frame wins")
    void lastFrame() throws Exception {
        String output = SignalCodec.encode(Map.of("x", 1.0)) + "\n" + SignalCodec.encode(Map.of("x", 2.0));

        assertEquals(2.0, SignalCodec.decode(output).get("x"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "plain output",
        "__SIGNAL_JSON_START__{\"x\":1.0}",
        "__SIGNAL_JSON_START__not json__SIGNAL_JSON_END__",
        "__SIGNAL_JSON_START__[1,2]__SIGNAL_JSON_END__",
        "__SIGNAL_JSON_START__{\"x\":null}__SIGNAL_JSON_END__",
        "__SIGNAL_JSON_START__null__SIGNAL_JSON_END__"
    })
    @DisplayName("broken signals are isolation failures")
    void broken(String output) {
        assertThrows(IsolationException.class, () -> SignalCodec.decode(output));
    }
}
