package io.github.manjago.mutagen.exec;

import java.util.List;
import java.util.Map;

/**
 * Function implemented in Java.
 */
public record BuiltinFunction(String name, Body body) implements ScriptCallable {

    @FunctionalInterface
    public interface Body {
        Object apply(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs);
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs) {
        return body.apply(interpreter, args, kwargs);
    }

    @Override
    public String toString() {
        return "<builtin " + name + ">";
    }
}
