package io.github.manjago.mutagen.exec;

import java.util.List;
import java.util.Map;

/**
 * Anything a snippet can call.
 */
public interface ScriptCallable {

    String name();

    Object call(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs);
}
