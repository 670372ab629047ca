package io.github.manjago.mutagen.exec;

import io.github.manjago.mutagen.snippet.Stmt;

import java.util.List;
import java.util.Map;

/**
 * Function defined by a snippet's {@code def}.
 * Parameter defaults are evaluated once, at definition time.
 */
public record ScriptFunction(Stmt.FunctionDef definition, List<Object> defaults) implements ScriptCallable {

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs) {
        return interpreter.invoke(this, args, kwargs);
    }

    @Override
    public String toString() {
        return "<function " + name() + ">";
    }
}
