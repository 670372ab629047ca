package io.github.manjago.mutagen.exec;

/**
 * Host object reachable from snippets through attribute access.
 *
 * Only what an implementation explicitly returns is visible; there is no
 * reflection into Java objects.
 */
public interface ScriptObject {

    /**
     * Attribute value or bound method.
     *
     * @throws EvaluationException when the attribute does not exist
     */
    Object getAttribute(String name);

    /**
     * Value of {@code obj[key]}.
     */
    default Object getItem(Object key) {
        throw new EvaluationException(getClass().getSimpleName() + " is not subscriptable");
    }
}
