package io.github.manjago.mutagen.core;

/**
 * Callback interface for mutation events.
 *
 * All methods have default no-op implementations.
 * Implement only the methods you need.
 */
public interface MutationListener {

    /**
     * Called after every mutation request, successful or not.
     */
    default void onMutation(MutationResult result) {}

    /**
     * Called when a tier attempt failed and the cascade moves on.
     *
     * @param failed tier that failed
     * @param next   tier that will be attempted next
     * @param reason failure reason of the failed attempt
     */
    default void onFallback(Tier failed, Tier next, String reason) {}

    /**
     * Called when every tier of the cascade failed.
     */
    default void onExhausted(MutationResult result) {}

    /**
     * No-op listener.
     */
    MutationListener NOOP = new MutationListener() {};
}
