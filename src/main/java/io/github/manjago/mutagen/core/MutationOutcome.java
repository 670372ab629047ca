package io.github.manjago.mutagen.core;

import java.util.Map;

/**
 * Result of one tier mutator call.
 *
 * Tier mutators never throw for an unusable candidate: they return
 * {@link Rejected} and the dispatcher decides whether to fall back.
 */
public sealed interface MutationOutcome {

    boolean isApplied();

    /**
     * The mutator produced new code.
     *
     * @param code         mutated snippet
     * @param mutationType what was done (may refine the planned type)
     * @param metadata     mutator-specific details for logging and tracking
     */
    record Applied(String code, String mutationType, Map<String, Object> metadata) implements MutationOutcome {

        public Applied {
            metadata = Map.copyOf(metadata);
        }

        @Override
        public boolean isApplied() {
            return true;
        }
    }

    /**
     * The mutator could not produce a valid candidate.
     */
    record Rejected(String reason) implements MutationOutcome {

        @Override
        public boolean isApplied() {
            return false;
        }
    }

    static MutationOutcome applied(String code, String mutationType, Map<String, Object> metadata) {
        return new Applied(code, mutationType, metadata);
    }

    static MutationOutcome rejected(String reason) {
        return new Rejected(reason);
    }
}
