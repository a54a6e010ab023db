package de.mirkosertic.ftsquery;

import org.jspecify.annotations.Nullable;

/**
 * Converts a user search phrase into a full-text search condition.
 */
public interface ConditionTransformer {

    /**
     * Converts a search phrase to a valid full-text search condition.
     *
     * @param query the phrase typed by the user, may be {@code null}
     * @return the condition, or an empty string if no valid condition could be built
     */
    String transform(@Nullable String query);
}
