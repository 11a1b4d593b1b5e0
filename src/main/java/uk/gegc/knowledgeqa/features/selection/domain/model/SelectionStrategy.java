package uk.gegc.knowledgeqa.features.selection.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Policy used by the content selector to pick the fragment a question is generated from.
 * A pure per-call parameter; nothing about it is persisted.
 */
public enum SelectionStrategy {
    /**
     * Uniform draw over every indexed fragment
     */
    RANDOM,

    /**
     * Avoids sources already used in the current session until all sources are exhausted
     */
    DIVERSE,

    /**
     * Samples from the most recently ingested tier of fragments
     */
    RECENT,

    /**
     * Prefers fragments with many key concepts and no previously generated questions.
     * Degrades to {@link #DIVERSE} without metadata.
     */
    COMPREHENSIVE;

    @JsonCreator
    public static SelectionStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Selection strategy cannot be blank");
        }
        return SelectionStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
