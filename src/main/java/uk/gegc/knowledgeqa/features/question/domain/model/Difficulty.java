package uk.gegc.knowledgeqa.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;

import java.util.Locale;

/**
 * Difficulty of a generated question. Each level maps to an instruction rubric
 * in the generation prompt rather than to any numeric scaling.
 */
@Getter
public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String value;

    Difficulty(String value) {
        this.value = value;
    }

    /**
     * Resolves a difficulty from its name or lower-case value, ignoring case.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static Difficulty fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Difficulty cannot be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Difficulty difficulty : values()) {
            if (difficulty.name().equals(normalized)) {
                return difficulty;
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + value);
    }
}
