package uk.gegc.knowledgeqa.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

import java.time.Duration;

/**
 * Pipeline defaults for question generation, answer evaluation and content selection.
 * Injected into each pipeline at construction time.
 */
@Component
@ConfigurationProperties(prefix = "knowledge-qa")
@Validated
@Data
public class KnowledgeQaProperties {

    @NotNull
    private Difficulty defaultDifficulty = Difficulty.MEDIUM;

    @NotNull
    private SelectionStrategy defaultStrategy = SelectionStrategy.RANDOM;

    /**
     * Maximum number of characters of knowledge base text embedded in a prompt
     */
    @Min(100)
    private int maxContextLength = 4000;

    @Valid
    private Generation generation = new Generation();

    @Valid
    private Evaluation evaluation = new Evaluation();

    @Valid
    private Selection selection = new Selection();

    @Valid
    private Retrieval retrieval = new Retrieval();

    @Valid
    private History history = new History();

    @Data
    public static class Generation {

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7;

        /**
         * Added to the temperature on every retry to move away from a repeated failure
         */
        @DecimalMin("0.0")
        @DecimalMax("0.5")
        private double temperatureStep = 0.1;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double maxTemperature = 1.2;

        @Min(16)
        private int maxTokens = 1000;

        @NotNull
        private Duration modelTimeout = Duration.ofSeconds(60);

        /**
         * Character-bigram similarity at or above which a question counts as a near-duplicate
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double duplicateSimilarityThreshold = 0.85;

        /**
         * How many recent questions per knowledge base are kept for duplicate detection
         */
        @Min(1)
        private int recentQuestionWindow = 50;
    }

    @Data
    public static class Evaluation {

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.3;

        @Min(16)
        private int maxTokens = 1000;

        @NotNull
        private Duration modelTimeout = Duration.ofSeconds(60);

        /**
         * Score (0-10) at or above which an answer is considered correct
         */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("10.0")
        private double correctnessThreshold = 6.0;
    }

    @Data
    public static class Selection {

        /**
         * Share of the newest fragments sampled by the RECENT strategy
         */
        @DecimalMin("0.01")
        @DecimalMax("1.0")
        private double recentQuantile = 0.2;

        /**
         * Number of caller selection sessions kept in memory
         */
        @Min(1)
        private int maxSessions = 1000;
    }

    @Data
    public static class Retrieval {

        @NotNull
        private Backend backend = Backend.IN_MEMORY;

        @Min(1)
        private int topK = 5;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        public enum Backend {
            IN_MEMORY,
            VECTOR_STORE
        }
    }

    @Data
    public static class History {

        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(2);

        /**
         * Number of issued questions remembered while waiting for an answer
         */
        @Min(1)
        private int issuedQuestionCacheSize = 1000;
    }
}
