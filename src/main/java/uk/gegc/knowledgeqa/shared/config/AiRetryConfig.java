package uk.gegc.knowledgeqa.shared.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the retry budget shared by question generation and answer evaluation.
 * Transport failures, timeouts, empty responses, validation failures and parse failures all
 * count against the same {@code maxRetries}.
 */
@Component
@ConfigurationProperties(prefix = "knowledge-qa.ai.retry")
@Validated
@Data
public class AiRetryConfig {

    /**
     * Maximum number of model attempts per pipeline call
     */
    @Min(1)
    private int maxRetries = 3;

    /**
     * Base delay in milliseconds for exponential backoff between attempts
     */
    @Min(0)
    private long baseDelayMs = 500;

    /**
     * Maximum delay in milliseconds (cap for exponential backoff)
     */
    @Min(0)
    private long maxDelayMs = 10_000;

    /**
     * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.25;
}
