package uk.gegc.knowledgeqa.features.ai.infra.parser;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResponseSanitizer")
class ResponseSanitizerTest {

    private final ResponseSanitizer sanitizer = new ResponseSanitizer();
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(ResponseSanitizer.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(logAppender);
    }

    @Test
    @DisplayName("removes a leading reasoning block and keeps the answer")
    void removesLeadingThinkBlock() {
        assertThat(sanitizer.sanitize("<think>reasoning...</think>为什么Python适合初学者？"))
                .isEqualTo("为什么Python适合初学者？");
    }

    @Test
    @DisplayName("removes reasoning blocks wherever they appear, with any supported tag and case")
    void removesBlocksAnywhere() {
        String raw = "Intro\n<THINKING>step 1\nstep 2</THINKING>\nWhat is a closure?\n<reasoning>done</reasoning>";

        assertThat(sanitizer.sanitize(raw)).isEqualTo("Intro\n\nWhat is a closure?");
    }

    @Test
    @DisplayName("removes an unterminated block through the end and flags truncation")
    void unterminatedBlockIsTruncated() {
        SanitizedResponse response = sanitizer.sanitizeDetailed("What does the GIL protect?\n<think>let me reconsider");

        assertThat(response.text()).isEqualTo("What does the GIL protect?");
        assertThat(response.reasoningTruncated()).isTrue();
        assertThat(response.failedOpen()).isFalse();
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains("unterminated reasoning block"));
    }

    @Test
    @DisplayName("drops everything before an orphan closing tag")
    void orphanClosingTag() {
        assertThat(sanitizer.sanitize("the model forgot to open the tag</think>\n\nHow are lists sorted?"))
                .isEqualTo("How are lists sorted?");
    }

    @Test
    @DisplayName("returns the raw text when nothing but reasoning remains")
    void failsOpenWhenOnlyReasoning() {
        String raw = "<think>only thoughts here</think>";

        SanitizedResponse response = sanitizer.sanitizeDetailed(raw);

        assertThat(response.text()).isEqualTo(raw);
        assertThat(response.failedOpen()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "<think>a</think>What is recursion?",
            "What is recursion?\n<think>unfinished",
            "  plain answer with no reasoning  ",
            "<think>only</think>",
            "x</thought>y\n\n\n\nz"
    })
    @DisplayName("is idempotent")
    void idempotent(String raw) {
        String once = sanitizer.sanitize(raw);

        assertThat(sanitizer.sanitize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("treats null as empty")
    void nullInput() {
        assertThat(sanitizer.sanitize(null)).isEmpty();
    }
}
