package uk.gegc.knowledgeqa;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Base class for integration tests running the full application context with MockMvc.
 * The model provider is never contacted; subclasses mock the generation client.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@TestPropertySource(properties = {
        "spring.ai.openai.api-key=test-key",
        "knowledge-qa.ai.retry.base-delay-ms=0"
})
public abstract class BaseIntegrationTest {

    @Autowired
    protected MockMvc mockMvc;
}
