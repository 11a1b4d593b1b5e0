package uk.gegc.knowledgeqa.features.drill.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.knowledgeqa.features.history.HistoryFixtures.question;

@DisplayName("IssuedQuestionCache")
class IssuedQuestionCacheTest {

    @Test
    @DisplayName("evicts the least recently used question when full")
    void evictsLeastRecentlyUsed() {
        KnowledgeQaProperties properties = new KnowledgeQaProperties();
        properties.getHistory().setIssuedQuestionCacheSize(2);
        IssuedQuestionCache cache = new IssuedQuestionCache(properties);

        Question first = question("python");
        Question second = question("python");
        Question third = question("python");
        cache.put(first);
        cache.put(second);
        cache.get(first.id());
        cache.put(third);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(first.id())).contains(first);
        assertThat(cache.get(second.id())).isEmpty();
        assertThat(cache.get(third.id())).contains(third);
    }
}
