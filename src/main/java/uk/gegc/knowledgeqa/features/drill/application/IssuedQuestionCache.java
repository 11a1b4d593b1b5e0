package uk.gegc.knowledgeqa.features.drill.application;

import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Questions issued to callers and not yet evicted, least recently used first out.
 */
@Component
public class IssuedQuestionCache {

    private final Map<UUID, Question> questions;

    public IssuedQuestionCache(KnowledgeQaProperties properties) {
        int capacity = properties.getHistory().getIssuedQuestionCacheSize();
        this.questions = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, Question> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized void put(Question question) {
        questions.put(question.id(), question);
    }

    public synchronized Optional<Question> get(UUID questionId) {
        return Optional.ofNullable(questions.get(questionId));
    }

    public synchronized int size() {
        return questions.size();
    }
}
