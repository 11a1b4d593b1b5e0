package uk.gegc.knowledgeqa.features.question.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;
import uk.gegc.knowledgeqa.shared.util.TextSimilarity;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding window of recently generated questions per knowledge base, used to reject
 * near-duplicates. Process-local.
 */
@Component
@RequiredArgsConstructor
public class RecentQuestionRegistry {

    private final KnowledgeQaProperties properties;
    private final Map<String, Deque<String>> recentByKb = new ConcurrentHashMap<>();

    public void register(String kbName, String question) {
        Deque<String> recent = recentByKb.computeIfAbsent(kbName, key -> new ArrayDeque<>());
        synchronized (recent) {
            recent.addFirst(question);
            while (recent.size() > properties.getGeneration().getRecentQuestionWindow()) {
                recent.removeLast();
            }
        }
    }

    /**
     * Returns true when the candidate is at least as similar as the configured threshold to
     * any remembered question of the same knowledge base.
     */
    public boolean isNearDuplicate(String kbName, String candidate) {
        Deque<String> recent = recentByKb.get(kbName);
        if (recent == null) {
            return false;
        }
        double threshold = properties.getGeneration().getDuplicateSimilarityThreshold();
        synchronized (recent) {
            return recent.stream()
                    .anyMatch(previous -> TextSimilarity.bigramSimilarity(previous, candidate) >= threshold);
        }
    }

    public void clear(String kbName) {
        recentByKb.remove(kbName);
    }

    public int count(String kbName) {
        Deque<String> recent = recentByKb.get(kbName);
        if (recent == null) {
            return 0;
        }
        synchronized (recent) {
            return recent.size();
        }
    }
}
