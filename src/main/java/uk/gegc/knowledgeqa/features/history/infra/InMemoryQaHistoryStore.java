package uk.gegc.knowledgeqa.features.history.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.history.application.QaHistoryRecorder;
import uk.gegc.knowledgeqa.features.history.domain.model.QaRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local history store. Records are kept per knowledge base in insertion order.
 */
@Component
@Slf4j
public class InMemoryQaHistoryStore implements QaHistoryRecorder {

    private final Map<String, List<QaRecord>> recordsByKb = new ConcurrentHashMap<>();

    @Override
    public void record(QaRecord record) {
        recordsByKb.computeIfAbsent(record.kbName(), key -> new CopyOnWriteArrayList<>()).add(record);
        log.debug("Recorded answer {} for question {} in '{}'", record.id(), record.question().id(), record.kbName());
    }

    @Override
    public List<QaRecord> findByKnowledgeBase(String kbName, int limit) {
        List<QaRecord> records = recordsByKb.get(kbName);
        if (records == null) {
            return List.of();
        }
        List<QaRecord> newestFirst = new ArrayList<>(records);
        // reverse first so records with equal timestamps keep newest-first order
        Collections.reverse(newestFirst);
        newestFirst.sort(Comparator.comparing(QaRecord::recordedAt).reversed());
        if (limit > 0 && newestFirst.size() > limit) {
            return List.copyOf(newestFirst.subList(0, limit));
        }
        return List.copyOf(newestFirst);
    }

    @Override
    public int deleteByKnowledgeBase(String kbName) {
        List<QaRecord> removed = recordsByKb.remove(kbName);
        int count = removed == null ? 0 : removed.size();
        log.info("Deleted {} history records for '{}'", count, kbName);
        return count;
    }
}
