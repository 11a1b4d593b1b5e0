package uk.gegc.knowledgeqa.features.history.application;

import uk.gegc.knowledgeqa.features.history.domain.model.QaRecord;

import java.util.List;

/**
 * Storage for answered questions.
 */
public interface QaHistoryRecorder {

    void record(QaRecord record);

    /**
     * Records of a knowledge base, newest first.
     *
     * @param limit maximum number of records; non-positive means all
     */
    List<QaRecord> findByKnowledgeBase(String kbName, int limit);

    /**
     * @return number of records removed
     */
    int deleteByKnowledgeBase(String kbName);
}
