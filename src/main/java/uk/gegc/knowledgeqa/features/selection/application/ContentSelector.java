package uk.gegc.knowledgeqa.features.selection.application;

import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

/**
 * Chooses the fragment a question is generated from.
 */
public interface ContentSelector {

    /**
     * Selects a fragment of {@code kbName} according to {@code strategy}, skipping content
     * already used in {@code session}. Leaves the session unchanged.
     *
     * @return a fragment that belongs to the knowledge base's indexed content
     * @throws uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException if the knowledge base is unknown
     * @throws uk.gegc.knowledgeqa.shared.exception.EmptyKnowledgeBaseException if it has no indexed fragments
     */
    ContentFragment select(String kbName, SelectionStrategy strategy, Difficulty difficulty, SelectionSession session);

    /**
     * Records that a question was built from {@code fragment}. Starts a new coverage cycle when
     * every source (or fragment) of the knowledge base had already been used.
     */
    void recordUse(String kbName, ContentFragment fragment, SelectionSession session);
}
