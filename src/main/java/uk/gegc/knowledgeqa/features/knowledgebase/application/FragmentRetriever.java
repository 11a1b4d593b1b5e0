package uk.gegc.knowledgeqa.features.knowledgebase.application;

import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;

import java.util.List;

/**
 * Semantic retrieval over a knowledge base.
 */
public interface FragmentRetriever {

    /**
     * Returns up to {@code k} fragments ordered from most to least similar to {@code query}.
     *
     * @throws uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException if the knowledge base is unknown
     */
    List<ContentFragment> similaritySearch(String kbName, String query, int k);
}
