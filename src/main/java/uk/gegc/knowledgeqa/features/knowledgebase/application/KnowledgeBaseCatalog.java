package uk.gegc.knowledgeqa.features.knowledgebase.application;

import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;

import java.util.List;

/**
 * Read-only view of the ingested fragments of each knowledge base.
 * Implementations must be safe for concurrent use.
 */
public interface KnowledgeBaseCatalog {

    boolean exists(String kbName);

    /**
     * Full candidate fragment set of a knowledge base, possibly empty.
     *
     * @throws uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException if the knowledge base is unknown
     */
    List<ContentFragment> listFragments(String kbName);
}
