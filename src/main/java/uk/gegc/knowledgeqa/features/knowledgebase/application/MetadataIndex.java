package uk.gegc.knowledgeqa.features.knowledgebase.application;

import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.FragmentInsights;

import java.util.Map;

/**
 * Optional per-fragment enrichment built at ingestion time.
 */
public interface MetadataIndex {

    /**
     * Insights keyed by fragment id; empty when the knowledge base was ingested without enrichment.
     */
    Map<String, FragmentInsights> insights(String kbName);
}
