package uk.gegc.knowledgeqa.features.knowledgebase.domain.model;

import java.util.List;

/**
 * Precomputed enrichment for one fragment: question/answer pairs the fragment already answers
 * and the key concepts it covers. Produced at ingestion time, read by content selection.
 */
public record FragmentInsights(
        String fragmentId,
        List<QaPair> qaPairs,
        List<String> keyConcepts
) {

    public FragmentInsights {
        qaPairs = qaPairs == null ? List.of() : List.copyOf(qaPairs);
        keyConcepts = keyConcepts == null ? List.of() : List.copyOf(keyConcepts);
    }
}
