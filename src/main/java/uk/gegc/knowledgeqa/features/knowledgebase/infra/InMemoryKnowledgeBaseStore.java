package uk.gegc.knowledgeqa.features.knowledgebase.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.knowledgebase.application.FragmentRetriever;
import uk.gegc.knowledgeqa.features.knowledgebase.application.KnowledgeBaseCatalog;
import uk.gegc.knowledgeqa.features.knowledgebase.application.MetadataIndex;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.FragmentInsights;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;
import uk.gegc.knowledgeqa.shared.util.TextSimilarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local knowledge base store used when no external vector store is configured.
 *
 * Fragments and insights are registered by ingestion code (or tests) and are read-only from the
 * pipelines' point of view. Similarity search ranks fragments by lexical term overlap.
 */
@Component
@Slf4j
public class InMemoryKnowledgeBaseStore implements KnowledgeBaseCatalog, FragmentRetriever, MetadataIndex {

    private final Map<String, List<ContentFragment>> fragmentsByKb = new ConcurrentHashMap<>();
    private final Map<String, Map<String, FragmentInsights>> insightsByKb = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) the fragments of a knowledge base.
     */
    public void register(String kbName, List<ContentFragment> fragments) {
        fragmentsByKb.put(kbName, List.copyOf(fragments));
        log.info("Registered knowledge base '{}' with {} fragments", kbName, fragments.size());
    }

    /**
     * Registers (or replaces) the precomputed insights of a knowledge base.
     */
    public void putInsights(String kbName, List<FragmentInsights> insights) {
        Map<String, FragmentInsights> byFragment = new ConcurrentHashMap<>();
        insights.forEach(insight -> byFragment.put(insight.fragmentId(), insight));
        insightsByKb.put(kbName, byFragment);
    }

    public boolean delete(String kbName) {
        insightsByKb.remove(kbName);
        return fragmentsByKb.remove(kbName) != null;
    }

    @Override
    public boolean exists(String kbName) {
        return kbName != null && fragmentsByKb.containsKey(kbName);
    }

    @Override
    public List<ContentFragment> listFragments(String kbName) {
        List<ContentFragment> fragments = kbName == null ? null : fragmentsByKb.get(kbName);
        if (fragments == null) {
            throw new KnowledgeBaseNotFoundException("Knowledge base '" + kbName + "' does not exist");
        }
        return fragments;
    }

    @Override
    public List<ContentFragment> similaritySearch(String kbName, String query, int k) {
        List<ContentFragment> fragments = listFragments(kbName);
        if (k <= 0 || fragments.isEmpty()) {
            return List.of();
        }

        Set<String> queryTerms = TextSimilarity.terms(query);
        List<ScoredFragment> scored = new ArrayList<>();
        for (ContentFragment fragment : fragments) {
            Set<String> fragmentTerms = TextSimilarity.terms(fragment.text());
            long overlap = queryTerms.stream().filter(fragmentTerms::contains).count();
            if (overlap > 0) {
                scored.add(new ScoredFragment(fragment, (double) overlap / Math.sqrt(fragmentTerms.size())));
            }
        }

        return scored.stream()
                .sorted(Comparator.comparingDouble(ScoredFragment::score).reversed())
                .limit(k)
                .map(ScoredFragment::fragment)
                .toList();
    }

    @Override
    public Map<String, FragmentInsights> insights(String kbName) {
        return insightsByKb.getOrDefault(kbName, Map.of());
    }

    private record ScoredFragment(ContentFragment fragment, double score) {
    }
}
