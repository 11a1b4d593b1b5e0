package uk.gegc.knowledgeqa.features.selection.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import uk.gegc.knowledgeqa.features.knowledgebase.application.KnowledgeBaseCatalog;
import uk.gegc.knowledgeqa.features.knowledgebase.application.MetadataIndex;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.FragmentInsights;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.selection.application.ContentSelector;
import uk.gegc.knowledgeqa.features.selection.application.SelectionSession;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;
import uk.gegc.knowledgeqa.shared.exception.EmptyKnowledgeBaseException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Strategy-driven content selection. Every strategy ranks or filters the same candidate set
 * (the knowledge base's full fragment list) and then draws uniformly from the best tier.
 */
@Service
@Slf4j
public class ContentSelectorImpl implements ContentSelector {

    /**
     * Bonus for fragments that no precomputed question/answer pair covers yet
     */
    static final int UNCOVERED_FRAGMENT_BONUS = 2;

    private final KnowledgeBaseCatalog catalog;
    private final MetadataIndex metadataIndex;
    private final KnowledgeQaProperties properties;
    private final Random random;

    @Autowired
    public ContentSelectorImpl(KnowledgeBaseCatalog catalog,
                               MetadataIndex metadataIndex,
                               KnowledgeQaProperties properties) {
        this(catalog, metadataIndex, properties, new Random());
    }

    ContentSelectorImpl(KnowledgeBaseCatalog catalog,
                        MetadataIndex metadataIndex,
                        KnowledgeQaProperties properties,
                        Random random) {
        this.catalog = catalog;
        this.metadataIndex = metadataIndex;
        this.properties = properties;
        this.random = random;
    }

    @Override
    public ContentFragment select(String kbName,
                                  SelectionStrategy strategy,
                                  Difficulty difficulty,
                                  SelectionSession session) {
        List<ContentFragment> candidates = catalog.listFragments(kbName);
        if (candidates.isEmpty()) {
            throw new EmptyKnowledgeBaseException("Knowledge base '" + kbName + "' has no indexed content");
        }

        SelectionStrategy effective = strategy != null ? strategy : properties.getDefaultStrategy();
        ContentFragment selected = switch (effective) {
            case RANDOM -> pickRandom(candidates);
            case DIVERSE -> pickDiverse(kbName, candidates, session);
            case RECENT -> pickRecent(candidates);
            case COMPREHENSIVE -> pickComprehensive(kbName, candidates, session);
        };

        log.debug("Selected fragment {} (source {}) from '{}' using {} strategy for {} question",
                selected.id(), selected.sourceId(), kbName, effective, difficulty);
        return selected;
    }

    @Override
    public void recordUse(String kbName, ContentFragment fragment, SelectionSession session) {
        List<ContentFragment> candidates = catalog.listFragments(kbName);
        if (!candidates.isEmpty() && candidates.stream().allMatch(f -> session.isSourceUsed(kbName, f.sourceId()))) {
            log.debug("All {} sources of '{}' used in session {}, starting a new cycle",
                    session.usedSourceCount(kbName), kbName, session.getId());
            session.resetSources(kbName);
        }
        if (!candidates.isEmpty() && candidates.stream().allMatch(f -> session.isFragmentUsed(kbName, f.id()))) {
            session.resetFragments(kbName);
        }
        session.markUsed(kbName, fragment);
    }

    private ContentFragment pickRandom(List<ContentFragment> candidates) {
        return candidates.get(random.nextInt(candidates.size()));
    }

    /**
     * Excludes fragments whose source was already used in this session. Once every source has
     * been used this falls back to a random draw; {@link #recordUse} then starts the new cycle.
     */
    private ContentFragment pickDiverse(String kbName, List<ContentFragment> candidates, SelectionSession session) {
        List<ContentFragment> fresh = candidates.stream()
                .filter(fragment -> !session.isSourceUsed(kbName, fragment.sourceId()))
                .toList();

        if (fresh.isEmpty()) {
            return pickRandom(candidates);
        }
        return pickRandom(fresh);
    }

    /**
     * Samples uniformly from the newest quantile of fragments. Fragments without a timestamp
     * rank after every dated one.
     */
    private ContentFragment pickRecent(List<ContentFragment> candidates) {
        List<ContentFragment> byRecency = candidates.stream()
                .sorted(Comparator.comparing(ContentFragment::ingestedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();

        if (byRecency.get(0).ingestedAt() == null) {
            log.debug("No ingestion timestamps available, sampling uniformly");
            return pickRandom(candidates);
        }

        int tierSize = (int) Math.ceil(byRecency.size() * properties.getSelection().getRecentQuantile());
        tierSize = Math.max(1, Math.min(tierSize, byRecency.size()));
        return pickRandom(byRecency.subList(0, tierSize));
    }

    /**
     * Ranks fragments by key-concept count plus a bonus when no precomputed question covers
     * them, skipping fragments already quizzed on in this session.
     */
    private ContentFragment pickComprehensive(String kbName, List<ContentFragment> candidates, SelectionSession session) {
        Map<String, FragmentInsights> insights = metadataIndex.insights(kbName);
        if (insights == null || insights.isEmpty()) {
            log.debug("No metadata index for '{}', comprehensive selection degrades to diverse", kbName);
            return pickDiverse(kbName, candidates, session);
        }

        List<ContentFragment> unused = candidates.stream()
                .filter(fragment -> !session.isFragmentUsed(kbName, fragment.id()))
                .toList();
        if (unused.isEmpty()) {
            unused = candidates;
        }

        int bestScore = unused.stream()
                .mapToInt(fragment -> densityScore(insights.get(fragment.id())))
                .max()
                .orElse(0);

        List<ContentFragment> bestTier = unused.stream()
                .filter(fragment -> densityScore(insights.get(fragment.id())) == bestScore)
                .toList();
        return pickRandom(bestTier);
    }

    static int densityScore(FragmentInsights insights) {
        if (insights == null) {
            return 0;
        }
        int score = insights.keyConcepts().size();
        if (insights.qaPairs().isEmpty()) {
            score += UNCOVERED_FRAGMENT_BONUS;
        }
        return score;
    }
}
