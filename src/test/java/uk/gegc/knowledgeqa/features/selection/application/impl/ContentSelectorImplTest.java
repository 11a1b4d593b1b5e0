package uk.gegc.knowledgeqa.features.selection.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.FragmentInsights;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.QaPair;
import uk.gegc.knowledgeqa.features.knowledgebase.infra.InMemoryKnowledgeBaseStore;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.selection.application.SelectionSession;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;
import uk.gegc.knowledgeqa.shared.exception.EmptyKnowledgeBaseException;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContentSelectorImpl")
class ContentSelectorImplTest {

    private static final String KB = "notes";

    private InMemoryKnowledgeBaseStore store;
    private ContentSelectorImpl selector;
    private List<ContentFragment> fragments;

    @BeforeEach
    void setUp() {
        store = new InMemoryKnowledgeBaseStore();
        fragments = new ArrayList<>();
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 10; i++) {
            fragments.add(new ContentFragment("f" + i, "fragment text " + i, "doc-" + (i % 5),
                    Map.of(), base.plusSeconds(3600L * i)));
        }
        store.register(KB, fragments);
        selector = new ContentSelectorImpl(store, store, new KnowledgeQaProperties(), new Random(42));
    }

    private ContentFragment draw(SelectionStrategy strategy, SelectionSession session) {
        ContentFragment selected = selector.select(KB, strategy, Difficulty.MEDIUM, session);
        selector.recordUse(KB, selected, session);
        return selected;
    }

    @Test
    @DisplayName("always returns a member of the knowledge base for every strategy")
    void selectionIsMember() {
        SelectionSession session = new SelectionSession("s");
        for (SelectionStrategy strategy : SelectionStrategy.values()) {
            for (int i = 0; i < 20; i++) {
                assertThat(fragments).contains(selector.select(KB, strategy, Difficulty.MEDIUM, session));
            }
        }
    }

    @Test
    @DisplayName("diverse does not repeat a source until every source has been used")
    void diverseCoversAllSourcesFirst() {
        SelectionSession session = new SelectionSession("s");
        Set<String> sources = new HashSet<>();

        for (int i = 0; i < 5; i++) {
            ContentFragment selected = draw(SelectionStrategy.DIVERSE, session);
            assertThat(sources.add(selected.sourceId())).as("source %s repeated", selected.sourceId()).isTrue();
        }

        // sixth draw starts a new cycle instead of failing
        assertThat(draw(SelectionStrategy.DIVERSE, session)).isNotNull();
        assertThat(session.usedSourceCount(KB)).isEqualTo(1);
    }

    @Test
    @DisplayName("separate sessions track used sources independently")
    void sessionsAreIndependent() {
        SelectionSession first = new SelectionSession("a");
        SelectionSession second = new SelectionSession("b");

        draw(SelectionStrategy.DIVERSE, first);

        assertThat(first.usedSourceCount(KB)).isEqualTo(1);
        assertThat(second.usedSourceCount(KB)).isZero();
    }

    @Test
    @DisplayName("select leaves the session untouched until the use is recorded")
    void selectHasNoSideEffects() {
        SelectionSession session = new SelectionSession("s");
        for (int i = 0; i < 3; i++) {
            selector.select(KB, SelectionStrategy.DIVERSE, Difficulty.EASY, session);
            selector.select(KB, SelectionStrategy.COMPREHENSIVE, Difficulty.EASY, session);
        }

        assertThat(session.usedSourceCount(KB)).isZero();
    }

    @Test
    @DisplayName("recent samples only from the newest quantile")
    void recentUsesNewestTier() {
        SelectionSession session = new SelectionSession("s");
        for (int i = 0; i < 50; i++) {
            ContentFragment selected = selector.select(KB, SelectionStrategy.RECENT, Difficulty.HARD, session);
            assertThat(selected.id()).isIn("f9", "f8");
        }
    }

    @Test
    @DisplayName("recent falls back to uniform sampling without timestamps")
    void recentWithoutTimestamps() {
        store.register("undated", List.of(ContentFragment.of("a", "text", "doc"), ContentFragment.of("b", "text", "doc")));

        assertThat(selector.select("undated", SelectionStrategy.RECENT, Difficulty.MEDIUM, new SelectionSession("s")))
                .extracting(ContentFragment::id)
                .isIn("a", "b");
    }

    @Test
    @DisplayName("comprehensive prefers dense, uncovered fragments and then moves on")
    void comprehensivePrefersDenseFragments() {
        store.putInsights(KB, List.of(
                new FragmentInsights("f3", List.of(new QaPair("q", "a")), List.of("a", "b", "c")),
                new FragmentInsights("f7", List.of(), List.of("x", "y"))));
        SelectionSession session = new SelectionSession("s");

        assertThat(draw(SelectionStrategy.COMPREHENSIVE, session).id()).isEqualTo("f7");
        assertThat(draw(SelectionStrategy.COMPREHENSIVE, session).id()).isEqualTo("f3");
    }

    @Test
    @DisplayName("comprehensive degrades to diverse without a metadata index")
    void comprehensiveWithoutInsights() {
        SelectionSession session = new SelectionSession("s");
        ContentFragment first = draw(SelectionStrategy.COMPREHENSIVE, session);
        ContentFragment second = draw(SelectionStrategy.COMPREHENSIVE, session);

        assertThat(first.sourceId()).isNotEqualTo(second.sourceId());
    }

    @Test
    @DisplayName("density score adds a bonus for fragments without precomputed questions")
    void densityScore() {
        assertThat(ContentSelectorImpl.densityScore(null)).isZero();
        assertThat(ContentSelectorImpl.densityScore(new FragmentInsights("f", List.of(), List.of("a"))))
                .isEqualTo(1 + ContentSelectorImpl.UNCOVERED_FRAGMENT_BONUS);
    }

    @Test
    @DisplayName("fails for empty and unknown knowledge bases")
    void emptyAndUnknown() {
        store.register("empty", List.of());
        SelectionSession session = new SelectionSession("s");

        assertThatThrownBy(() -> selector.select("empty", SelectionStrategy.RANDOM, Difficulty.EASY, session))
                .isInstanceOf(EmptyKnowledgeBaseException.class);
        assertThatThrownBy(() -> selector.select("missing", SelectionStrategy.RANDOM, Difficulty.EASY, session))
                .isInstanceOf(KnowledgeBaseNotFoundException.class);
    }
}
