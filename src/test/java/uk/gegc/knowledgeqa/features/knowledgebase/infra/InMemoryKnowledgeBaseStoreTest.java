package uk.gegc.knowledgeqa.features.knowledgebase.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.FragmentInsights;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.QaPair;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryKnowledgeBaseStore")
class InMemoryKnowledgeBaseStoreTest {

    private InMemoryKnowledgeBaseStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKnowledgeBaseStore();
        store.register("python", List.of(
                ContentFragment.of("f1", "Python lists are mutable sequences.", "doc-1"),
                ContentFragment.of("f2", "Tuples are immutable sequences in Python.", "doc-1"),
                ContentFragment.of("f3", "The garbage collector frees unreachable objects.", "doc-2"),
                ContentFragment.of("f4", "Python适合初学者，因为语法简单。", "doc-3")));
    }

    @Test
    @DisplayName("ranks fragments by term overlap and drops unrelated ones")
    void similaritySearch() {
        List<ContentFragment> results = store.similaritySearch("python", "Are tuples immutable?", 5);

        assertThat(results).extracting(ContentFragment::id).first().isEqualTo("f2");
        assertThat(results).extracting(ContentFragment::id).doesNotContain("f3");
    }

    @Test
    @DisplayName("matches Chinese queries through character bigrams")
    void chineseSearch() {
        assertThat(store.similaritySearch("python", "为什么适合初学者", 2))
                .extracting(ContentFragment::id)
                .containsExactly("f4");
    }

    @Test
    @DisplayName("respects k")
    void limitsResults() {
        assertThat(store.similaritySearch("python", "Python sequences", 1)).hasSize(1);
        assertThat(store.similaritySearch("python", "Python sequences", 0)).isEmpty();
    }

    @Test
    @DisplayName("reports unknown knowledge bases")
    void unknownKnowledgeBase() {
        assertThat(store.exists("missing")).isFalse();
        assertThatThrownBy(() -> store.listFragments("missing"))
                .isInstanceOf(KnowledgeBaseNotFoundException.class);
        assertThatThrownBy(() -> store.similaritySearch("missing", "anything", 3))
                .isInstanceOf(KnowledgeBaseNotFoundException.class);
    }

    @Test
    @DisplayName("stores insights per fragment and forgets them on delete")
    void insightsLifecycle() {
        store.putInsights("python", List.of(
                new FragmentInsights("f1", List.of(new QaPair("What is a list?", "A mutable sequence.")), List.of("list"))));

        assertThat(store.insights("python")).containsOnlyKeys("f1");

        assertThat(store.delete("python")).isTrue();
        assertThat(store.exists("python")).isFalse();
        assertThat(store.insights("python")).isEmpty();
    }
}
