package uk.gegc.knowledgeqa.features.evaluation.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.knowledgeqa.features.evaluation.application.EvaluationContextAssembler.SEPARATOR;

@DisplayName("EvaluationContextAssembler")
class EvaluationContextAssemblerTest {

    private static final String SOURCE = "Python适合初学者，因为语法简单。";

    private final EvaluationContextAssembler assembler = new EvaluationContextAssembler();

    private Question question() {
        return Question.builder()
                .id(UUID.randomUUID())
                .content("为什么Python适合初学者？")
                .kbName("python")
                .sourceContext(SOURCE)
                .difficulty(Difficulty.EASY)
                .createdAt(Instant.EPOCH)
                .fragmentId("f1")
                .build();
    }

    @Test
    @DisplayName("returns the source context alone when nothing was retrieved")
    void noRetrieval() {
        assertThat(assembler.assemble(question(), List.of(), 4000)).isEqualTo(SOURCE);
        assertThat(assembler.assemble(question(), null, 4000)).isEqualTo(SOURCE);
    }

    @Test
    @DisplayName("appends new fragments and skips the question's own fragment and duplicates")
    void deduplicates() {
        List<ContentFragment> retrieved = List.of(
                ContentFragment.of("f1", SOURCE, "doc-1"),
                ContentFragment.of("f2", "社区活跃。", "doc-1"),
                ContentFragment.of("f2", "社区活跃。", "doc-1"),
                ContentFragment.of("f3", SOURCE, "doc-2"),
                ContentFragment.of("f4", "标准库丰富。", "doc-3"));

        String context = assembler.assemble(question(), retrieved, 4000);

        assertThat(context).isEqualTo(SOURCE + SEPARATOR + "社区活跃。" + SEPARATOR + "标准库丰富。");
    }

    @Test
    @DisplayName("keeps the source context whole even when it exceeds the budget")
    void sourceAlwaysKept() {
        String context = assembler.assemble(question(), List.of(ContentFragment.of("f2", "extra", "doc")), 5);

        assertThat(context).isEqualTo(SOURCE);
    }

    @Test
    @DisplayName("cuts the last fragment only when a meaningful part fits")
    void partialFragment() {
        String longText = "x".repeat(500);
        int budget = SOURCE.length() + SEPARATOR.length() + 150;

        String withPartial = assembler.assemble(question(), List.of(ContentFragment.of("f2", longText, "doc")), budget);
        assertThat(withPartial).hasSize(budget).startsWith(SOURCE + SEPARATOR);

        int smallBudget = SOURCE.length() + SEPARATOR.length() + 50;
        String withoutPartial = assembler.assemble(question(), List.of(ContentFragment.of("f2", longText, "doc")), smallBudget);
        assertThat(withoutPartial).isEqualTo(SOURCE);
    }
}
