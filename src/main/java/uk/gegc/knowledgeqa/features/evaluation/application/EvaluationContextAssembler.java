package uk.gegc.knowledgeqa.features.evaluation.application;

import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines a question's source context with freshly retrieved fragments.
 *
 * The source context is always kept whole. Retrieved fragments are deduplicated by id, the
 * question's own fragment is skipped, and additions are appended in retrieval order until the
 * length budget is spent. The fragment that crosses the budget is cut only when a meaningful
 * part of it still fits.
 */
@Component
public class EvaluationContextAssembler {

    static final String SEPARATOR = "\n\n---\n\n";
    static final int MIN_PARTIAL_FRAGMENT = 100;

    public String assemble(Question question, List<ContentFragment> retrieved, int maxLength) {
        StringBuilder context = new StringBuilder(question.sourceContext());
        if (retrieved == null || retrieved.isEmpty()) {
            return context.toString();
        }

        Set<String> seen = new HashSet<>();
        if (question.fragmentId() != null) {
            seen.add(question.fragmentId());
        }

        for (ContentFragment fragment : retrieved) {
            if (!seen.add(fragment.id()) || fragment.text().isBlank()
                    || fragment.text().strip().equals(question.sourceContext().strip())) {
                continue;
            }

            int remaining = maxLength - context.length() - SEPARATOR.length();
            if (remaining <= 0) {
                break;
            }
            if (fragment.text().length() <= remaining) {
                context.append(SEPARATOR).append(fragment.text());
            } else {
                if (remaining > MIN_PARTIAL_FRAGMENT) {
                    context.append(SEPARATOR).append(fragment.text(), 0, remaining);
                }
                break;
            }
        }
        return context.toString();
    }
}
