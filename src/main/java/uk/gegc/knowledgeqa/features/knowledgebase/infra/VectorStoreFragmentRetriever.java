package uk.gegc.knowledgeqa.features.knowledgebase.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.knowledgebase.application.FragmentRetriever;
import uk.gegc.knowledgeqa.features.knowledgebase.application.KnowledgeBaseCatalog;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Retrieval backed by a Spring AI {@link VectorStore}. Documents of every knowledge base share
 * one store and are told apart by their {@code kb_name} metadata.
 */
@Component
@Primary
@ConditionalOnProperty(name = "knowledge-qa.retrieval.backend", havingValue = "vector-store")
@RequiredArgsConstructor
@Slf4j
public class VectorStoreFragmentRetriever implements FragmentRetriever {

    private final VectorStore vectorStore;
    private final KnowledgeBaseCatalog catalog;

    @Override
    public List<ContentFragment> similaritySearch(String kbName, String query, int k) {
        if (!catalog.exists(kbName)) {
            throw new KnowledgeBaseNotFoundException("Knowledge base '" + kbName + "' does not exist");
        }

        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(k)
                .filterExpression(new FilterExpressionBuilder().eq(ContentFragment.KB_NAME_KEY, kbName).build())
                .build();

        List<Document> documents = vectorStore.similaritySearch(request);
        if (documents == null) {
            return List.of();
        }

        log.debug("Vector search in '{}' returned {} documents", kbName, documents.size());
        return documents.stream()
                .filter(document -> document.getText() != null)
                .map(VectorStoreFragmentRetriever::toFragment)
                .toList();
    }

    static ContentFragment toFragment(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        Object sourceId = metadata.get(ContentFragment.SOURCE_ID_KEY);
        return new ContentFragment(
                document.getId(),
                document.getText(),
                sourceId != null ? sourceId.toString() : document.getId(),
                metadata,
                parseInstant(metadata.get(ContentFragment.CREATED_AT_KEY))
        );
    }

    private static Instant parseInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparseable created_at '{}'", text);
            }
        }
        return null;
    }
}
