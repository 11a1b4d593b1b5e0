package uk.gegc.knowledgeqa.features.knowledgebase.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A retrievable unit of document text with its provenance.
 *
 * @param id         fragment identity, unique within a knowledge base
 * @param text       fragment text
 * @param sourceId   identifier of the source document the fragment was cut from
 * @param metadata   free-form ingestion metadata
 * @param ingestedAt creation time of the fragment or its source document, null when unknown
 */
public record ContentFragment(
        String id,
        String text,
        String sourceId,
        Map<String, Object> metadata,
        Instant ingestedAt
) {

    public static final String SOURCE_ID_KEY = "source_id";
    public static final String CREATED_AT_KEY = "created_at";
    public static final String KB_NAME_KEY = "kb_name";

    public ContentFragment {
        Objects.requireNonNull(id, "Fragment id cannot be null");
        Objects.requireNonNull(text, "Fragment text cannot be null");
        Objects.requireNonNull(sourceId, "Fragment source id cannot be null");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ContentFragment of(String id, String text, String sourceId) {
        return new ContentFragment(id, text, sourceId, Map.of(), null);
    }
}
