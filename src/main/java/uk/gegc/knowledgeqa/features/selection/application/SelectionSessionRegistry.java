package uk.gegc.knowledgeqa.features.selection.application;

import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves caller session ids to their {@link SelectionSession}. Calls without a session id
 * share the default session. Holds at most {@code knowledge-qa.selection.max-sessions}
 * sessions; the least recently used one is dropped first and starts over if it comes back.
 */
@Component
public class SelectionSessionRegistry {

    public static final String DEFAULT_SESSION_ID = "default";

    private final Map<String, SelectionSession> sessions;

    public SelectionSessionRegistry(KnowledgeQaProperties properties) {
        int capacity = properties.getSelection().getMaxSessions();
        this.sessions = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SelectionSession> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized SelectionSession session(String sessionId) {
        String key = sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId.trim();
        return sessions.computeIfAbsent(key, SelectionSession::new);
    }

    public synchronized int size() {
        return sessions.size();
    }
}
