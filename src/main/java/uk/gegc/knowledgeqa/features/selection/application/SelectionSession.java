package uk.gegc.knowledgeqa.features.selection.application;

import lombok.Getter;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-caller memory of what content has already been quizzed on, kept separately for each
 * knowledge base. Process-local and never persisted.
 */
public class SelectionSession {

    @Getter
    private final String id;
    private final Map<String, Set<String>> usedSourcesByKb = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> usedFragmentsByKb = new ConcurrentHashMap<>();

    public SelectionSession(String id) {
        this.id = id;
    }

    public void markUsed(String kbName, ContentFragment fragment) {
        usedSourcesByKb.computeIfAbsent(kbName, kb -> ConcurrentHashMap.newKeySet()).add(fragment.sourceId());
        usedFragmentsByKb.computeIfAbsent(kbName, kb -> ConcurrentHashMap.newKeySet()).add(fragment.id());
    }

    public boolean isSourceUsed(String kbName, String sourceId) {
        return usedSourcesByKb.getOrDefault(kbName, Set.of()).contains(sourceId);
    }

    public boolean isFragmentUsed(String kbName, String fragmentId) {
        return usedFragmentsByKb.getOrDefault(kbName, Set.of()).contains(fragmentId);
    }

    /**
     * Forgets used sources of a knowledge base so a new coverage cycle can start.
     */
    public void resetSources(String kbName) {
        usedSourcesByKb.remove(kbName);
    }

    public void resetFragments(String kbName) {
        usedFragmentsByKb.remove(kbName);
    }

    public int usedSourceCount(String kbName) {
        return usedSourcesByKb.getOrDefault(kbName, Set.of()).size();
    }
}
