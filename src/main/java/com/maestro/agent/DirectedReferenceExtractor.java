package com.maestro.agent;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Strategy for detecting directed references to other agents in free-text agent output.
 */
public interface DirectedReferenceExtractor {

    /**
     * @param text          agent output to scan
     * @param sourceAgentId agent that produced the text; references to itself are ignored
     * @param candidates    agent ids that may be addressed, in addition to any catalogued agents
     * @return references in order of appearance, at most one per target agent
     */
    List<DirectedReference> extract(String text, String sourceAgentId, Collection<String> candidates);

    default Set<String> targets(String text, String sourceAgentId, Collection<String> candidates) {
        var ids = new LinkedHashSet<String>();
        for (var ref : extract(text, sourceAgentId, candidates)) {
            ids.add(ref.toAgent());
        }
        return ids;
    }
}
