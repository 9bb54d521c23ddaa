package com.maestro.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects lines of the form {@code @AgentName: message}.
 * <p>
 * Names are matched case-insensitively with spaces ignored, first exactly against agent ids
 * and display names, then by containment in either direction ("@Dev" finds "developer").
 */
@Component
public class AtMentionReferenceExtractor implements DirectedReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(AtMentionReferenceExtractor.class);

    private final AgentCatalog catalog;

    public AtMentionReferenceExtractor(AgentCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public List<DirectedReference> extract(String text, String sourceAgentId, Collection<String> candidates) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Map<String, String> variants = catalog.nameVariants(candidates);
        var references = new ArrayList<DirectedReference>();
        var seenTargets = new HashSet<String>();

        for (String rawLine : text.split("\n")) {
            String line = rawLine.strip();
            if (!line.startsWith("@")) continue;
            int colon = line.indexOf(':');
            if (colon < 2) continue;

            String name = line.substring(1, colon).strip();
            String message = line.substring(colon + 1).strip();
            if (name.isEmpty() || message.isEmpty()) continue;

            Optional<String> target = resolve(name, variants);
            if (target.isEmpty()) {
                log.debug("Mention of unknown agent '{}' ignored", name);
                continue;
            }
            String toAgent = target.get();
            if (toAgent.equals(sourceAgentId) || !seenTargets.add(toAgent)) continue;
            references.add(new DirectedReference(toAgent, message));
        }
        return references;
    }

    private Optional<String> resolve(String name, Map<String, String> variants) {
        String wanted = AgentCatalog.normalize(name);
        String exact = variants.get(wanted);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (var entry : variants.entrySet()) {
            if (entry.getKey().contains(wanted) || wanted.contains(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
