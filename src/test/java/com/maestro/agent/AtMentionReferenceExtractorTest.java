package com.maestro.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AtMentionReferenceExtractorTest {

    private static AgentCatalog catalog(AgentProperties.Agent... agents) {
        var properties = new AgentProperties();
        properties.setKnown(List.of(agents));
        return new AgentCatalog(properties);
    }

    private final AtMentionReferenceExtractor openExtractor = new AtMentionReferenceExtractor(catalog());

    @Test
    @DisplayName("extracts @agent: message lines for participants")
    void extractsMentions() {
        String output = """
                Summary of findings.
                @reviewer: please double-check the pricing table
                  @analyst: can you confirm Q3 numbers?
                Thanks.""";

        var refs = openExtractor.extract(output, "writer", List.of("writer", "reviewer", "analyst"));

        assertEquals(List.of(
                new DirectedReference("reviewer", "please double-check the pricing table"),
                new DirectedReference("analyst", "can you confirm Q3 numbers?")), refs);
    }

    @Test
    @DisplayName("ignores self mentions, unknown agents and empty messages")
    void ignoresNoise() {
        String output = "@writer: note to self\n@ghost: hello\n@reviewer:\nemail me @ home: later";

        assertTrue(openExtractor.extract(output, "writer", List.of("writer", "reviewer")).isEmpty());
    }

    @Test
    @DisplayName("keeps only the first message per target agent")
    void firstMessagePerTarget() {
        var refs = openExtractor.extract("@reviewer: one\n@reviewer: two", "writer", List.of("reviewer"));
        assertEquals(List.of(new DirectedReference("reviewer", "one")), refs);
    }

    @Test
    @DisplayName("matches display names case-insensitively and ignoring spaces")
    void matchesDisplayNames() {
        var extractor = new AtMentionReferenceExtractor(catalog(
                new AgentProperties.Agent("qa-bot", "Quality Reviewer")));

        var refs = extractor.extract("@quality reviewer: look at this", "writer", List.of());

        assertEquals(List.of(new DirectedReference("qa-bot", "look at this")), refs);
    }

    @Test
    @DisplayName("partial names resolve by containment")
    void partialNames() {
        assertEquals(Set.of("developer"),
                openExtractor.targets("@Dev: build it", "writer", List.of("developer", "writer")));
    }

    @Test
    @DisplayName("blank output yields nothing")
    void blankOutput() {
        assertTrue(openExtractor.extract("  ", "writer", List.of("reviewer")).isEmpty());
        assertTrue(openExtractor.extract(null, "writer", List.of("reviewer")).isEmpty());
    }
}
