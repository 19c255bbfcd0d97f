package no.cantara.siren.model;

import java.util.List;

/**
 * Decoded resources of one or more source documents, with the dependency cycles
 * found among them.
 *
 * @param source document name, or {@code null} when several documents were merged
 */
public record Document(
        List<Resource> resources,
        List<Cycle> cycles,
        String source
) {
    public Document {
        resources = resources != null ? List.copyOf(resources) : List.of();
        cycles = cycles != null ? List.copyOf(cycles) : List.of();
    }
}
