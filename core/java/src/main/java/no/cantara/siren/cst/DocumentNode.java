package no.cantara.siren.cst;

import java.util.List;

/**
 * Root of a parsed document.
 *
 * @param document name of the parsed document, or {@code null}
 */
public record DocumentNode(
        List<ResourceNode> resources,
        String document,
        Origin origin
) {
    public DocumentNode {
        resources = resources != null ? List.copyOf(resources) : List.of();
    }
}
