package no.cantara.siren.model;

import java.util.List;
import java.util.Objects;

/**
 * One node of a dependency tree rooted at some resource.
 *
 * @param cycle   the node closes a cycle back to one of its ancestors; it has no children
 * @param missing the referenced id is not declared anywhere; {@code resource} is a placeholder task
 */
public record DependencyTree(
        Resource resource,
        List<DependencyTree> dependencies,
        boolean cycle,
        boolean missing
) {
    public DependencyTree {
        Objects.requireNonNull(resource, "resource");
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public String id() {
        return resource.id();
    }
}
