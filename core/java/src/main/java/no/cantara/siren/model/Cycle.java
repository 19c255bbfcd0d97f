package no.cantara.siren.model;

import java.util.List;

/**
 * A closed chain of dependency edges. The first node is repeated at the end,
 * e.g. {@code [a, b, c, a]}.
 */
public record Cycle(List<String> nodes) {
    public Cycle {
        nodes = List.copyOf(nodes);
    }
}
