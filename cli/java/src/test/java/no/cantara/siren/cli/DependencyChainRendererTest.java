package no.cantara.siren.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyChainRendererTest {

    @Test
    void emptyChainsDrawNothing() {
        assertEquals(List.of(), DependencyChainRenderer.render(List.of()));
        assertEquals(List.of(), DependencyChainRenderer.render(List.of(List.of("root"))));
    }

    @Test
    void sharedPrefixesMergeIntoOneBranch() {
        List<String> lines = DependencyChainRenderer.render(List.of(
                List.of("m", "b", "x"),
                List.of("m", "b", "y"),
                List.of("m", "a")));

        assertEquals(List.of(
                "├─ a",
                "└─ b",
                "   ├─ x",
                "   └─ y"), lines);
    }

    @Test
    void topOrderComesFirstAtTopLevelOnly() {
        List<String> lines = DependencyChainRenderer.render(List.of(
                List.of("m", "a"),
                List.of("m", "z", "q"),
                List.of("m", "z", "p")), List.of("z", "missing"));

        assertEquals(List.of(
                "├─ z",
                "│  ├─ p",
                "│  └─ q",
                "└─ a"), lines);
    }

    // -----------------------------------------------------------------------
    // Truncation
    // -----------------------------------------------------------------------

    @Test
    void fourDependenciesAreKept() {
        List<String> lines = DependencyChainRenderer.render(List.of(List.of("m", "a", "b", "c", "d")));

        assertEquals(List.of(
                "└─ a",
                "   └─ b",
                "      └─ c",
                "         └─ d"), lines);
    }

    @Test
    void longChainsKeepFirstAndLast() {
        List<String> lines = DependencyChainRenderer.render(List.of(List.of("m", "a", "b", "c", "d", "e")));

        assertEquals(List.of(
                "└─ a",
                "   └─ … (3 intermediate dependencies)",
                "      └─ e"), lines);
    }

    @Test
    void siblingElisionsCollapse() {
        List<String> lines = DependencyChainRenderer.render(List.of(
                List.of("m", "a", "b", "c", "d", "e"),
                List.of("m", "a", "x", "y", "z", "w", "e")));

        assertEquals(List.of(
                "└─ a",
                "   └─ … (multiple dependency branches)"), lines);
    }
}
