package no.cantara.siren.ir;

import no.cantara.siren.model.Attribute;
import no.cantara.siren.model.AttributeValue;
import no.cantara.siren.model.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyChainsTest {

    private static Attribute dependsOn(String... ids) {
        return Attribute.of(Resource.DEPENDS_ON, AttributeValue.references(ids));
    }

    @Test
    void followsIncompleteWorkToLeaves() {
        List<Resource> resources = List.of(
                Resource.milestone("m", dependsOn("t1", "t3")),
                Resource.task("t1", dependsOn("t2")),
                Resource.task("t2"),
                Resource.task("t3").withComplete(true));

        assertEquals(List.of(List.of("m", "t1", "t2")), DependencyChains.incompleteLeafChains("m", resources));
    }

    @Test
    void walksThroughCompleteTasks() {
        List<Resource> resources = List.of(
                Resource.milestone("m", dependsOn("done")),
                Resource.task("done", dependsOn("open")).withComplete(true),
                Resource.task("open"));

        assertEquals(List.of(List.of("m", "done", "open")), DependencyChains.incompleteLeafChains("m", resources));
    }

    @Test
    void stopsAtNestedMilestonesAndMissingIds() {
        List<Resource> resources = List.of(
                Resource.milestone("m", dependsOn("m2", "ghost")),
                Resource.milestone("m2", dependsOn("t")),
                Resource.task("t"));

        assertEquals(List.of(List.of("m", "m2"), List.of("m", "ghost")),
                DependencyChains.incompleteLeafChains("m", resources));
    }

    @Test
    void milestoneLoopYieldsSentinel() {
        List<Resource> resources = List.of(
                Resource.milestone("m", dependsOn("a")),
                Resource.task("a", dependsOn("b")),
                Resource.task("b", dependsOn("a")));

        assertEquals(List.of(List.of("m", "a", DependencyChains.LOOP_SENTINEL)),
                DependencyChains.incompleteLeafChains("m", resources));
    }

    @Test
    void taskLoopYieldsNothing() {
        List<Resource> resources = List.of(
                Resource.task("a", dependsOn("b")),
                Resource.task("b", dependsOn("a")));

        assertTrue(DependencyChains.incompleteLeafChains("a", resources).isEmpty());
    }

    @Test
    void depthLimitCutsLongChains() {
        List<Resource> resources = List.of(
                Resource.milestone("m", dependsOn("a")),
                Resource.task("a", dependsOn("b")),
                Resource.task("b"));

        assertTrue(DependencyChains.incompleteLeafChains("m", resources, 1).isEmpty());
        assertEquals(1, DependencyChains.incompleteLeafChains("m", resources, 2).size());
    }
}
