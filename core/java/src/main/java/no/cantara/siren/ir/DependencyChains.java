package no.cantara.siren.ir;

import no.cantara.siren.graph.DirectedGraph;
import no.cantara.siren.model.Resource;
import no.cantara.siren.model.ResourceType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paths from a root resource down to the unfinished work it waits on.
 */
public final class DependencyChains {

    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final String LOOP_SENTINEL = "... (dependency loop - check warnings)";

    private DependencyChains() {
    }

    /**
     * Every chain of ids from {@code rootId} to an incomplete leaf. A leaf is a
     * milestone other than the root, a task without dependencies, or an id nothing
     * declares. Complete tasks are walked through, never reported as leaves.
     * {@code maxDepth} bounds the number of edges per chain.
     * <p>
     * When the root is a milestone, reaching a node already on the chain adds the
     * chain {@code [root, firstDependency, LOOP_SENTINEL]}.
     */
    public static List<List<String>> incompleteLeafChains(String rootId, List<Resource> resources, int maxDepth) {
        Map<String, Resource> byId = new LinkedHashMap<>();
        for (Resource resource : resources) {
            byId.putIfAbsent(resource.id(), resource);
        }
        DirectedGraph graph = DependencyTrees.graphOf(new ArrayList<>(byId.values()));
        Resource root = byId.get(rootId);
        boolean milestoneRoot = root != null && root.type() == ResourceType.MILESTONE;
        List<List<String>> chains = new ArrayList<>();

        graph.dfs(rootId,
                (nodeId, path, depth) -> {
                    Resource resource = byId.get(nodeId);
                    boolean missing = resource == null;
                    boolean milestone = !missing && resource.type() == ResourceType.MILESTONE;
                    boolean incomplete = missing || milestone || !resource.complete();
                    boolean leaf = missing
                            || (milestone && !nodeId.equals(rootId))
                            || (!milestone && graph.successors(nodeId).isEmpty());
                    if (leaf && incomplete) {
                        chains.add(List.copyOf(path));
                        return false;
                    }
                    return depth < maxDepth && !missing;
                },
                (from, to, path) -> {
                    if (milestoneRoot) {
                        List<String> sentinel = new ArrayList<>();
                        sentinel.add(rootId);
                        if (path.size() > 1) {
                            sentinel.add(path.get(1));
                        }
                        sentinel.add(LOOP_SENTINEL);
                        chains.add(List.copyOf(sentinel));
                    }
                });
        return chains;
    }

    public static List<List<String>> incompleteLeafChains(String rootId, List<Resource> resources) {
        return incompleteLeafChains(rootId, resources, DEFAULT_MAX_DEPTH);
    }
}
