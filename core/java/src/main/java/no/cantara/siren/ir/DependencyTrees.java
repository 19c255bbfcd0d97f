package no.cantara.siren.ir;

import no.cantara.siren.graph.DirectedGraph;
import no.cantara.siren.model.DependencyTree;
import no.cantara.siren.model.Resource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Builds {@link DependencyTree}s by walking {@code depends_on} edges.
 */
public final class DependencyTrees {

    private DependencyTrees() {
    }

    /**
     * Graph of {@code depends_on} edges, dependent to dependency.
     */
    public static DirectedGraph graphOf(List<Resource> resources) {
        DirectedGraph graph = new DirectedGraph();
        for (Resource resource : resources) {
            graph.addNode(resource.id());
            for (String dependency : resource.dependsOn()) {
                graph.addEdge(resource.id(), dependency);
            }
        }
        return graph;
    }

    /**
     * Tree of everything {@code rootId} depends on, shaped by {@code predicate}.
     * The root is always part of the tree. An id that no resource declares becomes a
     * placeholder task marked missing. An edge back to an ancestor becomes a childless
     * node marked as a cycle.
     *
     * @param resources resources with unique ids
     * @throws NoSuchElementException if no resource has id {@code rootId}
     */
    public static DependencyTree build(String rootId, List<Resource> resources, TraversePredicate predicate) {
        Map<String, Resource> byId = new LinkedHashMap<>();
        for (Resource resource : resources) {
            byId.putIfAbsent(resource.id(), resource);
        }
        Resource root = byId.get(rootId);
        if (root == null) {
            throw new NoSuchElementException("Resource with id " + rootId + " not found");
        }
        Node rootNode = new Node(root, false, false);
        if (!predicate.test(root, null).expand()) {
            return rootNode.freeze();
        }

        Map<List<String>, Node> nodesByPath = new HashMap<>();
        nodesByPath.put(List.of(rootId), rootNode);
        graphOf(new ArrayList<>(byId.values())).dfs(rootId,
                (nodeId, path, depth) -> {
                    if (depth == 0) {
                        return true;
                    }
                    Node parent = nodesByPath.get(path.subList(0, path.size() - 1));
                    if (parent == null) {
                        return false;
                    }
                    Resource resource = byId.get(nodeId);
                    boolean missing = resource == null;
                    if (missing) {
                        resource = Resource.task(nodeId);
                    }
                    TraversalControl control = predicate.test(resource, parent.resource);
                    if (!control.include()) {
                        return false;
                    }
                    Node child = new Node(resource, false, missing);
                    parent.children.add(child);
                    nodesByPath.put(path, child);
                    return control.expand();
                },
                (from, to, path) -> {
                    Node parent = nodesByPath.get(path);
                    if (parent == null) {
                        return;
                    }
                    Resource resource = byId.get(to);
                    parent.children.add(new Node(resource != null ? resource : Resource.task(to), true, false));
                });
        return rootNode.freeze();
    }

    private static final class Node {
        private final Resource resource;
        private final boolean cycle;
        private final boolean missing;
        private final List<Node> children = new ArrayList<>();

        Node(Resource resource, boolean cycle, boolean missing) {
            this.resource = resource;
            this.cycle = cycle;
            this.missing = missing;
        }

        DependencyTree freeze() {
            List<DependencyTree> dependencies = new ArrayList<>(children.size());
            for (Node child : children) {
                dependencies.add(child.freeze());
            }
            return new DependencyTree(resource, dependencies, cycle, missing);
        }
    }
}
