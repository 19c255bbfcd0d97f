package no.cantara.siren.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over string node ids. Nodes and successors keep insertion order.
 * Not thread-safe while being built.
 */
public class DirectedGraph {

    public static final int MAX_DEPTH = 1_000_000;

    /**
     * Decides whether the traversal descends into a node's successors. {@code path}
     * runs from the start node to {@code nodeId} inclusive; {@code depth} is its
     * edge distance from the start.
     */
    @FunctionalInterface
    public interface Visitor {
        boolean visit(String nodeId, List<String> path, int depth);
    }

    /**
     * Called when an edge leads back to a node on the current path. {@code path}
     * ends with {@code from}.
     */
    @FunctionalInterface
    public interface BackEdgeListener {
        void onBackEdge(String from, String to, List<String> path);
    }

    private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();
    private final int maxDepth;

    public DirectedGraph() {
        this(MAX_DEPTH);
    }

    DirectedGraph(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public void addNode(String id) {
        adjacency.computeIfAbsent(id, k -> new LinkedHashSet<>());
    }

    public void addEdge(String from, String to) {
        addNode(from);
        addNode(to);
        adjacency.get(from).add(to);
    }

    public List<String> successors(String id) {
        Set<String> successors = adjacency.get(id);
        return successors == null ? List.of() : List.copyOf(successors);
    }

    public List<String> nodes() {
        return List.copyOf(adjacency.keySet());
    }

    public boolean contains(String id) {
        return adjacency.containsKey(id);
    }

    /**
     * Depth-first traversal from {@code start}. There is no global visited set, so
     * a node reachable along several paths is visited once per path. Edges back
     * into the current path are reported to {@code onBackEdge} and not followed.
     *
     * @throws TraversalDepthExceededException if a path exceeds the depth ceiling
     */
    public void dfs(String start, Visitor visitor, BackEdgeListener onBackEdge) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new LinkedHashSet<>();
        if (enter(start, 0, visitor, path, onPath)) {
            stack.push(new Frame(start, successors(start).iterator()));
        } else {
            return;
        }
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.successors.hasNext()) {
                stack.pop();
                path.remove(path.size() - 1);
                onPath.remove(frame.nodeId);
                continue;
            }
            String next = frame.successors.next();
            if (onPath.contains(next)) {
                if (onBackEdge != null) {
                    onBackEdge.onBackEdge(frame.nodeId, next, Collections.unmodifiableList(new ArrayList<>(path)));
                }
                continue;
            }
            int depth = path.size();
            if (depth > maxDepth) {
                throw new TraversalDepthExceededException(next, depth);
            }
            if (enter(next, depth, visitor, path, onPath)) {
                stack.push(new Frame(next, successors(next).iterator()));
            }
        }
    }

    private static boolean enter(String nodeId, int depth, Visitor visitor, List<String> path, Set<String> onPath) {
        path.add(nodeId);
        boolean expand = visitor.visit(nodeId, Collections.unmodifiableList(new ArrayList<>(path)), depth);
        if (expand) {
            onPath.add(nodeId);
        } else {
            path.remove(path.size() - 1);
        }
        return expand;
    }

    /**
     * Every elementary cycle reachable by back edges, each starting and ending at
     * its lexicographically smallest node, in discovery order.
     * <p>
     * An edge into another strongly connected component cannot lead back to the
     * current path, so a node entered that way is expanded only once per graph.
     * This keeps acyclic regions linear without changing which cycles are found or
     * their order.
     */
    public List<List<String>> cycles() {
        Map<String, Integer> component = components();
        Set<String> explored = new HashSet<>();
        Set<List<String>> found = new LinkedHashSet<>();
        for (String node : adjacency.keySet()) {
            if (!explored.add(node)) {
                continue;
            }
            dfs(node,
                    (id, path, depth) -> {
                        if (depth == 0) {
                            return true;
                        }
                        String parent = path.get(path.size() - 2);
                        return component.get(parent).equals(component.get(id)) || explored.add(id);
                    },
                    (from, to, path) -> {
                        int index = path.indexOf(to);
                        found.add(normalize(path.subList(index, path.size())));
                    });
        }
        return new ArrayList<>(found);
    }

    /**
     * Strongly connected component index of every node (iterative Tarjan).
     */
    Map<String, Integer> components() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Map<String, Integer> component = new HashMap<>();
        Deque<String> members = new ArrayDeque<>();
        Set<String> onMembers = new HashSet<>();
        int counter = 0;
        int components = 0;

        for (String start : adjacency.keySet()) {
            if (index.containsKey(start)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            index.put(start, counter);
            lowLink.put(start, counter++);
            members.push(start);
            onMembers.add(start);
            stack.push(new Frame(start, adjacency.get(start).iterator()));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter++);
                        members.push(next);
                        onMembers.add(next);
                        stack.push(new Frame(next, adjacency.get(next).iterator()));
                    } else if (onMembers.contains(next)) {
                        lowLink.put(frame.nodeId, Math.min(lowLink.get(frame.nodeId), index.get(next)));
                    }
                    continue;
                }
                stack.pop();
                if (!stack.isEmpty()) {
                    String parent = stack.peek().nodeId;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.nodeId)));
                }
                if (lowLink.get(frame.nodeId).equals(index.get(frame.nodeId))) {
                    String member;
                    do {
                        member = members.pop();
                        onMembers.remove(member);
                        component.put(member, components);
                    } while (!member.equals(frame.nodeId));
                    components++;
                }
            }
        }
        return component;
    }

    static List<String> normalize(List<String> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(min)) < 0) {
                min = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle.size() + 1);
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((min + i) % cycle.size()));
        }
        rotated.add(rotated.get(0));
        return List.copyOf(rotated);
    }

    private static final class Frame {
        private final String nodeId;
        private final Iterator<String> successors;

        Frame(String nodeId, Iterator<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }
    }
}
