package no.cantara.siren.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws dependency chains as an ASCII tree below their common root. Chains with
 * more than four dependencies keep only the first and last, and several such
 * elided siblings collapse into one marker.
 */
public final class DependencyChainRenderer {

    static final int MAX_UNTRUNCATED = 4;
    static final String ELISION_PREFIX = "… (";
    static final String MULTIPLE_BRANCHES = "… (multiple dependency branches)";

    private DependencyChainRenderer() {
    }

    public static List<String> render(List<List<String>> chains) {
        return render(chains, List.of());
    }

    /**
     * @param topOrder ids to list first at the top level, in this order; the rest
     *                 follow sorted by id
     */
    public static List<String> render(List<List<String>> chains, List<String> topOrder) {
        Node root = new Node();
        for (List<String> chain : chains) {
            Node current = root;
            for (String id : truncate(chain.subList(1, chain.size()))) {
                current = current.children.computeIfAbsent(id, k -> new Node());
            }
        }
        compressElided(root);
        List<String> lines = new ArrayList<>();
        draw(root, "", topOrder, lines);
        return lines;
    }

    static List<String> truncate(List<String> dependencies) {
        if (dependencies.size() <= MAX_UNTRUNCATED) {
            return dependencies;
        }
        return List.of(
                dependencies.get(0),
                ELISION_PREFIX + (dependencies.size() - 2) + " intermediate dependencies)",
                dependencies.get(dependencies.size() - 1));
    }

    private static void compressElided(Node node) {
        List<String> elided = node.children.keySet().stream().filter(k -> k.startsWith(ELISION_PREFIX)).toList();
        if (elided.size() > 1) {
            elided.forEach(node.children::remove);
            node.children.put(MULTIPLE_BRANCHES, new Node());
        }
        node.children.values().forEach(DependencyChainRenderer::compressElided);
    }

    private static void draw(Node node, String prefix, List<String> topOrder, List<String> lines) {
        List<String> keys = new ArrayList<>();
        for (String id : topOrder) {
            if (node.children.containsKey(id) && !keys.contains(id)) {
                keys.add(id);
            }
        }
        node.children.keySet().stream().filter(k -> !keys.contains(k)).sorted().forEach(keys::add);
        for (int i = 0; i < keys.size(); i++) {
            boolean last = i == keys.size() - 1;
            String key = keys.get(i);
            lines.add(prefix + (last ? "└─ " : "├─ ") + key);
            Node child = node.children.get(key);
            if (!child.children.isEmpty()) {
                draw(child, prefix + (last ? "   " : "│  "), List.of(), lines);
            }
        }
    }

    private static final class Node {
        private final Map<String, Node> children = new LinkedHashMap<>();
    }
}
