package no.cantara.siren.graph;

/**
 * Thrown when a traversal path grows past {@link DirectedGraph#MAX_DEPTH}.
 */
public class TraversalDepthExceededException extends IllegalStateException {

    private final String nodeId;
    private final int depth;

    public TraversalDepthExceededException(String nodeId, int depth) {
        super("Traversal depth " + depth + " exceeded at node '" + nodeId + "'");
        this.nodeId = nodeId;
        this.depth = depth;
    }

    public String nodeId() {
        return nodeId;
    }

    public int depth() {
        return depth;
    }
}
