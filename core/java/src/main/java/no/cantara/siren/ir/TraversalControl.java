package no.cantara.siren.ir;

/**
 * How a dependency-tree traversal treats one node.
 *
 * @param include the node appears in the tree
 * @param expand  the node's own dependencies are traversed; ignored when not included
 */
public record TraversalControl(boolean include, boolean expand) {

    public static final TraversalControl INCLUDE_AND_EXPAND = new TraversalControl(true, true);
    public static final TraversalControl LEAF = new TraversalControl(true, false);
    public static final TraversalControl EXCLUDE = new TraversalControl(false, false);

    /** {@code true} includes and expands, {@code false} excludes. */
    public static TraversalControl of(boolean included) {
        return included ? INCLUDE_AND_EXPAND : EXCLUDE;
    }
}
