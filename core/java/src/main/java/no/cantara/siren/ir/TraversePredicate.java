package no.cantara.siren.ir;

import no.cantara.siren.model.Resource;

import java.util.function.Predicate;

/**
 * Decides, per node, what a dependency-tree traversal does with it.
 */
@FunctionalInterface
public interface TraversePredicate {

    /**
     * @param parent the resource whose dependency this is, {@code null} for the root
     */
    TraversalControl test(Resource resource, Resource parent);

    static TraversePredicate all() {
        return (resource, parent) -> TraversalControl.INCLUDE_AND_EXPAND;
    }

    static TraversePredicate when(Predicate<Resource> predicate) {
        return (resource, parent) -> TraversalControl.of(predicate.test(resource));
    }
}
