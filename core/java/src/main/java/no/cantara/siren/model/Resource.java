package no.cantara.siren.model;

import no.cantara.siren.cst.Origin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A declared task or milestone.
 */
public record Resource(
        ResourceType type,
        String id,
        boolean complete,
        List<Attribute> attributes,
        Origin origin
) {
    public static final String DEPENDS_ON = "depends_on";

    public Resource {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }

    public static Resource task(String id, Attribute... attributes) {
        return new Resource(ResourceType.TASK, id, false, Arrays.asList(attributes), null);
    }

    public static Resource milestone(String id, Attribute... attributes) {
        return new Resource(ResourceType.MILESTONE, id, false, Arrays.asList(attributes), null);
    }

    public Resource withComplete(boolean complete) {
        return new Resource(type, id, complete, attributes, origin);
    }

    public Resource withOrigin(Origin origin) {
        return new Resource(type, id, complete, attributes, origin);
    }

    /** First attribute with the given key. */
    public Optional<Attribute> attribute(String key) {
        return attributes.stream().filter(a -> a.key().equals(key)).findFirst();
    }

    /**
     * Ids named by the {@code depends_on} attribute, in declaration order. Accepts a
     * single reference or an array; non-reference array elements are ignored.
     */
    public List<String> dependsOn() {
        Optional<Attribute> attr = attribute(DEPENDS_ON);
        if (attr.isEmpty()) return List.of();
        AttributeValue value = attr.get().value();
        if (value instanceof AttributeValue.Reference ref) {
            return List.of(ref.id());
        }
        if (value instanceof AttributeValue.ArrayValue array) {
            List<String> ids = new ArrayList<>();
            for (AttributeValue element : array.elements()) {
                if (element instanceof AttributeValue.Reference ref) {
                    ids.add(ref.id());
                }
            }
            return ids;
        }
        return List.of();
    }

    /** Copy without origin and raw literal text, for semantic comparison. */
    public Resource withoutSourceInfo() {
        return new Resource(type, id, complete,
                attributes.stream().map(Attribute::withoutSourceInfo).toList(), null);
    }
}
