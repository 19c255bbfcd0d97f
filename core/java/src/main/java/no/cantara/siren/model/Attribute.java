package no.cantara.siren.model;

import no.cantara.siren.cst.Origin;

import java.util.Objects;

/**
 * A {@code key = value} pair in a resource body.
 *
 * @param key    attribute name
 * @param value  decoded value
 * @param raw    literal text as written in the source, or {@code null}
 * @param origin source span of the whole assignment, or {@code null}
 */
public record Attribute(
        String key,
        AttributeValue value,
        String raw,
        Origin origin
) {
    public Attribute {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static Attribute of(String key, AttributeValue value) {
        return new Attribute(key, value, null, null);
    }

    public Attribute withoutSourceInfo() {
        return raw == null && origin == null ? this : new Attribute(key, value, null, null);
    }
}
