package no.cantara.siren.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The kinds of resource a Siren document can declare.
 */
public enum ResourceType {
    TASK("task"),
    MILESTONE("milestone");

    private final String keyword;

    ResourceType(String keyword) {
        this.keyword = keyword;
    }

    /** The keyword that opens a resource block of this type in source text. */
    public String keyword() {
        return keyword;
    }

    public static Optional<ResourceType> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(t -> t.keyword.equals(keyword)).findFirst();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
