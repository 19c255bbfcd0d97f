package no.cantara.siren.cst;

import java.util.List;
import java.util.Objects;

/**
 * A {@code task} or {@code milestone} block.
 *
 * @param resourceType         the type keyword as written
 * @param completeKeywordCount how many {@code complete} modifiers follow the identifier
 */
public record ResourceNode(
        String resourceType,
        IdentifierNode identifier,
        List<AttributeNode> body,
        int completeKeywordCount,
        Origin origin
) {
    public ResourceNode {
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(identifier, "identifier");
        body = body != null ? List.copyOf(body) : List.of();
    }

    public boolean complete() {
        return completeKeywordCount > 0;
    }
}
