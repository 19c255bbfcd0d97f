package no.cantara.siren.parser;

import no.cantara.siren.cst.CommentToken;
import no.cantara.siren.cst.DocumentNode;

import java.util.List;

/**
 * Output of a parse: the (possibly partial) tree, syntax errors, and every comment
 * in source order.
 */
public record ParseResult(
        DocumentNode tree,
        List<ParseError> errors,
        List<CommentToken> comments,
        String source
) {
    public ParseResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        comments = comments != null ? List.copyOf(comments) : List.of();
    }

    public boolean success() {
        return tree != null && errors.isEmpty();
    }
}
