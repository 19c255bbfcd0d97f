package no.cantara.siren.cst;

/**
 * A {@code #} or {@code //} comment running to the end of its line. {@code text}
 * excludes the line break.
 */
public record CommentToken(
        String text,
        int startOffset,
        int endOffset,
        int startRow,
        int endRow
) {
}
