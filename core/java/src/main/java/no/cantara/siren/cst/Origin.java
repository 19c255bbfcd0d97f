package no.cantara.siren.cst;

/**
 * Source span of a node. Offsets are character offsets into the source string
 * (end exclusive); rows and columns are 0-based.
 *
 * @param document name of the source document, or {@code null}
 */
public record Origin(
        int startOffset,
        int endOffset,
        int startRow,
        int endRow,
        int startColumn,
        String document
) {
    public static Origin of(int startOffset, int endOffset, int startRow, int endRow) {
        return new Origin(startOffset, endOffset, startRow, endRow, 0, null);
    }

    public Origin withDocument(String document) {
        return new Origin(startOffset, endOffset, startRow, endRow, startColumn, document);
    }

    public boolean contains(int startOffset, int endOffset) {
        return startOffset >= this.startOffset && endOffset <= this.endOffset;
    }
}
