package no.cantara.siren.parser;

import no.cantara.siren.cst.CommentToken;
import no.cantara.siren.cst.Origin;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceIndexTest {

    private static final String SOURCE = """
            # Project plan

            # about a
            task a {
              title = "A" # inline
              # body note
              depends_on = b
            }
            // trailing a

            task b complete {} # done

            # loose

            task c {}

            # end
            """;

    private final ParseResult parsed = new SirenParser().parse(SOURCE);
    private final SourceIndex index = SourceIndex.of(parsed);

    private Origin origin(int i) {
        return parsed.tree().resources().get(i).origin();
    }

    private static List<String> texts(List<CommentToken> comments) {
        return comments.stream().map(CommentToken::text).toList();
    }

    @Test
    void classifiesLeadingComments() {
        assertEquals(List.of("# about a"), texts(index.leadingComments(origin(0))));
        assertTrue(index.leadingComments(origin(1)).isEmpty());
    }

    @Test
    void classifiesBodyComments() {
        assertEquals(List.of("# inline", "# body note"), texts(index.bodyComments(origin(0))));
    }

    @Test
    void classifiesTrailingComments() {
        assertEquals(List.of("// trailing a"), texts(index.trailingComments(origin(0))));
        assertEquals(List.of("# done"), texts(index.trailingComments(origin(1))));
    }

    @Test
    void classifiesDetachedBlocksWithBlankLines() {
        List<SourceIndex.CommentBlock> detached = index.detachedBlocks();
        assertEquals(2, detached.size());
        assertEquals(List.of("# Project plan"), texts(detached.get(0).comments()));
        assertEquals(0, detached.get(0).blankLinesBefore());
        assertEquals(List.of("# loose"), texts(detached.get(1).comments()));
        assertEquals(1, detached.get(1).blankLinesBefore());
    }

    @Test
    void blankLinesAreCountedFromThePreviousBlock() {
        SourceIndex stacked = SourceIndex.of(new SirenParser().parse("task a {}\n\n\n# c1\n\n# c2\n\ntask b {}\n"));

        List<SourceIndex.CommentBlock> detached = stacked.detachedBlocks();
        assertEquals(2, detached.size());
        assertEquals(2, detached.get(0).blankLinesBefore());
        assertEquals(1, detached.get(1).blankLinesBefore());
    }

    @Test
    void classifiesEndOfFileComments() {
        assertEquals(List.of("# end"), texts(index.eofComments()));
        assertEquals(1, index.eofBlocks().get(0).blankLinesBefore());
    }

    @Test
    void everyCommentIsIndexed() {
        assertEquals(8, index.allComments().size());
    }

    @Test
    void commentOnlySourceIsEndOfFile() {
        SourceIndex only = SourceIndex.of(new SirenParser().parse("# one\n# two\n"));

        assertEquals(List.of("# one", "# two"), texts(only.eofComments()));
        assertTrue(only.detachedBlocks().isEmpty());
    }

    @Test
    void unknownOriginHasNoComments() {
        assertTrue(index.leadingComments(null).isEmpty());
        assertTrue(index.bodyComments(Origin.of(999, 1000, 50, 50)).isEmpty());
    }
}
