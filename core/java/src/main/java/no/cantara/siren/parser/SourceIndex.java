package no.cantara.siren.parser;

import no.cantara.siren.cst.CommentToken;
import no.cantara.siren.cst.Origin;
import no.cantara.siren.cst.ResourceNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places every comment of a parsed document relative to the resources around it,
 * so a formatter can re-emit them next to the code they describe.
 * <p>
 * Resources are identified by the start offset of their origin.
 */
public final class SourceIndex {

    /**
     * Consecutive comment lines with {@code blankLinesBefore} blank lines above them.
     */
    public record CommentBlock(List<CommentToken> comments, int blankLinesBefore) {
        public CommentBlock {
            comments = List.copyOf(comments);
        }

        public int startOffset() {
            return comments.get(0).startOffset();
        }
    }

    private final List<CommentToken> allComments;
    private final Map<Integer, List<CommentToken>> leading = new LinkedHashMap<>();
    private final Map<Integer, List<CommentToken>> trailing = new LinkedHashMap<>();
    private final Map<Integer, List<CommentToken>> body = new LinkedHashMap<>();
    private final List<CommentBlock> detached = new ArrayList<>();
    private final List<CommentBlock> eof = new ArrayList<>();

    private SourceIndex(List<CommentToken> allComments) {
        this.allComments = List.copyOf(allComments);
    }

    public static SourceIndex of(ParseResult parseResult) {
        List<Origin> resources = new ArrayList<>();
        if (parseResult.tree() != null) {
            for (ResourceNode resource : parseResult.tree().resources()) {
                resources.add(resource.origin());
            }
        }
        resources.sort(Comparator.comparingInt(Origin::startOffset));
        List<CommentToken> comments = new ArrayList<>(parseResult.comments());
        comments.sort(Comparator.comparingInt(CommentToken::startOffset));
        String source = parseResult.source() != null ? parseResult.source() : "";
        SourceIndex index = new SourceIndex(comments);
        index.classify(resources, comments, source.split("\n", -1));
        return index;
    }

    private void classify(List<Origin> resources, List<CommentToken> comments, String[] lines) {
        List<CommentToken> run = new ArrayList<>();
        Origin runPrevious = null;
        Origin runNext = null;
        int runFromRow = 0;
        int lastCommentEndRow = -1;
        for (CommentToken comment : comments) {
            Origin enclosing = enclosing(resources, comment);
            Origin previous = enclosing == null ? previous(resources, comment) : null;
            if (enclosing != null) {
                add(body, enclosing, comment);
            } else if (previous != null && comment.startRow() == previous.endRow()) {
                add(trailing, previous, comment);
            } else {
                Origin next = next(resources, comment);
                boolean contiguous = !run.isEmpty()
                        && run.get(run.size() - 1).endRow() + 1 == comment.startRow()
                        && runNext == next;
                if (!contiguous && !run.isEmpty()) {
                    flush(run, runPrevious, runNext, runFromRow, lines);
                    run = new ArrayList<>();
                }
                if (run.isEmpty()) {
                    // blank lines are counted from whatever ends last above the run
                    runFromRow = Math.max(previous != null ? previous.endRow() + 1 : 0, lastCommentEndRow + 1);
                }
                run.add(comment);
                runPrevious = previous;
                runNext = next;
            }
            lastCommentEndRow = comment.endRow();
        }
        if (!run.isEmpty()) {
            flush(run, runPrevious, runNext, runFromRow, lines);
        }
    }

    private void flush(List<CommentToken> run, Origin previous, Origin next, int fromRow, String[] lines) {
        CommentToken first = run.get(0);
        CommentToken last = run.get(run.size() - 1);
        if (next != null && last.endRow() + 1 == next.startRow()) {
            leading.computeIfAbsent(next.startOffset(), k -> new ArrayList<>()).addAll(run);
        } else if (previous != null && first.startRow() == previous.endRow() + 1) {
            trailing.computeIfAbsent(previous.startOffset(), k -> new ArrayList<>()).addAll(run);
        } else {
            CommentBlock block = new CommentBlock(run, blankLines(lines, fromRow, first.startRow()));
            if (next == null) {
                eof.add(block);
            } else {
                detached.add(block);
            }
        }
    }

    private static int blankLines(String[] lines, int fromRow, int toRow) {
        int count = 0;
        for (int row = fromRow; row < toRow && row < lines.length; row++) {
            if (lines[row].isBlank()) {
                count++;
            }
        }
        return count;
    }

    private static Origin enclosing(List<Origin> resources, CommentToken comment) {
        for (Origin origin : resources) {
            if (origin.contains(comment.startOffset(), comment.endOffset())) {
                return origin;
            }
        }
        return null;
    }

    private static Origin previous(List<Origin> resources, CommentToken comment) {
        Origin previous = null;
        for (Origin origin : resources) {
            if (origin.endOffset() <= comment.startOffset()) {
                previous = origin;
            }
        }
        return previous;
    }

    private static Origin next(List<Origin> resources, CommentToken comment) {
        for (Origin origin : resources) {
            if (origin.startOffset() >= comment.endOffset()) {
                return origin;
            }
        }
        return null;
    }

    private static void add(Map<Integer, List<CommentToken>> map, Origin origin, CommentToken comment) {
        map.computeIfAbsent(origin.startOffset(), k -> new ArrayList<>()).add(comment);
    }

    public List<CommentToken> leadingComments(Origin origin) {
        return lookup(leading, origin);
    }

    public List<CommentToken> trailingComments(Origin origin) {
        return lookup(trailing, origin);
    }

    public List<CommentToken> bodyComments(Origin origin) {
        return lookup(body, origin);
    }

    public List<CommentBlock> detachedBlocks() {
        return List.copyOf(detached);
    }

    public List<CommentBlock> eofBlocks() {
        return List.copyOf(eof);
    }

    public List<CommentToken> eofComments() {
        List<CommentToken> comments = new ArrayList<>();
        eof.forEach(block -> comments.addAll(block.comments()));
        return comments;
    }

    public List<CommentToken> allComments() {
        return allComments;
    }

    private static List<CommentToken> lookup(Map<Integer, List<CommentToken>> map, Origin origin) {
        if (origin == null) {
            return List.of();
        }
        List<CommentToken> comments = map.get(origin.startOffset());
        return comments != null ? List.copyOf(comments) : List.of();
    }
}
