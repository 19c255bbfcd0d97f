package no.cantara.siren.export;

import no.cantara.siren.cst.CommentToken;
import no.cantara.siren.cst.Origin;
import no.cantara.siren.ir.IRContext;
import no.cantara.siren.model.Attribute;
import no.cantara.siren.model.Resource;
import no.cantara.siren.parser.SourceIndex;
import no.cantara.siren.parser.SourceIndex.CommentBlock;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Formats resources like {@link SirenExporter} while keeping the comments of the
 * source they were parsed from, and literal values exactly as written.
 */
public final class CommentPreservingExporter {

    private CommentPreservingExporter() {
    }

    /**
     * @param index comments of the document {@code ir} was decoded from; without one
     *              the output is the canonical export
     */
    public static String exportWithComments(IRContext ir, SourceIndex index) {
        if (index == null) {
            return SirenExporter.exportCanonical(ir);
        }
        return new Session(index).export(ir.allResources());
    }

    private record Chunk(String text, int blankLinesBefore) {
    }

    private static final class Session {
        private final SourceIndex index;
        private final Set<Integer> emitted = new HashSet<>();
        private final List<Chunk> chunks = new ArrayList<>();

        Session(SourceIndex index) {
            this.index = index;
        }

        String export(List<Resource> resources) {
            List<Resource> ordered = new ArrayList<>(resources);
            ordered.sort(Comparator.comparingInt(r -> r.origin() != null ? r.origin().startOffset() : Integer.MAX_VALUE));
            List<CommentBlock> detached = new ArrayList<>(index.detachedBlocks());
            detached.sort(Comparator.comparingInt(CommentBlock::startOffset));
            int nextDetached = 0;

            for (Resource resource : ordered) {
                Origin origin = resource.origin();
                while (origin != null && nextDetached < detached.size()
                        && detached.get(nextDetached).startOffset() < origin.startOffset()) {
                    addBlock(detached.get(nextDetached++));
                }
                chunks.add(new Chunk(resource(resource), 1));
            }
            while (nextDetached < detached.size()) {
                addBlock(detached.get(nextDetached++));
            }
            for (CommentBlock block : index.eofBlocks()) {
                addBlock(block);
            }

            StringBuilder out = new StringBuilder();
            for (int i = 0; i < chunks.size(); i++) {
                Chunk chunk = chunks.get(i);
                if (i > 0) {
                    out.append("\n".repeat(chunk.blankLinesBefore() + 1));
                }
                out.append(chunk.text());
            }
            return out.length() == 0 ? "" : out.append('\n').toString();
        }

        private void addBlock(CommentBlock block) {
            List<String> lines = new ArrayList<>();
            for (CommentToken comment : block.comments()) {
                if (emitted.add(comment.startOffset())) {
                    lines.add(comment.text());
                }
            }
            if (!lines.isEmpty()) {
                chunks.add(new Chunk(String.join("\n", lines), Math.max(1, block.blankLinesBefore())));
            }
        }

        private String resource(Resource resource) {
            Origin origin = resource.origin();
            List<String> lines = new ArrayList<>();
            for (CommentToken comment : index.leadingComments(origin)) {
                if (emitted.add(comment.startOffset())) {
                    lines.add(comment.text());
                }
            }

            String headerComment = null;
            Map<Attribute, List<String>> attached = new LinkedHashMap<>();
            Map<Attribute, List<String>> before = new LinkedHashMap<>();
            List<String> beforeClose = new ArrayList<>();
            for (CommentToken comment : index.bodyComments(origin)) {
                if (!emitted.add(comment.startOffset())) {
                    continue;
                }
                Attribute sameRow = null;
                Attribute following = null;
                for (Attribute attribute : resource.attributes()) {
                    Origin span = attribute.origin();
                    if (span == null) {
                        continue;
                    }
                    if (span.endRow() == comment.startRow()) {
                        sameRow = attribute;
                    } else if (following == null && span.endRow() > comment.startRow()) {
                        following = attribute;
                    }
                }
                if (sameRow != null) {
                    attached.computeIfAbsent(sameRow, k -> new ArrayList<>()).add(comment.text());
                } else if (comment.startRow() == origin.startRow()) {
                    headerComment = headerComment == null ? comment.text() : headerComment + " " + comment.text();
                } else if (following != null) {
                    before.computeIfAbsent(following, k -> new ArrayList<>()).add(comment.text());
                } else {
                    beforeClose.add(comment.text());
                }
            }

            String header = SirenFormatting.header(resource);
            String close;
            if (resource.attributes().isEmpty() && headerComment == null && beforeClose.isEmpty()) {
                close = header + " {}";
            } else {
                lines.add(header + " {" + (headerComment != null ? " " + headerComment : ""));
                for (Attribute attribute : resource.attributes()) {
                    for (String text : before.getOrDefault(attribute, List.of())) {
                        lines.add(SirenFormatting.INDENT + text);
                    }
                    String line = SirenFormatting.attributeLine(attribute, true);
                    for (String text : attached.getOrDefault(attribute, List.of())) {
                        line += " " + text;
                    }
                    lines.add(line);
                }
                for (String text : beforeClose) {
                    lines.add(SirenFormatting.INDENT + text);
                }
                close = "}";
            }

            List<String> after = new ArrayList<>();
            for (CommentToken comment : index.trailingComments(origin)) {
                if (!emitted.add(comment.startOffset())) {
                    continue;
                }
                if (comment.startRow() == origin.endRow()) {
                    close += " " + comment.text();
                } else {
                    after.add(comment.text());
                }
            }
            lines.add(close);
            lines.addAll(after);
            return String.join("\n", lines);
        }
    }
}
