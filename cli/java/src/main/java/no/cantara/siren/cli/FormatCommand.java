package no.cantara.siren.cli;

import no.cantara.siren.DecodeResult;
import no.cantara.siren.SirenDecoder;
import no.cantara.siren.export.CommentPreservingExporter;
import no.cantara.siren.ir.IRContext;
import no.cantara.siren.model.Resource;
import no.cantara.siren.parser.ParseError;
import no.cantara.siren.parser.ParseResult;
import no.cantara.siren.parser.SirenParserAdapter;
import no.cantara.siren.parser.SourceIndex;
import no.cantara.siren.project.SirenProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code siren format [--dry-run] [--verbose]}: rewrites every file in canonical
 * layout, keeping its comments. A file is only written when re-parsing the new
 * text yields the same resources.
 */
final class FormatCommand {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    private FormatCommand() {
    }

    static int run(SirenProject project, SirenParserAdapter parser, boolean dryRun, boolean verbose,
                   PrintStream out, PrintStream err) throws IOException {
        SirenDecoder decoder = new SirenDecoder();
        List<String> updated = new ArrayList<>();
        for (Path file : project.files()) {
            String name = project.relativize(file);
            String source = Files.readString(file, StandardCharsets.UTF_8);
            ParseResult parsed = parser.parse(source, name);
            if (!parsed.success()) {
                err.println("Skipping " + name + " (parse error)");
                if (verbose) {
                    for (ParseError error : parsed.errors()) {
                        err.println(ParseErrorFormatter.format(error, source));
                    }
                }
                continue;
            }
            DecodeResult decoded = decoder.decode(parsed.tree());
            String formatted = CommentPreservingExporter.exportWithComments(
                    IRContext.fromDocument(decoded), SourceIndex.of(parsed));

            ParseResult reparsed = parser.parse(formatted, name);
            if (!reparsed.success()) {
                err.println("Format produced unparsable output for " + name + "; skipping");
                continue;
            }
            if (!sameResources(decoded.document().resources(), decoder.decode(reparsed.tree()).document().resources())) {
                err.println("Format round-trip changed semantics for " + name + "; skipping");
                continue;
            }
            if (formatted.equals(source)) {
                log.debug("{} is already formatted", name);
                continue;
            }
            if (dryRun) {
                out.print(formatted);
            } else {
                Files.writeString(file, formatted, StandardCharsets.UTF_8);
                log.debug("Wrote {}", name);
            }
            updated.add(name);
        }
        out.println("Updated " + updated.size() + " files out of " + project.files().size());
        if (verbose) {
            updated.forEach(name -> out.println("- " + name));
        }
        return 0;
    }

    static boolean sameResources(List<Resource> before, List<Resource> after) {
        return before.stream().map(Resource::withoutSourceInfo).toList()
                .equals(after.stream().map(Resource::withoutSourceInfo).toList());
    }
}
