package no.cantara.siren.project;

import no.cantara.siren.SirenDecoder;
import no.cantara.siren.ir.IRContext;
import no.cantara.siren.model.Diagnostic;
import no.cantara.siren.parser.ParseError;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A loaded Siren project.
 *
 * @param files       every {@code .siren} file found, sorted
 * @param warnings    ready-to-print messages about skipped files and config problems
 * @param parseErrors syntax errors of the skipped files
 */
public record SirenProject(
        Path rootDir,
        Path sirenDir,
        SirenConfig config,
        List<Path> files,
        IRContext ir,
        List<String> warnings,
        List<ParseError> parseErrors
) {
    public SirenProject {
        files = List.copyOf(files);
        warnings = List.copyOf(warnings);
        parseErrors = List.copyOf(parseErrors);
    }

    public List<String> milestones() {
        return ir.getMilestoneIds();
    }

    /** Syntax errors as E001 diagnostics followed by the semantic diagnostics. */
    public List<Diagnostic> diagnostics() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ParseError error : parseErrors) {
            diagnostics.add(SirenDecoder.syntaxError(error));
        }
        diagnostics.addAll(ir.diagnostics());
        return diagnostics;
    }

    /** {@code file} relative to the project root, with forward slashes. */
    public String relativize(Path file) {
        return ProjectLoader.relativeName(rootDir, file);
    }
}
