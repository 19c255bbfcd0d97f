package no.cantara.siren.cli;

import no.cantara.siren.model.Diagnostic;
import no.cantara.siren.model.Severity;
import no.cantara.siren.project.SirenProject;

import java.io.PrintStream;
import java.util.List;

/**
 * {@code siren check [--json]}: prints every diagnostic of the project. Exits
 * non-zero when any of them is an error.
 */
final class CheckCommand {

    private CheckCommand() {
    }

    static int run(SirenProject project, boolean json, PrintStream out) {
        List<Diagnostic> diagnostics = project.diagnostics();
        if (json) {
            out.println(DiagnosticJsonWriter.write(diagnostics));
        } else {
            diagnostics.forEach(d -> out.println(DiagnosticFormatter.format(d)));
        }
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR) ? 1 : 0;
    }
}
