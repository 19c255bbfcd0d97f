package no.cantara.siren.cli;

import no.cantara.siren.model.Diagnostic;
import no.cantara.siren.model.Diagnostic.CircularDependency;
import no.cantara.siren.model.Diagnostic.DanglingDependency;
import no.cantara.siren.model.Diagnostic.DuplicateId;
import no.cantara.siren.model.Diagnostic.ParseDiagnostic;

/**
 * Renders diagnostics as {@code file:line:col: code: message}.
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {
    }

    public static String format(Diagnostic diagnostic) {
        return prefix(diagnostic) + ": " + diagnostic.code() + ": " + message(diagnostic);
    }

    static String prefix(Diagnostic diagnostic) {
        String file = diagnostic.file() != null ? diagnostic.file() : "unknown";
        return file + ":" + orZero(diagnostic.line()) + ":" + orZero(diagnostic.column());
    }

    public static String message(Diagnostic diagnostic) {
        if (diagnostic instanceof CircularDependency cycle) {
            return "Circular dependency detected: " + String.join(" -> ", cycle.nodes());
        }
        if (diagnostic instanceof DanglingDependency dangling) {
            return "Dangling dependency: " + dangling.resourceType() + " '" + dangling.resourceId()
                    + "' depends on '" + dangling.dependencyId() + "'";
        }
        if (diagnostic instanceof DuplicateId duplicate) {
            String first = orZero(duplicate.firstLine()) + ":" + orZero(duplicate.firstColumn());
            if (duplicate.firstFile() != null) {
                first = duplicate.firstFile() + ":" + first;
            }
            return "Duplicate resource ID detected: " + duplicate.resourceType() + " '"
                    + duplicate.resourceId() + "' first defined at " + first;
        }
        return ((ParseDiagnostic) diagnostic).message();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
