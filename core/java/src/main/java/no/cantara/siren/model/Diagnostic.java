package no.cantara.siren.model;

import java.util.List;
import java.util.Objects;

/**
 * A structured warning or error. Frontends decide how to render the message;
 * only {@link ParseDiagnostic} carries a ready-made one.
 *
 * <p>{@code line} is 1-based and {@code column} 0-based. Either may be {@code null}
 * when the resource has no source origin, and {@code file} is {@code null} when the
 * document was not named.
 */
public sealed interface Diagnostic {

    DiagnosticCode code();

    String file();

    Integer line();

    Integer column();

    default Severity severity() {
        return code().severity();
    }

    /** W004. */
    record CircularDependency(
            List<String> nodes,
            String file,
            Integer line,
            Integer column
    ) implements Diagnostic {
        public CircularDependency {
            nodes = List.copyOf(nodes);
        }

        @Override
        public DiagnosticCode code() {
            return DiagnosticCode.W004;
        }
    }

    /** W005. */
    record DanglingDependency(
            String resourceId,
            ResourceType resourceType,
            String dependencyId,
            String file,
            Integer line,
            Integer column
    ) implements Diagnostic {
        @Override
        public DiagnosticCode code() {
            return DiagnosticCode.W005;
        }
    }

    /**
     * W006. {@code file}, {@code line} and {@code column} locate the duplicate; the
     * {@code first*} fields locate the occurrence that takes precedence.
     */
    record DuplicateId(
            String resourceId,
            ResourceType resourceType,
            String file,
            Integer line,
            Integer column,
            String firstFile,
            Integer firstLine,
            Integer firstColumn
    ) implements Diagnostic {
        @Override
        public DiagnosticCode code() {
            return DiagnosticCode.W006;
        }
    }

    /** Grammar-level or completion notices: W001, W002, W003 and E001. */
    record ParseDiagnostic(
            DiagnosticCode code,
            String message,
            String file,
            Integer line,
            Integer column
    ) implements Diagnostic {
        public ParseDiagnostic {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
        }
    }
}
