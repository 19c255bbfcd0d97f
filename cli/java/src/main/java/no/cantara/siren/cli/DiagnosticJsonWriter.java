package no.cantara.siren.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.siren.model.Diagnostic;
import no.cantara.siren.model.Diagnostic.CircularDependency;
import no.cantara.siren.model.Diagnostic.DanglingDependency;
import no.cantara.siren.model.Diagnostic.DuplicateId;

import java.util.List;

/**
 * JSON array rendering of diagnostics for {@code siren check --json}.
 */
public final class DiagnosticJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DiagnosticJsonWriter() {
    }

    public static String write(List<Diagnostic> diagnostics) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            array.add(toJson(diagnostic));
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise diagnostics", e);
        }
    }

    static ObjectNode toJson(Diagnostic diagnostic) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", diagnostic.code().name());
        node.put("severity", diagnostic.severity().label());
        node.put("file", diagnostic.file());
        node.put("line", diagnostic.line());
        node.put("column", diagnostic.column());
        node.put("message", DiagnosticFormatter.message(diagnostic));
        if (diagnostic instanceof CircularDependency cycle) {
            ArrayNode nodes = node.putArray("nodes");
            cycle.nodes().forEach(nodes::add);
        } else if (diagnostic instanceof DanglingDependency dangling) {
            node.put("resourceId", dangling.resourceId());
            node.put("resourceType", dangling.resourceType().keyword());
            node.put("dependencyId", dangling.dependencyId());
        } else if (diagnostic instanceof DuplicateId duplicate) {
            node.put("resourceId", duplicate.resourceId());
            node.put("resourceType", duplicate.resourceType().keyword());
            node.put("firstFile", duplicate.firstFile());
            node.put("firstLine", duplicate.firstLine());
            node.put("firstColumn", duplicate.firstColumn());
        }
        return node;
    }
}
