package no.cantara.siren.cli;

import no.cantara.siren.model.Diagnostic.CircularDependency;
import no.cantara.siren.model.Diagnostic.DanglingDependency;
import no.cantara.siren.model.Diagnostic.DuplicateId;
import no.cantara.siren.model.Diagnostic.ParseDiagnostic;
import no.cantara.siren.model.DiagnosticCode;
import no.cantara.siren.model.ResourceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticFormatterTest {

    @Test
    void circularDependency() {
        assertEquals("main.siren:3:0: W004: Circular dependency detected: a -> b -> a",
                DiagnosticFormatter.format(new CircularDependency(List.of("a", "b", "a"), "main.siren", 3, 0)));
    }

    @Test
    void danglingDependency() {
        assertEquals("main.siren:1:2: W005: Dangling dependency: task 'a' depends on 'ghost'",
                DiagnosticFormatter.format(new DanglingDependency("a", ResourceType.TASK, "ghost", "main.siren", 1, 2)));
    }

    @Test
    void duplicateIdPointsAtSecondOccurrence() {
        DuplicateId duplicate = new DuplicateId("a", ResourceType.MILESTONE, "b.siren", 4, 0, "a.siren", 1, 0);

        assertEquals("b.siren:4:0: W006: Duplicate resource ID detected: milestone 'a' first defined at a.siren:1:0",
                DiagnosticFormatter.format(duplicate));
    }

    @Test
    void duplicateIdWithoutFirstFile() {
        DuplicateId duplicate = new DuplicateId("a", ResourceType.TASK, null, 4, 0, null, 1, 0);

        assertEquals("unknown:4:0: W006: Duplicate resource ID detected: task 'a' first defined at 1:0",
                DiagnosticFormatter.format(duplicate));
    }

    @Test
    void parseDiagnosticPassesMessageThrough() {
        ParseDiagnostic diagnostic = new ParseDiagnostic(DiagnosticCode.E001, "Expected '{' but found '}'", null, null, null);

        assertEquals("unknown:0:0: E001: Expected '{' but found '}'", DiagnosticFormatter.format(diagnostic));
    }

    @Test
    void jsonCarriesTypeSpecificFields() {
        var json = DiagnosticJsonWriter.toJson(new DanglingDependency("a", ResourceType.TASK, "ghost", "main.siren", 1, 2));

        assertEquals("W005", json.get("code").asText());
        assertEquals("warning", json.get("severity").asText());
        assertEquals("task", json.get("resourceType").asText());
        assertEquals("ghost", json.get("dependencyId").asText());
        assertEquals(1, json.get("line").asInt());
    }
}
