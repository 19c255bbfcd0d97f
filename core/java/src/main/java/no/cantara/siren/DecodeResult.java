package no.cantara.siren;

import no.cantara.siren.model.Diagnostic;
import no.cantara.siren.model.Document;

import java.util.List;

/**
 * @param document decoded document, {@code null} only when there was no tree to decode
 */
public record DecodeResult(Document document, List<Diagnostic> diagnostics) {
    public DecodeResult {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }
}
