package no.cantara.siren.export;

import no.cantara.siren.ir.IRContext;
import no.cantara.siren.model.Attribute;
import no.cantara.siren.model.Resource;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical Siren text for an {@link IRContext}: every decoded resource in decode
 * order, one blank line between resources, two-space indented attributes.
 */
public final class SirenExporter {

    private SirenExporter() {
    }

    public static String exportCanonical(IRContext ir) {
        List<String> blocks = new ArrayList<>();
        for (Resource resource : ir.allResources()) {
            blocks.add(block(resource));
        }
        return blocks.isEmpty() ? "" : String.join("\n\n", blocks) + "\n";
    }

    static String block(Resource resource) {
        if (resource.attributes().isEmpty()) {
            return SirenFormatting.header(resource) + " {}";
        }
        StringBuilder sb = new StringBuilder(SirenFormatting.header(resource)).append(" {\n");
        for (Attribute attribute : resource.attributes()) {
            sb.append(SirenFormatting.attributeLine(attribute, false)).append('\n');
        }
        return sb.append('}').toString();
    }
}
