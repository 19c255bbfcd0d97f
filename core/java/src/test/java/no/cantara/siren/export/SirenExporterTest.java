package no.cantara.siren.export;

import no.cantara.siren.ir.IRContext;
import no.cantara.siren.model.Attribute;
import no.cantara.siren.model.AttributeValue;
import no.cantara.siren.model.Resource;
import no.cantara.siren.parser.SirenParser;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SirenExporterTest {

    private final SirenParser parser = new SirenParser();

    private String roundTrip(String source) {
        return SirenExporter.exportCanonical(IRContext.fromParseResult(parser.parse(source)));
    }

    @Test
    void emptyBodyIsSingleLine() {
        IRContext ir = IRContext.fromResources(List.of(Resource.milestone("m1")));

        assertEquals("milestone m1 {}\n", SirenExporter.exportCanonical(ir));
    }

    @Test
    void completeEmptyBody() {
        IRContext ir = IRContext.fromResources(List.of(Resource.task("t").withComplete(true)));

        assertEquals("task t complete {}\n", SirenExporter.exportCanonical(ir));
    }

    @Test
    void emptyContextExportsNothing() {
        assertEquals("", SirenExporter.exportCanonical(IRContext.fromResources(List.of())));
    }

    @Test
    void rendersEveryValueKind() {
        IRContext ir = IRContext.fromResources(List.of(
                Resource.task("a",
                        Attribute.of("title", AttributeValue.string("Say \"hi\"\n\tnow \\o/")),
                        Attribute.of("estimate", new AttributeValue.NumberValue(new BigDecimal("10.00"))),
                        Attribute.of("ratio", new AttributeValue.NumberValue(new BigDecimal("0.250"))),
                        Attribute.of("urgent", AttributeValue.bool(true)),
                        Attribute.of("owner", AttributeValue.nullValue()),
                        Attribute.of("depends_on", AttributeValue.references("b", "c")),
                        Attribute.of("mixed", AttributeValue.array(AttributeValue.number(1),
                                AttributeValue.array(AttributeValue.string("x")))))));

        assertEquals("""
                task a {
                  title = "Say \\"hi\\"\\n\\tnow \\\\o/"
                  estimate = 10
                  ratio = 0.25
                  urgent = true
                  owner = null
                  depends_on = [b, c]
                  mixed = [1, ["x"]]
                }
                """, SirenExporter.exportCanonical(ir));
    }

    @Test
    void quotesIdsThatAreNotIdentifiers() {
        IRContext ir = IRContext.fromResources(List.of(Resource.task("has space"), Resource.task("9lives")));

        assertEquals("task \"has space\" {}\n\ntask \"9lives\" {}\n", SirenExporter.exportCanonical(ir));
    }

    @Test
    void normalisesLayout() {
        String exported = roundTrip("task   a complete{x=1.0 y=[b,c,]}   milestone \"m\" { depends_on = a }");

        assertEquals("""
                task a complete {
                  x = 1
                  y = [b, c]
                }

                milestone m {
                  depends_on = a
                }
                """, exported);
    }

    @Test
    void exportIsIdempotent() {
        String first = roundTrip("""
                milestone launch {
                  title = "Launch \\"v1\\""
                  depends_on = [build, "not-a-ref", docs]
                }
                task build complete { estimate = 3.50 }
                task docs {}
                task "odd id" { note = "tab\\there" }
                """);

        assertEquals(first, roundTrip(first));
    }

    @Test
    void exportKeepsSemantics() {
        String source = "task a {\n  s = \"back\\\\slash and \\\"quote\\\"\"\n  n = 007\n}\n";
        IRContext before = IRContext.fromParseResult(parser.parse(source));
        IRContext after = IRContext.fromParseResult(parser.parse(SirenExporter.exportCanonical(before)));

        assertEquals(before.allResources().stream().map(Resource::withoutSourceInfo).toList(),
                after.allResources().stream().map(Resource::withoutSourceInfo).toList());
    }
}
