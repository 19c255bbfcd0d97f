package no.cantara.siren.cli;

import no.cantara.siren.SirenDecoder;
import no.cantara.siren.cst.Origin;
import no.cantara.siren.model.Attribute;
import no.cantara.siren.model.AttributeValue;
import no.cantara.siren.model.Resource;
import no.cantara.siren.model.ResourceType;
import no.cantara.siren.parser.SirenParser;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormatCommandTest {

    private static List<Resource> decode(String source) {
        return new SirenDecoder().decode(new SirenParser().parse(source, "main.siren")).document().resources();
    }

    @Test
    void sourcePositionsAndSpellingAreIgnored() {
        Origin origin = new Origin(0, 20, 0, 2, 0, "main.siren");
        Resource written = new Resource(ResourceType.TASK, "a", false,
                List.of(new Attribute("estimate", new AttributeValue.NumberValue(new BigDecimal("1.50")), "1.50", origin)),
                origin);
        Resource plain = Resource.task("a", Attribute.of("estimate", new AttributeValue.NumberValue(new BigDecimal("1.5"))));

        assertTrue(FormatCommand.sameResources(List.of(written), List.of(plain)));
    }

    @Test
    void reformattedTextHasSameResources() {
        assertTrue(FormatCommand.sameResources(
                decode("task   a complete {x=1 depends_on=[b,c]}\ntask b{}"),
                decode("task a complete {\n  x = 1\n  depends_on = [b, c]\n}\n\ntask b {}\n")));
    }

    @Test
    void valueChangeIsDetected() {
        assertFalse(FormatCommand.sameResources(decode("task a { x = 1 }"), decode("task a { x = 2 }")));
    }

    @Test
    void completionChangeIsDetected() {
        assertFalse(FormatCommand.sameResources(decode("task a complete {}"), decode("task a {}")));
    }

    @Test
    void lostResourceIsDetected() {
        assertFalse(FormatCommand.sameResources(decode("task a {}\ntask b {}"), decode("task a {}")));
    }
}
