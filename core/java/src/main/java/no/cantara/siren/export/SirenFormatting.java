package no.cantara.siren.export;

import no.cantara.siren.model.Attribute;
import no.cantara.siren.model.AttributeValue;
import no.cantara.siren.model.AttributeValue.ArrayValue;
import no.cantara.siren.model.AttributeValue.BooleanValue;
import no.cantara.siren.model.AttributeValue.NullValue;
import no.cantara.siren.model.AttributeValue.NumberValue;
import no.cantara.siren.model.AttributeValue.Reference;
import no.cantara.siren.model.AttributeValue.StringValue;
import no.cantara.siren.model.Resource;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Text rendering of Siren values, identifiers and resource headers.
 */
public final class SirenFormatting {

    static final String INDENT = "  ";

    private static final Pattern BARE_IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_-]*");

    private SirenFormatting() {
    }

    public static String formatValue(AttributeValue value) {
        if (value instanceof StringValue string) {
            return quote(string.value());
        }
        if (value instanceof NumberValue number) {
            return number.value().toPlainString();
        }
        if (value instanceof BooleanValue bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof NullValue) {
            return "null";
        }
        if (value instanceof Reference reference) {
            return reference.id();
        }
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (AttributeValue element : ((ArrayValue) value).elements()) {
            joiner.add(formatValue(element));
        }
        return joiner.toString();
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /** Bare when the id is a valid identifier, quoted otherwise. */
    public static String formatIdentifier(String id) {
        return BARE_IDENTIFIER.matcher(id).matches() ? id : quote(id);
    }

    /**
     * @param preferRaw render literals exactly as they were written when the raw text is known
     */
    public static String attributeLine(Attribute attribute, boolean preferRaw) {
        String value = preferRaw && attribute.raw() != null && attribute.value() instanceof AttributeValue.Primitive
                ? attribute.raw()
                : formatValue(attribute.value());
        return INDENT + attribute.key() + " = " + value;
    }

    /** {@code type id [complete]}, without the opening brace. */
    public static String header(Resource resource) {
        return resource.type().keyword() + " " + formatIdentifier(resource.id()) + (resource.complete() ? " complete" : "");
    }
}
