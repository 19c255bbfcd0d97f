package no.cantara.siren.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The value of a resource attribute: a primitive literal, a reference to another
 * resource, or an array of values.
 */
public sealed interface AttributeValue {

    /** String, number, boolean or null literal. */
    sealed interface Primitive extends AttributeValue {}

    record StringValue(String value) implements Primitive {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * A decimal literal. The value is kept without trailing zeros so that {@code 1.0}
     * and {@code 1} compare equal.
     */
    record NumberValue(BigDecimal value) implements Primitive {
        public NumberValue {
            Objects.requireNonNull(value, "value");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        public static NumberValue of(String text) {
            return new NumberValue(new BigDecimal(text));
        }
    }

    record BooleanValue(boolean value) implements Primitive {
        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);
    }

    record NullValue() implements Primitive {
        public static final NullValue INSTANCE = new NullValue();
    }

    /** A bare identifier pointing at another resource by id. */
    record Reference(String id) implements AttributeValue {
        public Reference {
            Objects.requireNonNull(id, "id");
        }
    }

    record ArrayValue(List<AttributeValue> elements) implements AttributeValue {
        public ArrayValue {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }
    }

    static StringValue string(String value) {
        return new StringValue(value);
    }

    static NumberValue number(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static BooleanValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static NullValue nullValue() {
        return NullValue.INSTANCE;
    }

    static Reference reference(String id) {
        return new Reference(id);
    }

    static ArrayValue array(AttributeValue... elements) {
        return new ArrayValue(Arrays.asList(elements));
    }

    static ArrayValue references(String... ids) {
        return new ArrayValue(Arrays.stream(ids).map(id -> (AttributeValue) new Reference(id)).toList());
    }
}
