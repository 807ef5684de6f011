package nl.bytesoflife.deltakicad.sexp;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Scalar types an atom can be decoded into.
 */
public final class SValueType<T> {

    // plain decimal: optional sign, no exponent, within Decimals.LIMIT
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)");

    public static final SValueType<String> STRING = new SValueType<>("string", s -> s);

    public static final SValueType<Double> FLOAT = new SValueType<>("float", s -> {
        if (!DECIMAL.matcher(s).matches()) {
            throw new IllegalArgumentException(s);
        }
        double value = Double.parseDouble(s);
        if (!Decimals.isRepresentable(value)) {
            throw new IllegalArgumentException(s);
        }
        return value;
    });

    public static final SValueType<Integer> INTEGER = new SValueType<>("integer", Integer::parseInt);

    public static final SValueType<Boolean> BOOLEAN = new SValueType<>("boolean", s -> switch (s) {
        case "yes", "true" -> Boolean.TRUE;
        case "no", "false" -> Boolean.FALSE;
        default -> throw new IllegalArgumentException(s);
    });

    private final String name;
    private final Function<String, T> decoder;

    private SValueType(String name, Function<String, T> decoder) {
        this.name = name;
        this.decoder = decoder;
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    T decode(String text) {
        return decoder.apply(text);
    }

    @Override
    public String toString() {
        return name;
    }
}
