package nl.bytesoflife.deltakicad.sexp;

import nl.bytesoflife.deltakicad.MissingFieldException;

/**
 * A value was present but could not be decoded as the requested type.
 */
public class ValueDecodeException extends MissingFieldException {

    private final String rawValue;
    private final SValueType<?> type;

    public ValueDecodeException(String node, String field, String rawValue, SValueType<?> type) {
        super(node, field, "Cannot decode '" + rawValue + "' as " + type
                + " for field '" + field + "' in (" + node + ")");
        this.rawValue = rawValue;
        this.type = type;
    }

    public String getRawValue() {
        return rawValue;
    }

    public SValueType<?> getType() {
        return type;
    }
}
