package nl.bytesoflife.deltakicad;

/**
 * A mandatory field was absent, or present but not decodable.
 */
public class MissingFieldException extends KicadException {

    private final String node;
    private final String field;

    public MissingFieldException(String node, String field) {
        this(node, field, "Missing mandatory field '" + field + "' in (" + node + ")");
    }

    protected MissingFieldException(String node, String field, String message) {
        super(ErrorKind.MISSING_MANDATORY_FIELD, message);
        this.node = node;
        this.field = field;
    }

    public String getNode() {
        return node;
    }

    public String getField() {
        return field;
    }
}
