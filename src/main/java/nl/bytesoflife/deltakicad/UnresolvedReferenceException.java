package nl.bytesoflife.deltakicad;

public class UnresolvedReferenceException extends KicadException {

    private final String reference;

    public UnresolvedReferenceException(String reference, String message) {
        super(ErrorKind.UNRESOLVED_REFERENCE, message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
