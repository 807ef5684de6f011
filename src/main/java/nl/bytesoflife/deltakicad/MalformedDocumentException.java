package nl.bytesoflife.deltakicad;

public class MalformedDocumentException extends KicadException {

    private final int position;

    public MalformedDocumentException(String message, int position) {
        super(ErrorKind.MALFORMED_DOCUMENT, message);
        this.position = position;
    }

    /**
     * Character offset in the input, or -1 when the failure is not tied to one.
     */
    public int getPosition() {
        return position;
    }
}
