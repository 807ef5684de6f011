package nl.bytesoflife.deltakicad;

/**
 * Base type of every error raised while reading, writing or resolving a KiCad document.
 * A document that raises one of these is rejected as a whole.
 */
public abstract class KicadException extends RuntimeException {

    private final ErrorKind kind;

    protected KicadException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected KicadException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
