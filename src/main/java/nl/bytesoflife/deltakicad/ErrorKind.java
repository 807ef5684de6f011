package nl.bytesoflife.deltakicad;

public enum ErrorKind {
    MALFORMED_DOCUMENT,
    MISSING_MANDATORY_FIELD,
    UNRESOLVED_REFERENCE,
    IO_FAILURE
}
