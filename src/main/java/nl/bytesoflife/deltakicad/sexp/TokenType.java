package nl.bytesoflife.deltakicad.sexp;

public enum TokenType {
    /** Opening parenthesis together with the list name, {@code (name}. */
    LIST_START,
    LIST_END,
    ATOM,
    QUOTED_TEXT
}
