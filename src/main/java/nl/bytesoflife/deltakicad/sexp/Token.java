package nl.bytesoflife.deltakicad.sexp;

/**
 * Lexical event of the S-expression text. {@code text} is the list name for
 * {@link TokenType#LIST_START}, the raw characters for atoms and quoted text,
 * and empty for {@link TokenType#LIST_END}.
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return switch (type) {
            case LIST_START -> "(" + text;
            case LIST_END -> ")";
            case ATOM -> text;
            case QUOTED_TEXT -> "\"" + text + "\"";
        };
    }
}
