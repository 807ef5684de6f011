package nl.bytesoflife.deltakicad.sexp;

import nl.bytesoflife.deltakicad.MalformedDocumentException;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns KiCad S-expression text into a flat list of tokens.
 * Every opening parenthesis must be followed by a bare list name.
 */
public class SExpressionTokenizer {

    private String input;
    private int pos;

    public List<Token> tokenize(String text) {
        this.input = text;
        this.pos = 0;
        List<Token> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (pos >= input.length()) break;

            char c = input.charAt(pos);
            if (c == '(') {
                tokens.add(readListStart());
            } else if (c == ')') {
                tokens.add(new Token(TokenType.LIST_END, "", pos));
                pos++;
            } else if (c == '"') {
                tokens.add(readQuotedText());
            } else {
                int start = pos;
                tokens.add(new Token(TokenType.ATOM, readAtom(), start));
            }
        }
        return tokens;
    }

    private Token readListStart() {
        int start = pos;
        pos++;
        skipWhitespace();
        if (pos >= input.length()) {
            throw new MalformedDocumentException("Unexpected end of input, expected list name", pos);
        }
        char c = input.charAt(pos);
        if (c == '(' || c == ')' || c == '"') {
            throw new MalformedDocumentException("Expected list name at position " + pos, pos);
        }
        return new Token(TokenType.LIST_START, readAtom(), start);
    }

    private Token readQuotedText() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new Token(TokenType.QUOTED_TEXT, sb.toString(), start);
            }
            // escapes are kept verbatim so the writer reproduces them
            if (c == '\\' && pos + 1 < input.length()) {
                sb.append(c);
                pos++;
                c = input.charAt(pos);
            }
            sb.append(c);
            pos++;
        }
        throw new MalformedDocumentException("Unterminated quoted string", start);
    }

    private String readAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return input.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
