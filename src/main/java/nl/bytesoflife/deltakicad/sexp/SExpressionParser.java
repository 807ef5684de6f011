package nl.bytesoflife.deltakicad.sexp;

import nl.bytesoflife.deltakicad.MalformedDocumentException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the document tree from the token stream. The input must hold exactly
 * one balanced root list.
 */
public class SExpressionParser {

    private final SExpressionTokenizer tokenizer = new SExpressionTokenizer();

    public SDocument parse(String text) {
        return build(tokenizer.tokenize(text));
    }

    public SDocument build(List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new MalformedDocumentException("Empty document", 0);
        }
        Token first = tokens.get(0);
        if (first.type() != TokenType.LIST_START) {
            throw new MalformedDocumentException(
                    "Document does not start with a list at position " + first.position(), first.position());
        }

        Deque<OpenList> stack = new ArrayDeque<>();
        SNode.SList root = null;

        for (Token token : tokens) {
            if (root != null) {
                throw new MalformedDocumentException(
                        "Unexpected content after root list at position " + token.position(), token.position());
            }
            switch (token.type()) {
                case LIST_START -> stack.push(new OpenList(token.text()));
                case ATOM -> stack.peek().children.add(new SNode.SValue(token.text()));
                case QUOTED_TEXT -> stack.peek().children.add(new SNode.SText(token.text()));
                case LIST_END -> {
                    if (stack.isEmpty()) {
                        throw new MalformedDocumentException(
                                "Unbalanced ')' at position " + token.position(), token.position());
                    }
                    OpenList closed = stack.pop();
                    SNode.SList list = new SNode.SList(closed.name, closed.children);
                    if (stack.isEmpty()) {
                        root = list;
                    } else {
                        stack.peek().children.add(list);
                    }
                }
            }
        }

        if (root == null) {
            int end = tokens.get(tokens.size() - 1).position();
            throw new MalformedDocumentException("Unexpected end of input, expected ')'", end);
        }
        return new SDocument(root);
    }

    private static final class OpenList {
        private final String name;
        private final List<SNode> children = new ArrayList<>();

        private OpenList(String name) {
            this.name = name;
        }
    }
}
