package nl.bytesoflife.deltakicad.sexp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Assembles a document list by list, the way a writer walks the model:
 * {@code push("at").value("1.27").value("0").end()}.
 */
public class SExpressionBuilder {

    private final Deque<Frame> stack = new ArrayDeque<>();
    private SNode.SList root;

    public SExpressionBuilder push(String name) {
        if (root != null) {
            throw new IllegalStateException("Root list '" + root.name() + "' is already closed");
        }
        stack.push(new Frame(name));
        return this;
    }

    public SExpressionBuilder value(String value) {
        current().children.add(new SNode.SValue(value));
        return this;
    }

    public SExpressionBuilder text(String text) {
        current().children.add(new SNode.SText(text));
        return this;
    }

    public SExpressionBuilder end() {
        Frame frame = current();
        stack.pop();
        SNode.SList list = new SNode.SList(frame.name, frame.children);
        if (stack.isEmpty()) {
            root = list;
        } else {
            stack.peek().children.add(list);
        }
        return this;
    }

    public SDocument build() {
        if (!stack.isEmpty()) {
            throw new IllegalStateException(stack.size() + " list(s) still open, innermost '" + stack.peek().name + "'");
        }
        if (root == null) {
            throw new IllegalStateException("Nothing was pushed");
        }
        return new SDocument(root);
    }

    private Frame current() {
        Frame frame = stack.peek();
        if (frame == null) {
            throw new IllegalStateException("No open list");
        }
        return frame;
    }

    private static final class Frame {
        private final String name;
        private final List<SNode> children = new ArrayList<>();

        private Frame(String name) {
            this.name = name;
        }
    }
}
