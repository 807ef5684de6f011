package nl.bytesoflife.deltakicad.sexp;

import java.io.IOException;
import java.io.Writer;

/**
 * Pretty-prints a document. Nested lists go on a new line, one tab deeper than
 * their parent; values stay on the line of their list. A list closes on its own
 * line only when it has nested lists.
 */
public class SExpressionWriter {

    private final Writer out;

    public SExpressionWriter(Writer out) {
        this.out = out;
    }

    public void write(SDocument document) throws IOException {
        writeList(document.getRoot(), 0);
        out.write('\n');
    }

    private void writeList(SNode.SList list, int indent) throws IOException {
        out.write('(');
        out.write(list.name());
        boolean nested = false;
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList childList) {
                nested = true;
                newLine(indent + 1);
                writeList(childList, indent + 1);
            } else if (child instanceof SNode.SValue value) {
                out.write(' ');
                out.write(value.value());
            } else if (child instanceof SNode.SText text) {
                out.write(" \"");
                out.write(text.text());
                out.write('"');
            }
        }
        if (nested) {
            newLine(indent);
        }
        out.write(')');
    }

    private void newLine(int indent) throws IOException {
        out.write('\n');
        for (int i = 0; i < indent; i++) {
            out.write('\t');
        }
    }
}
