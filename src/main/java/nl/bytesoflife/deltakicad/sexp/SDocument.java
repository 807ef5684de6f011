package nl.bytesoflife.deltakicad.sexp;

import nl.bytesoflife.deltakicad.IoFailureException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Parsed S-expression document. Immutable; edits happen on the typed model,
 * which is written into a new document.
 */
public final class SDocument {

    private final SNode.SList root;

    public SDocument(SNode.SList root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public static SDocument parse(String text) {
        return new SExpressionParser().parse(text);
    }

    public static SDocument read(Reader reader) {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[8192];
        try {
            int n;
            while ((n = reader.read(buffer)) != -1) {
                sb.append(buffer, 0, n);
            }
        } catch (IOException e) {
            throw new IoFailureException(null, e);
        }
        return parse(sb.toString());
    }

    public static SDocument read(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IoFailureException(path, e);
        }
    }

    public SNode.SList getRoot() {
        return root;
    }

    public void write(Writer out) {
        try {
            new SExpressionWriter(out).write(this);
            out.flush();
        } catch (IOException e) {
            throw new IoFailureException(null, e);
        }
    }

    public void write(Path path) {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            new SExpressionWriter(out).write(this);
        } catch (IOException e) {
            throw new IoFailureException(path, e);
        }
    }

    public String toText() {
        StringWriter out = new StringWriter();
        write(out);
        return out.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SDocument other)) return false;
        return root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
