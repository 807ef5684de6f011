package nl.bytesoflife.deltakicad.sexp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionWriterTest {

    @Test
    void flatListStaysOnOneLine() {
        assertEquals("(at 1.27 0 90)\n", SDocument.parse("(at   1.27\n0 90)").toText());
    }

    @Test
    void nestedListsAreIndentedWithTabs() {
        String text = SDocument.parse("(wire (pts (xy 0 0) (xy 2.54 0)) (uuid \"u1\"))").toText();
        String expected = """
                (wire
                \t(pts
                \t\t(xy 0 0)
                \t\t(xy 2.54 0)
                \t)
                \t(uuid "u1")
                )
                """;
        assertEquals(expected, text);
    }

    @Test
    void valuesFollowingNestedListStayInline() {
        String text = SDocument.parse("(pin input (at 0 0) hide)").toText();
        assertEquals("(pin input\n\t(at 0 0) hide\n)\n", text);
    }

    @Test
    void escapesAreWrittenBack() {
        String input = "(text \"say \\\"hi\\\"\")\n";
        assertEquals(input, SDocument.parse(input).toText());
    }

    @Test
    void reparsingWrittenTextGivesAnEqualTree() {
        String input = "(kicad_sch (version 20231120) (lib_symbols (symbol \"Device:R\" (power) (pin passive line (at 0 3.81 270) (name \"~\")))) (paper \"A4\"))";
        SDocument document = SDocument.parse(input);
        SDocument reparsed = SDocument.parse(document.toText());
        assertEquals(document, reparsed);
        assertEquals(document.toText(), reparsed.toText());
    }

    @Test
    void readFromReader() {
        SDocument document = SDocument.read(new StringReader("(a (b c))"));
        assertEquals("b", document.getRoot().lists().get(0).name());
    }

    @Test
    void writeAndReadFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("out.kicad_sch");
        SDocument document = SDocument.parse("(kicad_sch (version 1))");
        document.write(file);
        assertEquals("(kicad_sch\n\t(version 1)\n)\n", Files.readString(file));
        assertEquals(document, SDocument.read(file));
    }
}
