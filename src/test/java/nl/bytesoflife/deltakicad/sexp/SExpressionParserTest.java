package nl.bytesoflife.deltakicad.sexp;

import nl.bytesoflife.deltakicad.ErrorKind;
import nl.bytesoflife.deltakicad.MalformedDocumentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        SNode.SList root = parser.parse("(version 20231120)").getRoot();
        assertEquals("version", root.name());
        assertEquals(1, root.children().size());
        assertEquals(new SNode.SValue("20231120"), root.children().get(0));
    }

    @Test
    void parseNestedLists() {
        SNode.SList root = parser.parse("(wire (pts (xy 0 0) (xy 2.54 0)) (uuid \"u1\"))").getRoot();
        assertEquals(2, root.children().size());
        SNode.SList pts = root.requireChild("pts");
        assertEquals(2, pts.query("xy").size());
        assertInstanceOf(SNode.SText.class, root.requireChild("uuid").children().get(0));
    }

    @Test
    void parseQuotedString() {
        SNode.SList root = parser.parse("(property \"Value\" \"10k 1%\")").getRoot();
        assertEquals("10k 1%", ((SNode.SText) root.children().get(1)).text());
    }

    @Test
    void textAndValueOfSameContentAreDistinct() {
        assertNotEquals(parser.parse("(a b)"), parser.parse("(a \"b\")"));
    }

    @Test
    void childOrderIsPreserved() {
        SNode.SList root = parser.parse("(pin input line (at 0 0) (length 2.54) hide)").getRoot();
        assertEquals(5, root.children().size());
        assertEquals(new SNode.SValue("input"), root.children().get(0));
        assertEquals("at", ((SNode.SList) root.children().get(2)).name());
        assertEquals(new SNode.SValue("hide"), root.children().get(4));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   \n\t ", "version 1", "(a (b)", "(a))", "(a) (b)", "(a) x"})
    void rejectMalformedInput(String input) {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class, () -> parser.parse(input));
        assertEquals(ErrorKind.MALFORMED_DOCUMENT, e.getKind());
    }

    @Test
    void contentAfterRootReportsItsPosition() {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class, () -> parser.parse("(a))"));
        assertEquals(3, e.getPosition());
    }

    @Test
    void trailingWhitespaceIsAccepted() {
        assertEquals("a", parser.parse("(a)\n\n").getRoot().name());
    }
}
