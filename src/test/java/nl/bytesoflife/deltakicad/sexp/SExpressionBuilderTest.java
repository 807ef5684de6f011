package nl.bytesoflife.deltakicad.sexp;

import nl.bytesoflife.deltakicad.MalformedDocumentException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionBuilderTest {

    @Test
    void buildNestedDocument() {
        SDocument document = new SExpressionBuilder()
                .push("label").text("VCC")
                .push("at").value("1.27").value("0").value("0").end()
                .end()
                .build();
        assertEquals(SDocument.parse("(label \"VCC\" (at 1.27 0 0))"), document);
    }

    @Test
    void buildRejectsOpenLists() {
        SExpressionBuilder builder = new SExpressionBuilder().push("a").push("b").end();
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void buildRejectsEmptyBuilder() {
        assertThrows(IllegalStateException.class, () -> new SExpressionBuilder().build());
    }

    @Test
    void valueWithoutOpenListIsRejected() {
        assertThrows(IllegalStateException.class, () -> new SExpressionBuilder().value("x"));
        assertThrows(IllegalStateException.class, () -> new SExpressionBuilder().end());
    }

    @Test
    void unescapedQuoteInTextIsRejected() {
        SExpressionBuilder builder = new SExpressionBuilder().push("kicad_sch");
        assertThrows(MalformedDocumentException.class, () -> builder.text("say \"hi\""));
        assertThrows(MalformedDocumentException.class, () -> builder.text("trailing \\"));
    }

    @Test
    void escapedTextRoundTrips() {
        // written form: say \"hi\" C:\\temp
        String text = "say \\\"hi\\\" C:\\\\temp";
        SDocument document = new SExpressionBuilder().push("kicad_sch").text(text).end().build();
        assertEquals("(kicad_sch \"" + text + "\")\n", document.toText());
        assertEquals(document, SDocument.parse(document.toText()));
    }

    @Test
    void secondRootIsRejected() {
        SExpressionBuilder builder = new SExpressionBuilder().push("a").end();
        assertThrows(IllegalStateException.class, () -> builder.push("b"));
    }
}
