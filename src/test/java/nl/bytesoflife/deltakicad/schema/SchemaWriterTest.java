package nl.bytesoflife.deltakicad.schema;

import nl.bytesoflife.deltakicad.MalformedDocumentException;
import nl.bytesoflife.deltakicad.schema.model.Junction;
import nl.bytesoflife.deltakicad.schema.model.LocalLabel;
import nl.bytesoflife.deltakicad.schema.model.Position;
import nl.bytesoflife.deltakicad.schema.model.Schema;
import nl.bytesoflife.deltakicad.sexp.SDocument;
import nl.bytesoflife.deltakicad.sexp.SNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SchemaWriterTest {

    private final SchemaReader reader = new SchemaReader();
    private final SchemaWriter writer = new SchemaWriter();

    @Test
    void writtenSchemaReadsBackEqual() throws IOException {
        Schema schema = reader.parse(fixture());
        SDocument written = writer.write(schema);
        assertEquals(schema, reader.read(written));
        assertEquals(schema, reader.parse(written.toText()));
    }

    @Test
    void numbersUseCanonicalFormat() {
        Schema schema = new Schema();
        schema.setVersion("20231120");
        schema.addJunction(new Junction(new Position(179.07000000000002, 49.5300), 0, "j1"));
        String text = writer.write(schema).toText();
        assertTrue(text.contains("(at 179.07 49.53)"), text);
        assertTrue(text.contains("(diameter 0)"), text);
    }

    @Test
    void labelTextIsQuotedAndKeepsAngle() {
        Schema schema = new Schema();
        schema.addLocalLabel(new LocalLabel("CLK", new Position(1.27, 2.54, 90), "l1"));
        SNode.SList root = writer.write(schema).getRoot();
        SNode.SList label = root.requireChild("label");
        assertEquals(new SNode.SText("CLK"), label.children().get(0));
        assertEquals("(at 1.27 2.54 90)", label.requireChild("at").toString());
    }

    @Test
    void labelWithUnescapedQuoteIsRejected() {
        Schema schema = new Schema();
        schema.addLocalLabel(new LocalLabel("say \"hi\"", new Position(0, 0, 0), "l1"));
        assertThrows(MalformedDocumentException.class, () -> writer.write(schema));
    }

    @Test
    void labelWithEscapedQuoteReadsBackEqual() {
        Schema schema = new Schema();
        schema.addLocalLabel(new LocalLabel("say \\\"hi\\\"", new Position(0, 0, 0), "l1"));
        assertEquals(schema, reader.parse(writer.write(schema).toText()));
    }

    @Test
    void emptySchemaStillHasLibrarySection() {
        SDocument document = writer.write(new Schema());
        assertEquals("kicad_sch", document.getRoot().name());
        assertTrue(document.getRoot().child("lib_symbols").isPresent());
    }

    private static String fixture() throws IOException {
        try (InputStream is = SchemaWriterTest.class.getResourceAsStream("/schematics/netlist.kicad_sch")) {
            assertNotNull(is);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
