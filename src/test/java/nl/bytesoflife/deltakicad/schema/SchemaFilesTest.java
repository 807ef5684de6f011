package nl.bytesoflife.deltakicad.schema;

import nl.bytesoflife.deltakicad.ErrorKind;
import nl.bytesoflife.deltakicad.IoFailureException;
import nl.bytesoflife.deltakicad.schema.model.Schema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SchemaFilesTest {

    @Test
    void saveThenLoad(@TempDir Path dir) throws Exception {
        Path source = Path.of(SchemaFilesTest.class.getResource("/schematics/netlist.kicad_sch").toURI());
        Schema schema = SchemaFiles.load(source);
        assertEquals(6, schema.getSymbols().size());

        Path target = dir.resolve("copy.kicad_sch");
        SchemaFiles.save(schema, target);
        assertTrue(Files.size(target) > 0);
        assertEquals(schema, SchemaFiles.load(target));
    }

    @Test
    void loadMissingFileFails(@TempDir Path dir) {
        Path missing = dir.resolve("missing.kicad_sch");
        IoFailureException e = assertThrows(IoFailureException.class, () -> SchemaFiles.load(missing));
        assertEquals(ErrorKind.IO_FAILURE, e.getKind());
        assertEquals(missing, e.getPath());
        assertInstanceOf(NoSuchFileException.class, e.getCause());
    }

    @Test
    void saveIntoMissingDirectoryFails(@TempDir Path dir) {
        Path target = dir.resolve("no/such/dir/out.kicad_sch");
        assertThrows(IoFailureException.class, () -> SchemaFiles.save(new Schema(), target));
    }
}
