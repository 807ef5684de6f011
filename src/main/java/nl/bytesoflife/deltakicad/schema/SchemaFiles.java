package nl.bytesoflife.deltakicad.schema;

import nl.bytesoflife.deltakicad.schema.model.Schema;
import nl.bytesoflife.deltakicad.sexp.SDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Loads and saves {@code .kicad_sch} files.
 */
public final class SchemaFiles {

    private static final Logger log = LoggerFactory.getLogger(SchemaFiles.class);

    private SchemaFiles() {
    }

    public static Schema load(Path path) {
        long start = System.currentTimeMillis();
        Schema schema = new SchemaReader().read(SDocument.read(path));
        log.info("Loaded {} in {}ms: {} symbols, {} wires",
                path.getFileName(), System.currentTimeMillis() - start,
                schema.getSymbols().size(), schema.getWires().size());
        return schema;
    }

    public static void save(Schema schema, Path path) {
        new SchemaWriter().write(schema).write(path);
        log.info("Saved {}", path.getFileName());
    }
}
