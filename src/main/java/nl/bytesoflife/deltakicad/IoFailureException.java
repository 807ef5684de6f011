package nl.bytesoflife.deltakicad;

import java.io.IOException;
import java.nio.file.Path;

public class IoFailureException extends KicadException {

    private final Path path;

    public IoFailureException(Path path, IOException cause) {
        super(ErrorKind.IO_FAILURE,
                (path != null ? "I/O failure on " + path : "I/O failure") + ": " + cause.getMessage(),
                cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
