package fr.lapetina.imagebatch.infrastructure.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes output files so that a reader never sees a partial file.
 *
 * Bytes go to a hidden temporary sibling which is then moved over the target.
 * On failure the temporary file is removed and the target is left as it was.
 */
public final class OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);

    /**
     * Writes {@code data} to {@code target}, creating parent directories as needed.
     *
     * @throws IOException if the directory, temporary file or move fails
     */
    public void write(Path target, byte[] data) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path parent = absolute.getParent();
        Files.createDirectories(parent);

        Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".part");
        try {
            Files.write(temp, data);
            move(temp, absolute);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        log.debug("Output written: path={}, bytes={}", absolute, data.length);
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
