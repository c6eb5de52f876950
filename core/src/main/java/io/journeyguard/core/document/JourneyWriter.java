package io.journeyguard.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.error.PersistException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists journey documents atomically. The content is fully serialized first, written to a
 * temporary file next to the target and then moved over it, so a failed write leaves the original
 * file untouched.
 */
public final class JourneyWriter {

    private static final Logger LOG = LoggerFactory.getLogger(JourneyWriter.class);

    /** Moves a fully written temporary file over its target. */
    @FunctionalInterface
    public interface FileMover {
        void move(Path source, Path target) throws IOException;
    }

    private final FileMover mover;

    public JourneyWriter() {
        this(JourneyWriter::atomicMove);
    }

    public JourneyWriter(FileMover mover) {
        this.mover = Objects.requireNonNull(mover, "mover must not be null");
    }

    /**
     * Writes a document back to its file as two-space indented JSON.
     *
     * @throws IllegalArgumentException if the document is not file-backed
     * @throws PersistException if the file cannot be written
     */
    public void write(JourneyDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        if (!document.isFileBacked()) {
            throw new IllegalArgumentException("Document is not file-backed: " + document.documentName());
        }
        write(document.path(), document.root());
    }

    /** Writes a JSON tree to a file as two-space indented JSON. */
    public void write(Path path, JsonNode root) {
        writeText(path, PrettyJson.write(root));
    }

    /**
     * Replaces a file's content with the given text.
     *
     * @throws PersistException if the file cannot be written
     */
    public void writeText(Path path, String text) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(text, "text must not be null");
        String documentName = path.getFileName().toString();
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        Path directory = path.toAbsolutePath().getParent();

        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + documentName + ".", ".tmp");
            Files.write(temp, bytes);
            mover.move(temp, path);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new PersistException("Failed to write " + documentName + ": " + e.getClass().getSimpleName(), e,
                    documentName);
        }
        LOG.info("Journey written: document={}, bytes={}", documentName, bytes.length);
    }

    private static void atomicMove(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported, replacing in place: target={}", target.getFileName());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
