package io.journeyguard.core.document;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A loaded journey document. The Jackson tree is the source of truth: {@code workflow} is the
 * object inside {@code root}, so repairs made through either are the same change.
 *
 * @param root           the parsed document
 * @param workflow       the extracted workflow object
 * @param documentName   bare file name, used in messages
 * @param path           the backing file, or {@code null} for in-memory documents
 * @param rawTextRepairs number of over-escaped sequences collapsed before parsing
 */
public record JourneyDocument(
        ObjectNode root, ObjectNode workflow, String documentName, Path path, int rawTextRepairs) {

    public JourneyDocument {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(documentName, "documentName must not be null");
    }

    public boolean isFileBacked() {
        return path != null;
    }
}
