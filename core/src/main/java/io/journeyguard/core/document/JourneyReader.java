package io.journeyguard.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.error.DocumentParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads journey documents: raw-text repair, JSON parsing and envelope extraction, in that order.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class JourneyReader {

    private static final Logger LOG = LoggerFactory.getLogger(JourneyReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Reads a journey file.
     *
     * @throws DocumentParseException if the file cannot be read, is not JSON or its root is not an
     *     object
     * @throws io.journeyguard.core.error.EnvelopeException if the workflow cannot be located
     */
    public JourneyDocument read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String documentName = path.getFileName().toString();
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentParseException(
                    "Failed to load Journey JSON file: " + e.getClass().getSimpleName(), e, documentName);
        }
        return parse(text, documentName, path);
    }

    /** Parses an in-memory document. */
    public JourneyDocument parse(String text, String documentName) {
        return parse(text, documentName, null);
    }

    private JourneyDocument parse(String text, String documentName, Path path) {
        Objects.requireNonNull(text, "text must not be null");
        RawTextRepair.Result repaired = RawTextRepair.repair(text);
        if (repaired.changed()) {
            LOG.info("Collapsed over-escaped sequences before parsing: document={}, count={}",
                    documentName, repaired.fixes());
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(repaired.text());
        } catch (JsonProcessingException e) {
            throw new DocumentParseException(
                    "Failed to load Journey JSON file: " + e.getOriginalMessage(), e, documentName);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentParseException(
                    "The journey JSON is not a valid dictionary. Expected a JSON object at the root level.",
                    documentName);
        }

        ObjectNode rootObject = (ObjectNode) root;
        ObjectNode workflow = EnvelopeExtractor.extract(rootObject, documentName);
        LOG.debug("Journey loaded: document={}, nodes={}", documentName, workflow.path("nodes").size());
        return new JourneyDocument(rootObject, workflow, documentName, path, repaired.fixes());
    }
}
