package io.journeyguard.cli.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access checks for the files the tool reads and rewrites.
 *
 * <p>
 * A file is accepted when it lies under the workspace folder or the user working directory,
 * has a {@code .json} extension, exists, is readable and writable, and is no larger than the
 * configured limit. Symbolic links are resolved before the containment check.
 */
public final class PathGuard {

    private static final Logger LOG = LoggerFactory.getLogger(PathGuard.class);

    private static final String ALLOWED_EXTENSION = ".json";
    private static final List<String> FORBIDDEN_FIELD_PATH_PARTS =
            List.of("..", "~", "$", "`", "|", ";", "&", "<", ">", "\n", "\r");

    private final List<Path> allowedRoots;
    private final long maxFileBytes;

    /**
     * @param workspaceFolder workspace root, or {@code null}
     * @param userCwd         user working directory, or {@code null}
     * @param maxFileBytes    largest accepted file size
     */
    public PathGuard(String workspaceFolder, String userCwd, long maxFileBytes) {
        List<Path> roots = new ArrayList<>();
        for (String root : new String[] {workspaceFolder, userCwd}) {
            if (root != null && !root.isBlank()) {
                roots.add(resolve(Path.of(root)));
            }
        }
        this.allowedRoots = List.copyOf(roots);
        this.maxFileBytes = maxFileBytes;
    }

    /**
     * Checks a file.
     *
     * @param file the requested file, relative paths resolve against the process working directory
     * @return the bare file name, for use in messages
     * @throws PathAccessException if any check fails
     */
    public String check(Path file) {
        Path resolved = resolve(file);
        Path fileName = resolved.getFileName();
        String name = fileName == null ? "" : fileName.toString();

        if (allowedRoots.stream().noneMatch(resolved::startsWith)) {
            LOG.warn("Rejected file outside the allowed folders: file={}", name);
            throw new PathAccessException("Access denied: file must be within workspace or current directory");
        }
        if (!name.toLowerCase(Locale.ROOT).endsWith(ALLOWED_EXTENSION)) {
            throw new PathAccessException("Access denied: only " + ALLOWED_EXTENSION + " files are allowed");
        }
        if (!Files.isRegularFile(resolved)) {
            throw new PathAccessException("File not found: " + name);
        }
        if (!Files.isReadable(resolved)) {
            throw new PathAccessException("File not readable: " + name);
        }
        if (!Files.isWritable(resolved)) {
            throw new PathAccessException("File not writable: " + name);
        }
        long size;
        try {
            size = Files.size(resolved);
        } catch (IOException e) {
            throw new PathAccessException("File not readable: " + name, e);
        }
        if (size > maxFileBytes) {
            throw new PathAccessException("File too large: maximum size is " + maxFileBytes + " bytes");
        }
        return name;
    }

    /**
     * Checks a {@code <node-id>/<field>/...} path before it is used for text replacement.
     *
     * @throws PathAccessException if the path is malformed or contains shell or traversal characters
     */
    public static void checkFieldPath(String fieldPath) {
        if (fieldPath == null || fieldPath.isEmpty()) {
            throw new PathAccessException("Field path must be a non-empty string");
        }
        if (fieldPath.split("/", -1).length < 2) {
            throw new PathAccessException("Field path must include node ID and field path");
        }
        for (String part : FORBIDDEN_FIELD_PATH_PARTS) {
            if (fieldPath.contains(part)) {
                throw new PathAccessException("Field path contains invalid characters");
            }
        }
    }

    private static Path resolve(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            return absolute;
        }
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            throw new PathAccessException("Invalid path: " + absolute.getFileName(), e);
        }
    }
}
