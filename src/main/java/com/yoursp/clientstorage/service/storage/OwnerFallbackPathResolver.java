package com.yoursp.clientstorage.service.storage;

import com.yoursp.clientstorage.service.storage.exception.InvalidStoragePathException;
import com.yoursp.clientstorage.service.storage.exception.StorageException;
import com.yoursp.clientstorage.service.storage.exception.StoredFileNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Resolves references against the two-level layout
 * {@code root/<clientId>/[<owner>/]<storedName>}.
 * <p>
 * Lookup order:
 * </p>
 * <ol>
 * <li>{@code root/clientId/reference} as given (flat files, or callers that
 * already pass {@code owner/filename})</li>
 * <li>for a bare file name only: each owner directory of the client, in name
 * order; the first hit wins</li>
 * </ol>
 * Hidden names (leading {@code .}) never resolve.
 * Step 2 keeps pre-owner uploads and bare-name lookups working. It scans the
 * owner directories linearly, which assumes tens of owners per client rather
 * than thousands.
 */
@Slf4j
public class OwnerFallbackPathResolver implements PathResolver {

    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");

    private final Path storageRoot;

    public OwnerFallbackPathResolver(Path storageRoot) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
    }

    @Override
    public Path clientRoot(String clientId) {
        checkSegment(clientId, "client identity");
        return within(storageRoot, storageRoot.resolve(clientId), clientId);
    }

    @Override
    public Path targetDirectory(String clientId, String owner) {
        Path clientRoot = clientRoot(clientId);
        if (owner == null || owner.isBlank()) {
            return clientRoot;
        }
        checkSegment(owner, "owner");
        return within(clientRoot, clientRoot.resolve(owner), owner);
    }

    @Override
    public Path resolve(String clientId, String reference) {
        Path clientRoot = clientRoot(clientId);
        List<String> segments = referenceSegments(reference);
        // hidden entries (partial uploads, dot-files) are never listed, so they are not served either
        if (segments.stream().anyMatch(segment -> segment.startsWith("."))) {
            log.debug("Reference {} points at a hidden entry", reference);
            throw new StoredFileNotFoundException(reference);
        }

        Path direct = within(clientRoot, clientRoot.resolve(String.join("/", segments)), reference);
        if (Files.isRegularFile(direct)) {
            return direct;
        }

        if (segments.size() == 1 && Files.isDirectory(clientRoot)) {
            Optional<Path> ownerMatch = findInOwnerDirectories(clientRoot, segments.get(0));
            if (ownerMatch.isPresent()) {
                return ownerMatch.get();
            }
        }

        log.debug("Reference {} not found for client namespace {}", reference, clientRoot.getFileName());
        throw new StoredFileNotFoundException(reference);
    }

    private Optional<Path> findInOwnerDirectories(Path clientRoot, String filename) {
        try (Stream<Path> children = Files.list(clientRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(dir -> !dir.getFileName().toString().startsWith("."))
                    .sorted()
                    .map(dir -> dir.resolve(filename))
                    .filter(Files::isRegularFile)
                    .findFirst();
        } catch (IOException e) {
            throw new StorageException("Failed to scan owner directories under " + clientRoot, e);
        }
    }

    /**
     * A reference is {@code filename} or {@code owner/filename}; anything else
     * is rejected before touching the filesystem.
     */
    static List<String> referenceSegments(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidStoragePathException("File reference is required");
        }
        if (reference.startsWith("/") || reference.indexOf('\\') >= 0) {
            throw rejected(reference);
        }
        List<String> segments = Arrays.asList(reference.split("/", -1));
        if (segments.size() > 2) {
            throw rejected(reference);
        }
        for (String segment : segments) {
            checkSegment(segment, "file reference");
        }
        return segments;
    }

    static void checkSegment(String segment, String what) {
        if (segment == null || segment.isBlank()) {
            throw new InvalidStoragePathException("Missing " + what);
        }
        if (".".equals(segment)
                || "..".equals(segment)
                || segment.contains("/")
                || segment.contains("\\")
                || segment.indexOf('\0') >= 0
                || DRIVE_PREFIX.matcher(segment).matches()) {
            throw rejected(segment);
        }
    }

    private static Path within(Path base, Path candidate, String input) {
        Path normalized = candidate.normalize();
        if (!normalized.startsWith(base) || normalized.equals(base)) {
            throw rejected(input);
        }
        return normalized;
    }

    private static InvalidStoragePathException rejected(String input) {
        log.warn("Rejected storage path: {}", input);
        return new InvalidStoragePathException("Invalid path: " + input);
    }
}
