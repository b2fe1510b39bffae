package com.yoursp.clientstorage.service.storage;

import com.yoursp.clientstorage.config.StorageProperties;
import com.yoursp.clientstorage.service.storage.dto.FileStatistics;
import com.yoursp.clientstorage.service.storage.dto.StoredFileRecord;
import com.yoursp.clientstorage.service.storage.exception.InvalidStoragePathException;
import com.yoursp.clientstorage.service.storage.exception.StorageException;
import com.yoursp.clientstorage.service.storage.exception.StoredFileNotFoundException;
import com.yoursp.clientstorage.service.storage.exception.UnauthorizedClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link StorageService}.
 * <p>
 * Layout: {@code <root>/<clientId>/[<owner>/]<storedName>}. The directory
 * tree is the only index; records are rebuilt from paths and file attributes
 * on every call.
 * </p>
 */
@Slf4j
@Service
public class LocalStorageServiceImpl implements StorageService {

    private final Path storageRoot;
    private final String apiPrefix;
    private final String staticPrefix;
    private final PathResolver pathResolver;
    private final ClientKeyGate clientKeyGate;
    private final StoredNameGenerator nameGenerator;
    private final MimeClassifier mimeClassifier;
    private final FileStatisticsAggregator statisticsAggregator;

    @Autowired
    public LocalStorageServiceImpl(StorageProperties properties,
            ClientKeyGate clientKeyGate,
            StoredNameGenerator nameGenerator,
            MimeClassifier mimeClassifier,
            FileStatisticsAggregator statisticsAggregator) {
        this(properties.getRootPath(), properties.getApiPrefix(), properties.getStaticPrefix(),
                clientKeyGate, nameGenerator, mimeClassifier, statisticsAggregator);
    }

    public LocalStorageServiceImpl(Path storageRoot, ClientKeyGate clientKeyGate) {
        this(storageRoot, "storage", "storage-data", clientKeyGate,
                new StoredNameGenerator(), new MimeClassifier(), new FileStatisticsAggregator());
    }

    public LocalStorageServiceImpl(Path storageRoot,
            String apiPrefix,
            String staticPrefix,
            ClientKeyGate clientKeyGate,
            StoredNameGenerator nameGenerator,
            MimeClassifier mimeClassifier,
            FileStatisticsAggregator statisticsAggregator) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        this.apiPrefix = trimSlashes(apiPrefix);
        this.staticPrefix = trimSlashes(staticPrefix);
        this.pathResolver = new OwnerFallbackPathResolver(this.storageRoot);
        this.clientKeyGate = clientKeyGate;
        this.nameGenerator = nameGenerator;
        this.mimeClassifier = mimeClassifier;
        this.statisticsAggregator = statisticsAggregator;
        try {
            Files.createDirectories(this.storageRoot);
            log.info("LocalStorageService initialized at {}", this.storageRoot);
        } catch (IOException e) {
            throw new StorageException("Failed to create local storage directory: " + this.storageRoot, e);
        }
    }

    @Override
    public StoredFileRecord save(String clientId, String originalName, byte[] data, String mimeType, String owner) {
        if (!clientKeyGate.isAuthorized(clientId)) {
            throw new UnauthorizedClientException("Invalid or revoked client key");
        }
        if (data == null) {
            throw new InvalidStoragePathException("File content is required");
        }

        Path directory = pathResolver.targetDirectory(clientId, owner);
        String storedName = nameGenerator.generate(originalName);
        Path target = directory.resolve(storedName);
        // hidden names are skipped by list(), so a half-written file is never reported
        Path partial = directory.resolve(StoredNameGenerator.partialName(storedName));

        try {
            Files.createDirectories(directory);
            Files.write(partial, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            if (Files.exists(target)) {
                throw new FileAlreadyExistsException(target.toString());
            }
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);

            BasicFileAttributes attributes = Files.readAttributes(target, BasicFileAttributes.class);
            StoredFileRecord record = toRecord(clientId, pathResolver.clientRoot(clientId), target, attributes,
                    mimeType);
            log.info("Stored {} ({} bytes, type={}) for owner={}", record.getRelativePath(), record.getSize(),
                    record.getMimeType(), owner);
            return record;
        } catch (IOException e) {
            throw new StorageException("Failed to store file: " + target, e);
        } finally {
            deleteQuietly(partial);
        }
    }

    @Override
    public List<StoredFileRecord> list(String clientId) {
        Path clientRoot = pathResolver.clientRoot(clientId);
        if (!Files.isDirectory(clientRoot)) {
            return List.of();
        }

        List<StoredFileRecord> records = new ArrayList<>();
        try (Stream<Path> entries = Files.list(clientRoot)) {
            for (Path entry : entries.filter(p -> !isHidden(p)).collect(Collectors.toList())) {
                if (Files.isRegularFile(entry)) {
                    addRecord(records, clientId, clientRoot, entry);
                } else if (Files.isDirectory(entry)) {
                    listOwnerDirectory(records, clientId, clientRoot, entry);
                }
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StorageException("Failed to list files under " + clientRoot, e);
        }

        records.sort(Comparator.comparing(StoredFileRecord::getRelativePath));
        log.debug("Listed {} file(s) for client namespace", records.size());
        return records;
    }

    @Override
    public Path fetchPath(String clientId, String reference) {
        return pathResolver.resolve(clientId, reference);
    }

    @Override
    public StoredFileRecord info(String clientId, String reference) {
        Path file = pathResolver.resolve(clientId, reference);
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return toRecord(clientId, pathResolver.clientRoot(clientId), file, attributes, null);
        } catch (NoSuchFileException e) {
            throw new StoredFileNotFoundException(reference);
        } catch (IOException e) {
            throw new StorageException("Failed to read file attributes: " + file, e);
        }
    }

    @Override
    public void delete(String clientId, String reference) {
        Path file = pathResolver.resolve(clientId, reference);
        try {
            Files.delete(file);
            log.info("Deleted {}", pathResolver.clientRoot(clientId).relativize(file));
        } catch (NoSuchFileException e) {
            throw new StoredFileNotFoundException(reference);
        } catch (IOException e) {
            throw new StorageException("Failed to delete file: " + file, e);
        }
    }

    @Override
    public FileStatistics statistics(String clientId) {
        return statisticsAggregator.aggregate(list(clientId));
    }

    private void listOwnerDirectory(List<StoredFileRecord> records, String clientId, Path clientRoot,
            Path ownerDirectory) throws IOException {
        try (Stream<Path> owned = Files.list(ownerDirectory)) {
            for (Path file : owned.filter(p -> !isHidden(p)).collect(Collectors.toList())) {
                // owner directories are not nested further
                if (Files.isRegularFile(file)) {
                    addRecord(records, clientId, clientRoot, file);
                }
            }
        } catch (NoSuchFileException e) {
            log.debug("Owner directory {} vanished while listing", ownerDirectory.getFileName());
        }
    }

    private void addRecord(List<StoredFileRecord> records, String clientId, Path clientRoot, Path file)
            throws IOException {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            records.add(toRecord(clientId, clientRoot, file, attributes, null));
        } catch (NoSuchFileException e) {
            log.debug("File {} vanished while listing", file.getFileName());
        }
    }

    private StoredFileRecord toRecord(String clientId, Path clientRoot, Path file, BasicFileAttributes attributes,
            String declaredMimeType) {
        Path relative = clientRoot.relativize(file);
        String storedName = file.getFileName().toString();
        String owner = relative.getNameCount() > 1 ? relative.getName(0).toString() : null;
        String relativePath = owner == null ? storedName : owner + "/" + storedName;
        String mimeType = declaredMimeType == null || declaredMimeType.isBlank()
                ? mimeClassifier.mimeTypeOf(storedName)
                : declaredMimeType;

        return StoredFileRecord.builder()
                .storedName(storedName)
                .originalName(nameGenerator.parse(storedName))
                .owner(owner)
                .relativePath(relativePath)
                .size(attributes.size())
                .mimeType(mimeType)
                .category(mimeClassifier.categoryOf(storedName))
                .uploadedAt(attributes.lastModifiedTime().toInstant())
                .downloadUrl("/" + apiPrefix + "/file/" + encodePath(relativePath))
                .publicUrl("/" + staticPrefix + "/" + encodePath(clientId) + "/" + encodePath(relativePath))
                .build();
    }

    private static String encodePath(String path) {
        return Stream.of(path.split("/"))
                .map(segment -> UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8))
                .collect(Collectors.joining("/"));
    }

    private static boolean isHidden(Path path) {
        return path.getFileName().toString().startsWith(".");
    }

    private static String trimSlashes(String prefix) {
        String trimmed = prefix == null ? "" : prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static void deleteQuietly(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Could not remove partial upload {}: {}", partial.getFileName(), e.getMessage());
        }
    }
}
