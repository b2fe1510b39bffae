package com.yoursp.clientstorage.modules.keys;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.clientstorage.config.StorageProperties;
import com.yoursp.clientstorage.model.ClientKeyRecord;
import com.yoursp.clientstorage.modules.keys.exception.ClientKeyNotFoundException;
import com.yoursp.clientstorage.service.storage.ClientKeyGate;
import com.yoursp.clientstorage.service.storage.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Client key registry backed by a single JSON file.
 * <ul>
 * <li>keys: 32 random bytes, hex encoded</li>
 * <li>ids: max existing id + 1; newest record first in the file</li>
 * <li>writes: temp file + atomic move, serialized by an in-process lock</li>
 * </ul>
 * Also serves as the {@link ClientKeyGate} of the storage engine.
 */
@Slf4j
@Service
public class ClientKeyService implements ClientKeyGate {

    private static final int KEY_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final TypeReference<List<ClientKeyRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final Path storeFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object lock = new Object();

    @Autowired
    public ClientKeyService(StorageProperties properties, ObjectMapper objectMapper) {
        this(properties.getKeysFilePath(), objectMapper, Clock.systemUTC());
    }

    public ClientKeyService(Path storeFile, ObjectMapper objectMapper, Clock clock) {
        this.storeFile = storeFile;
        this.objectMapper = objectMapper;
        this.clock = clock;
        log.info("Client key registry at {}", storeFile);
    }

    public List<ClientKeyRecord> findAll() {
        synchronized (lock) {
            return readAll();
        }
    }

    public ClientKeyRecord findOne(long id) {
        return findAll().stream()
                .filter(r -> r.getId() == id)
                .findFirst()
                .orElseThrow(() -> new ClientKeyNotFoundException(id));
    }

    public ClientKeyRecord create(String name, String note) {
        synchronized (lock) {
            List<ClientKeyRecord> records = readAll();
            Instant now = clock.instant();
            long id = records.stream().mapToLong(ClientKeyRecord::getId).max().orElse(0) + 1;

            ClientKeyRecord record = ClientKeyRecord.builder()
                    .id(id)
                    .key(generateKey())
                    .name(name)
                    .active(true)
                    .note(note)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            records.add(0, record);
            writeAll(records);
            log.info("Client key created: id={}, name={}", id, name);
            return record;
        }
    }

    /**
     * Apply a partial update; {@code null} arguments leave the field as is.
     * Deactivating stamps {@code revokedAt}, reactivating clears it.
     */
    public ClientKeyRecord update(long id, String name, Boolean active, String note) {
        ClientKeyRecord updated = modify(id, current -> {
            ClientKeyRecord.ClientKeyRecordBuilder builder = current.toBuilder();
            if (name != null) {
                builder.name(name);
            }
            if (note != null) {
                builder.note(note);
            }
            if (active != null && active != current.isActive()) {
                builder.active(active).revokedAt(active ? null : clock.instant());
            }
            return builder.build();
        });
        log.info("Client key updated: id={}", id);
        return updated;
    }

    public ClientKeyRecord revoke(long id) {
        ClientKeyRecord revoked = modify(id, current -> current.toBuilder()
                .active(false)
                .revokedAt(current.isActive() || current.getRevokedAt() == null
                        ? clock.instant()
                        : current.getRevokedAt())
                .build());
        log.info("Client key revoked: id={}", id);
        return revoked;
    }

    /**
     * Issue a new key for the record and reactivate it. Files stored under the
     * old key stay in the old namespace directory.
     */
    public ClientKeyRecord rotate(long id) {
        ClientKeyRecord rotated = modify(id, current -> current.toBuilder()
                .key(generateKey())
                .active(true)
                .revokedAt(null)
                .build());
        log.info("Client key rotated: id={}", id);
        return rotated;
    }

    public boolean remove(long id) {
        synchronized (lock) {
            List<ClientKeyRecord> records = readAll();
            boolean changed = records.removeIf(r -> r.getId() == id);
            if (changed) {
                writeAll(records);
                log.info("Client key removed: id={}", id);
            }
            return changed;
        }
    }

    @Override
    public boolean isAuthorized(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        byte[] candidate = key.getBytes(StandardCharsets.UTF_8);
        try {
            return findAll().stream()
                    .filter(ClientKeyRecord::isActive)
                    .anyMatch(r -> r.getKey() != null
                            && MessageDigest.isEqual(r.getKey().getBytes(StandardCharsets.UTF_8), candidate));
        } catch (StorageException e) {
            log.error("Client key validation failed: {}", e.getMessage());
            return false;
        }
    }

    private ClientKeyRecord modify(long id, UnaryOperator<ClientKeyRecord> change) {
        synchronized (lock) {
            List<ClientKeyRecord> records = readAll();
            for (int i = 0; i < records.size(); i++) {
                if (records.get(i).getId() == id) {
                    ClientKeyRecord updated = change.apply(records.get(i));
                    updated.setUpdatedAt(clock.instant());
                    records.set(i, updated);
                    writeAll(records);
                    return updated;
                }
            }
            throw new ClientKeyNotFoundException(id);
        }
    }

    private List<ClientKeyRecord> readAll() {
        if (!Files.exists(storeFile)) {
            return new ArrayList<>();
        }
        try {
            List<ClientKeyRecord> records = objectMapper.readValue(storeFile.toFile(), RECORD_LIST);
            return records == null ? new ArrayList<>() : new ArrayList<>(records);
        } catch (IOException e) {
            throw new StorageException("Failed to read client key registry: " + storeFile, e);
        }
    }

    private void writeAll(List<ClientKeyRecord> records) {
        Path temp = storeFile.resolveSibling(storeFile.getFileName() + ".tmp");
        try {
            Path parent = storeFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), records);
            Files.move(temp, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to write client key registry: " + storeFile, e);
        }
    }

    private static String generateKey() {
        byte[] bytes = new byte[KEY_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
