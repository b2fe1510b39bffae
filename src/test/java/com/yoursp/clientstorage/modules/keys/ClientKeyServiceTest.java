package com.yoursp.clientstorage.modules.keys;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.clientstorage.model.ClientKeyRecord;
import com.yoursp.clientstorage.modules.keys.exception.ClientKeyNotFoundException;
import com.yoursp.clientstorage.service.storage.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClientKeyServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private Path storeFile;
    private ClientKeyService service;

    @BeforeEach
    void setUp() {
        storeFile = tempDir.resolve("client-keys.json");
        service = new ClientKeyService(storeFile, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Missing registry file reads as empty")
    void missingFileIsEmpty() {
        assertTrue(service.findAll().isEmpty());
        assertFalse(Files.exists(storeFile));
    }

    @Test
    void createIssuesHexKeysWithIncreasingIds() {
        ClientKeyRecord first = service.create("Acme", "primary");
        ClientKeyRecord second = service.create("Globex", null);

        assertEquals(1, first.getId());
        assertEquals(2, second.getId());
        assertTrue(first.getKey().matches("[0-9a-f]{64}"));
        assertNotEquals(first.getKey(), second.getKey());
        assertTrue(first.isActive());
        assertEquals(NOW, first.getCreatedAt());
        assertEquals("primary", first.getNote());

        List<ClientKeyRecord> all = service.findAll();
        assertEquals(List.of(2L, 1L), all.stream().map(ClientKeyRecord::getId).toList());
    }

    @Test
    void registryIsPersistedAcrossInstances() {
        ClientKeyRecord created = service.create("Acme", null);

        ClientKeyService reopened = new ClientKeyService(storeFile, objectMapper, Clock.systemUTC());

        ClientKeyRecord found = reopened.findOne(created.getId());
        assertEquals(created.getKey(), found.getKey());
        assertEquals("Acme", found.getName());
        assertTrue(reopened.isAuthorized(created.getKey()));
    }

    @Test
    void idsContinueAfterTheHighestExistingId() {
        service.create("a", null);
        ClientKeyRecord second = service.create("b", null);
        service.remove(1);

        ClientKeyRecord third = service.create("c", null);

        assertEquals(second.getId() + 1, third.getId());
    }

    @Test
    void onlyActiveKeysAreAuthorized() {
        ClientKeyRecord record = service.create("Acme", null);
        assertTrue(service.isAuthorized(record.getKey()));

        ClientKeyRecord revoked = service.revoke(record.getId());

        assertFalse(revoked.isActive());
        assertEquals(NOW, revoked.getRevokedAt());
        assertFalse(service.isAuthorized(record.getKey()));
    }

    @Test
    void blankOrUnknownKeysAreRejected() {
        service.create("Acme", null);

        assertFalse(service.isAuthorized(null));
        assertFalse(service.isAuthorized(""));
        assertFalse(service.isAuthorized("   "));
        assertFalse(service.isAuthorized("f".repeat(64)));
    }

    @Test
    void rotateReplacesTheKeyAndReactivates() {
        ClientKeyRecord record = service.create("Acme", null);
        service.revoke(record.getId());

        ClientKeyRecord rotated = service.rotate(record.getId());

        assertNotEquals(record.getKey(), rotated.getKey());
        assertTrue(rotated.isActive());
        assertNull(rotated.getRevokedAt());
        assertFalse(service.isAuthorized(record.getKey()));
        assertTrue(service.isAuthorized(rotated.getKey()));
    }

    @Test
    void updateOnlyTouchesGivenFields() {
        ClientKeyRecord record = service.create("Acme", "keep me");

        ClientKeyRecord renamed = service.update(record.getId(), "Acme Corp", null, null);
        assertEquals("Acme Corp", renamed.getName());
        assertEquals("keep me", renamed.getNote());
        assertTrue(renamed.isActive());

        ClientKeyRecord deactivated = service.update(record.getId(), null, false, null);
        assertFalse(deactivated.isActive());
        assertEquals(NOW, deactivated.getRevokedAt());

        ClientKeyRecord reactivated = service.update(record.getId(), null, true, null);
        assertTrue(reactivated.isActive());
        assertNull(reactivated.getRevokedAt());
        assertEquals(record.getKey(), reactivated.getKey());
    }

    @Test
    void unknownIdsAreReported() {
        assertThrows(ClientKeyNotFoundException.class, () -> service.findOne(42));
        assertThrows(ClientKeyNotFoundException.class, () -> service.revoke(42));
        assertThrows(ClientKeyNotFoundException.class, () -> service.update(42, "x", null, null));
        assertFalse(service.remove(42));
    }

    @Test
    void removeDeletesTheRecord() {
        ClientKeyRecord record = service.create("Acme", null);

        assertTrue(service.remove(record.getId()));

        assertTrue(service.findAll().isEmpty());
        assertFalse(service.isAuthorized(record.getKey()));
    }

    @Test
    @DisplayName("Legacy files using isActive are understood")
    void readsLegacyActiveFlag() throws Exception {
        Files.writeString(storeFile, """
                [
                  {"id": 7, "key": "legacykey", "name": "Old client", "isActive": true,
                   "createdAt": "2024-01-01T00:00:00Z", "updatedAt": "2024-01-01T00:00:00Z"}
                ]
                """);

        assertTrue(service.isAuthorized("legacykey"));
        assertEquals("Old client", service.findOne(7).getName());
    }

    @Test
    void corruptRegistryFailsClosed() throws Exception {
        Files.writeString(storeFile, "{ not json");

        assertThrows(StorageException.class, () -> service.findAll());
        assertFalse(service.isAuthorized("anything"));
    }
}
