package com.yoursp.clientstorage.exception;

import com.yoursp.clientstorage.modules.keys.exception.ClientKeyNotFoundException;
import com.yoursp.clientstorage.service.storage.exception.InvalidStoragePathException;
import com.yoursp.clientstorage.service.storage.exception.StorageException;
import com.yoursp.clientstorage.service.storage.exception.StoredFileNotFoundException;
import com.yoursp.clientstorage.service.storage.exception.UnauthorizedClientException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @BeforeEach
    void setUp() {
        MDC.put("correlationId", "test-correlation");
    }

    @AfterEach
    void tearDown() {
        MDC.remove("correlationId");
    }

    @Test
    void invalidPathIsBadRequestWithMessage() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleInvalidPath(new InvalidStoragePathException("Invalid filename"));

        assertEquals(400, response.getStatusCode().value());
        assertEquals("INVALID_ARGUMENT", response.getBody().get("error"));
        assertEquals("Invalid filename", response.getBody().get("message"));
        assertEquals("test-correlation", response.getBody().get("correlationId"));
    }

    @Test
    void missingFileDoesNotEchoTheReference() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleFileNotFound(new StoredFileNotFoundException("u42/secret-plan.pdf"));

        assertEquals(404, response.getStatusCode().value());
        assertEquals("File not found", response.getBody().get("message"));
    }

    @Test
    void unknownClientKeyIsNotFound() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleClientKeyNotFound(new ClientKeyNotFoundException(9));

        assertEquals(404, response.getStatusCode().value());
        assertEquals("Client key not found: 9", response.getBody().get("message"));
    }

    @Test
    void unauthorizedClientIs401() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleUnauthorized(new UnauthorizedClientException("Invalid or revoked client key"));

        assertEquals(401, response.getStatusCode().value());
        assertEquals("UNAUTHORIZED", response.getBody().get("error"));
    }

    @Test
    void storageFaultHidesFilesystemDetails() {
        ResponseEntity<Map<String, Object>> response = handler.handleStorageException(
                new StorageException("Failed to store /srv/storage-data/abc/file.pdf"));

        assertEquals(500, response.getStatusCode().value());
        assertEquals("STORAGE_ERROR", response.getBody().get("error"));
        assertFalse(response.getBody().get("message").toString().contains("/srv"));
    }

    @Test
    void frameworkClientErrorsKeepTheirStatus() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(
                new MissingServletRequestParameterException("owner", "String"));

        assertEquals(400, response.getStatusCode().value());
    }

    @Test
    void unexpectedExceptionIs500() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleGenericException(new IllegalStateException("boom"));

        assertEquals(500, response.getStatusCode().value());
        assertFalse(response.getBody().get("message").toString().contains("boom"));
    }
}
