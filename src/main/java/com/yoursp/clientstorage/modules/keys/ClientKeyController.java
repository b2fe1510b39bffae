package com.yoursp.clientstorage.modules.keys;

import com.yoursp.clientstorage.model.ClientKeyRecord;
import com.yoursp.clientstorage.modules.keys.dto.CreateClientKeyRequest;
import com.yoursp.clientstorage.modules.keys.dto.UpdateClientKeyRequest;
import com.yoursp.clientstorage.modules.keys.exception.ClientKeyNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Admin endpoints for the client key lifecycle.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>GET /admin/client-keys: list all keys</li>
 * <li>POST /admin/client-keys: create a key</li>
 * <li>GET /admin/client-keys/{id}: one key</li>
 * <li>PATCH /admin/client-keys/{id}: rename, (de)activate, annotate</li>
 * <li>POST /admin/client-keys/{id}/revoke: deactivate</li>
 * <li>POST /admin/client-keys/{id}/rotate: issue a new key value</li>
 * <li>DELETE /admin/client-keys/{id}: remove the record</li>
 * </ul>
 */
@RestController
@RequestMapping("/admin/client-keys")
@RequiredArgsConstructor
public class ClientKeyController {

    private final ClientKeyService clientKeyService;

    @GetMapping
    public List<ClientKeyRecord> findAll() {
        return clientKeyService.findAll();
    }

    @PostMapping
    public ResponseEntity<ClientKeyRecord> create(@Valid @RequestBody CreateClientKeyRequest request) {
        ClientKeyRecord record = clientKeyService.create(request.name(), request.note());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @GetMapping("/{id}")
    public ClientKeyRecord findOne(@PathVariable long id) {
        return clientKeyService.findOne(id);
    }

    @PatchMapping("/{id}")
    public ClientKeyRecord update(@PathVariable long id, @Valid @RequestBody UpdateClientKeyRequest request) {
        return clientKeyService.update(id, request.name(), request.active(), request.note());
    }

    @PostMapping("/{id}/revoke")
    public ClientKeyRecord revoke(@PathVariable long id) {
        return clientKeyService.revoke(id);
    }

    @PostMapping("/{id}/rotate")
    public ClientKeyRecord rotate(@PathVariable long id) {
        return clientKeyService.rotate(id);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> remove(@PathVariable long id) {
        if (!clientKeyService.remove(id)) {
            throw new ClientKeyNotFoundException(id);
        }
        return Map.of("success", true);
    }
}
