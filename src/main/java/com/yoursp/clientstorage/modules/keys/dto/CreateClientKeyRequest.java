package com.yoursp.clientstorage.modules.keys.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /admin/client-keys.
 */
public record CreateClientKeyRequest(
        @NotBlank @Size(max = 200) String name,
        @Size(max = 1000) String note) {
}
