package com.yoursp.clientstorage.modules.keys.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Size;

/**
 * Request body for PATCH /admin/client-keys/{id}. Null fields are left
 * unchanged.
 */
public record UpdateClientKeyRequest(
        @Size(min = 1, max = 200) String name,
        @JsonAlias("isActive") Boolean active,
        @Size(max = 1000) String note) {
}
