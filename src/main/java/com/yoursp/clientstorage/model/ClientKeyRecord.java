package com.yoursp.clientstorage.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One client key, as persisted in the key registry file.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ClientKeyRecord {

    private long id;

    /** 64 lowercase hex characters; also the name of the client's namespace directory. */
    private String key;

    private String name;

    @JsonAlias("isActive")
    private boolean active;

    private Instant revokedAt;

    private String note;

    private Instant createdAt;

    private Instant updatedAt;
}
