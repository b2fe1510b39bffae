package com.yoursp.clientstorage.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Binds the {@code storage.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    /** Directory holding one sub-directory per client. */
    private String root = "storage-data";

    /** URL prefix under which stored files are served publicly. */
    private String staticPrefix = "storage-data";

    /** URL prefix of the authenticated storage API. */
    private String apiPrefix = "storage";

    /** Request header carrying the client key. */
    private String clientHeader = "x-client-key";

    /** JSON file of the client key registry; defaults to a sibling of the root. */
    private String keysFile;

    public Path getRootPath() {
        return Paths.get(root).toAbsolutePath().normalize();
    }

    public Path getKeysFilePath() {
        if (keysFile != null && !keysFile.isBlank()) {
            return Paths.get(keysFile).toAbsolutePath().normalize();
        }
        return getRootPath().resolveSibling("client-keys.json");
    }
}
