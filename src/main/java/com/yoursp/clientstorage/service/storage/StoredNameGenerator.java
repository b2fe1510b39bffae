package com.yoursp.clientstorage.service.storage;

import com.yoursp.clientstorage.service.storage.exception.InvalidStoragePathException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;

/**
 * Builds and parses on-disk file names.
 * <p>
 * Layout: {@code <timestamp>_<disambiguator>_<originalName>}, e.g.
 * {@code 2026-10-19T08-15-30-123Z_3f9a0c1e_report.pdf}.
 * </p>
 * <ul>
 * <li>timestamp: UTC, millisecond precision, {@code :} and {@code .} replaced
 * by {@code -} so names sort chronologically and stay valid path segments</li>
 * <li>disambiguator: 8 hex chars from {@link SecureRandom}</li>
 * <li>original name: kept verbatim, may itself contain {@code _}</li>
 * </ul>
 * Stored names are limited to {@value #MAX_NAME_BYTES} UTF-8 bytes, the
 * usual single path segment limit.
 */
@Component
public class StoredNameGenerator {

    static final String SEPARATOR = "_";
    static final int MAX_NAME_BYTES = 255;
    private static final int DISAMBIGUATOR_BYTES = 4;

    private final Clock clock;
    private final SecureRandom random;

    public StoredNameGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    public StoredNameGenerator(Clock clock, SecureRandom random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Generate a unique stored name for the given original file name.
     *
     * @param originalName name supplied by the uploader; only its last path
     *                     segment is kept
     * @return the stored name
     * @throws InvalidStoragePathException when no usable name remains or the
     *                                     stored name would exceed
     *                                     {@value #MAX_NAME_BYTES} bytes
     */
    public String generate(String originalName) {
        String baseName = baseName(originalName);
        String storedName = timestamp() + SEPARATOR + disambiguator() + SEPARATOR + baseName;
        if (storedName.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
            throw new InvalidStoragePathException("File name too long: " + baseName.length() + " characters");
        }
        return storedName;
    }

    /**
     * Hidden name for the in-progress copy of {@code storedName}. Only the
     * timestamp and disambiguator are kept so the name stays short.
     */
    static String partialName(String storedName) {
        int first = storedName.indexOf(SEPARATOR);
        int second = first < 0 ? -1 : storedName.indexOf(SEPARATOR, first + 1);
        String prefix = second < 0 ? storedName : storedName.substring(0, second);
        return "." + prefix + ".part";
    }

    /**
     * Recover the original file name from a stored name. Names that do not
     * follow the generated layout (legacy uploads) are returned unchanged.
     */
    public String parse(String storedName) {
        if (storedName == null) {
            return null;
        }
        String[] parts = storedName.split(SEPARATOR, 3);
        if (parts.length < 3) {
            return storedName;
        }
        return parts[2];
    }

    /**
     * Strip any directory part a browser may have sent along with the name.
     */
    static String baseName(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            throw new InvalidStoragePathException("Original file name is required");
        }
        String name = originalName.trim();
        int cut = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (cut >= 0) {
            name = name.substring(cut + 1);
        }
        if (name.isEmpty() || ".".equals(name) || "..".equals(name) || name.indexOf('\0') >= 0) {
            throw new InvalidStoragePathException("Invalid file name: " + originalName);
        }
        return name;
    }

    private String timestamp() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        String iso = DateTimeFormatter.ISO_INSTANT.format(now);
        // ISO_INSTANT drops the fraction when it is zero; keep a fixed width
        if (iso.indexOf('.') < 0) {
            iso = iso.substring(0, iso.length() - 1) + ".000Z";
        }
        return iso.replace(':', '-').replace('.', '-');
    }

    private String disambiguator() {
        byte[] bytes = new byte[DISAMBIGUATOR_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
