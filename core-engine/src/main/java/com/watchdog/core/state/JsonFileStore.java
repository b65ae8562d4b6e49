package com.watchdog.core.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes JSON documents on local disk.
 *
 * <p>
 * Writes go to a sibling temp file that is then moved over the target, so a
 * crash mid-write leaves the previous document intact. Timestamps are
 * written as ISO-8601 strings.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonFileStore {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonFileStore() {
        // utility class
    }

    /**
     * @return the shared mapper, configured for {@code java.time} types
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @param path document location
     * @param type target type
     * @return the parsed document, or empty when the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static <T> Optional<T> read(Path path, Class<T> type) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.ofNullable(MAPPER.readValue(path.toFile(), type));
    }

    /**
     * @param path document location
     * @param type target type reference, for generic documents
     * @return the parsed document, or empty when the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static <T> Optional<T> read(Path path, TypeReference<T> type) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.ofNullable(MAPPER.readValue(path.toFile(), type));
    }

    /**
     * Serialize {@code value} and atomically replace the file at {@code path}.
     *
     * @param path  document location; parent directories are created
     * @param value document to write
     * @throws IOException if serialization or the file system fails
     */
    public static void write(Path path, Object value) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Path absolute = path.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        // one temp file per write, so overlapping writers never share it
        Path tmp = Files.createTempFile(dir != null ? dir : Path.of("."), absolute.getFileName() + ".", ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
