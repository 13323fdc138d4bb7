package com.quoteterm.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.quoteterm.exception.StorageException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JSON files on local disk: whole-document state files and append-only JSON-lines logs.
 *
 * <p>State files are replaced atomically: the document is written to a sibling {@code .tmp} file
 * and moved over the target, so a crash leaves either the old or the new version, never a
 * truncated one. A file that exists but cannot be parsed is copied to
 * {@code <name>.corrupt.<epochSeconds>.bak} and treated as absent.
 *
 * <p>Instants are written as ISO-8601 strings whatever the shared mapper is configured with.
 */
@Component
public class JsonFileStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final ObjectMapper objectMapper;
    private final ObjectWriter documentWriter;
    private final ObjectWriter lineWriter;
    private final Clock clock;

    public JsonFileStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.documentWriter = objectMapper
                .writerWithDefaultPrettyPrinter()
                .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.lineWriter = objectMapper.writer().without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    /**
     * Reads a state file.
     *
     * @return the document, or empty when the file is missing or was corrupt (and has been
     *     backed up)
     * @throws StorageException if the file exists but cannot be read at all
     */
    public <T> Optional<T> read(Path path, Class<T> type) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException(path, "Failed to read", e);
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(bytes, type));
        } catch (IOException e) {
            Path backup = backupCorrupt(path, bytes);
            log.warn(
                    "Unreadable {} ({}), backed up to {} and starting empty",
                    path.getFileName(),
                    e.getMessage(),
                    backup.getFileName());
            return Optional.empty();
        }
    }

    /**
     * Replaces {@code path} with {@code value} serialized as pretty-printed JSON.
     *
     * @throws StorageException if the document cannot be written or moved into place
     */
    public void write(Path path, Object value) {
        byte[] bytes;
        try {
            bytes = documentWriter.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException(path, "Failed to serialize " + value.getClass().getSimpleName(), e);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            createParent(path);
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException(path, "Failed to write", e);
        }
    }

    /**
     * Appends {@code value} as one compact JSON line. The file is created if needed and never
     * truncated.
     */
    public void appendLine(Path path, Object value) {
        try {
            String line = lineWriter.writeValueAsString(value);
            createParent(path);
            try (BufferedWriter writer = Files.newBufferedWriter(
                    path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new StorageException(path, "Failed to append", e);
        }
    }

    /**
     * Reads every line of a JSON-lines file. Lines that do not parse are logged and skipped.
     */
    public <T> List<T> readLines(Path path, Class<T> type) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StorageException(path, "Failed to read", e);
        }
        List<T> values = new ArrayList<>(lines.size());
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                values.add(objectMapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable line {} of {}: {}", lineNumber, path.getFileName(), e.getOriginalMessage());
            }
        }
        return values;
    }

    // ---- Internal ----

    private Path backupCorrupt(Path path, byte[] bytes) {
        Path backup = path.resolveSibling(
                path.getFileName() + ".corrupt." + clock.instant().getEpochSecond() + ".bak");
        try {
            Files.write(backup, bytes);
        } catch (IOException e) {
            log.error("Failed to back up corrupt file {} to {}", path, backup, e);
        }
        return backup;
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}
