package com.commandcenter.backend.service.storage;

import com.commandcenter.backend.config.DashboardProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * One pretty-printed JSON document per collection key under the data directory.
 * <p>
 * Stateless apart from the directory: callers own the in-memory value and the lock around
 * load-mutate-save (see {@link PersistentDocument}).
 */
@Component
public class JsonCollectionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonCollectionStore.class);

    private final ObjectMapper om;
    private final Path dataDir;

    @Autowired
    public JsonCollectionStore(ObjectMapper om, DashboardProperties props) {
        this(om, props.getDataDir());
    }

    public JsonCollectionStore(ObjectMapper om, Path dataDir) {
        this.om = om;
        this.dataDir = dataDir;
    }

    public Path pathFor(String key) {
        return dataDir.resolve(key + ".json");
    }

    /**
     * Reads the document for {@code key}. A missing, empty, {@code null} or unparseable document
     * yields {@code fallback}; this never throws.
     */
    public <T> T load(String key, TypeReference<T> type, Supplier<T> fallback) {
        Path file = pathFor(key);
        if (!Files.exists(file)) {
            return fallback.get();
        }
        try {
            byte[] raw = Files.readAllBytes(file);
            if (raw.length == 0) {
                return fallback.get();
            }
            ObjectReader reader = om.readerFor(type)
                    .with(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
            T value = reader.readValue(raw);
            return value == null ? fallback.get() : value;
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable '{}' document at {}, starting from default: {}", key, file, e.getMessage());
            return fallback.get();
        }
    }

    /**
     * Replaces the document for {@code key}. The new content is written to a sibling temp file and
     * moved over the old one, so readers never see a half-written document.
     */
    public void save(String key, Object value) {
        Path file = pathFor(key);
        Path tmp = null;
        try {
            Files.createDirectories(dataDir);
            byte[] out = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
            tmp = Files.createTempFile(dataDir, key + "-", ".tmp");
            Files.write(tmp, out);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("failed to write '" + key + "' to " + file, e);
        }
    }

    /** Deep copy through the same codec used on disk. */
    public <T> T copy(T value, TypeReference<T> type) {
        try {
            return om.readValue(om.writeValueAsBytes(value), type);
        } catch (IOException e) {
            throw new StorageException("failed to copy value of type " + type.getType(), e);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}", tmp, e);
        }
    }
}
