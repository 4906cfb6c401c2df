package com.spa.aggregator.crawl.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spa.aggregator.crawl.model.EnrichmentCheckpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps the enrichment checkpoint in a JSON file. Writes go to a temporary sibling file that is then renamed over
 * the target, so readers never observe a partial document.
 */
public class EnrichmentCheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentCheckpointStore.class);

    private final ObjectMapper objectMapper;
    private final Path path;
    private final Object writeLock = new Object();

    public EnrichmentCheckpointStore(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path.toAbsolutePath();
    }

    public Path path() {
        return path;
    }

    public EnrichmentCheckpoint load() {
        if (!Files.exists(path)) {
            return EnrichmentCheckpoint.initial();
        }
        try {
            EnrichmentCheckpoint checkpoint = objectMapper.readValue(path.toFile(), EnrichmentCheckpoint.class);
            return checkpoint == null ? EnrichmentCheckpoint.initial() : checkpoint;
        } catch (IOException e) {
            log.warn("Unreadable enrichment checkpoint {}, starting from offset 0", path, e);
            return EnrichmentCheckpoint.initial();
        }
    }

    public void save(EnrichmentCheckpoint checkpoint) {
        synchronized (writeLock) {
            Path tmp = null;
            try {
                Path dir = path.getParent();
                if (dir != null) {
                    Files.createDirectories(dir);
                }
                tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), checkpoint);
                try {
                    Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                deleteQuietly(tmp);
                throw new UncheckedIOException("Unable to write enrichment checkpoint " + path, e);
            }
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temporary checkpoint {}", tmp, e);
        }
    }
}
