package com.querysub.storage.progress;

import com.querysub.common.exception.ExceptionLogger;
import com.querysub.common.exception.ProgressStoreException;
import com.querysub.storage.watermark.WatermarkEntry;
import com.querysub.storage.watermark.WatermarkSet;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists subscription progress, one file per topic, under {dataDir}/subscribe/.
 *
 * File format (UTF-8):
 * - line 1: query text, verbatim
 * - lines 2..n: {entityId}:{progressKey}, ascending entity id
 *
 * The query text is a guard: any difference invalidates the whole file.
 * All I/O failures are logged and reported through return values, never thrown.
 */
@Singleton
public class ProgressStore {
    private static final Logger log = LoggerFactory.getLogger(ProgressStore.class);
    private static final String SUBSCRIBE_DIR = "subscribe";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path progressDir;

    public ProgressStore(@Value("${subscription.data-dir:./data}") String dataDir) {
        this.progressDir = Paths.get(dataDir, SUBSCRIBE_DIR);
        log.info("ProgressStore initialized: progressDir={}", progressDir);
    }

    public Path getProgressDir() {
        return progressDir;
    }

    public Path getProgressFile(String topic) {
        return progressDir.resolve(topic);
    }

    public boolean exists(String topic) {
        return Files.exists(getProgressFile(topic));
    }

    /**
     * Write a snapshot of the watermark set. Best effort.
     *
     * @return true if the file was written
     */
    public boolean save(String topic, String queryText, WatermarkSet watermarks) {
        try {
            Files.createDirectories(progressDir);
        } catch (IOException e) {
            log.error("Failed to create subscribe dir: {}", progressDir, e);
        }

        Path progressFile = getProgressFile(topic);
        Path tempFile = progressDir.resolve(topic + TEMP_SUFFIX);
        List<WatermarkEntry> snapshot = watermarks.entries();

        try {
            try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                writer.write(queryText);
                writer.write('\n');
                for (WatermarkEntry entry : snapshot) {
                    writer.write(Long.toString(entry.getEntityId()));
                    writer.write(':');
                    writer.write(Long.toString(entry.getProgressKey()));
                    writer.write('\n');
                }
            }

            Files.move(tempFile, progressFile, StandardCopyOption.REPLACE_EXISTING);

            log.trace("Saved subscription progress: topic={}, tables={}", topic, snapshot.size());
            return true;
        } catch (IOException e) {
            ExceptionLogger.logError(log, ProgressStoreException.writeFailed(topic, progressFile.toString(), e));
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                log.warn("Failed to remove temp progress file: {}", tempFile, cleanup);
            }
            return false;
        }
    }

    /**
     * Read the topic's progress file into {@code watermarks}.
     * The set is replaced only when the outcome is {@link LoadOutcome#LOADED}.
     */
    public LoadOutcome load(String topic, String queryText, WatermarkSet watermarks) {
        Path progressFile = getProgressFile(topic);

        try (BufferedReader reader = Files.newBufferedReader(progressFile, StandardCharsets.UTF_8)) {
            String storedQuery = reader.readLine();
            if (storedQuery == null) {
                log.trace("Invalid subscription progress file: {}", topic);
                return LoadOutcome.MALFORMED;
            }

            if (!storedQuery.equals(queryText)) {
                log.trace("Subscription sql statement mismatch: {}", topic);
                return LoadOutcome.QUERY_MISMATCH;
            }

            List<WatermarkEntry> loaded = new ArrayList<>();
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                WatermarkEntry entry = parseEntry(line);
                if (entry == null) {
                    ExceptionLogger.logConditional(log,
                            ProgressStoreException.malformed(topic, progressFile.toString(), lineNumber, line));
                    return LoadOutcome.MALFORMED;
                }
                loaded.add(entry);
            }

            watermarks.rebuild(loaded);
            log.trace("Subscription progress loaded, {} tables: {}", watermarks.size(), topic);
            return LoadOutcome.LOADED;

        } catch (NoSuchFileException e) {
            log.trace("Subscription progress file does not exist: {}", topic);
            return LoadOutcome.NOT_FOUND;
        } catch (IOException e) {
            ExceptionLogger.logWarn(log, ProgressStoreException.readFailed(topic, progressFile.toString(), e));
            return LoadOutcome.READ_FAILED;
        }
    }

    /**
     * Remove the topic's progress file. Best effort.
     *
     * @return true if a file was removed
     */
    public boolean delete(String topic) {
        Path progressFile = getProgressFile(topic);
        try {
            return Files.deleteIfExists(progressFile);
        } catch (IOException e) {
            ExceptionLogger.logError(log, ProgressStoreException.deleteFailed(topic, progressFile.toString(), e));
            return false;
        }
    }

    private static WatermarkEntry parseEntry(String line) {
        int separator = line.indexOf(':');
        if (separator <= 0 || separator == line.length() - 1) {
            return null;
        }
        try {
            long entityId = Long.parseLong(line.substring(0, separator).trim());
            long progressKey = Long.parseLong(line.substring(separator + 1).trim());
            return new WatermarkEntry(entityId, progressKey);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
