package io.github.manjago.mutagen.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.manjago.mutagen.tracking.MutationRecord;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mutation record storage using H2 MVStore.
 *
 * Structure:
 * - "meta" map: format version, record count, save time
 * - "records" map: record id to the record as JSON
 *
 * A save replaces whatever the file held before.
 */
public class TrackerStore {

    private static final Logger log = LoggerFactory.getLogger(TrackerStore.class);

    private static final int VERSION = 1;

    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_RECORDS = "records";
    private static final String KEY_SAVED_AT = "saved_at";

    private static final String MAP_META = "meta";
    private static final String MAP_RECORDS = "records";

    private static final ObjectMapper JSON = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private TrackerStore() {
    }

    /**
     * Save all tracker records to an MVStore file.
     */
    public static void save(Path path, TierPerformanceTracker tracker) throws IOException {
        List<MutationRecord> records = tracker.records();
        log.info("Saving {} mutation records to {}", records.size(), path);

        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .compress()
                .open()) {

            MVMap<String, Long> meta = store.openMap(MAP_META);
            meta.put(KEY_VERSION, (long) VERSION);
            meta.put(KEY_RECORDS, (long) records.size());
            meta.put(KEY_SAVED_AT, System.currentTimeMillis());

            MVMap<Long, String> data = store.openMap(MAP_RECORDS);
            data.clear();
            for (MutationRecord record : records) {
                data.put(record.id(), JSON.writeValueAsString(record));
            }

            store.commit();
        } catch (MVStoreException e) {
            throw new IOException("Cannot write tracker store " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load records saved by {@link #save}, ordered by id.
     */
    public static List<MutationRecord> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        log.info("Loading mutation records from {}", path);

        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .readOnly()
                .open()) {

            MVMap<String, Long> meta = store.openMap(MAP_META);
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            if (version < 1 || version > VERSION) {
                throw new IOException("Unsupported tracker store version: " + version);
            }

            MVMap<Long, String> data = store.openMap(MAP_RECORDS);
            List<MutationRecord> records = new ArrayList<>(data.size());
            for (Map.Entry<Long, String> entry : data.entrySet()) {
                try {
                    records.add(JSON.readValue(entry.getValue(), MutationRecord.class));
                } catch (JsonProcessingException e) {
                    throw new IOException("Corrupt mutation record #" + entry.getKey() + ": " + e.getOriginalMessage(), e);
                }
            }

            long expected = meta.getOrDefault(KEY_RECORDS, (long) records.size());
            if (expected != records.size()) {
                log.warn("Tracker store lists {} records but holds {}", expected, records.size());
            }
            log.info("Loaded {} mutation records", records.size());
            return records;
        } catch (MVStoreException e) {
            throw new IOException("Cannot read tracker store " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Tracker with the records of a store file.
     */
    public static TierPerformanceTracker loadTracker(Path path) throws IOException {
        TierPerformanceTracker tracker = new TierPerformanceTracker();
        tracker.restore(load(path));
        return tracker;
    }
}
