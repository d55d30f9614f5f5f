package dev.pekelund.billing.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * History kept in Google Cloud Storage, one JSON object per packet. Updates use generation
 * preconditions, so {@link #compareAndSet} only succeeds against the exact object version that
 * was read.
 */
public class GcsHistoryStore implements HistoryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsHistoryStore.class);
    private static final String DEFAULT_PREFIX = "hash-history/";
    private static final String OBJECT_SUFFIX = ".json";
    private static final int PRECONDITION_FAILED = 412;

    private final Storage storage;
    private final String bucket;
    private final String prefix;
    private final ObjectMapper objectMapper;

    public GcsHistoryStore(Storage storage, String bucket, ObjectMapper objectMapper) {
        this(storage, bucket, DEFAULT_PREFIX, objectMapper);
    }

    public GcsHistoryStore(Storage storage, String bucket, String prefix, ObjectMapper objectMapper) {
        this.storage = Objects.requireNonNull(storage, "storage");
        Assert.isTrue(StringUtils.hasText(bucket), "A history bucket must be configured for the GCS history store");
        this.bucket = bucket;
        this.prefix = StringUtils.hasText(prefix) ? prefix : DEFAULT_PREFIX;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        LOGGER.info("GcsHistoryStore initialized with location gs://{}/{}", bucket, this.prefix);
    }

    @Override
    public Map<String, HistoryRecord> loadAll() {
        try {
            Map<String, HistoryRecord> records = new TreeMap<>();
            for (Blob blob : storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll()) {
                if (blob.isDirectory() || !blob.getName().endsWith(OBJECT_SUFFIX)) {
                    continue;
                }
                records.put(packetIdOf(blob.getName()), parse(blob));
            }
            LOGGER.info("Loaded {} history records from gs://{}/{}", records.size(), bucket, prefix);
            return Collections.unmodifiableMap(records);
        } catch (StorageException ex) {
            throw new HistoryStoreException("Unable to list history in gs://" + bucket + "/" + prefix, ex);
        }
    }

    @Override
    public Optional<HistoryRecord> find(String packetId) {
        try {
            Blob blob = storage.get(blobId(packetId));
            return blob != null ? Optional.of(parse(blob)) : Optional.empty();
        } catch (StorageException ex) {
            throw new HistoryStoreException("Unable to read history for " + packetId, ex);
        }
    }

    @Override
    public boolean compareAndSet(String packetId, HistoryRecord expected, HistoryRecord replacement) {
        Objects.requireNonNull(replacement, "replacement");
        BlobId currentId = blobId(packetId);
        try {
            Blob current = storage.get(currentId);
            Storage.BlobTargetOption precondition;
            BlobId targetId;
            if (expected == null) {
                if (current != null) {
                    return false;
                }
                targetId = currentId;
                precondition = Storage.BlobTargetOption.doesNotExist();
            } else {
                if (current == null || !expected.equals(parse(current))) {
                    return false;
                }
                targetId = BlobId.of(bucket, currentId.getName(), current.getGeneration());
                precondition = Storage.BlobTargetOption.generationMatch();
            }

            BlobInfo info = BlobInfo.newBuilder(targetId)
                .setContentType("application/json")
                .build();
            storage.create(info, objectMapper.writeValueAsBytes(replacement), precondition);
            return true;
        } catch (StorageException ex) {
            if (ex.getCode() == PRECONDITION_FAILED) {
                LOGGER.warn("History for {} was updated concurrently; not overwriting", packetId);
                return false;
            }
            throw new HistoryStoreException("Unable to write history for " + packetId, ex);
        } catch (IOException ex) {
            throw new HistoryStoreException("Unable to serialize history for " + packetId, ex);
        }
    }

    @Override
    public boolean reset(String packetId) {
        try {
            return storage.delete(blobId(packetId));
        } catch (StorageException ex) {
            throw new HistoryStoreException("Unable to reset history for " + packetId, ex);
        }
    }

    @Override
    public void resetAll() {
        try {
            int deleted = 0;
            for (Blob blob : storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll()) {
                if (!blob.isDirectory() && storage.delete(blob.getBlobId())) {
                    deleted++;
                }
            }
            LOGGER.info("Reset {} history records in gs://{}/{}", deleted, bucket, prefix);
        } catch (StorageException ex) {
            throw new HistoryStoreException("Unable to reset history in gs://" + bucket + "/" + prefix, ex);
        }
    }

    String objectName(String packetId) {
        return prefix + URLEncoder.encode(packetId, StandardCharsets.UTF_8) + OBJECT_SUFFIX;
    }

    private String packetIdOf(String objectName) {
        String encoded = objectName.substring(prefix.length(), objectName.length() - OBJECT_SUFFIX.length());
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }

    private BlobId blobId(String packetId) {
        return BlobId.of(bucket, objectName(packetId));
    }

    private HistoryRecord parse(Blob blob) {
        try {
            return objectMapper.readValue(blob.getContent(), HistoryRecord.class);
        } catch (IOException ex) {
            throw new HistoryStoreException("Corrupt history object gs://" + bucket + "/" + blob.getName(), ex);
        }
    }
}
