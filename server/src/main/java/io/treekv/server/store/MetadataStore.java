// file: server/src/main/java/io/treekv/server/store/MetadataStore.java
package io.treekv.server.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.treekv.core.MetadataRecord;
import io.treekv.core.PathResolver;
import io.treekv.storage.Bucket;
import io.treekv.storage.BucketStore;
import io.treekv.storage.Tx;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-path header records kept in their own top-level bucket.
 * <p>
 * Responsibilities:
 *  - Map canonical path -> {@link MetadataRecord}, serialized as a JSON object
 *    of header name -> list of values (e.g. {"ETag":["hZRBcfc5Z+g="]}).
 *  - Share the caller's transaction, so a record and its value are written
 *    and removed atomically.
 * <p>
 * The bucket key starts with a NUL byte, which can never be a path segment,
 * so user buckets cannot collide with it.
 */
public final class MetadataStore {
    public static final String BUCKET = "\0headers";

    private static final TypeReference<Map<String, List<String>>> HEADER_MAP = new TypeReference<>() {};

    private final ObjectMapper json;

    public MetadataStore(ObjectMapper json) {
        this.json = json;
    }

    /**
     * Create the metadata bucket with the empty root record, and the root
     * namespace bucket. Idempotent; run once at startup.
     */
    public void bootstrap(BucketStore store) {
        store.update(tx -> {
            Bucket headers = tx.createBucketIfNotExists(BUCKET);
            if (headers.get(PathResolver.ROOT) == null) {
                headers.put(PathResolver.ROOT, serialize(MetadataRecord.empty()));
            }
            tx.createBucketIfNotExists(NamespaceNavigator.ROOT_BUCKET);
            return null;
        });
    }

    /** Stored record for 'path', or null if none. */
    public MetadataRecord get(Tx tx, String path) {
        byte[] raw = bucket(tx).get(path);
        return raw == null ? null : deserialize(path, raw);
    }

    public void put(Tx tx, String path, MetadataRecord record) {
        bucket(tx).put(path, serialize(record));
    }

    public void delete(Tx tx, String path) {
        bucket(tx).delete(path);
    }

    /** Remove every record strictly below 'path' (used when a whole container goes). */
    public int deleteBeneath(Tx tx, String path) {
        String prefix = path.endsWith("/") ? path : path + "/";
        Bucket b = bucket(tx);
        List<String> doomed = new ArrayList<>();
        for (String key : b.keys()) {
            if (key.startsWith(prefix)) {
                doomed.add(key);
            }
        }
        doomed.forEach(b::delete);
        return doomed.size();
    }

    private static Bucket bucket(Tx tx) {
        Bucket b = tx.bucket(BUCKET);
        if (b == null) {
            throw new IllegalStateException("metadata bucket missing");
        }
        return b;
    }

    private byte[] serialize(MetadataRecord record) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        record.toHeaders().forEach((k, v) -> out.put(k, List.of(v)));
        try {
            return json.writeValueAsBytes(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize metadata record", e);
        }
    }

    private MetadataRecord deserialize(String path, byte[] raw) {
        Map<String, List<String>> in;
        try {
            in = json.readValue(raw, HEADER_MAP);
        } catch (IOException e) {
            throw new IllegalStateException("corrupt metadata record for " + path, e);
        }
        return new MetadataRecord(
                first(in, MetadataRecord.CONTENT_TYPE),
                first(in, MetadataRecord.CONTENT_LENGTH),
                first(in, MetadataRecord.ETAG),
                first(in, MetadataRecord.LAST_MODIFIED));
    }

    private static String first(Map<String, List<String>> headers, String name) {
        List<String> v = headers.get(name);
        return v == null || v.isEmpty() ? null : v.get(0);
    }
}
