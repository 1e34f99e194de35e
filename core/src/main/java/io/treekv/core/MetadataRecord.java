// file: core/src/main/java/io/treekv/core/MetadataRecord.java
package io.treekv.core;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP header state kept alongside a stored value.
 *
 * Fields:
 *  - contentType / contentLength: copied from the PUT request (may be null).
 *  - etag: computed from the value bytes by {@link ETags}.
 *  - lastModified: stamped at write time, RFC 1123 with numeric zone
 *    ("Mon, 02 Jan 2006 15:04:05 +0000").
 *
 * The root path carries the {@link #empty()} record: every field null.
 */
public record MetadataRecord(
        String contentType,
        String contentLength,
        String etag,
        String lastModified
) {
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";
    public static final String ETAG = "ETag";
    public static final String LAST_MODIFIED = "Last-Modified";

    public static final DateTimeFormatter RFC1123Z =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US)
                    .withZone(ZoneOffset.UTC);

    private static final MetadataRecord EMPTY = new MetadataRecord(null, null, null, null);

    public static MetadataRecord empty() {
        return EMPTY;
    }

    /**
     * Build the record for a freshly written value.
     * The ETag and Last-Modified are always computed here, never taken from the client.
     */
    public static MetadataRecord forValue(String contentType, String contentLength, byte[] value, Instant now) {
        return new MetadataRecord(contentType, contentLength, ETags.of(value), RFC1123Z.format(now));
    }

    /** Non-null fields as response headers, in a stable order. */
    public Map<String, String> toHeaders() {
        Map<String, String> out = new LinkedHashMap<>();
        if (contentType != null) out.put(CONTENT_TYPE, contentType);
        if (contentLength != null) out.put(CONTENT_LENGTH, contentLength);
        if (etag != null) out.put(ETAG, etag);
        if (lastModified != null) out.put(LAST_MODIFIED, lastModified);
        return out;
    }

    /** Header view for a partial (206) response: ETag and Content-Length describe the whole value, so drop them. */
    public Map<String, String> toPartialHeaders() {
        Map<String, String> out = toHeaders();
        out.remove(ETAG);
        out.remove(CONTENT_LENGTH);
        return out;
    }
}
