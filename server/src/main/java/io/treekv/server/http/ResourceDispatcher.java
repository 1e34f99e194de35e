// file: server/src/main/java/io/treekv/server/http/ResourceDispatcher.java
package io.treekv.server.http;

import io.treekv.core.ByteRange;
import io.treekv.core.MetadataRecord;
import io.treekv.core.PathResolver;
import io.treekv.core.Preconditions;
import io.treekv.core.Ranges;
import io.treekv.core.UnsatisfiableRangeException;
import io.treekv.server.store.MetadataStore;
import io.treekv.server.store.NamespaceNavigator;
import io.treekv.server.store.NamespaceNavigator.Container;
import io.treekv.server.store.NamespaceNavigator.Resolved;
import io.treekv.server.store.NamespaceNavigator.Value;
import io.treekv.storage.Bucket;
import io.treekv.storage.BucketStore;
import io.treekv.storage.StoreException;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Maps HTTP verbs on an escaped path onto the bucket tree.
 * <p>
 * Responsibilities:
 *  - Open exactly one transaction per request (read-only for HEAD/GET,
 *    writable for PUT/DELETE) and do every read and write inside it.
 *  - Evaluate If-Match / If-None-Match against the stored metadata record in
 *    that same transaction, so check-then-write is atomic.
 *  - Keep values and metadata records in lockstep.
 *  - Turn every failure into one status + plain-text message.
 * <p>
 * Verbs:
 *   - HEAD    stored metadata headers, 404 if none
 *   - OPTIONS Allow header only
 *   - GET     listing (bucket), full value, 206 range or 304
 *   - PUT     bodyless: create bucket chain (200); with body: write value (201/204)
 *   - DELETE  value or whole bucket at depth >= 2 (204)
 *   - other   405 with Allow
 */
public final class ResourceDispatcher {
    private static final Logger log = Logger.getLogger(ResourceDispatcher.class.getName());

    public static final String ALLOW = "GET,PUT,DELETE,HEAD";
    public static final long MAX_BODY_BYTES = 1L << 24; // 16 MiB

    private final BucketStore store;
    private final MetadataStore metadata;
    private final Listings listings;
    private final Clock clock;

    public ResourceDispatcher(BucketStore store, MetadataStore metadata, Listings listings, Clock clock) {
        this.store = store;
        this.metadata = metadata;
        this.listings = listings;
        this.clock = clock;
    }

    public ResourceResponse handle(ResourceRequest req) {
        try {
            return switch (req.method()) {
                case "HEAD" -> head(req);
                case "OPTIONS" -> new ResourceResponse(200).header("Allow", ALLOW);
                case "GET" -> get(req);
                case "PUT" -> put(req);
                case "DELETE" -> delete(req);
                default -> throw new MethodNotAllowedException();
            };
        } catch (HttpException e) {
            return ResourceResponse.failure(e);
        } catch (StoreException e) {
            if (e.kind() == StoreException.Kind.INCOMPATIBLE_VALUE) {
                return ResourceResponse.failure(new ConflictException()).cause(e);
            }
            return ResourceResponse.failure(new InternalErrorException("Internal server error.")).cause(e);
        } catch (RuntimeException e) {
            return ResourceResponse.failure(new InternalErrorException("Internal server error.")).cause(e);
        }
    }

    // ---------- verbs ----------

    private ResourceResponse head(ResourceRequest req) {
        String path = PathResolver.canonical(PathResolver.split(req.escapedPath()));
        return timed(() -> {
            MetadataRecord rec = store.view(tx -> metadata.get(tx, path));
            if (rec == null) {
                throw new NotFoundException("Not found.");
            }
            return new ResourceResponse(200).headers(rec.toHeaders());
        });
    }

    private ResourceResponse get(ResourceRequest req) {
        List<String> segments = PathResolver.split(req.escapedPath());
        String path = PathResolver.canonical(segments);
        RequestHeaders headers = req.headers();

        return timed(() -> store.view(tx -> {
            MetadataRecord rec = metadata.get(tx, path);
            if (rec != null && Preconditions.ifNoneMatchHits(rec, headers.all("If-None-Match"))) {
                ResourceResponse notModified = new ResourceResponse(304);
                if (rec.etag() != null) {
                    notModified.header(MetadataRecord.ETAG, rec.etag());
                }
                return notModified;
            }

            Resolved node = NamespaceNavigator.resolve(tx, segments);
            if (node == null) {
                if (rec != null) {
                    log.severe(() -> "Can't find content for metadata record at " + path + ": " + rec);
                    throw new InternalErrorException("Internal server error.");
                }
                throw new NotFoundException();
            }
            if (node instanceof Container c) {
                return listings.render(headers.first("Accept"), req.escapedPath(), c.bucket().keys());
            }

            byte[] value = ((Value) node).bytes();
            if (rec == null) {
                log.severe(() -> "Value without metadata record at " + path);
                throw new InternalErrorException("Internal server error.");
            }
            if (headers.has("Range")) {
                return partial(rec, value, headers.first("Range"));
            }
            return new ResourceResponse(200)
                    .headers(rec.toHeaders())
                    .header("Accept-Ranges", "bytes")
                    .body(value);
        }));
    }

    private static ResourceResponse partial(MetadataRecord rec, byte[] value, String range) {
        List<ByteRange> spans;
        try {
            spans = Ranges.parse(range, value.length);
        } catch (UnsatisfiableRangeException e) {
            throw new RangeNotSatisfiableException(value.length, e);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Bad request.", e);
        }
        ResourceResponse r = new ResourceResponse(206).headers(rec.toPartialHeaders());
        if (spans.size() == 1) {
            r.header("Content-Range", Ranges.contentRange(spans.get(0), value.length));
        }
        return r.body(Ranges.slice(value, spans));
    }

    private ResourceResponse put(ResourceRequest req) {
        rejectBadWriteHeaders(req);
        List<String> segments = PathResolver.split(req.escapedPath());
        String path = PathResolver.canonical(segments);
        RequestHeaders headers = req.headers();

        boolean hasBody = req.contentLength() > 0;
        if (!hasBody && req.chunked()) {
            throw new LengthRequiredException();
        }
        // read before taking the writer slot; a slow upload must not block other writers
        byte[] body = hasBody ? readBody(req) : null;

        return timed(() -> store.update(tx -> {
            MetadataRecord stored = metadata.get(tx, path);
            if (!Preconditions.ifMatchHolds(stored, headers.all("If-Match"))) {
                throw new PreconditionFailedException();
            }
            if (body == null) {
                NamespaceNavigator.getOrCreateContainerChain(tx, segments);
                return new ResourceResponse(200);
            }
            if (PathResolver.depth(segments) < 2) {
                throw new BadRequestException("Cannot PUT a value in the root bucket.");
            }

            Bucket parent = NamespaceNavigator.getOrCreateContainerChain(tx, PathResolver.parent(segments));
            parent.put(PathResolver.last(segments), body);

            String contentLength = headers.first(MetadataRecord.CONTENT_LENGTH);
            MetadataRecord fresh = MetadataRecord.forValue(
                    headers.first(MetadataRecord.CONTENT_TYPE),
                    contentLength != null ? contentLength : Integer.toString(body.length),
                    body,
                    clock.instant());
            metadata.put(tx, path, fresh);

            ResourceResponse r = new ResourceResponse(stored == null ? 201 : 204)
                    .header(MetadataRecord.ETAG, fresh.etag())
                    .header(MetadataRecord.LAST_MODIFIED, fresh.lastModified());
            if (stored == null) {
                r.header("Location", req.escapedPath());
            }
            return r;
        }));
    }

    private ResourceResponse delete(ResourceRequest req) {
        rejectBadWriteHeaders(req);
        List<String> segments = PathResolver.split(req.escapedPath());
        if (PathResolver.depth(segments) < 2) {
            throw new BadRequestException("Invalid path.");
        }
        String path = PathResolver.canonical(segments);
        String name = PathResolver.last(segments);
        RequestHeaders headers = req.headers();

        return timed(() -> store.update(tx -> {
            MetadataRecord stored = metadata.get(tx, path);
            if (!Preconditions.ifMatchHolds(stored, headers.all("If-Match"))) {
                throw new PreconditionFailedException();
            }
            Bucket parent = NamespaceNavigator.resolveContainer(tx, PathResolver.parent(segments));

            if (stored == null) {
                if (parent == null || parent.bucket(name) == null) {
                    throw new NotFoundException("Not found.");
                }
                parent.deleteBucket(name);
                int dropped = metadata.deleteBeneath(tx, path);
                log.fine(() -> "Deleted bucket " + path + " with " + dropped + " metadata records");
                return new ResourceResponse(204);
            }

            if (parent == null || parent.get(name) == null) {
                log.severe(() -> "Can't find content for metadata record at " + path + ": " + stored);
                throw new InternalErrorException("Internal server error.");
            }
            metadata.delete(tx, path);
            parent.delete(name);
            return new ResourceResponse(204);
        }));
    }

    // ---------- helpers ----------

    /** PUT/DELETE guards that need no transaction. */
    private static void rejectBadWriteHeaders(ResourceRequest req) {
        if (req.contentLength() > MAX_BODY_BYTES) {
            throw new BadRequestException("Request too large.");
        }
        String inm = req.headers().first("If-None-Match");
        if (inm != null && !inm.isEmpty()) {
            throw new PreconditionFailedException();
        }
    }

    private static byte[] readBody(ResourceRequest req) {
        int expected = (int) req.contentLength();
        byte[] buf;
        try {
            buf = req.body().readNBytes(expected);
        } catch (IOException e) {
            throw new BadRequestException("Bad request.", e);
        }
        if (buf.length < expected) {
            throw new BadRequestException("Bad request.");
        }
        return buf;
    }

    private static ResourceResponse timed(Supplier<ResourceResponse> work) {
        long start = System.nanoTime();
        ResourceResponse r = work.get();
        return r.storageMillis((System.nanoTime() - start) / 1_000_000L);
    }
}
