// file: server/src/test/java/io/treekv/server/store/NamespaceNavigatorTest.java
package io.treekv.server.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.treekv.core.PathResolver;
import io.treekv.storage.DurableBucketStore;
import io.treekv.storage.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamespaceNavigatorTest {

    @TempDir Path dataDir;

    private DurableBucketStore store;

    @BeforeEach
    void open() {
        store = DurableBucketStore.open(dataDir, 1000);
        new MetadataStore(new ObjectMapper()).bootstrap(store);
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void chain_creation_is_idempotent_and_resolves() {
        List<String> segs = PathResolver.split("/a/b/c");
        store.update(tx -> NamespaceNavigator.getOrCreateContainerChain(tx, segs));
        store.update(tx -> NamespaceNavigator.getOrCreateContainerChain(tx, segs));

        store.view(tx -> {
            assertNotNull(NamespaceNavigator.resolveContainer(tx, segs));
            assertInstanceOf(NamespaceNavigator.Container.class, NamespaceNavigator.resolve(tx, segs));
            assertNull(NamespaceNavigator.resolveContainer(tx, PathResolver.split("/a/x/c")));
            return null;
        });
    }

    @Test
    void last_segment_may_be_a_value() {
        store.update(tx -> {
            NamespaceNavigator.getOrCreateContainerChain(tx, PathResolver.split("/a"))
                    .put("v", "hi".getBytes(StandardCharsets.UTF_8));
            return null;
        });
        store.view(tx -> {
            NamespaceNavigator.Resolved r = NamespaceNavigator.resolve(tx, PathResolver.split("/a/v"));
            NamespaceNavigator.Value v = assertInstanceOf(NamespaceNavigator.Value.class, r);
            assertArrayEquals("hi".getBytes(StandardCharsets.UTF_8), v.bytes());
            assertNull(NamespaceNavigator.resolve(tx, PathResolver.split("/a/v/deeper")));
            assertNull(NamespaceNavigator.resolve(tx, PathResolver.split("/a/missing")));
            return null;
        });
    }

    @Test
    void root_path_resolves_to_root_container() {
        store.view(tx -> {
            assertInstanceOf(NamespaceNavigator.Container.class, NamespaceNavigator.resolve(tx, PathResolver.split("/")));
            return null;
        });
    }

    @Test
    void chain_through_value_is_incompatible() {
        store.update(tx -> {
            NamespaceNavigator.getOrCreateContainerChain(tx, PathResolver.split("/a")).put("v", new byte[]{1});
            return null;
        });
        StoreException e = assertThrows(StoreException.class,
                () -> store.update(tx -> NamespaceNavigator.getOrCreateContainerChain(tx, PathResolver.split("/a/v/x"))));
        assertEquals(StoreException.Kind.INCOMPATIBLE_VALUE, e.kind());
    }
}
