// file: core/src/test/java/io/treekv/core/PathResolverTest.java
package io.treekv.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathResolverTest {

    @Test
    void root_only_paths_yield_single_root_segment() {
        assertEquals(List.of("/"), PathResolver.split("/"));
        assertEquals(List.of("/"), PathResolver.split(""));
        assertEquals(List.of("/"), PathResolver.split(null));
        assertEquals(List.of("/"), PathResolver.split("///"));
    }

    @Test
    void empty_components_are_dropped() {
        assertEquals(List.of("/", "foo", "bar"), PathResolver.split("//foo///bar/"));
    }

    @Test
    void escaped_slash_stays_inside_one_segment() {
        var parts = PathResolver.split("/foo/bar%2fbaz");
        assertEquals(List.of("/", "foo", "bar%2fbaz"), parts);
        assertEquals(2, PathResolver.depth(parts));
    }

    @Test
    void canonical_form_normalises_slashes() {
        assertEquals("/a/b", PathResolver.canonical(PathResolver.split("/a//b/")));
        assertEquals("/", PathResolver.canonical(PathResolver.split("/")));
    }

    @Test
    void parent_and_last_of_nested_path() {
        var parts = PathResolver.split("/a/b/c");
        assertEquals(List.of("/", "a", "b"), PathResolver.parent(parts));
        assertEquals("c", PathResolver.last(parts));

        var root = PathResolver.split("/");
        assertEquals(root, PathResolver.parent(root));
        assertEquals("/", PathResolver.last(root));
    }
}
