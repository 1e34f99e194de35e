// file: server/src/test/java/io/treekv/server/http/ListingPageTest.java
package io.treekv.server.http;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListingPageTest {

    private static String render(String base, List<String> names) {
        return new String(ListingPage.render(base, names), StandardCharsets.UTF_8);
    }

    @Test
    void links_each_name_under_the_base_path() {
        String html = render("/foo/", List.of("bar", "baz"));
        assertTrue(html.contains("<title>/foo/</title>"));
        assertTrue(html.contains("<a href=\"/foo/bar\">bar</a>"));
        assertTrue(html.contains("<a href=\"/foo/baz\">baz</a>"));
        assertFalse(html.contains("Empty bucket."));
    }

    @Test
    void empty_bucket_gets_a_note() {
        String html = render("/foo", List.of());
        assertTrue(html.contains("Empty bucket."));
        assertFalse(html.contains("<ul>"));
    }

    @Test
    void names_and_path_are_escaped() {
        String html = render("/a<b>", List.of("x\"&'y"));
        assertTrue(html.contains("<title>/a&lt;b&gt;</title>"));
        assertTrue(html.contains(">x&quot;&amp;&#x27;y</a>"));
        assertFalse(html.contains("<b>"));
    }

    @Test
    void join_collapses_slashes() {
        assertEquals("/a/b", ListingPage.join("/a/", "b"));
        assertEquals("/a/b", ListingPage.join("/a", "b"));
        assertEquals("/b", ListingPage.join("/", "b"));
        assertEquals("/b", ListingPage.join("", "b"));
    }
}
