// file: core/src/test/java/io/treekv/core/ETagsTest.java
package io.treekv.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ETagsTest {

    @Test
    void matches_fnv1a_64_reference_values() {
        assertEquals("y/Kc5IQiIyU=", ETags.of(new byte[0]));
        assertEquals("hZRBcfc5Z+g=", ETags.of("foobar".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void deterministic_and_twelve_chars() {
        byte[] v = "foobarbaz".getBytes(StandardCharsets.UTF_8);
        String a = ETags.of(v);
        String b = ETags.of(v.clone());
        assertEquals(a, b);
        assertEquals(12, a.length());
    }

    @Test
    void single_byte_difference_changes_tag() {
        assertNotEquals(ETags.of("foobar".getBytes()), ETags.of("foobaz".getBytes()));
    }
}
