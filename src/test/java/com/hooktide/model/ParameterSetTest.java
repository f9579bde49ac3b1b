package com.hooktide.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterSetTest {

    @Test
    @DisplayName("same name in both namespaces is kept apart")
    void namespaces_shouldNotCollide() {
        ParameterSet params = ParameterSet.builder()
                .body("resourceId", "payload-value")
                .extension("resourceId", "svc-a")
                .build();

        assertEquals("payload-value", params.body("resourceId").orElseThrow());
        assertEquals("svc-a", params.extension("resourceId").orElseThrow());
        assertEquals(Map.of("body.resourceId", "payload-value", "extensions.resourceId", "svc-a"), params.flatten());
    }

    @Test
    @DisplayName("binding a name twice in one namespace is an error")
    void duplicateName_shouldThrow() {
        ParameterSet.Builder builder = ParameterSet.builder().extension("target", "a");
        assertThrows(IllegalStateException.class, () -> builder.extension("target", "b"));

        ParameterSet params = ParameterSet.builder().extension("target", "a").build();
        assertThrows(IllegalStateException.class, () -> params.withExtension("target", "b"));
    }

    @Test
    @DisplayName("null values are skipped and the set is read-only")
    void nullsSkipped_andImmutable() {
        ParameterSet params = ParameterSet.builder().body("branch", null).body("revision", "abc").build();

        assertTrue(params.body("branch").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> params.bodyFields().put("x", "y"));
    }

    @Test
    @DisplayName("withExtension returns a copy")
    void withExtension_shouldCopy() {
        ParameterSet original = ParameterSet.builder().body("revision", "abc").build();
        ParameterSet extended = original.withExtension("target", "svc-a-build-42");

        assertTrue(original.extension("target").isEmpty());
        assertEquals("svc-a-build-42", extended.extension("target").orElseThrow());
        assertEquals("abc", extended.body("revision").orElseThrow());
    }
}
