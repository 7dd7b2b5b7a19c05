package org.fm.cnf;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

final class VariableRegistryTest {

    @Test
    void assignsDenseIdsInFirstSeenOrder() {
        VariableRegistry registry = new VariableRegistry();

        assertEquals(1, registry.getOrCreate("Root"));
        assertEquals(2, registry.getOrCreate("A"));
        assertEquals(1, registry.getOrCreate("Root"));
        assertEquals(3, registry.getOrCreate("B"));

        assertEquals(3, registry.size());
        assertEquals(List.of("Root", "A", "B"), List.copyOf(registry.asMap().keySet()));
    }

    @Test
    void lookupsOfUnknownEntries() {
        VariableRegistry registry = new VariableRegistry();
        registry.getOrCreate("A");

        assertEquals(0, registry.idOf("Ghost"));
        assertNull(registry.nameOf(7));
        assertEquals("A", registry.nameOf(-1));
        assertFalse(registry.contains("Ghost"));
    }
}
