package org.fm.analysis;

import org.fm.TestModels;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class SelectionEditorTest {

    private final SelectionEditor editor = new SelectionEditor(TestModels.load(TestModels.SEARCH_APP));

    @Test
    void selectingAddsAncestors() {
        Set<String> result = editor.select(Set.of(), "Card");

        assertEquals(List.of("Root", "Payment", "Card"), List.copyOf(result));
    }

    @Test
    void selectingXorMemberClearsSiblings() {
        Set<String> result = editor.select(List.of("Root", "Search", "ByName", "Location"), "ByLocation");

        assertEquals(List.of("Root", "Search", "ByLocation", "Location"), List.copyOf(result));
    }

    @Test
    void selectingOrMemberKeepsSiblings() {
        Set<String> result = editor.select(List.of("Root", "Payment", "Cash"), "Card");

        assertEquals(List.of("Root", "Payment", "Card", "Cash"), List.copyOf(result));
    }

    @Test
    void deselectingRemovesSubtree() {
        Set<String> result = editor.deselect(List.of("Root", "Search", "ByName", "Payment", "Card", "Cash"), "Payment");

        assertEquals(List.of("Root", "Search", "ByName"), List.copyOf(result));
    }

    @Test
    void toggleSwitchesMembership() {
        List<String> start = List.of("Root", "Location");

        assertEquals(List.of("Root"), List.copyOf(editor.toggle(start, "Location")));
        assertEquals(List.of("Root", "Search", "ByName", "Location"), List.copyOf(editor.toggle(start, "ByName")));
    }

    @Test
    void unknownNamesInInputStayAtTheEnd() {
        Set<String> result = editor.select(List.of("Ghost", "Root"), "Location");

        assertEquals(List.of("Root", "Location", "Ghost"), List.copyOf(result));
    }

    @Test
    void rejectsUnknownTarget() {
        assertThrows(IllegalArgumentException.class, () -> editor.select(Set.of(), "Ghost"));
        assertThrows(IllegalArgumentException.class, () -> editor.deselect(Set.of(), "Ghost"));
    }
}
