package me.relaybot.gateway.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResponseCleanerTest {

    private final ResponseCleaner cleaner = new ResponseCleaner();

    @Test
    void shouldRemoveNumberedListMarkers() {
        assertEquals("Steps:\none\ntwo\nthree", cleaner.clean("Steps:\n1. one\n2) two\n3、three"));
    }

    @Test
    void shouldRemoveBulletMarkersAtLineStart() {
        assertEquals("Items:\na\nb\nc\nd", cleaner.clean("Items:\n- a\n* b\n• c\n·d"));
    }

    @Test
    void shouldKeepMarkerOnFirstLine() {
        assertEquals("- first\nsecond", cleaner.clean("  - first\n- second  "));
    }

    @Test
    void shouldCollapseBlankLines() {
        assertEquals("para one\npara two", cleaner.clean("para one\n\n\npara two"));
    }

    @Test
    void shouldKeepInlineDashes() {
        assertEquals("A — B", cleaner.clean("A — B"));
    }

    @Test
    void shouldReturnEmptyForNull() {
        assertEquals("", cleaner.clean(null));
    }
}
