package me.golemcore.agent.domain.processing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LineTruncatorTest {

    @Test
    void shouldLeaveShortLinesUntouched() {
        assertEquals("abc\nde", new LineTruncator(3).rewrite("abc\nde"));
    }

    @Test
    void shouldCutEachLongLine() {
        assertEquals("abc...\nxyz...", new LineTruncator(3).rewrite("abcdef\nxyzxyz"));
    }

    @Test
    void shouldDropTrailingNewlineAndCarriageReturns() {
        assertEquals("one\ntwo", new LineTruncator(10).rewrite("one\r\ntwo\n"));
    }

    @Test
    void shouldKeepEmptyText() {
        assertEquals("", new LineTruncator(3).rewrite(""));
    }

    @Test
    void shouldRejectNegativeLength() {
        assertThrows(IllegalArgumentException.class, () -> new LineTruncator(-1));
    }
}
