package in.hostsnap.snapshot.change;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultisetChangeDetectorTest {

    private final ChangeDetector detector = MultisetChangeDetector.INSTANCE;

    @Test
    void testSameElementsInDifferentOrderAreUnchanged() {
        assertFalse(detector.hasChanged(List.of(3, 1, 2), List.of(1, 2, 3)));
    }

    @Test
    void testEmptyToEmptyIsUnchanged() {
        assertFalse(detector.hasChanged(List.of(), List.of()));
    }

    @Test
    void testDuplicateCountMatters() {
        assertTrue(detector.hasChanged(List.of("a", "a", "b"), List.of("a", "b", "b")),
            "Same distinct values with different multiplicities is a change");
        assertTrue(detector.hasChanged(List.of("a", "b"), List.of("a", "b", "b")));
    }

    @Test
    void testReplacedElementIsChange() {
        assertTrue(detector.hasChanged(List.of(10, 20, 30), List.of(10, 20, 40)));
    }

    @Test
    void testRecordsCompareByValue() {
        record Row(long id, String name) {}

        assertFalse(detector.hasChanged(
            List.of(new Row(1, "init"), new Row(2, "sshd")),
            List.of(new Row(2, "sshd"), new Row(1, "init"))));
        assertTrue(detector.hasChanged(
            List.of(new Row(1, "init")),
            List.of(new Row(1, "systemd"))));
    }
}
