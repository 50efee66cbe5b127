package edu.isi.hyperkbest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class SemiringTest {

    @Test
    void maxPlusPrefersHigh() throws Exception {
        Semiring s = Semiring.get("maxplus");
        assertTrue(s instanceof MaxPlusSemiring);
        assertTrue(s.better(2, 1));
        assertFalse(s.better(1, 1));
        assertEquals(3.0, s.times(1, 2));
        assertEquals(-1, s.compare(2, 1));
        assertEquals(0, s.compare(1, 1));
        assertTrue(s.better(s.ONE(), s.ZERO()));
        assertTrue(s.priority(2) > s.priority(1));
    }

    @Test
    void tropicalPrefersLow() throws Exception {
        Semiring s = Semiring.get("tropical");
        assertTrue(s.better(1, 2));
        assertEquals(1, s.compare(2, 1));
        assertTrue(s.better(s.ONE(), s.ZERO()));
        // larger priority is still better
        assertTrue(s.priority(1) > s.priority(2));
    }

    @Test
    void unknownNameIsRejected() {
        assertThrows(ConfigureException.class, () -> Semiring.get("real"));
    }
}
