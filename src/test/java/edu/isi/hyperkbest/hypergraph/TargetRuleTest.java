package edu.isi.hyperkbest.hypergraph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import edu.isi.hyperkbest.DataFormatException;
import edu.isi.hyperkbest.features.ScoreBreakdown;

final class TargetRuleTest {

    @Test
    void slotsMapToAntecedents() throws Exception {
        TargetRule r = TargetRule.parse("NP", "  the [1] of [0] ");
        assertEquals(4, r.getSize());
        assertEquals(2, r.getArity());
        assertFalse(r.isNonTerminal(0));
        assertTrue(r.isNonTerminal(1));
        assertEquals(1, r.getNonTermIndex(1));
        assertEquals(0, r.getNonTermIndex(3));
        assertEquals(-1, r.getNonTermIndex(2));
        assertEquals("NP -> the [1] of [0]", r.toString());
    }

    @Test
    void terminalsOnly() throws Exception {
        TargetRule r = new TargetRule("X", List.of("a", "b"));
        assertEquals(0, r.getArity());
        assertEquals("b", r.getWord(1));
        // not a slot, just a bracketed word
        assertEquals(-1, new TargetRule("X", List.of("[x]")).getNonTermIndex(0));
    }

    @Test
    void slotsMustBindEachAntecedentOnce() {
        assertThrows(DataFormatException.class, () -> TargetRule.parse("X", "[0] [2]"));
        assertThrows(DataFormatException.class, () -> TargetRule.parse("X", "[0] [0]"));
        assertThrows(DataFormatException.class, () -> TargetRule.parse("X", "[1]"));
        DataFormatException e = assertThrows(DataFormatException.class, () -> TargetRule.parse("X", "a [99999999999]"));
        assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @Test
    void hyperedgeArityMustMatch() throws Exception {
        TargetRule r = TargetRule.parse("X", "a [0]");
        assertThrows(IllegalArgumentException.class,
                () -> new Hyperedge(r, List.<Hypothesis>of(), ScoreBreakdown.EMPTY, 0));
    }
}
