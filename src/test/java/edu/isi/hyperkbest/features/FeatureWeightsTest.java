package edu.isi.hyperkbest.features;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.StringReader;

import org.junit.jupiter.api.Test;

import edu.isi.hyperkbest.ConfigureException;
import edu.isi.hyperkbest.DataFormatException;

final class FeatureWeightsTest {

    private static FeatureWeights read(String text) throws Exception {
        return FeatureWeights.read(new BufferedReader(new StringReader(text)));
    }

    @Test
    void readsWeightsAndSkipsComments() throws Exception {
        FeatureWeights w = read("% tuned weights\n\nlm 0.5\n  tm -1.25  % phrase table\nwp 1e-1\n");
        assertEquals(3, w.size());
        assertEquals(0.5, w.getWeight("lm"));
        assertEquals(-1.25, w.getWeight("tm"));
        assertEquals(0.1, w.getWeight("wp"), 1e-12);
        assertFalse(w.isUniform());
        assertThrows(ConfigureException.class, () -> w.getWeight("d"));
    }

    @Test
    void uniformDefaultsToOne() throws Exception {
        FeatureWeights w = FeatureWeights.uniform().set("lm", 2);
        assertTrue(w.isUniform());
        assertEquals(2.0, w.getWeight("lm"));
        assertEquals(1.0, w.getWeight("anything"));
    }

    @Test
    void badLinesCarryLineNumbers() {
        DataFormatException e = assertThrows(DataFormatException.class, () -> read("lm 1\ntm\n"));
        assertEquals(2, e.getLineNumber());
        e = assertThrows(DataFormatException.class, () -> read("lm one\n"));
        assertEquals(1, e.getLineNumber());
        e = assertThrows(DataFormatException.class, () -> read("lm 1\n% x\nlm 2\n"));
        assertEquals(3, e.getLineNumber());
        assertTrue(e.getMessage().startsWith("line 3: "));
    }
}
