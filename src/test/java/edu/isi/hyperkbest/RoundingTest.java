package edu.isi.hyperkbest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Locale;

import org.junit.jupiter.api.Test;

final class RoundingTest {

    @Test
    void fixedPlaces() {
        assertEquals("-5.500000", Rounding.round(-5.5, 6));
        assertEquals("0.333", Rounding.round(1.0 / 3, 3));
        assertEquals("0.0", Rounding.round(0.0, 6));
    }

    @Test
    void tinyValuesUseExponent() {
        assertEquals("1.5E-8", Rounding.round(1.5e-8, 6));
    }

    @Test
    void specialValuesPassThrough() {
        assertEquals("-Infinity", Rounding.round(Double.NEGATIVE_INFINITY, 6));
        assertEquals("NaN", Rounding.round(Double.NaN, 6));
    }

    @Test
    void localeDoesNotMatter() {
        Locale old = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals("2.500000", Rounding.round(2.5, 6));
        }
        finally {
            Locale.setDefault(old);
        }
    }
}
