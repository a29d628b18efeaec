package com.astro.stamps.model;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StampHeaderTest {

    private static StampHeader header(String key, String value) {
        Map<String, String> values = new HashMap<>();
        values.put(key, value);
        return new StampHeader(values, null);
    }

    @Test
    void testFortranExponent() throws Exception {
        assertEquals(1.5e-3, header("CALIB", "1.5D-3").getDouble("CALIB"));
    }

    @Test
    void testRoundedIntTiesToEven() throws Exception {
        assertEquals(2, header("RUN", "2.5").getRoundedInt("RUN"));
        assertEquals(4, header("RUN", "3.5").getRoundedInt("RUN"));
        assertEquals(301, header("RUN", "300.7").getRoundedInt("RUN"));
    }

    @Test
    void testErrorKinds() {
        assertEquals(StampDataException.Kind.MISSING_FIELD,
                assertThrows(StampDataException.class, () -> header("A", "1").getDouble("B")).getKind());
        assertEquals(StampDataException.Kind.MALFORMED_VALUE,
                assertThrows(StampDataException.class, () -> header("A", "NaN").getDouble("A")).getKind());
        assertEquals(StampDataException.Kind.MALFORMED_VALUE,
                assertThrows(StampDataException.class, () -> header("A", "-2").getPositiveDouble("A")).getKind());
        assertEquals("", header("A", "1").getHeaderText());
    }
}
