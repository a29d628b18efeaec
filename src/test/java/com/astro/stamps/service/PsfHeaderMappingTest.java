package com.astro.stamps.service;

import com.astro.stamps.model.PsfComponent;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampHeader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PsfHeaderMappingTest {

    @Test
    @DisplayName("Nine scalars and six covariance terms map onto three components in order")
    void testComponentsTakeTheirOwnSlots() throws Exception {
        List<PsfComponent> psf = PsfHeaderMapping.toPsf(new StampHeader(TestStamps.headerValues(), ""));

        assertEquals(3, psf.size());
        assertEquals(0.7, psf.get(0).weight);
        assertEquals(0.2, psf.get(1).weight);
        assertEquals(0.1, psf.get(2).weight);

        assertArrayEquals(new double[] { 0.01, -0.02 }, psf.get(0).getMean());
        assertArrayEquals(new double[] { 0.3, 0.1 }, psf.get(1).getMean());
        assertArrayEquals(new double[] { -0.5, 0.6 }, psf.get(2).getMean());

        assertArrayEquals(new double[] { 1.2, 0.1 }, psf.get(0).getCovariance()[0]);
        assertArrayEquals(new double[] { 0.1, 1.5 }, psf.get(0).getCovariance()[1]);
        assertArrayEquals(new double[] { 4.0, -0.5 }, psf.get(1).getCovariance()[0]);
        assertArrayEquals(new double[] { -0.5, 3.0 }, psf.get(1).getCovariance()[1]);
        assertArrayEquals(new double[] { 9.0, 2.0 }, psf.get(2).getCovariance()[0]);
        assertArrayEquals(new double[] { 2.0, 10.0 }, psf.get(2).getCovariance()[1]);
    }

    @Test
    void testCovariancesAreSymmetricPositiveDefinite() throws Exception {
        for (PsfComponent c : PsfHeaderMapping.toPsf(new StampHeader(TestStamps.headerValues(), ""))) {
            assertEquals(c.covarianceAt(0, 1), c.covarianceAt(1, 0));
            assertTrue(c.covarianceAt(0, 0) > 0);
            assertTrue(c.determinant() > 0);
        }
    }

    @Test
    void testMissingCoefficientIsReported() {
        Map<String, String> values = TestStamps.headerValues();
        values.remove("PSF_P13");
        StampDataException e = assertThrows(StampDataException.class,
                () -> PsfHeaderMapping.toPsf(new StampHeader(values, "")));
        assertEquals(StampDataException.Kind.MISSING_FIELD, e.getKind());
        assertTrue(e.getMessage().contains("PSF_P13"));
    }

    @Test
    @DisplayName("A covariance that is not positive-definite is a data error")
    void testIndefiniteCovarianceIsRejected() {
        Map<String, String> values = TestStamps.headerValues();
        // var x 1, var y 1, cov 2: determinant -3
        values.put("PSF_P12", "1.0");
        values.put("PSF_P13", "1.0");
        values.put("PSF_P14", "2.0");
        StampDataException e = assertThrows(StampDataException.class,
                () -> PsfHeaderMapping.toPsf(new StampHeader(values, "")));
        assertEquals(StampDataException.Kind.MALFORMED_VALUE, e.getKind());
        assertTrue(e.getMessage().contains("component 2"));
    }
}
