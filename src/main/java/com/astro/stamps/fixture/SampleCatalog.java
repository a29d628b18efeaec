package com.astro.stamps.fixture;

import com.astro.stamps.model.CatalogEntry;

/**
 * Hand-made catalog entries used by the small fixtures.
 */
public final class SampleCatalog {

    private static final double[] SAMPLE_STAR_FLUXES = {
            4.451805E+03, 1.491065E+03, 2.264545E+03, 2.027004E+03, 1.846822E+04 };

    // 1x wasn't bright enough to be found reliably
    private static final double[] SAMPLE_GALAXY_FLUXES = times(new double[] {
            1.377666E+01, 5.635334E+01, 1.258656E+02, 1.884264E+02, 2.351820E+02 }, 100);

    private SampleCatalog() {
    }

    public static double[] sampleStarFluxes() {
        return SAMPLE_STAR_FLUXES.clone();
    }

    public static double[] sampleGalaxyFluxes() {
        return SAMPLE_GALAXY_FLUXES.clone();
    }

    public static CatalogEntry sampleEntry(double[] pos, boolean isStar) {
        return new CatalogEntry(pos, isStar, SAMPLE_STAR_FLUXES, SAMPLE_GALAXY_FLUXES,
                0.1, 0.7, Math.PI / 4, 4.0, "sample", 0);
    }

    /** A star at {@code pos} with the sample star fluxes under both hypotheses, tagged {@code s}. */
    public static CatalogEntry nBodyStar(double[] pos, int s) {
        return new CatalogEntry(pos, true, SAMPLE_STAR_FLUXES, SAMPLE_STAR_FLUXES,
                0.1, 0.7, Math.PI / 4, 4.0, String.valueOf(s), s);
    }

    private static double[] times(double[] v, double k) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[i] * k;
        return out;
    }
}
