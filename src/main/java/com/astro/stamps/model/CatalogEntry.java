package com.astro.stamps.model;

import java.util.Arrays;

/**
 * A canonical catalog source: position, star/galaxy flag, per-band fluxes
 * for both hypotheses and the galaxy shape in the inference engine's units.
 */
public final class CatalogEntry {

    private final double[] pos;
    public final boolean isStar;
    private final double[] starFluxes;
    private final double[] galFluxes;
    /** Fraction of galaxy light in the de Vaucouleurs profile. */
    public final double galFracDev;
    /** Minor over major axis. */
    public final double galAb;
    /** Position angle in radians, in [0, pi). */
    public final double galAngle;
    /** Effective radius in pixels. */
    public final double galScale;
    public final String objid;
    public final int thingId;

    public CatalogEntry(double[] pos, boolean isStar, double[] starFluxes, double[] galFluxes,
                        double galFracDev, double galAb, double galAngle, double galScale,
                        String objid, int thingId) {
        if (pos == null || pos.length != 2) {
            throw new IllegalArgumentException("Position must be a 2-vector: " + Arrays.toString(pos));
        }
        checkFluxes("star", starFluxes);
        checkFluxes("galaxy", galFluxes);
        if (!(galFracDev >= 0 && galFracDev <= 1)) {
            throw new IllegalArgumentException("frac_dev outside [0, 1]: " + galFracDev);
        }
        if (!(galAb > 0 && galAb <= 1)) {
            throw new IllegalArgumentException("Axis ratio outside (0, 1]: " + galAb);
        }
        if (!(galAngle >= 0 && galAngle < Math.PI)) {
            throw new IllegalArgumentException("Angle outside [0, pi): " + galAngle);
        }
        if (!(galScale > 0) || Double.isInfinite(galScale)) {
            throw new IllegalArgumentException("Effective radius must be positive: " + galScale);
        }
        this.pos = pos.clone();
        this.isStar = isStar;
        this.starFluxes = starFluxes.clone();
        this.galFluxes = galFluxes.clone();
        this.galFracDev = galFracDev;
        this.galAb = galAb;
        this.galAngle = galAngle;
        this.galScale = galScale;
        this.objid = objid;
        this.thingId = thingId;
    }

    public double[] getPos() {
        return pos.clone();
    }

    public double[] getStarFluxes() {
        return starFluxes.clone();
    }

    public double[] getGalFluxes() {
        return galFluxes.clone();
    }

    public double starFlux(Band band) {
        return starFluxes[band.index()];
    }

    public double galFlux(Band band) {
        return galFluxes[band.index()];
    }

    private static void checkFluxes(String which, double[] fluxes) {
        if (fluxes == null || fluxes.length != Band.COUNT) {
            throw new IllegalArgumentException("Expected " + Band.COUNT + " " + which + " fluxes, got "
                    + Arrays.toString(fluxes));
        }
        for (double f : fluxes) {
            if (!(f >= 0) || Double.isInfinite(f)) {
                throw new IllegalArgumentException("Invalid " + which + " flux: " + Arrays.toString(fluxes));
            }
        }
    }

    @Override
    public String toString() {
        return "CatalogEntry[" + objid + " at " + Arrays.toString(pos) + (isStar ? ", star" : ", galaxy") + "]";
    }
}
