package com.astro.stamps.service;

import com.astro.stamps.model.Band;
import com.astro.stamps.model.CatalogEntry;
import com.astro.stamps.model.CatalogRow;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives canonical {@link CatalogEntry} records from raw survey catalog
 * rows carrying separate de Vaucouleurs and exponential fits.
 */
public class CatalogNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(CatalogNormalizer.class);

    public static final double FLUX_FLOOR = 1e-6;
    public static final double MIN_RADIUS_ARCSEC = 1.0 / 30;
    public static final double ARCSEC_PER_PIXEL = 0.396;
    /** Above this frac_dev the dev fit supplies the galaxy shape. */
    public static final double DEV_THRESHOLD = 0.5;

    /** The two galaxy light profiles of the raw catalog. */
    public enum GalaxyProfile {
        DEV("dev"), EXP("exp");

        private final String suffix;

        GalaxyProfile(String suffix) {
            this.suffix = suffix;
        }

        public String fluxColumn(Band band) {
            return suffix + "flux_" + band.letter();
        }

        public static GalaxyProfile dominant(double fracDev) {
            return fracDev > DEV_THRESHOLD ? DEV : EXP;
        }

        ProfileShape readShape(CatalogRow row) throws StampDataException {
            return new ProfileShape(this, row.getDouble("ab_" + suffix),
                    row.getDouble("phi_" + suffix), row.getDouble("theta_" + suffix));
        }
    }

    /** Shape columns of one profile, in raw catalog units. */
    public static final class ProfileShape {
        public final GalaxyProfile profile;
        public final double axisRatio;
        public final double angleDegrees;
        public final double radiusArcsec;

        ProfileShape(GalaxyProfile profile, double axisRatio, double angleDegrees, double radiusArcsec) {
            this.profile = profile;
            this.axisRatio = axisRatio;
            this.angleDegrees = angleDegrees;
            this.radiusArcsec = radiusArcsec;
        }
    }

    /**
     * @param angleMatchesTarget true when the row's position angle already uses
     *                           the engine's sign; otherwise the angle is negated
     * @param fallbackId         identifier used when the row has no {@code objid}
     */
    public CatalogEntry normalize(CatalogRow row, boolean angleMatchesTarget, String fallbackId) throws StampDataException {
        try {
            return build(row, angleMatchesTarget, fallbackId);
        } catch (StampDataException e) {
            throw e.withContext("catalog row " + row.getIndex());
        }
    }

    /**
     * Normalizes every row independently. Rows without an {@code objid}
     * get their 1-based position in {@code rows} as identifier.
     */
    public NormalizationResult normalizeAll(List<CatalogRow> rows, boolean angleMatchesTarget) {
        List<CatalogEntry> entries = new ArrayList<>(rows.size());
        List<NormalizationResult.RowFailure> failures = new ArrayList<>();
        for (int s = 0; s < rows.size(); s++) {
            CatalogRow row = rows.get(s);
            try {
                entries.add(normalize(row, angleMatchesTarget, String.valueOf(s + 1)));
            } catch (StampDataException e) {
                logger.warn("Skipping {}", e.getMessage());
                failures.add(new NormalizationResult.RowFailure(row.getIndex(), e));
            }
        }
        return new NormalizationResult(entries, failures);
    }

    private CatalogEntry build(CatalogRow row, boolean angleMatchesTarget, String fallbackId) throws StampDataException {
        double[] pos = { row.getDouble("ra"), row.getDouble("dec") };
        boolean isStar = row.getBoolean("is_star");
        double fracDev = row.getDouble("frac_dev");
        if (!(fracDev >= 0 && fracDev <= 1)) {
            throw new StampDataException(Kind.MALFORMED_VALUE, "frac_dev outside [0, 1]: " + fracDev);
        }

        double[] starFluxes = new double[Band.COUNT];
        double[] galFluxes = new double[Band.COUNT];
        for (Band b : Band.values()) {
            starFluxes[b.index()] = floorFlux(finite(row, "psfflux_" + b.letter()));
            double dev = floorFlux(finite(row, GalaxyProfile.DEV.fluxColumn(b)));
            double exp = floorFlux(finite(row, GalaxyProfile.EXP.fluxColumn(b)));
            galFluxes[b.index()] = fracDev * dev + (1 - fracDev) * exp;
        }

        ProfileShape shape = GalaxyProfile.dominant(fracDev).readShape(row);
        double phi = angleMatchesTarget ? shape.angleDegrees : -shape.angleDegrees;
        if (!Double.isFinite(phi)) {
            throw new StampDataException(Kind.MALFORMED_VALUE, "phi_" + shape.profile.suffix + " is not finite");
        }

        String objid = row.has("objid") ? row.getString("objid") : fallbackId;
        try {
            return new CatalogEntry(pos, isStar, starFluxes, galFluxes, fracDev, shape.axisRatio,
                    canonicalAngle(phi), effectiveRadiusPixels(shape.radiusArcsec), objid, 0);
        } catch (IllegalArgumentException e) {
            throw new StampDataException(Kind.MALFORMED_VALUE, e.getMessage(), e);
        }
    }

    public static double floorFlux(double flux) {
        return Math.max(flux, FLUX_FLOOR);
    }

    /**
     * Converts a catalog position angle in degrees to radians measured from
     * the perpendicular axis, wrapped into [0, pi).
     */
    public static double canonicalAngle(double degrees) {
        double phi90 = 90 - degrees;
        phi90 -= Math.floor(phi90 / 180) * 180;
        // rounding in the subtraction can land on exactly 180
        if (phi90 >= 180) phi90 -= 180;
        double radians = phi90 * (Math.PI / 180);
        return radians < Math.PI ? radians : 0.0;
    }

    public static double effectiveRadiusPixels(double thetaArcsec) {
        return Math.max(thetaArcsec, MIN_RADIUS_ARCSEC) / ARCSEC_PER_PIXEL;
    }

    private static double finite(CatalogRow row, String column) throws StampDataException {
        double v = row.getDouble(column);
        if (!Double.isFinite(v)) {
            throw new StampDataException(Kind.MALFORMED_VALUE, "column " + column + " is not finite: " + v);
        }
        return v;
    }
}
