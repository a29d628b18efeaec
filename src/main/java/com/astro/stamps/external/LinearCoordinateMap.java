package com.astro.stamps.external;

import java.util.Arrays;

/**
 * The linear part of a FITS world coordinate system:
 * {@code world = crval + cd * (pixel - crpix)}. No projection is applied.
 */
public final class LinearCoordinateMap implements CoordinateMap {

    private static final LinearCoordinateMap IDENTITY =
            new LinearCoordinateMap(new double[] { 1, 1 }, new double[] { 1, 1 }, new double[][] { { 1, 0 }, { 0, 1 } });

    private final double[] crpix;
    private final double[] crval;
    private final double[][] cd;

    public LinearCoordinateMap(double[] crpix, double[] crval, double[][] cd) {
        if (crpix.length != 2 || crval.length != 2 || cd.length != 2 || cd[0].length != 2 || cd[1].length != 2) {
            throw new IllegalArgumentException("Linear coordinate map needs 2-vectors and a 2x2 CD matrix");
        }
        this.crpix = crpix.clone();
        this.crval = crval.clone();
        this.cd = new double[][] { cd[0].clone(), cd[1].clone() };
    }

    /** World coordinates equal to pixel coordinates. */
    public static LinearCoordinateMap identity() {
        return IDENTITY;
    }

    @Override
    public double[] pixToWorld(double[] pixel) {
        double dx = pixel[0] - crpix[0];
        double dy = pixel[1] - crpix[1];
        return new double[] {
                crval[0] + cd[0][0] * dx + cd[0][1] * dy,
                crval[1] + cd[1][0] * dx + cd[1][1] * dy
        };
    }

    @Override
    public String toString() {
        return "LinearCoordinateMap[crpix=" + Arrays.toString(crpix) + ", crval=" + Arrays.toString(crval)
                + ", cd=" + Arrays.deepToString(cd) + "]";
    }
}
