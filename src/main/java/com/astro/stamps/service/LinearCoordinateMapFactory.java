package com.astro.stamps.service;

import com.astro.stamps.external.CoordinateMap;
import com.astro.stamps.external.CoordinateMapFactory;
import com.astro.stamps.external.LinearCoordinateMap;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampHeader;

/**
 * Reads CRPIX, CRVAL and the CD matrix (or CDELT when there is no CD
 * matrix) from a stamp header.
 */
public class LinearCoordinateMapFactory implements CoordinateMapFactory {

    @Override
    public CoordinateMap fromHeader(String headerText) throws StampDataException {
        StampHeader header = FitsHeaders.parse(headerText);
        double[] crpix = { header.getDouble("CRPIX1"), header.getDouble("CRPIX2") };
        double[] crval = { header.getDouble("CRVAL1"), header.getDouble("CRVAL2") };
        double[][] cd;
        if (header.containsKey("CD1_1")) {
            cd = new double[][] {
                    { header.getDouble("CD1_1"), optional(header, "CD1_2") },
                    { optional(header, "CD2_1"), header.getDouble("CD2_2") }
            };
        } else {
            cd = new double[][] { { header.getDouble("CDELT1"), 0 }, { 0, header.getDouble("CDELT2") } };
        }
        return new LinearCoordinateMap(crpix, crval, cd);
    }

    private static double optional(StampHeader header, String key) throws StampDataException {
        return header.containsKey(key) ? header.getDouble(key) : 0.0;
    }
}
