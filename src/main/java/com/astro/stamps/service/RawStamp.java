package com.astro.stamps.service;

import com.astro.stamps.model.Band;
import com.astro.stamps.model.StampHeader;

/**
 * Uncalibrated pixels of one band of a stamp, with its header. Pixel rows
 * follow the FITS NAXIS1 axis.
 */
public class RawStamp {
    public final Band band;
    public final String stampId;
    public final double[][] pixels;
    public final StampHeader header;

    public RawStamp(Band band, String stampId, double[][] pixels, StampHeader header) {
        this.band = band;
        this.stampId = stampId;
        this.pixels = pixels;
        this.header = header;
    }
}
