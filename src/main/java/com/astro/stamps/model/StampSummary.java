package com.astro.stamps.model;

public class StampSummary {
    public final Band band;
    public final int pixelCount;
    // Photon counts
    public final double min;
    public final double max;
    public final double mean;
    public final double stdDev;

    public StampSummary(Band band, int pixelCount, double min, double max, double mean, double stdDev) {
        this.band = band;
        this.pixelCount = pixelCount;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.stdDev = stdDev;
    }

    @Override
    public String toString() {
        return String.format("band %s: %d px, min %.1f, max %.1f, mean %.2f, sd %.2f",
                band.letter(), pixelCount, min, max, mean, stdDev);
    }
}
