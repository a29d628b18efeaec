package com.astro.stamps.external;

/**
 * Pixel to world transform of an image. Implementations come from the WCS
 * library; this code only hands them around and asks for world positions.
 */
public interface CoordinateMap {

    /**
     * @param pixel 1-based pixel coordinates, first along the image's row axis
     * @return world coordinates, right ascension then declination for sky maps
     */
    double[] pixToWorld(double[] pixel);

    default double[][] pixToWorld(double[][] pixels) {
        double[][] world = new double[pixels.length][];
        for (int s = 0; s < pixels.length; s++) world[s] = pixToWorld(pixels[s]);
        return world;
    }
}
