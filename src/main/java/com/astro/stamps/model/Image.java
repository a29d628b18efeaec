package com.astro.stamps.model;

import com.astro.stamps.external.CoordinateMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One calibrated band observation: photon-count pixels with the calibration,
 * sky and PSF models the inference engine needs to explain them.
 *
 * <p>Pixel rows run along the first pixel coordinate of the coordinate map.
 * Band, pixels, PSF and provenance are fixed at construction. The canvas size,
 * coordinate map, sky model and calibration vector can be replaced as a unit
 * through {@link #rebind}; the pixel array is not resized by a rebind, a
 * compositor supplies new pixels through {@link #withPixels}.
 */
public class Image {

    public static final int PSF_COMPONENTS = 3;

    private final Band band;
    private final double[][] pixels;
    private final List<PsfComponent> psf;
    private final int runNum;
    private final int camcolNum;
    private final int fieldNum;

    private int h;
    private int w;
    private CoordinateMap coordinateMap;
    private SkyIntensity sky;
    private double[] iotaVec;

    public Image(int h, int w, double[][] pixels, Band band, CoordinateMap coordinateMap,
                 List<PsfComponent> psf, int runNum, int camcolNum, int fieldNum,
                 SkyIntensity sky, double[] iotaVec) {
        if (band == null) throw new IllegalArgumentException("Image band is required");
        if (psf == null || psf.size() != PSF_COMPONENTS) {
            throw new IllegalArgumentException("Image PSF must have exactly " + PSF_COMPONENTS + " components, got "
                    + (psf == null ? "none" : psf.size()));
        }
        checkPixels(pixels, h, w);
        checkCanvas(h, w, sky, iotaVec);
        this.band = band;
        this.pixels = copy(pixels);
        this.psf = Collections.unmodifiableList(new ArrayList<>(psf));
        this.runNum = runNum;
        this.camcolNum = camcolNum;
        this.fieldNum = fieldNum;
        this.h = h;
        this.w = w;
        this.coordinateMap = coordinateMap;
        this.sky = sky;
        this.iotaVec = iotaVec.clone();
    }

    /**
     * Points this image at a different canvas. The sky model must cover
     * {@code h} x {@code w} and the calibration vector must have {@code h} entries.
     */
    public void rebind(int h, int w, CoordinateMap coordinateMap, SkyIntensity sky, double[] iotaVec) {
        checkCanvas(h, w, sky, iotaVec);
        this.h = h;
        this.w = w;
        this.coordinateMap = coordinateMap;
        this.sky = sky;
        this.iotaVec = iotaVec.clone();
    }

    /**
     * Rebinds to an {@code h} x {@code w} canvas, carrying the current sky
     * level and calibration constant over as constant fields.
     */
    public void retarget(int h, int w, CoordinateMap coordinateMap) {
        double[] iota = new double[h];
        Arrays.fill(iota, iotaVec[0]);
        rebind(h, w, coordinateMap, SkyIntensity.constant(sky.get(0, 0), h, w), iota);
    }

    /** A copy of this image, on its current canvas, holding {@code newPixels}. */
    public Image withPixels(double[][] newPixels) {
        return new Image(h, w, newPixels, band, coordinateMap, psf, runNum, camcolNum, fieldNum, sky, iotaVec);
    }

    public int getH() { return h; }
    public int getW() { return w; }
    public Band getBand() { return band; }
    public CoordinateMap getCoordinateMap() { return coordinateMap; }
    public List<PsfComponent> getPsf() { return psf; }
    public int getRunNum() { return runNum; }
    public int getCamcolNum() { return camcolNum; }
    public int getFieldNum() { return fieldNum; }
    public SkyIntensity getSky() { return sky; }

    public double[] getIotaVec() {
        return iotaVec.clone();
    }

    /** The pixels as built; after a {@link #rebind} they may not match the canvas size. */
    public double[][] getPixels() {
        return copy(pixels);
    }

    public double pixel(int i, int j) {
        return pixels[i][j];
    }

    private static void checkPixels(double[][] pixels, int h, int w) {
        if (pixels == null || pixels.length != h) {
            throw new IllegalArgumentException("Pixel array has " + (pixels == null ? 0 : pixels.length)
                    + " rows, expected " + h);
        }
        for (double[] row : pixels) {
            if (row.length != w) {
                throw new IllegalArgumentException("Pixel row has " + row.length + " columns, expected " + w);
            }
        }
    }

    private static void checkCanvas(int h, int w, SkyIntensity sky, double[] iotaVec) {
        if (h <= 0 || w <= 0) throw new IllegalArgumentException("Canvas must be non-empty: " + h + "x" + w);
        if (sky == null || sky.height() != h || sky.width() != w) {
            throw new IllegalArgumentException("Sky model does not cover a " + h + "x" + w + " canvas");
        }
        if (iotaVec == null || iotaVec.length != h) {
            throw new IllegalArgumentException("Calibration vector must have " + h + " entries");
        }
    }

    private static double[][] copy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) out[i] = src[i].clone();
        return out;
    }
}
