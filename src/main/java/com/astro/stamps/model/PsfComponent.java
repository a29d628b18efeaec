package com.astro.stamps.model;

import java.util.Arrays;

/**
 * One term of the three-component Gaussian mixture PSF. Offsets are in
 * pixels, the covariance in pixels squared.
 */
public final class PsfComponent {

    public final double weight;
    private final double[] mean;
    private final double[][] covariance;

    /**
     * @throws IllegalArgumentException if a value is not finite or the
     *         covariance is not symmetric positive-definite
     */
    public PsfComponent(double weight, double[] mean, double[][] covariance) {
        if (!Double.isFinite(weight)) {
            throw new IllegalArgumentException("PSF weight is not finite: " + weight);
        }
        if (mean == null || mean.length != 2 || !Double.isFinite(mean[0]) || !Double.isFinite(mean[1])) {
            throw new IllegalArgumentException("PSF mean must be a finite 2-vector: " + Arrays.toString(mean));
        }
        if (covariance == null || covariance.length != 2 || covariance[0].length != 2 || covariance[1].length != 2) {
            throw new IllegalArgumentException("PSF covariance must be 2x2");
        }
        double a = covariance[0][0], c = covariance[0][1], c2 = covariance[1][0], b = covariance[1][1];
        if (!Double.isFinite(a) || !Double.isFinite(b) || !Double.isFinite(c) || !Double.isFinite(c2)) {
            throw new IllegalArgumentException("PSF covariance has non-finite entries: " + Arrays.deepToString(covariance));
        }
        if (c != c2) {
            throw new IllegalArgumentException("PSF covariance is not symmetric: " + Arrays.deepToString(covariance));
        }
        // Sylvester's criterion for a 2x2 matrix.
        if (a <= 0 || a * b - c * c <= 0) {
            throw new IllegalArgumentException("PSF covariance is not positive-definite: " + Arrays.deepToString(covariance));
        }
        this.weight = weight;
        this.mean = mean.clone();
        this.covariance = new double[][] { covariance[0].clone(), covariance[1].clone() };
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[][] getCovariance() {
        return new double[][] { covariance[0].clone(), covariance[1].clone() };
    }

    public double covarianceAt(int row, int col) {
        return covariance[row][col];
    }

    public double determinant() {
        return covariance[0][0] * covariance[1][1] - covariance[0][1] * covariance[1][0];
    }

    @Override
    public String toString() {
        return String.format("PsfComponent[w=%.4g, mean=%s, cov=%s]", weight, Arrays.toString(mean), Arrays.deepToString(covariance));
    }
}
