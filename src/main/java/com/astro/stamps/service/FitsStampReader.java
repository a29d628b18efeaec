package com.astro.stamps.service;

import com.astro.stamps.model.Band;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import java.io.File;
import java.io.IOException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;

/**
 * Reads {@code stamp-<band>-<id>.fits} from a stamp directory.
 */
public class FitsStampReader implements StampReader {

    public static File stampFile(String stampDir, Band band, String stampId) {
        return new File(stampDir, "stamp-" + band.letter() + "-" + stampId + ".fits");
    }

    @Override
    public RawStamp read(String stampDir, Band band, String stampId) throws StampDataException {
        File f = stampFile(stampDir, band, stampId);
        if (!f.isFile()) {
            throw new StampDataException(Kind.IO_FAILURE, "stamp file not found: " + f);
        }
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new StampDataException(Kind.IO_FAILURE, "no primary HDU in " + f);
            }
            double[][] stored = toDouble(hdu.getKernel(), hdu.getBScale(), hdu.getBZero());
            if (stored.length == 0) {
                throw new StampDataException(Kind.MALFORMED_VALUE, "primary HDU of " + f + " is not a 2-D image");
            }
            return new RawStamp(band, stampId, transpose(stored), FitsHeaders.toStampHeader(hdu.getHeader()));
        } catch (FitsException | IOException e) {
            throw new StampDataException(Kind.IO_FAILURE, "cannot read " + f + ": " + e.getMessage(), e);
        }
    }

    // nom.tam returns [NAXIS2][NAXIS1]
    private static double[][] transpose(double[][] d) {
        double[][] t = new double[d[0].length][d.length];
        for (int y = 0; y < d.length; y++)
            for (int x = 0; x < d[0].length; x++)
                t[x][y] = d[y][x];
        return t;
    }

    private static double[][] toDouble(Object k, double bscale, double bzero) {
        double[][] d;
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j];
        } else if (k instanceof int[][]) {
            int[][] n = (int[][]) k;
            d = new double[n.length][n[0].length];
            for (int i = 0; i < n.length; i++) for (int j = 0; j < n[0].length; j++) d[i][j] = n[i][j];
        } else if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = f[i][j];
        } else if (k instanceof double[][]) {
            double[][] src = (double[][]) k;
            d = new double[src.length][];
            for (int i = 0; i < src.length; i++) d[i] = src[i].clone();
        } else {
            return new double[0][0];
        }
        if (bscale != 1.0 || bzero != 0.0) {
            for (double[] row : d) for (int j = 0; j < row.length; j++) row[j] = row[j] * bscale + bzero;
        }
        return d;
    }
}
