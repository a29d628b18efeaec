package com.astro.stamps.service;

import com.astro.stamps.external.CoordinateMap;
import com.astro.stamps.external.CoordinateMapFactory;
import com.astro.stamps.model.Image;
import com.astro.stamps.model.PsfComponent;
import com.astro.stamps.model.SkyIntensity;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import com.astro.stamps.model.StampHeader;
import com.astro.stamps.model.StampSummary;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw stamp into a calibrated {@link Image}: pixels in photon
 * counts, a constant sky model, the PSF mixture and provenance.
 */
public class StampCalibrator {

    private static final Logger logger = LoggerFactory.getLogger(StampCalibrator.class);

    private final CoordinateMapFactory coordinateMaps;
    private final StampStatisticsService statistics;

    public StampCalibrator(CoordinateMapFactory coordinateMaps) {
        this(coordinateMaps, new StampStatisticsService());
    }

    public StampCalibrator(CoordinateMapFactory coordinateMaps, StampStatisticsService statistics) {
        this.coordinateMaps = coordinateMaps;
        this.statistics = statistics;
    }

    public Image calibrate(RawStamp raw) throws StampDataException {
        try {
            Image image = build(raw);
            if (logger.isDebugEnabled()) {
                StampSummary summary = statistics.summarize(image);
                logger.debug("Calibrated stamp {} {}", raw.stampId, summary);
            }
            return image;
        } catch (StampDataException e) {
            throw e.withContext("band " + raw.band.letter() + " of stamp " + raw.stampId);
        }
    }

    private Image build(RawStamp raw) throws StampDataException {
        StampHeader hdr = raw.header;
        double[][] rawPixels = raw.pixels;
        if (rawPixels.length == 0 || rawPixels[0].length == 0) {
            throw new StampDataException(Kind.SHAPE_MISMATCH, "pixel array is empty");
        }
        int h = rawPixels.length;
        int w = rawPixels[0].length;
        checkDeclaredShape(hdr, rawPixels, h, w);

        double calib = hdr.getPositiveDouble("CALIB");
        double sky = hdr.getDouble("SKY");
        double gain = hdr.getPositiveDouble("GAIN");

        double[][] nelec = new double[h][w];
        int negative = 0;
        for (int i = 0; i < h; i++) {
            for (int j = 0; j < w; j++) {
                double v = rawPixels[i][j];
                if (!Double.isFinite(v)) {
                    throw new StampDataException(Kind.MALFORMED_VALUE, "pixel (" + i + ", " + j + ") is not finite");
                }
                double dn = v / calib + sky;
                nelec[i][j] = Math.rint(dn * gain);
                if (nelec[i][j] < 0) negative++;
            }
        }
        if (negative > 0) {
            logger.warn("Stamp {} band {} has {} pixels below zero photons", raw.stampId, raw.band.letter(), negative);
        }

        List<PsfComponent> psf = PsfHeaderMapping.toPsf(hdr);
        CoordinateMap coordinateMap = coordinateMaps.fromHeader(hdr.getHeaderText());

        double iota = gain / calib;
        double epsilon = sky * calib;

        int runNum = hdr.getRoundedInt("RUN");
        int camcolNum = hdr.getRoundedInt("CAMCOL");
        int fieldNum = hdr.getRoundedInt("FIELD");

        double[] iotaVec = new double[h];
        Arrays.fill(iotaVec, iota);
        try {
            return new Image(h, w, nelec, raw.band, coordinateMap, psf,
                    runNum, camcolNum, fieldNum, SkyIntensity.constant(epsilon, h, w), iotaVec);
        } catch (IllegalArgumentException e) {
            throw new StampDataException(Kind.MALFORMED_VALUE, e.getMessage(), e);
        }
    }

    private static void checkDeclaredShape(StampHeader hdr, double[][] pixels, int h, int w) throws StampDataException {
        for (double[] row : pixels) {
            if (row.length != w) throw new StampDataException(Kind.SHAPE_MISMATCH, "pixel array is ragged");
        }
        if (hdr.containsKey("NAXIS1") && hdr.getRoundedInt("NAXIS1") != h) {
            throw new StampDataException(Kind.SHAPE_MISMATCH,
                    "NAXIS1 is " + hdr.getRoundedInt("NAXIS1") + " but pixel array has " + h + " rows");
        }
        if (hdr.containsKey("NAXIS2") && hdr.getRoundedInt("NAXIS2") != w) {
            throw new StampDataException(Kind.SHAPE_MISMATCH,
                    "NAXIS2 is " + hdr.getRoundedInt("NAXIS2") + " but pixel array has " + w + " columns");
        }
    }
}
