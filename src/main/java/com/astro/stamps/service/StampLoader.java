package com.astro.stamps.service;

import com.astro.stamps.model.Band;
import com.astro.stamps.model.Image;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads all five bands of a stamp as calibrated images, in band order.
 */
public class StampLoader {

    private static final Logger logger = LoggerFactory.getLogger(StampLoader.class);

    private final StampReader reader;
    private final StampCalibrator calibrator;

    public StampLoader(StampReader reader, StampCalibrator calibrator) {
        this.reader = reader;
        this.calibrator = calibrator;
    }

    public Image loadBand(String stampDir, Band band, String stampId) throws StampDataException {
        return calibrator.calibrate(reader.read(stampDir, band, stampId));
    }

    public List<Image> loadStampBlob(String stampDir, String stampId) throws StampDataException {
        List<Image> images = new ArrayList<>(Band.COUNT);
        for (Band b : Band.values()) {
            images.add(loadBand(stampDir, b, stampId));
        }
        logger.debug("Loaded {} bands of stamp {}", images.size(), stampId);
        return images;
    }

    /**
     * Calibrates the bands concurrently on {@code exec} and waits for all of
     * them. The first band to fail aborts the blob and cancels the rest.
     */
    public List<Image> loadStampBlob(String stampDir, String stampId, ExecutorService exec) throws StampDataException {
        List<Future<Image>> pending = new ArrayList<>(Band.COUNT);
        for (Band b : Band.values()) {
            pending.add(exec.submit(() -> loadBand(stampDir, b, stampId)));
        }
        List<Image> images = new ArrayList<>(Band.COUNT);
        try {
            for (Future<Image> f : pending) {
                images.add(f.get());
            }
        } catch (ExecutionException e) {
            cancelAll(pending);
            if (e.getCause() instanceof StampDataException) {
                throw (StampDataException) e.getCause();
            }
            throw new StampDataException(Kind.IO_FAILURE, "loading stamp " + stampId + " failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            cancelAll(pending);
            Thread.currentThread().interrupt();
            throw new StampDataException(Kind.IO_FAILURE, "interrupted while loading stamp " + stampId, e);
        }
        logger.debug("Loaded {} bands of stamp {} in parallel", images.size(), stampId);
        return images;
    }

    private static void cancelAll(List<Future<Image>> pending) {
        for (Future<Image> f : pending) f.cancel(true);
    }
}
