package com.astro.stamps.service;

import com.astro.stamps.model.Band;
import com.astro.stamps.model.Image;
import com.astro.stamps.model.StampDataException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StampLoaderTest {

    private final ExecutorService exec = Executors.newFixedThreadPool(3);

    @AfterEach
    void shutdown() {
        exec.shutdownNow();
    }

    private static StampReader readerFailingOn(Band bad) {
        return (dir, band, id) -> {
            Map<String, String> values = TestStamps.headerValues();
            if (band == bad) values.remove("CALIB");
            return TestStamps.rawStamp(band, id, 3, 4, band.index(), values);
        };
    }

    @Test
    void testBandsLoadInOrder() throws Exception {
        StampLoader loader = new StampLoader(readerFailingOn(null), new StampCalibrator(TestStamps.IDENTITY_MAPS));
        List<Image> images = loader.loadStampBlob("dir", "s1");

        assertEquals(5, images.size());
        for (Band b : Band.values()) {
            assertEquals(b, images.get(b.index()).getBand());
            assertEquals(TestStamps.photons(b.index()), images.get(b.index()).pixel(0, 0));
        }
    }

    @Test
    void testParallelLoadJoinsInBandOrder() throws Exception {
        StampLoader loader = new StampLoader(readerFailingOn(null), new StampCalibrator(TestStamps.IDENTITY_MAPS));
        List<Image> images = loader.loadStampBlob("dir", "s1", exec);

        assertEquals(5, images.size());
        for (Band b : Band.values()) {
            assertEquals(b, images.get(b.index()).getBand());
        }
    }

    @Test
    void testParallelLoadReportsFailingBand() {
        StampLoader loader = new StampLoader(readerFailingOn(Band.I), new StampCalibrator(TestStamps.IDENTITY_MAPS));
        StampDataException e = assertThrows(StampDataException.class, () -> loader.loadStampBlob("dir", "s1", exec));
        assertEquals(StampDataException.Kind.MISSING_FIELD, e.getKind());
        assertTrue(e.getMessage().contains("band i"));
    }
}
