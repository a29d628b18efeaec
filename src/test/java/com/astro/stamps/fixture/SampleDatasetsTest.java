package com.astro.stamps.fixture;

import com.astro.stamps.external.LinearCoordinateMap;
import com.astro.stamps.fixture.FakeEngine.Args;
import com.astro.stamps.fixture.FakeEngine.NoiseCompositor;
import com.astro.stamps.model.Band;
import com.astro.stamps.model.CatalogEntry;
import com.astro.stamps.model.Image;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.service.StampCalibrator;
import com.astro.stamps.service.StampLoader;
import com.astro.stamps.service.StampReader;
import com.astro.stamps.service.TestStamps;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SampleDatasetsTest {

    private static final StampReader STAMPS = (dir, band, id) -> TestStamps.rawStamp(band, id, 6, 7, 1.0);

    private NoiseCompositor compositor;
    private SampleDatasets<Args> datasets;

    @BeforeEach
    void setUp() {
        compositor = new NoiseCompositor();
        datasets = datasets(STAMPS, compositor);
    }

    private static SampleDatasets<Args> datasets(StampReader reader, NoiseCompositor compositor) {
        StampLoader loader = new StampLoader(reader, new StampCalibrator(TestStamps.IDENTITY_MAPS));
        return new SampleDatasets<>(loader, compositor, FakeEngine.ARGS, FakeEngine.INITIALIZER, FakeEngine.IDS,
                "data", "stamp");
    }

    @Test
    @DisplayName("Sample star: one star on a 20x23 identity canvas, the only active source")
    void testSampleStarDataset() throws Exception {
        DatasetBundle<Args> bundle = datasets.sampleStarDataset(false);

        assertEquals(1, bundle.catalog.size());
        CatalogEntry ce = bundle.catalog.get(0);
        assertTrue(ce.isStar);
        assertArrayEquals(new double[] { 10.1, 12.2 }, ce.getPos());

        Args ea = bundle.elboArgs;
        assertArrayEquals(new int[] { 1 }, ea.activeSources);
        assertTrue(ea.includeKl);
        assertTrue(Double.isNaN(ea.patchRadiusPix));
        assertEquals(5, ea.images.size());
        for (Image img : ea.images) {
            assertEquals(20, img.getH());
            assertEquals(23, img.getW());
            assertSame(LinearCoordinateMap.identity(), img.getCoordinateMap());
            assertEquals(20, img.getIotaVec().length);
            assertEquals(20, img.getPixels().length);
        }
        assertEquals(Band.R, ea.images.get(2).getBand());

        double[] expected = FakeEngine.INITIALIZER.catalogInit(ce);
        assertArrayEquals(expected, bundle.params.get(0));
    }

    @Test
    void testPerturbedSampleStar() throws Exception {
        DatasetBundle<Args> bundle = datasets.sampleStarDataset(true);
        double[] truth = FakeEngine.INITIALIZER.catalogInit(bundle.catalog.get(0));
        double[] vs = bundle.params.get(0);

        assertEquals(0.4, vs[0]);
        assertEquals(truth[2] + 0.8, vs[2]);
        assertEquals(0.1, vs[27]);
    }

    @Test
    void testSampleGalaxyPassesIncludeKl() throws Exception {
        DatasetBundle<Args> bundle = datasets.sampleGalaxyDataset(true, false);

        assertFalse(bundle.elboArgs.includeKl);
        assertFalse(bundle.catalog.get(0).isStar);
        assertArrayEquals(new double[] { 8.5, 9.6 }, bundle.catalog.get(0).getPos());
    }

    @Test
    void testTwoAndThreeBodyDatasets() throws Exception {
        DatasetBundle<Args> two = datasets.twoBodyDataset(true);
        assertArrayEquals(new int[] { 1, 2 }, two.elboArgs.activeSources);
        assertFalse(two.catalog.get(0).isStar);
        assertTrue(two.catalog.get(1).isStar);
        assertEquals(2, two.params.size());

        DatasetBundle<Args> three = datasets.threeBodyDataset(true);
        assertArrayEquals(new int[] { 1, 2, 3 }, three.elboArgs.activeSources);
        assertEquals(112, three.elboArgs.images.get(0).getH());
        assertEquals(238, three.elboArgs.images.get(0).getW());
        assertArrayEquals(new double[] { 71.3, 100.4 }, three.catalog.get(2).getPos());
    }

    @Test
    @DisplayName("Small fixtures render with the same noise every time")
    void testSmallFixturesAreDeterministic() throws Exception {
        Image first = datasets.twoBodyDataset(true).elboArgs.images.get(3);
        Image second = datasets.twoBodyDataset(true).elboArgs.images.get(3);
        assertArrayEquals(first.getPixels()[5], second.getPixels()[5]);
    }

    @Test
    @DisplayName("Five random stars: placement follows the seed and the first three are active")
    void testNBodyDataset() throws Exception {
        DatasetBundle<Args> bundle = datasets.nBodyDataset(5, 30, 40, 20.0, 7L, false);

        Random rng = new Random(7L);
        for (int s = 0; s < 5; s++) {
            double x = rng.nextDouble() * 30;
            double y = rng.nextDouble() * 40;
            CatalogEntry ce = bundle.catalog.get(s);
            assertArrayEquals(new double[] { x, y }, ce.getPos(), 1e-12);
            assertEquals(String.valueOf(s + 1), ce.objid);
            assertEquals(s + 1, ce.thingId);
            assertTrue(ce.isStar);
            assertArrayEquals(SampleCatalog.sampleStarFluxes(), ce.getGalFluxes());
        }

        Args ea = bundle.elboArgs;
        assertArrayEquals(new int[] { 1, 2, 3 }, ea.activeSources);
        assertEquals(20.0, ea.patchRadiusPix);
        for (Image img : ea.images) {
            assertEquals(30, img.getH());
            assertEquals(40, img.getW());
            assertEquals(30, img.getIotaVec().length);
            assertEquals(30, img.getSky().height());
            assertEquals(40, img.getSky().width());
        }
        for (int[] size : compositor.canvasSizes) {
            assertArrayEquals(new int[] { 30, 40 }, size);
        }
    }

    @Test
    void testNBodySeedReproducesPixels() throws Exception {
        DatasetBundle<Args> a = datasets.nBodyDataset(4, 12, 9, 20.0, 99L, true);
        DatasetBundle<Args> b = datasets(STAMPS, new NoiseCompositor()).nBodyDataset(4, 12, 9, 20.0, 99L, true);

        for (int s = 0; s < 4; s++) {
            assertArrayEquals(a.catalog.get(s).getPos(), b.catalog.get(s).getPos());
            assertArrayEquals(a.params.get(s), b.params.get(s));
        }
        assertArrayEquals(a.elboArgs.images.get(4).getPixels()[11], b.elboArgs.images.get(4).getPixels()[11]);
    }

    @Test
    void testSingleBodyIsActive() throws Exception {
        DatasetBundle<Args> bundle = datasets.nBodyDataset(1, 10, 10, 20.0, 3L, false);
        assertArrayEquals(new int[] { 1 }, bundle.elboArgs.activeSources);
    }

    @Test
    void testExplicitActiveSource() throws Exception {
        DatasetBundle<Args> bundle = datasets.threeBodyDataset(false);
        Args ea = datasets.makeElboArgs(bundle.elboArgs.images, bundle.catalog, 2, 15.0, true);
        assertArrayEquals(new int[] { 2 }, ea.activeSources);
        assertEquals(15.0, ea.patchRadiusPix);
    }

    @Test
    void testTrueStarInit() throws Exception {
        DatasetBundle<Args> bundle = datasets.trueStarInit();
        double[] vs = bundle.params.get(0);

        assertEquals(1.0 - 1e-4, vs[0]);
        assertEquals(1e-4, vs[1]);
        assertEquals(1e-4, vs[10]);
        assertEquals(1e-4, vs[11]);
        double logFlux = Math.log(SampleCatalog.sampleStarFluxes()[2]);
        assertEquals(logFlux - 0.5e-4, vs[8]);
        assertEquals(logFlux - 0.5e-4, vs[9]);
        for (int i = 20; i < 28; i++) assertEquals(1e-4, vs[i]);
        assertEquals(10.1, vs[2], "position is not perturbed");
    }

    @Test
    void testEmptyModelParams() {
        DatasetBundle<Args> bundle = datasets.emptyModelParams(4);

        assertEquals(4, bundle.params.size());
        assertArrayEquals(new int[] { 1, 2, 3, 4 }, bundle.elboArgs.activeSources);
        assertTrue(bundle.elboArgs.images.isEmpty());
        assertTrue(bundle.catalog.isEmpty());
        assertEquals(0.0, bundle.params.get(3)[2]);
    }

    @Test
    @DisplayName("A stamp that fails to calibrate aborts the fixture")
    void testBadStampAborts() {
        StampReader broken = (dir, band, id) -> {
            Map<String, String> values = TestStamps.headerValues();
            if (band == Band.Z) values.remove("SKY");
            return TestStamps.rawStamp(band, id, 6, 7, 1.0, values);
        };
        NoiseCompositor unused = new NoiseCompositor();
        StampDataException e = assertThrows(StampDataException.class,
                () -> datasets(broken, unused).sampleStarDataset(true));
        assertEquals(StampDataException.Kind.MISSING_FIELD, e.getKind());
        assertTrue(unused.calls.isEmpty());
    }

    @Test
    void testCompositorMustKeepBands() {
        NoiseCompositor dropsBands = new NoiseCompositor() {
            @Override
            public List<Image> genBlob(List<Image> baseImages, List<CatalogEntry> catalog, Random rng) {
                return super.genBlob(baseImages, catalog, rng).subList(0, 3);
            }
        };
        StampDataException e = assertThrows(StampDataException.class,
                () -> datasets(STAMPS, dropsBands).sampleStarDataset(false));
        assertEquals(StampDataException.Kind.SHAPE_MISMATCH, e.getKind());
    }

    @Test
    void testCatalogIsReadOnly() throws Exception {
        DatasetBundle<Args> bundle = datasets.sampleStarDataset(false);
        assertThrows(UnsupportedOperationException.class, () -> bundle.catalog.clear());
    }
}
