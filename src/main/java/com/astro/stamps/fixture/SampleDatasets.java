package com.astro.stamps.fixture;

import com.astro.stamps.external.CoordinateMap;
import com.astro.stamps.external.ElboArgsFactory;
import com.astro.stamps.external.LinearCoordinateMap;
import com.astro.stamps.external.ParameterLayout;
import com.astro.stamps.external.SourceInitializer;
import com.astro.stamps.external.SyntheticCompositor;
import com.astro.stamps.model.Band;
import com.astro.stamps.model.CatalogEntry;
import com.astro.stamps.model.FixtureConfig;
import com.astro.stamps.model.Image;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import com.astro.stamps.service.StampLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds synthetic datasets for exercising the inference engine: a real
 * stamp supplies PSF and calibration, the compositor renders a known
 * catalog onto it, and the result is packaged as engine arguments.
 *
 * @param <A> the engine's argument type
 */
public class SampleDatasets<A> {

    private static final Logger logger = LoggerFactory.getLogger(SampleDatasets.class);

    static final int SMALL_H = 20;
    static final int SMALL_W = 23;
    static final int THREE_BODY_H = 112;
    static final int THREE_BODY_W = 238;
    static final long FIXTURE_SEED = 1L;

    private final StampLoader stampLoader;
    private final SyntheticCompositor compositor;
    private final ElboArgsFactory<A> elboArgsFactory;
    private final SourceInitializer initializer;
    private final ParameterLayout ids;
    private final String dataDir;
    private final String stampId;

    public SampleDatasets(StampLoader stampLoader, SyntheticCompositor compositor, ElboArgsFactory<A> elboArgsFactory,
                          SourceInitializer initializer, ParameterLayout ids) {
        this(stampLoader, compositor, elboArgsFactory, initializer, ids,
                FixtureConfig.getDataDir(), FixtureConfig.getStampId());
    }

    public SampleDatasets(StampLoader stampLoader, SyntheticCompositor compositor, ElboArgsFactory<A> elboArgsFactory,
                          SourceInitializer initializer, ParameterLayout ids, String dataDir, String stampId) {
        this.stampLoader = stampLoader;
        this.compositor = compositor;
        this.elboArgsFactory = elboArgsFactory;
        this.initializer = initializer;
        this.ids = ids;
        this.dataDir = dataDir;
        this.stampId = stampId;
    }

    /**
     * Engine arguments for {@code images} and {@code catalog}.
     *
     * @param activeSource   1-based source to optimize alone, or below 1 for the default selection
     * @param patchRadiusPix sky patch radius override, {@code NaN} for none
     */
    public A makeElboArgs(List<Image> images, List<CatalogEntry> catalog, int activeSource,
                          double patchRadiusPix, boolean includeKl) {
        int[] active = ActiveSources.select(catalog.size(), activeSource);
        return elboArgsFactory.build(images, catalog, active, includeKl, patchRadiusPix);
    }

    public DatasetBundle<A> sampleStarDataset(boolean perturb) throws StampDataException {
        return smallDataset(SMALL_H, SMALL_W,
                Collections.singletonList(SampleCatalog.sampleEntry(new double[] { 10.1, 12.2 }, true)), perturb, true);
    }

    public DatasetBundle<A> sampleGalaxyDataset(boolean perturb, boolean includeKl) throws StampDataException {
        return smallDataset(SMALL_H, SMALL_W,
                Collections.singletonList(SampleCatalog.sampleEntry(new double[] { 8.5, 9.6 }, false)), perturb, includeKl);
    }

    /** Two sources too close together to be told apart. */
    public DatasetBundle<A> twoBodyDataset(boolean perturb) throws StampDataException {
        return smallDataset(SMALL_H, SMALL_W, Arrays.asList(
                SampleCatalog.sampleEntry(new double[] { 4.5, 3.6 }, false),
                SampleCatalog.sampleEntry(new double[] { 10.1, 12.1 }, true)), perturb, true);
    }

    public DatasetBundle<A> threeBodyDataset(boolean perturb) throws StampDataException {
        return smallDataset(THREE_BODY_H, THREE_BODY_W, Arrays.asList(
                SampleCatalog.sampleEntry(new double[] { 4.5, 3.6 }, false),
                SampleCatalog.sampleEntry(new double[] { 60.1, 82.2 }, true),
                SampleCatalog.sampleEntry(new double[] { 71.3, 100.4 }, false)), perturb, true);
    }

    public DatasetBundle<A> nBodyDataset(int numSources, boolean perturb) throws StampDataException {
        return nBodyDataset(numSources, FixtureConfig.getNBodyPatchRadius(), null, perturb);
    }

    /**
     * {@code numSources} stars placed uniformly at random on a large canvas
     * that keeps the stamp's own coordinate map.
     *
     * @param seed seed for placement and rendering, or {@code null} for an unseeded run
     */
    public DatasetBundle<A> nBodyDataset(int numSources, double patchPixelRadius, Long seed, boolean perturb)
            throws StampDataException {
        return nBodyDataset(numSources, FixtureConfig.getNBodyCanvasHeight(), FixtureConfig.getNBodyCanvasWidth(),
                patchPixelRadius, seed, perturb);
    }

    /**
     * As {@link #nBodyDataset(int, double, Long, boolean)} on an {@code h} x {@code w} canvas.
     * Locations are drawn first, all of them, then mapped to world coordinates.
     */
    public DatasetBundle<A> nBodyDataset(int numSources, int h, int w, double patchPixelRadius, Long seed,
                                         boolean perturb) throws StampDataException {
        if (numSources < 1) {
            throw new IllegalArgumentException("An n-body dataset needs at least one source, got " + numSources);
        }
        Random rng = seed == null ? new Random() : new Random(seed);

        List<Image> images0 = stampLoader.loadStampBlob(dataDir, stampId);
        for (Image img : images0) {
            img.retarget(h, w, img.getCoordinateMap());
        }

        double[][] locations = new double[numSources][];
        for (int s = 0; s < numSources; s++) {
            double x = rng.nextDouble() * h;
            double y = rng.nextDouble() * w;
            locations[s] = new double[] { x, y };
        }
        CoordinateMap reference = images0.get(Band.R.index()).getCoordinateMap();
        double[][] worldLocations = reference.pixToWorld(locations);

        List<CatalogEntry> catalog = new ArrayList<>(numSources);
        for (int s = 0; s < numSources; s++) {
            catalog.add(SampleCatalog.nBodyStar(worldLocations[s], s + 1));
        }

        List<Image> images = render(images0, catalog, rng);

        // Sky and calibration rebuilt at the canvas size after rendering.
        for (Image img : images) {
            img.retarget(img.getH(), img.getW(), img.getCoordinateMap());
        }

        A ea = makeElboArgs(images, catalog, -1, patchPixelRadius, true);
        logger.info("Built {}-body dataset on a {}x{} canvas (seed {})", numSources, h, w, seed);
        return new DatasetBundle<>(ea, initialParams(catalog, perturb), catalog);
    }

    /** The unperturbed sample star with parameters set to the ground truth. */
    public DatasetBundle<A> trueStarInit() throws StampDataException {
        DatasetBundle<A> bundle = sampleStarDataset(false);
        double[] vs = bundle.params.get(0);
        int[] a = ids.a();
        vs[a[0]] = 1.0 - 1e-4;
        vs[a[1]] = 1e-4;
        int[] r1 = ids.r1();
        int[] r2 = ids.r2();
        for (int i : r2) vs[i] = 1e-4;
        double logFlux = Math.log(SampleCatalog.sampleStarFluxes()[Band.R.index()]);
        for (int k = 0; k < r1.length; k++) {
            vs[r1[k]] = logFlux - 0.5 * vs[r2[k]];
        }
        for (int i : ids.c2()) vs[i] = 1e-4;
        return bundle;
    }

    /** Engine arguments for {@code numSources} generic sources with no images, all active. */
    public DatasetBundle<A> emptyModelParams(int numSources) {
        List<double[]> vp = new ArrayList<>(numSources);
        for (int s = 0; s < numSources; s++) {
            vp.add(initializer.genericInit(new double[] { 0.0, 0.0 }));
        }
        int[] active = new int[numSources];
        for (int s = 0; s < numSources; s++) active[s] = s + 1;
        A ea = elboArgsFactory.build(Collections.<Image>emptyList(), Collections.<CatalogEntry>emptyList(),
                active, true, Double.NaN);
        return new DatasetBundle<>(ea, vp, Collections.<CatalogEntry>emptyList());
    }

    private DatasetBundle<A> smallDataset(int h, int w, List<CatalogEntry> catalog, boolean perturb, boolean includeKl)
            throws StampDataException {
        Random rng = new Random(FIXTURE_SEED);
        List<Image> images0 = stampLoader.loadStampBlob(dataDir, stampId);
        for (Image img : images0) {
            img.retarget(h, w, LinearCoordinateMap.identity());
        }
        List<Image> images = render(images0, catalog, rng);
        A ea = makeElboArgs(images, catalog, -1, Double.NaN, includeKl);
        logger.info("Built {}-source dataset on a {}x{} canvas", catalog.size(), h, w);
        return new DatasetBundle<>(ea, initialParams(catalog, perturb), catalog);
    }

    private List<Image> render(List<Image> images0, List<CatalogEntry> catalog, Random rng) throws StampDataException {
        List<Image> images = compositor.genBlob(images0, catalog, rng);
        if (images == null || images.size() != images0.size()) {
            throw new StampDataException(Kind.SHAPE_MISMATCH, "compositor returned "
                    + (images == null ? "no" : String.valueOf(images.size())) + " images for " + images0.size() + " bands");
        }
        for (int b = 0; b < images.size(); b++) {
            Image in = images0.get(b);
            Image out = images.get(b);
            if (out.getH() != in.getH() || out.getW() != in.getW()) {
                throw new StampDataException(Kind.SHAPE_MISMATCH, "compositor changed band " + in.getBand().letter()
                        + " from " + in.getH() + "x" + in.getW() + " to " + out.getH() + "x" + out.getW());
            }
        }
        return new ArrayList<>(images);
    }

    private List<double[]> initialParams(List<CatalogEntry> catalog, boolean perturb) {
        List<double[]> vp = new ArrayList<>(catalog.size());
        for (CatalogEntry ce : catalog) {
            vp.add(initializer.catalogInit(ce));
        }
        if (perturb) {
            ParameterPerturbation.perturb(vp, ids);
        }
        return vp;
    }
}
