package com.astro.stamps.external;

import com.astro.stamps.model.CatalogEntry;
import com.astro.stamps.model.Image;
import java.util.List;
import java.util.Random;

/**
 * Renders catalog sources, PSF-convolved and with noise, onto base images.
 */
public interface SyntheticCompositor {

    /**
     * @param baseImages images already rebound to the target canvas
     * @param rng        the source of noise; fixtures seed it for reproducibility
     * @return one image per base image, same canvas size, sources rendered in
     */
    List<Image> genBlob(List<Image> baseImages, List<CatalogEntry> catalog, Random rng);
}
