package com.astro.stamps.external;

import com.astro.stamps.model.CatalogEntry;
import com.astro.stamps.model.Image;
import java.util.List;

/**
 * Builds the inference engine's argument object.
 *
 * @param <A> the engine's argument type
 */
public interface ElboArgsFactory<A> {

    /**
     * @param activeSources  1-based indices into {@code catalog} the engine optimizes
     * @param patchRadiusPix sky patch radius override in pixels, {@code NaN} for the engine default
     */
    A build(List<Image> images, List<CatalogEntry> catalog, int[] activeSources,
            boolean includeKl, double patchRadiusPix);
}
