package com.astro.stamps.external;

import com.astro.stamps.model.CatalogEntry;

/** Encodes sources into the engine's per-source parameter vectors. */
public interface SourceInitializer {

    double[] catalogInit(CatalogEntry entry);

    double[] genericInit(double[] position);
}
