package com.astro.stamps.fixture;

import com.astro.stamps.model.CatalogEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Engine arguments, initial per-source parameters and the ground-truth
 * catalog of one fixture. The parameter vectors are mutable so tests can
 * adjust them; the catalog is read-only.
 *
 * @param <A> the engine's argument type
 */
public class DatasetBundle<A> {
    public final A elboArgs;
    public final List<double[]> params;
    public final List<CatalogEntry> catalog;

    public DatasetBundle(A elboArgs, List<double[]> params, List<CatalogEntry> catalog) {
        this.elboArgs = elboArgs;
        this.params = params;
        this.catalog = Collections.unmodifiableList(new ArrayList<>(catalog));
    }
}
