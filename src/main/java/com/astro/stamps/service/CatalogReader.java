package com.astro.stamps.service;

import com.astro.stamps.model.CatalogRow;
import com.astro.stamps.model.StampDataException;
import java.util.List;

public interface CatalogReader {

    /** All rows of the raw catalog for a stamp, in table order. */
    List<CatalogRow> read(String catDir, String stampId) throws StampDataException;
}
