package com.astro.stamps.service;

import com.astro.stamps.model.Band;
import com.astro.stamps.model.CatalogRow;
import com.astro.stamps.model.Image;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the raw catalog of a stamp and normalizes it against the stamp's
 * images.
 */
public class CatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    private final CatalogReader reader;
    private final CatalogNormalizer normalizer;

    public CatalogLoader(CatalogReader reader, CatalogNormalizer normalizer) {
        this.reader = reader;
        this.normalizer = normalizer;
    }

    /**
     * Raw rows of the stamp catalog. With {@code matchBlob}, only rows whose
     * run, camcol and field equal those of the r-band image are kept.
     */
    public List<CatalogRow> loadRows(String catDir, String stampId, List<Image> images, boolean matchBlob)
            throws StampDataException {
        List<CatalogRow> rows = reader.read(catDir, stampId);
        if (!matchBlob) {
            return rows;
        }
        if (images.size() <= Band.R.index()) {
            throw new StampDataException(Kind.SHAPE_MISMATCH,
                    "matching catalog " + stampId + " needs the r-band image, got " + images.size() + " images");
        }
        Image ref = images.get(Band.R.index());
        List<CatalogRow> matched = new ArrayList<>();
        for (CatalogRow row : rows) {
            try {
                if (row.getDouble("camcol") == ref.getCamcolNum()
                        && row.getDouble("run") == ref.getRunNum()
                        && row.getDouble("field") == ref.getFieldNum()) {
                    matched.add(row);
                }
            } catch (StampDataException e) {
                throw e.withContext("catalog " + stampId + " row " + row.getIndex());
            }
        }
        logger.debug("Catalog {}: {} of {} rows match run {} camcol {} field {}", stampId, matched.size(),
                rows.size(), ref.getRunNum(), ref.getCamcolNum(), ref.getFieldNum());
        return matched;
    }

    /**
     * Normalized catalog of a stamp. Rows matched to the blob are taken to use
     * the engine's angle sign already; unmatched catalogs have it flipped.
     */
    public NormalizationResult loadCatalog(String catDir, String stampId, List<Image> images, boolean matchBlob)
            throws StampDataException {
        List<CatalogRow> rows = loadRows(catDir, stampId, images, matchBlob);
        NormalizationResult result = normalizer.normalizeAll(rows, matchBlob);
        if (!result.isComplete()) {
            logger.warn("Catalog {}: {} of {} rows failed to normalize", stampId, result.getFailures().size(), rows.size());
        }
        return result;
    }
}
