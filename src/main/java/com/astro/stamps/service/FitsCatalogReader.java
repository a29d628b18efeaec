package com.astro.stamps.service;

import com.astro.stamps.model.CatalogRow;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;

/**
 * Reads {@code cat-<id>.fits}: a binary table in the first extension, one
 * row per candidate source, columns named by TTYPE.
 */
public class FitsCatalogReader implements CatalogReader {

    public static File catalogFile(String catDir, String stampId) {
        return new File(catDir, "cat-" + stampId + ".fits");
    }

    @Override
    public List<CatalogRow> read(String catDir, String stampId) throws StampDataException {
        File f = catalogFile(catDir, stampId);
        if (!f.isFile()) {
            throw new StampDataException(Kind.IO_FAILURE, "catalog file not found: " + f);
        }
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(1);
            if (!(hdu instanceof BinaryTableHDU)) {
                throw new StampDataException(Kind.MALFORMED_VALUE, "first extension of " + f + " is not a binary table");
            }
            BinaryTableHDU table = (BinaryTableHDU) hdu;
            int numCols = table.getNCols();
            int numRows = table.getNRows();

            List<String> names = new ArrayList<>(numCols);
            List<Object> columns = new ArrayList<>(numCols);
            for (int c = 0; c < numCols; c++) {
                names.add(table.getColumnName(c));
                columns.add(table.getColumn(c));
            }

            List<CatalogRow> rows = new ArrayList<>(numRows);
            for (int r = 0; r < numRows; r++) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (int c = 0; c < numCols; c++) {
                    Object column = columns.get(c);
                    if (names.get(c) != null && column != null && column.getClass().isArray()) {
                        values.put(names.get(c), Array.get(column, r));
                    }
                }
                rows.add(new CatalogRow(r, values));
            }
            return rows;
        } catch (FitsException | IOException e) {
            throw new StampDataException(Kind.IO_FAILURE, "cannot read " + f + ": " + e.getMessage(), e);
        }
    }
}
