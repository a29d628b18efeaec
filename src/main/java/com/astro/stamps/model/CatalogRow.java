package com.astro.stamps.model;

import com.astro.stamps.model.StampDataException.Kind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One raw catalog row keyed by column name. Column names are matched
 * without regard to case, as FITS TTYPE values vary between producers.
 */
public final class CatalogRow {

    private final int index;
    private final Map<String, Object> columns;

    public CatalogRow(int index, Map<String, ?> columns) {
        this.index = index;
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : columns.entrySet()) {
            copy.put(e.getKey().trim().toLowerCase(Locale.ROOT), e.getValue());
        }
        this.columns = Collections.unmodifiableMap(copy);
    }

    /** Zero-based position of the row in its table. */
    public int getIndex() {
        return index;
    }

    public boolean has(String column) {
        return columns.get(column.toLowerCase(Locale.ROOT)) != null;
    }

    public Map<String, Object> asMap() {
        return columns;
    }

    public double getDouble(String column) throws StampDataException {
        Object v = require(column);
        if (v instanceof Number) return ((Number) v).doubleValue();
        if (v instanceof String) {
            try {
                return Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException e) {
                throw malformed(column, v, e);
            }
        }
        throw malformed(column, v, null);
    }

    public boolean getBoolean(String column) throws StampDataException {
        Object v = require(column);
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Number) return ((Number) v).doubleValue() != 0;
        if (v instanceof String) {
            String s = ((String) v).trim();
            if (s.equalsIgnoreCase("T") || s.equalsIgnoreCase("true")) return true;
            if (s.equalsIgnoreCase("F") || s.equalsIgnoreCase("false")) return false;
        }
        throw malformed(column, v, null);
    }

    public String getString(String column) throws StampDataException {
        Object v = require(column);
        return v instanceof String ? ((String) v).trim() : String.valueOf(v);
    }

    private Object require(String column) throws StampDataException {
        Object v = columns.get(column.toLowerCase(Locale.ROOT));
        if (v == null) {
            throw new StampDataException(Kind.MISSING_FIELD, "column " + column + " is missing");
        }
        return v;
    }

    private static StampDataException malformed(String column, Object v, Throwable cause) {
        return new StampDataException(Kind.MALFORMED_VALUE,
                "column " + column + " has unusable value '" + v + "'", cause);
    }
}
