package com.astro.stamps.model;

import com.astro.stamps.model.StampDataException.Kind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header keywords of a raw stamp, as text, together with the raw header
 * the coordinate map is parsed from.
 */
public final class StampHeader {

    private final Map<String, String> values;
    private final String headerText;

    public StampHeader(Map<String, String> values, String headerText) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.headerText = headerText == null ? "" : headerText;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public String getHeaderText() {
        return headerText;
    }

    public Map<String, String> asMap() {
        return values;
    }

    public double getDouble(String key) throws StampDataException {
        String raw = values.get(key);
        if (raw == null) {
            throw new StampDataException(Kind.MISSING_FIELD, "header keyword " + key + " is missing");
        }
        double v;
        try {
            // FITS allows a D exponent
            v = Double.parseDouble(raw.trim().replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException e) {
            throw new StampDataException(Kind.MALFORMED_VALUE, "header keyword " + key + " is not numeric: '" + raw + "'", e);
        }
        if (!Double.isFinite(v)) {
            throw new StampDataException(Kind.MALFORMED_VALUE, "header keyword " + key + " is not finite: " + raw);
        }
        return v;
    }

    public double getPositiveDouble(String key) throws StampDataException {
        double v = getDouble(key);
        if (v <= 0) {
            throw new StampDataException(Kind.MALFORMED_VALUE, "header keyword " + key + " must be positive, got " + v);
        }
        return v;
    }

    /** Numeric keyword rounded to the nearest integer, ties to even. */
    public int getRoundedInt(String key) throws StampDataException {
        double v = Math.rint(getDouble(key));
        if (v > Integer.MAX_VALUE || v < Integer.MIN_VALUE) {
            throw new StampDataException(Kind.MALFORMED_VALUE, "header keyword " + key + " does not fit an int: " + v);
        }
        return (int) v;
    }
}
