package com.astro.stamps.external;

import com.astro.stamps.model.StampDataException;

public interface CoordinateMapFactory {

    /** Builds the coordinate map described by a raw FITS header (80-character cards). */
    CoordinateMap fromHeader(String headerText) throws StampDataException;
}
