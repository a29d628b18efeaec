package com.astro.stamps.service;

import com.astro.stamps.model.Band;
import com.astro.stamps.model.StampDataException;

public interface StampReader {

    /**
     * Reads one band of a stamp. Any file handle is released before this
     * returns, whether or not the read succeeded.
     */
    RawStamp read(String stampDir, Band band, String stampId) throws StampDataException;
}
