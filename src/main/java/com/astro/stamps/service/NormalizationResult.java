package com.astro.stamps.service;

import com.astro.stamps.model.CatalogEntry;
import com.astro.stamps.model.StampDataException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entries normalized from a batch of catalog rows, plus the rows that failed.
 */
public class NormalizationResult {

    public static class RowFailure {
        public final int rowIndex;
        public final StampDataException error;

        public RowFailure(int rowIndex, StampDataException error) {
            this.rowIndex = rowIndex;
            this.error = error;
        }
    }

    private final List<CatalogEntry> entries;
    private final List<RowFailure> failures;

    public NormalizationResult(List<CatalogEntry> entries, List<RowFailure> failures) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public List<CatalogEntry> getEntries() {
        return entries;
    }

    public List<RowFailure> getFailures() {
        return failures;
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    /** The entries, or the first row's error if any row failed. */
    public List<CatalogEntry> entriesOrThrow() throws StampDataException {
        if (!failures.isEmpty()) {
            throw failures.get(0).error;
        }
        return entries;
    }
}
