package com.astro.stamps.fixture;

/**
 * Chooses which sources the engine optimizes together.
 */
public final class ActiveSources {

    public static final int MAX_DEFAULT_ACTIVE = 3;

    private ActiveSources() {
    }

    /**
     * @param numSources   catalog size
     * @param activeSource 1-based source to optimize alone, or a value below 1 for the default
     * @return 1-based source indices: the requested source, else all sources
     *         when there are at most three, else the first three
     */
    public static int[] select(int numSources, int activeSource) {
        if (activeSource > 0) {
            if (activeSource > numSources) {
                throw new IllegalArgumentException("Active source " + activeSource + " out of range for "
                        + numSources + " sources");
            }
            return new int[] { activeSource };
        }
        int n = Math.min(numSources, MAX_DEFAULT_ACTIVE);
        int[] active = new int[n];
        for (int s = 0; s < n; s++) active[s] = s + 1;
        return active;
    }
}
