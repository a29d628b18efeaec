package com.astro.stamps.external;

/**
 * Zero-based slots of the engine's per-source parameter vector.
 * Array-valued slots cover one entry per source type or per color
 * coefficient, in the engine's order.
 */
public interface ParameterLayout {

    /** Star/galaxy probabilities. */
    int[] a();

    /** Position, two entries. */
    int[] u();

    int eDev();

    int eAxis();

    int eAngle();

    int eScale();

    /** Log-brightness mean, one entry per source type. */
    int[] r1();

    /** Log-brightness variance, one entry per source type. */
    int[] r2();

    /** Color means. */
    int[] c1();

    /** Color variances. */
    int[] c2();
}
