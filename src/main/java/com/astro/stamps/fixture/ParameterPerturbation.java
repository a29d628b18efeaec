package com.astro.stamps.fixture;

import com.astro.stamps.external.ParameterLayout;
import java.util.List;

/**
 * Moves initial parameters away from the truth so derivatives are not zero.
 * The offsets are fixed; tests depend on the exact values.
 */
public final class ParameterPerturbation {

    private ParameterPerturbation() {
    }

    public static void perturb(List<double[]> vp, ParameterLayout ids) {
        for (double[] vs : vp) {
            int[] a = ids.a();
            vs[a[0]] = 0.4;
            vs[a[1]] = 0.6;
            int[] u = ids.u();
            vs[u[0]] += 0.8;
            vs[u[1]] -= 0.7;
            for (int i : ids.r1()) vs[i] -= Math.log(10);
            for (int i : ids.r2()) vs[i] *= 25.0;
            vs[ids.eDev()] += 0.05;
            vs[ids.eAxis()] += 0.05;
            vs[ids.eAngle()] += Math.PI / 10;
            vs[ids.eScale()] *= 1.2;
            for (int i : ids.c1()) vs[i] += 0.5;
            for (int i : ids.c2()) vs[i] = 0.1;
        }
    }
}
