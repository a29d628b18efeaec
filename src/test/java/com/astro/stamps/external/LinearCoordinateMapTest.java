package com.astro.stamps.external;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearCoordinateMapTest {

    @Test
    void testIdentityMapsPixelsToThemselves() {
        CoordinateMap id = LinearCoordinateMap.identity();
        assertArrayEquals(new double[] { 10.1, 12.2 }, id.pixToWorld(new double[] { 10.1, 12.2 }), 1e-12);
        assertArrayEquals(new double[] { 1, 1 }, id.pixToWorld(new double[] { 1, 1 }));
    }

    @Test
    void testBatchTransformKeepsOrder() {
        CoordinateMap map = new LinearCoordinateMap(new double[] { 1, 1 }, new double[] { 100, -20 },
                new double[][] { { 0, 0.5 }, { 2, 0 } });
        double[][] world = map.pixToWorld(new double[][] { { 1, 1 }, { 3, 5 } });

        assertArrayEquals(new double[] { 100, -20 }, world[0], 1e-12);
        assertArrayEquals(new double[] { 102, -16 }, world[1], 1e-12);
    }
}
