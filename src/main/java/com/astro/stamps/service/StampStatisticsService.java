package com.astro.stamps.service;

import com.astro.stamps.model.Image;
import com.astro.stamps.model.StampSummary;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;

public class StampStatisticsService {

    public StampSummary summarize(Image image) {
        double[][] data = image.getPixels();
        int h = data.length;
        int w = data[0].length;

        // ImageJ is row-major with width along the second index
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();
        for (int i = 0; i < h; i++)
            for (int j = 0; j < w; j++)
                px[i * w + j] = (float) data[i][j];

        ImageStatistics stats = ip.getStatistics();
        return new StampSummary(image.getBand(), h * w, stats.min, stats.max, stats.mean, stats.stdDev);
    }
}
