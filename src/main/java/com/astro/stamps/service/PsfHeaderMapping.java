package com.astro.stamps.service;

import com.astro.stamps.model.Image;
import com.astro.stamps.model.PsfComponent;
import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import com.astro.stamps.model.StampHeader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Maps the flat {@code PSF_P0..PSF_P17} header keywords onto the three
 * PSF mixture components. Component k takes its weight from {@code PSF_P<k>},
 * its mean from the k-th pair of {@code PSF_P3..PSF_P8}, and its covariance
 * from the k-th triple of {@code PSF_P9..PSF_P17} ordered (var x, var y, cov xy).
 */
public final class PsfHeaderMapping {

    static final class Slot {
        final String weight;
        final String meanX;
        final String meanY;
        final String varX;
        final String varY;
        final String covXY;

        Slot(String weight, String meanX, String meanY, String varX, String varY, String covXY) {
            this.weight = weight;
            this.meanX = meanX;
            this.meanY = meanY;
            this.varX = varX;
            this.varY = varY;
            this.covXY = covXY;
        }
    }

    static final List<Slot> SLOTS = Collections.unmodifiableList(Arrays.asList(
            new Slot("PSF_P0", "PSF_P3", "PSF_P4", "PSF_P9", "PSF_P10", "PSF_P11"),
            new Slot("PSF_P1", "PSF_P5", "PSF_P6", "PSF_P12", "PSF_P13", "PSF_P14"),
            new Slot("PSF_P2", "PSF_P7", "PSF_P8", "PSF_P15", "PSF_P16", "PSF_P17")));

    private PsfHeaderMapping() {
    }

    public static List<PsfComponent> toPsf(StampHeader header) throws StampDataException {
        List<PsfComponent> psf = new ArrayList<>(Image.PSF_COMPONENTS);
        for (int k = 0; k < SLOTS.size(); k++) {
            Slot slot = SLOTS.get(k);
            double weight = header.getDouble(slot.weight);
            double[] mean = { header.getDouble(slot.meanX), header.getDouble(slot.meanY) };
            double a = header.getDouble(slot.varX);
            double b = header.getDouble(slot.varY);
            double c = header.getDouble(slot.covXY);
            try {
                psf.add(new PsfComponent(weight, mean, new double[][] { { a, c }, { c, b } }));
            } catch (IllegalArgumentException e) {
                throw new StampDataException(Kind.MALFORMED_VALUE, "PSF component " + (k + 1) + ": " + e.getMessage(), e);
            }
        }
        return psf;
    }
}
