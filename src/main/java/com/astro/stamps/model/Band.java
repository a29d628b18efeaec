package com.astro.stamps.model;

/**
 * The five photometric bands of a stamp, in the order the inference engine
 * indexes flux vectors.
 */
public enum Band {
    U('u'), G('g'), R('r'), I('i'), Z('z');

    public static final int COUNT = 5;

    private final char letter;

    Band(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    /** Zero-based position in a flux vector. */
    public int index() {
        return ordinal();
    }
}
