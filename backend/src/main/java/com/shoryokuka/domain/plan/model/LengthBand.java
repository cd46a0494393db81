package com.shoryokuka.domain.plan.model;

/**
 * Expected visible length of a slot in characters (whitespace excluded).
 */
public record LengthBand(int min, int max) {

    public LengthBand {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid length band: " + min + ".." + max);
        }
    }

    public boolean contains(int length) {
        return length >= min && length <= max;
    }

    public int midpoint() {
        return (min + max) / 2;
    }
}
