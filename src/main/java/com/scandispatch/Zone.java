package com.scandispatch;

/** Диапазон этажей (включительно), который лифт предпочитает. Влияет на оценку, но ничего не запрещает. */
public final class Zone {
    private final int low;
    private final int high;

    public Zone(int low, int high) {
        if (high < low) {
            throw new IllegalArgumentException("Empty zone [" + low + ", " + high + "]");
        }
        this.low = low;
        this.high = high;
    }

    public int low() {
        return low;
    }

    public int high() {
        return high;
    }

    public boolean contains(int floor) {
        return floor >= low && floor <= high;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Zone)) return false;
        Zone other = (Zone) obj;
        return low == other.low && high == other.high;
    }

    @Override
    public int hashCode() {
        return 31 * low + high;
    }

    @Override
    public String toString() {
        return "(" + low + ", " + high + ")";
    }
}
