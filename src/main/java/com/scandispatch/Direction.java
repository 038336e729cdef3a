package com.scandispatch;

/**
 * Направление движения лифта или внешнего вызова.
 * Вызов всегда UP или DOWN; NONE бывает только у лифта без работы.
 */
public enum Direction {
    UP,
    DOWN,
    NONE;

    public Direction opposite() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            default -> NONE;
        };
    }

    /** Куда ехать с {@code from}, чтобы попасть на {@code to}; NONE, если уже там. */
    public static Direction toward(int from, int to) {
        if (to > from) return UP;
        if (to < from) return DOWN;
        return NONE;
    }

    /** {@code floor} строго впереди {@code current} при движении в эту сторону. */
    public boolean isAhead(int current, int floor) {
        if (this == UP) return floor > current;
        if (this == DOWN) return floor < current;
        return false;
    }
}
