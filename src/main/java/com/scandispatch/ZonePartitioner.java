package com.scandispatch;

/**
 * Делит {@code [0, maxFloor]} на непрерывные зоны, по одной на лифт, и ставит домашний этаж в
 * середину каждого сегмента. Вызывается один раз на лифт при создании парка.
 */
public final class ZonePartitioner {

    private final int maxFloor;
    private final double overlapFraction;

    public ZonePartitioner(int maxFloor) {
        this(maxFloor, 0.0);
    }

    /**
     * @param overlapFraction расширение каждой зоны с обеих сторон в долях сегмента
     *                        (при 0 зоны не пересекаются)
     */
    public ZonePartitioner(int maxFloor, double overlapFraction) {
        if (maxFloor < 0) {
            throw new ConfigurationException("maxFloor must not be negative: " + maxFloor);
        }
        if (overlapFraction < 0.0 || overlapFraction >= 1.0) {
            throw new ConfigurationException("overlapFraction must be within [0, 1): " + overlapFraction);
        }
        this.maxFloor = maxFloor;
        this.overlapFraction = overlapFraction;
    }

    public int maxFloor() {
        return maxFloor;
    }

    public int homeFloor(int index, int total) {
        checkIndex(index, total);
        if (total == 1) return maxFloor / 2;

        double segment = segment(total);
        return Math.min((int) Math.floor(index * segment + segment / 2), maxFloor);
    }

    public Zone zoneFor(int index, int total) {
        checkIndex(index, total);
        if (total == 1) return new Zone(0, maxFloor);

        double segment = segment(total);
        int low = (int) Math.floor(index * segment);
        int high = (index == total - 1) ? maxFloor : (int) Math.floor((index + 1) * segment) - 1;
        // лифтов больше, чем этажей: сегмент может быть уже одного этажа
        if (high < low) high = low;

        int margin = (int) Math.floor(segment * overlapFraction);
        if (margin > 0) {
            low = Math.max(0, low - margin);
            high = Math.min(maxFloor, high + margin);
        }
        return new Zone(low, high);
    }

    private double segment(int total) {
        return (maxFloor + 1) / (double) total;
    }

    private static void checkIndex(int index, int total) {
        if (total <= 0) {
            throw new ConfigurationException("Fleet size must be positive: " + total);
        }
        if (index < 0 || index >= total) {
            throw new ConfigurationException("Car index " + index + " is outside fleet of " + total);
        }
    }
}
