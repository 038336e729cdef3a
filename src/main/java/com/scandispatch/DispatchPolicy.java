package com.scandispatch;

import java.util.HashMap;
import java.util.Map;

/**
 * Неизменяемый набор настроек для оценщика, разбиения на зоны и диспетчера.
 * Числа здесь задают политику, а не закон: в разных зданиях расстояние можно взвешивать по-разному.
 */
public final class DispatchPolicy {

    private final int carCapacity;
    private final double restingBaseScore;
    private final double restingDistanceWeight;
    private final double zoneBonus;
    private final double scanningBaseScore;
    private final double scanningDistanceWeight;
    private final double loadPenalty;
    private final double zoneOverlapFraction;
    private final int restDriftThreshold;
    private final int energyPerFloor;
    private final Map<Integer, Integer> energyPerFloorByCar;
    private final long noCarLogCooldownMs;
    private final boolean verbose;

    private DispatchPolicy(Builder b) {
        this.carCapacity = b.carCapacity;
        this.restingBaseScore = b.restingBaseScore;
        this.restingDistanceWeight = b.restingDistanceWeight;
        this.zoneBonus = b.zoneBonus;
        this.scanningBaseScore = b.scanningBaseScore;
        this.scanningDistanceWeight = b.scanningDistanceWeight;
        this.loadPenalty = b.loadPenalty;
        this.zoneOverlapFraction = b.zoneOverlapFraction;
        this.restDriftThreshold = b.restDriftThreshold;
        this.energyPerFloor = b.energyPerFloor;
        this.energyPerFloorByCar = Map.copyOf(b.energyPerFloorByCar);
        this.noCarLogCooldownMs = b.noCarLogCooldownMs;
        this.verbose = b.verbose;
    }

    public static DispatchPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.carCapacity = carCapacity;
        b.restingBaseScore = restingBaseScore;
        b.restingDistanceWeight = restingDistanceWeight;
        b.zoneBonus = zoneBonus;
        b.scanningBaseScore = scanningBaseScore;
        b.scanningDistanceWeight = scanningDistanceWeight;
        b.loadPenalty = loadPenalty;
        b.zoneOverlapFraction = zoneOverlapFraction;
        b.restDriftThreshold = restDriftThreshold;
        b.energyPerFloor = energyPerFloor;
        b.energyPerFloorByCar.putAll(energyPerFloorByCar);
        b.noCarLogCooldownMs = noCarLogCooldownMs;
        b.verbose = verbose;
        return b;
    }

    public int carCapacity() { return carCapacity; }
    public double restingBaseScore() { return restingBaseScore; }
    public double restingDistanceWeight() { return restingDistanceWeight; }
    public double zoneBonus() { return zoneBonus; }
    public double scanningBaseScore() { return scanningBaseScore; }
    public double scanningDistanceWeight() { return scanningDistanceWeight; }
    public double loadPenalty() { return loadPenalty; }
    public double zoneOverlapFraction() { return zoneOverlapFraction; }
    public int restDriftThreshold() { return restDriftThreshold; }
    public long noCarLogCooldownMs() { return noCarLogCooldownMs; }
    public boolean verbose() { return verbose; }

    /** Энергия на этаж для лифта (своё значение лифта, иначе общее). */
    public int energyPerFloor(int carId) {
        Integer v = energyPerFloorByCar.get(carId);
        return (v != null) ? v : energyPerFloor;
    }

    @Override
    public String toString() {
        return "DispatchPolicy{capacity=" + carCapacity
                + ", resting=" + restingBaseScore + "-" + restingDistanceWeight + "*d"
                + ", zoneBonus=" + zoneBonus
                + ", scanning=" + scanningBaseScore + "-" + scanningDistanceWeight + "*d"
                + ", loadPenalty=" + loadPenalty
                + ", zoneOverlap=" + zoneOverlapFraction
                + ", restDrift=" + restDriftThreshold + "}";
    }

    public static final class Builder {
        private int carCapacity = Config.CAR_CAPACITY;
        private double restingBaseScore = Config.RESTING_BASE_SCORE;
        private double restingDistanceWeight = Config.RESTING_DISTANCE_WEIGHT;
        private double zoneBonus = Config.ZONE_BONUS;
        private double scanningBaseScore = Config.SCANNING_BASE_SCORE;
        private double scanningDistanceWeight = Config.SCANNING_DISTANCE_WEIGHT;
        private double loadPenalty = Config.LOAD_PENALTY;
        private double zoneOverlapFraction = Config.ZONE_OVERLAP_FRACTION;
        private int restDriftThreshold = Config.REST_DRIFT_THRESHOLD;
        private int energyPerFloor = Config.ENERGY_PER_FLOOR;
        private final Map<Integer, Integer> energyPerFloorByCar = new HashMap<>();
        private long noCarLogCooldownMs = Config.NO_CAR_LOG_COOLDOWN_MS;
        private boolean verbose = Config.VERBOSE;

        private Builder() {}

        public Builder carCapacity(int v) { this.carCapacity = v; return this; }
        public Builder restingBaseScore(double v) { this.restingBaseScore = v; return this; }
        public Builder restingDistanceWeight(double v) { this.restingDistanceWeight = v; return this; }
        public Builder zoneBonus(double v) { this.zoneBonus = v; return this; }
        public Builder scanningBaseScore(double v) { this.scanningBaseScore = v; return this; }
        public Builder scanningDistanceWeight(double v) { this.scanningDistanceWeight = v; return this; }
        public Builder loadPenalty(double v) { this.loadPenalty = v; return this; }
        public Builder zoneOverlapFraction(double v) { this.zoneOverlapFraction = v; return this; }
        public Builder restDriftThreshold(int v) { this.restDriftThreshold = v; return this; }
        public Builder energyPerFloor(int v) { this.energyPerFloor = v; return this; }
        public Builder energyPerFloor(int carId, int v) { this.energyPerFloorByCar.put(carId, v); return this; }
        public Builder noCarLogCooldownMs(long v) { this.noCarLogCooldownMs = v; return this; }
        public Builder verbose(boolean v) { this.verbose = v; return this; }

        public DispatchPolicy build() {
            if (carCapacity <= 0) {
                throw new ConfigurationException("carCapacity must be positive: " + carCapacity);
            }
            if (loadPenalty < 0.0 || loadPenalty > 1.0) {
                throw new ConfigurationException("loadPenalty must be within [0, 1]: " + loadPenalty);
            }
            if (zoneOverlapFraction < 0.0 || zoneOverlapFraction >= 1.0) {
                throw new ConfigurationException("zoneOverlapFraction must be within [0, 1): " + zoneOverlapFraction);
            }
            if (restDriftThreshold < 0) {
                throw new ConfigurationException("restDriftThreshold must not be negative: " + restDriftThreshold);
            }
            if (energyPerFloor < 0 || energyPerFloorByCar.values().stream().anyMatch(v -> v == null || v < 0)) {
                throw new ConfigurationException("energy per floor must not be negative");
            }
            if (restingDistanceWeight < 0.0 || scanningDistanceWeight < 0.0) {
                throw new ConfigurationException("distance weights must not be negative");
            }
            return new DispatchPolicy(this);
        }
    }
}
