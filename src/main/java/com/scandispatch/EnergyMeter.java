package com.scandispatch;

import java.util.Objects;

/**
 * Счётчики пути и энергии по лифтам. Только для отчёта: решения диспетчера от них не зависят.
 */
public final class EnergyMeter {

    private final DispatchPolicy policy;
    private final long[] floorsTravelled;
    private final long[] movesCommanded;
    private final long[] energy;

    public EnergyMeter(int cars, DispatchPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.floorsTravelled = new long[cars];
        this.movesCommanded = new long[cars];
        this.energy = new long[cars];
    }

    private EnergyMeter(EnergyMeter source) {
        this.policy = source.policy;
        this.floorsTravelled = source.floorsTravelled.clone();
        this.movesCommanded = source.movesCommanded.clone();
        this.energy = source.energy.clone();
    }

    /** Независимая копия счётчиков на текущий момент. */
    EnergyMeter copy() {
        return new EnergyMeter(this);
    }

    void recordTravel(int carId, int fromFloor, int toFloor) {
        int floors = Math.abs(toFloor - fromFloor);
        if (floors == 0) return;
        floorsTravelled[carId] += floors;
        energy[carId] += (long) floors * policy.energyPerFloor(carId);
    }

    void recordCommand(int carId) {
        movesCommanded[carId]++;
    }

    public int cars() {
        return energy.length;
    }

    public long floorsTravelled(int carId) {
        return floorsTravelled[carId];
    }

    public long movesCommanded(int carId) {
        return movesCommanded[carId];
    }

    public long energy(int carId) {
        return energy[carId];
    }

    public long totalEnergy() {
        long sum = 0;
        for (long e : energy) sum += e;
        return sum;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder("energy total=").append(totalEnergy());
        for (int i = 0; i < energy.length; i++) {
            sb.append(" | Car-").append(i)
                    .append(": floors=").append(floorsTravelled[i])
                    .append(", moves=").append(movesCommanded[i])
                    .append(", energy=").append(energy[i]);
        }
        return sb.toString();
    }
}
