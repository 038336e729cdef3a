package com.scandispatch;

import java.util.Objects;

/** «Лифт X на этаж Y». {@code immediate} означает без очереди, только для начальной расстановки. */
public final class MoveCommand {
    private final int carId;
    private final int targetFloor;
    private final boolean immediate;

    public MoveCommand(int carId, int targetFloor, boolean immediate) {
        this.carId = carId;
        this.targetFloor = targetFloor;
        this.immediate = immediate;
    }

    public int carId() { return carId; }
    public int targetFloor() { return targetFloor; }
    public boolean immediate() { return immediate; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MoveCommand)) return false;
        MoveCommand other = (MoveCommand) obj;
        return carId == other.carId && targetFloor == other.targetFloor && immediate == other.immediate;
    }

    @Override
    public int hashCode() {
        return Objects.hash(carId, targetFloor, immediate);
    }

    @Override
    public String toString() {
        return "Move{Car-" + carId + " -> F" + targetFloor + (immediate ? ", immediate" : "") + "}";
    }
}
