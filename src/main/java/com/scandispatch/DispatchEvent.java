package com.scandispatch;

import java.util.Objects;

/**
 * Входящее событие от движка. Поля, не относящиеся к типу события, равны -1 / NONE.
 */
public final class DispatchEvent {

    public enum Type { CALL, STOPPED, BOARD, ALIGHT, IDLE, PASSING }

    private final Type type;
    private final int carId;
    private final int floor;
    private final Direction direction;
    private final int passengerId;
    private final int destination;

    private DispatchEvent(Type type, int carId, int floor, Direction direction, int passengerId, int destination) {
        this.type = Objects.requireNonNull(type, "type");
        this.carId = carId;
        this.floor = floor;
        this.direction = Objects.requireNonNull(direction, "direction");
        this.passengerId = passengerId;
        this.destination = destination;
    }

    public static DispatchEvent call(int floor, Direction direction) {
        return new DispatchEvent(Type.CALL, -1, floor, direction, -1, -1);
    }

    public static DispatchEvent call(Passenger p) {
        return new DispatchEvent(Type.CALL, -1, p.originFloor(), p.direction(), p.id(), p.destinationFloor());
    }

    public static DispatchEvent stopped(int carId, int floor) {
        return new DispatchEvent(Type.STOPPED, carId, floor, Direction.NONE, -1, -1);
    }

    public static DispatchEvent board(int carId, int passengerId, int destination) {
        return new DispatchEvent(Type.BOARD, carId, -1, Direction.NONE, passengerId, destination);
    }

    public static DispatchEvent alight(int carId, int passengerId, int floor) {
        return new DispatchEvent(Type.ALIGHT, carId, floor, Direction.NONE, passengerId, -1);
    }

    public static DispatchEvent idle(int carId) {
        return new DispatchEvent(Type.IDLE, carId, -1, Direction.NONE, -1, -1);
    }

    public static DispatchEvent passing(int carId, int floor) {
        return new DispatchEvent(Type.PASSING, carId, floor, Direction.NONE, -1, -1);
    }

    public Type type() { return type; }
    public int carId() { return carId; }
    public int floor() { return floor; }
    public Direction direction() { return direction; }
    public int passengerId() { return passengerId; }
    public int destination() { return destination; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DispatchEvent)) return false;
        DispatchEvent o = (DispatchEvent) obj;
        return type == o.type && carId == o.carId && floor == o.floor && direction == o.direction
                && passengerId == o.passengerId && destination == o.destination;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, carId, floor, direction, passengerId, destination);
    }

    @Override
    public String toString() {
        return switch (type) {
            case CALL -> "CALL{F" + floor + "," + direction + "}";
            case STOPPED -> "STOPPED{Car-" + carId + ",F" + floor + "}";
            case BOARD -> "BOARD{Car-" + carId + ",P" + passengerId + "->F" + destination + "}";
            case ALIGHT -> "ALIGHT{Car-" + carId + ",P" + passengerId + "@F" + floor + "}";
            case IDLE -> "IDLE{Car-" + carId + "}";
            case PASSING -> "PASSING{Car-" + carId + ",F" + floor + "}";
        };
    }
}
