package com.scandispatch;

import java.time.Instant;
import java.util.Objects;

/** Пассажир глазами диспетчера: от вызова до выхода из кабины. */
public final class Passenger {
    private final int id;
    private final int originFloor;
    private final int destinationFloor;
    private final Instant callTimestamp;

    public Passenger(int id, int originFloor, int destinationFloor, Instant callTimestamp) {
        if (originFloor == destinationFloor) {
            throw new IllegalArgumentException("Passenger-" + id + " origin equals destination: " + originFloor);
        }
        this.id = id;
        this.originFloor = originFloor;
        this.destinationFloor = destinationFloor;
        this.callTimestamp = Objects.requireNonNull(callTimestamp, "callTimestamp");
    }

    public Passenger(int id, int originFloor, int destinationFloor) {
        this(id, originFloor, destinationFloor, Instant.now());
    }

    public int id() { return id; }
    public int originFloor() { return originFloor; }
    public int destinationFloor() { return destinationFloor; }
    public Instant callTimestamp() { return callTimestamp; }

    /** Направление вызова этого пассажира. */
    public Direction direction() {
        return Direction.toward(originFloor, destinationFloor);
    }

    @Override
    public String toString() {
        return String.format("Passenger-%d [%d -> %d]", id, originFloor, destinationFloor);
    }
}
