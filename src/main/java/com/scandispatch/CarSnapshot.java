package com.scandispatch;

import java.util.Collections;
import java.util.NavigableSet;

/** Неизменяемый снимок кабины на момент обработки события. */
public final class CarSnapshot {
    private final int id;
    private final int currentFloor;
    private final Direction direction;
    private final CarStatus status;
    private final int load;
    private final int capacity;
    private final NavigableSet<Integer> targetFloors;
    private final Zone zone;
    private final int homeFloor;

    // null, если впереди по направлению ничего нет
    private final Integer primaryTarget;

    public CarSnapshot(int id,
                       int currentFloor,
                       Direction direction,
                       CarStatus status,
                       int load,
                       int capacity,
                       NavigableSet<Integer> targetFloors,
                       Zone zone,
                       int homeFloor,
                       Integer primaryTarget) {
        this.id = id;
        this.currentFloor = currentFloor;
        this.direction = direction;
        this.status = status;
        this.load = load;
        this.capacity = capacity;
        this.targetFloors = Collections.unmodifiableNavigableSet(targetFloors);
        this.zone = zone;
        this.homeFloor = homeFloor;
        this.primaryTarget = primaryTarget;
    }

    public int id() { return id; }
    public int currentFloor() { return currentFloor; }
    public Direction direction() { return direction; }
    public CarStatus status() { return status; }
    public int load() { return load; }
    public int capacity() { return capacity; }
    public NavigableSet<Integer> targetFloors() { return targetFloors; }
    public Zone zone() { return zone; }
    public int homeFloor() { return homeFloor; }
    public Integer primaryTarget() { return primaryTarget; }

    public boolean isFull() { return load >= capacity; }
    public boolean hasPrimaryTarget() { return primaryTarget != null; }

    @Override
    public String toString() {
        return "Car-" + id + "[" + direction + "|" + status + "] at F" + currentFloor
                + " targets=" + targetFloors + " load=" + load + "/" + capacity;
    }
}
