package com.scandispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Изменяемое состояние одной кабины. Принадлежит {@link Fleet}; меняют его только диспетчер и
 * планировщик, все остальные читают {@link CarSnapshot}.
 */
public final class Car {

    /** Маркер «команда движения не выдана». */
    static final int NO_COMMAND = -1;

    private final int id;
    private final int capacity;
    private final int homeFloor;
    private final Zone zone;

    private int currentFloor;
    private Direction direction = Direction.NONE;
    private CarStatus status = CarStatus.RESTING;
    private int restingFloor;
    private int commandedFloor = NO_COMMAND;

    private final NavigableSet<Integer> targetFloors = new TreeSet<>();
    private final Set<HallCall> assignedCalls = new TreeSet<>();
    private final Map<Integer, Integer> onboard = new LinkedHashMap<>();

    Car(int id, int capacity, int homeFloor, Zone zone, int startFloor) {
        this.id = id;
        this.capacity = capacity;
        this.homeFloor = homeFloor;
        this.zone = zone;
        this.currentFloor = startFloor;
        this.restingFloor = startFloor;
    }

    public int id() { return id; }
    public int capacity() { return capacity; }
    public int homeFloor() { return homeFloor; }
    public Zone zone() { return zone; }
    public int currentFloor() { return currentFloor; }
    public Direction direction() { return direction; }
    public CarStatus status() { return status; }
    public int restingFloor() { return restingFloor; }

    public int load() {
        return onboard.size();
    }

    public boolean isFull() {
        return onboard.size() >= capacity;
    }

    public NavigableSet<Integer> targetFloors() {
        return Collections.unmodifiableNavigableSet(targetFloors);
    }

    public Set<HallCall> assignedCalls() {
        return Collections.unmodifiableSet(assignedCalls);
    }

    public Map<Integer, Integer> onboard() {
        return Collections.unmodifiableMap(onboard);
    }

    /** Ближайшая цель строго впереди по текущему направлению, либо null. */
    public Integer primaryTarget() {
        if (direction == Direction.UP) return targetFloors.higher(currentFloor);
        if (direction == Direction.DOWN) return targetFloors.lower(currentFloor);
        return null;
    }

    public CarSnapshot snapshot() {
        return new CarSnapshot(id, currentFloor, direction, status, onboard.size(), capacity,
                new TreeSet<>(targetFloors), zone, homeFloor, primaryTarget());
    }

    // --- изменение состояния: только диспетчер/планировщик ---

    void setCurrentFloor(int floor) { this.currentFloor = floor; }
    void setDirection(Direction direction) { this.direction = direction; }
    void setStatus(CarStatus status) { this.status = status; }
    void setRestingFloor(int floor) { this.restingFloor = floor; }

    int commandedFloor() { return commandedFloor; }
    void setCommandedFloor(int floor) { this.commandedFloor = floor; }

    NavigableSet<Integer> mutableTargets() { return targetFloors; }
    Set<HallCall> mutableAssignedCalls() { return assignedCalls; }

    void board(int passengerId, int destination) {
        if (!onboard.containsKey(passengerId) && onboard.size() >= capacity) {
            throw new CapacityExceededException(id, capacity);
        }
        onboard.put(passengerId, destination);
    }

    Integer alight(int passengerId) {
        return onboard.remove(passengerId);
    }

    /** Цели = этажи назначения пассажиров в кабине; назначенные внешние вызовы сбрасываются. */
    void resetTargetsToOnboard() {
        targetFloors.clear();
        assignedCalls.clear();
        for (Integer dest : onboard.values()) {
            if (dest != currentFloor) targetFloors.add(dest);
        }
    }

    @Override
    public String toString() {
        return "Car-" + id + "[" + direction + "|" + status + "] at F" + currentFloor
                + " targets=" + targetFloors + " load=" + onboard.size() + "/" + capacity;
    }
}
