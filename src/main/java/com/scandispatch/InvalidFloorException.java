package com.scandispatch;

/** Этаж вне {@code [0, maxFloor]}. Такие этажи отклоняются, а не подрезаются. */
public class InvalidFloorException extends DispatchException {

    private final int floor;
    private final int maxFloor;

    public InvalidFloorException(int floor, int maxFloor) {
        super("Floor " + floor + " is outside [0, " + maxFloor + "]");
        this.floor = floor;
        this.maxFloor = maxFloor;
    }

    public int floor() {
        return floor;
    }

    public int maxFloor() {
        return maxFloor;
    }

    static void check(int floor, int maxFloor) {
        if (floor < 0 || floor > maxFloor) {
            throw new InvalidFloorException(floor, maxFloor);
        }
    }
}
