package com.scandispatch;

public class CapacityExceededException extends DispatchException {

    public CapacityExceededException(int carId, int capacity) {
        super("Car-" + carId + " is already carrying " + capacity + " passengers (capacity " + capacity + ")");
    }
}
