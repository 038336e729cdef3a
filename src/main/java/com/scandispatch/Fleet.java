package com.scandispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Фиксированный парк лифтов для этажей {@code [0, maxFloor]}. Номера лифтов совпадают с индексами
 * {@code 0..size-1}; после создания лифты не добавляются и не удаляются.
 */
public final class Fleet {

    private final int maxFloor;
    private final List<Car> cars;

    private Fleet(int maxFloor, List<Car> cars) {
        this.maxFloor = maxFloor;
        this.cars = Collections.unmodifiableList(cars);
    }

    /**
     * Создаёт {@code carCount} лифтов, каждый на домашнем этаже своей зоны.
     *
     * @throws ConfigurationException если лифтов или этажей ноль
     */
    public static Fleet create(int carCount, int floorCount, DispatchPolicy policy) {
        if (carCount <= 0) {
            throw new ConfigurationException("Fleet needs at least one car, got " + carCount);
        }
        if (floorCount <= 0) {
            throw new ConfigurationException("Building needs at least one floor, got " + floorCount);
        }
        int maxFloor = floorCount - 1;
        ZonePartitioner partitioner = new ZonePartitioner(maxFloor, policy.zoneOverlapFraction());

        List<Car> cars = new ArrayList<>(carCount);
        for (int i = 0; i < carCount; i++) {
            int home = partitioner.homeFloor(i, carCount);
            Zone zone = partitioner.zoneFor(i, carCount);
            cars.add(new Car(i, policy.carCapacity(), home, zone, home));
        }
        return new Fleet(maxFloor, cars);
    }

    public int maxFloor() {
        return maxFloor;
    }

    public int size() {
        return cars.size();
    }

    public List<Car> cars() {
        return cars;
    }

    /** @throws ConfigurationException если такого лифта нет */
    public Car car(int carId) {
        if (carId < 0 || carId >= cars.size()) {
            throw new ConfigurationException("Car id " + carId + " is outside fleet of " + cars.size());
        }
        return cars.get(carId);
    }

    /** Лифт, за которым уже закреплён {@code call}, либо null. */
    public Car assigneeOf(HallCall call) {
        for (Car c : cars) {
            if (c.assignedCalls().contains(call)) return c;
        }
        return null;
    }

    public List<CarSnapshot> snapshot() {
        List<CarSnapshot> out = new ArrayList<>(cars.size());
        for (Car c : cars) {
            out.add(c.snapshot());
        }
        return out;
    }
}
