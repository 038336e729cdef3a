package com.scandispatch;

import java.util.NavigableSet;
import java.util.Set;

/**
 * LOOK для одного лифта: едем в текущую сторону, пока впереди есть цели, разворачиваемся только
 * когда впереди пусто. Всегда едем к ближайшей цели впереди (nearest-first LOOK).
 */
public final class ScanPlanner {

    /**
     * Выбирает следующую остановку и обновляет направление и статус лифта.
     *
     * @return следующий этаж, либо null, если делать нечего (лифт переводится в RESTING)
     */
    public Integer nextStop(Car car) {
        NavigableSet<Integer> targets = car.mutableTargets();
        int current = car.currentFloor();

        if (targets.isEmpty()) {
            car.setStatus(CarStatus.RESTING);
            car.setDirection(Direction.NONE);
            return null;
        }

        car.setStatus(CarStatus.SCANNING);

        // сначала открываем двери здесь
        if (targets.contains(current)) {
            return current;
        }

        Direction dir = car.direction();
        if (dir == Direction.NONE) {
            dir = preferredDirection(targets, current);
            car.setDirection(dir);
        }

        Integer next = nearestAhead(targets, current, dir);
        if (next != null) return next;

        // впереди пусто: разворот, ровно один
        dir = dir.opposite();
        car.setDirection(dir);
        next = nearestAhead(targets, current, dir);
        if (next != null) return next;

        // сюда не попадаем: цели не пусты и текущего этажа среди них нет
        return targets.first();
    }

    /**
     * Учёт остановки на {@code floor}: этаж снимается с целей, гасится вызов в том направлении,
     * которое лифт будет обслуживать, и маршрут перепланируется.
     */
    public StopResult onStop(Car car, int floor, FloorRequestRegistry registry) {
        car.setCurrentFloor(floor);
        car.setStatus(CarStatus.LOADING);
        car.setCommandedFloor(Car.NO_COMMAND);
        car.mutableTargets().remove(floor);

        Direction served = serviceDirection(car, floor, registry);
        boolean cleared = false;
        if (served != Direction.NONE) {
            cleared = registry.clearCall(floor, served);
            car.setDirection(served);
        }
        // вызовы этого этажа в другую сторону возвращаются в общий пул
        car.mutableAssignedCalls().removeIf(c -> c.floor() == floor);

        Integer next = null;
        if (!car.mutableTargets().isEmpty() || car.load() > 0) {
            next = nextStop(car);
        }
        if (next == null) {
            rest(car);
        }
        return new StopResult(floor, served, cleared, next);
    }

    /** Лифт отдыхает там, где стоит. */
    public void rest(Car car) {
        car.setStatus(CarStatus.RESTING);
        car.setDirection(Direction.NONE);
        car.setRestingFloor(car.currentFloor());
    }

    /**
     * Какое направление обслуживает лифт, остановившийся на {@code floor}. Текущее направление, пока
     * на этаже есть назначенный вызов в эту сторону или впереди есть работа; иначе назначенный здесь
     * вызов, затем разворот к работе позади, затем любой ожидающий вызов.
     */
    Direction serviceDirection(Car car, int floor, FloorRequestRegistry registry) {
        Direction heading = car.direction();
        Set<HallCall> assigned = car.mutableAssignedCalls();

        if (heading != Direction.NONE) {
            if (assigned.contains(new HallCall(floor, heading)) || hasWorkAhead(car, floor, heading)) {
                return heading;
            }
        }
        for (HallCall c : assigned) {
            if (c.floor() == floor) return c.direction();
        }
        if (heading != Direction.NONE) {
            if (hasWorkAhead(car, floor, heading.opposite())) return heading.opposite();
            if (registry.hasCall(floor, heading)) return heading;
            if (registry.hasCall(floor, heading.opposite())) return heading.opposite();
            return heading;
        }
        if (registry.hasCall(floor, Direction.UP)) return Direction.UP;
        if (registry.hasCall(floor, Direction.DOWN)) return Direction.DOWN;
        return Direction.NONE;
    }

    private static boolean hasWorkAhead(Car car, int floor, Direction dir) {
        return nearestAhead(car.mutableTargets(), floor, dir) != null;
    }

    private static Integer nearestAhead(NavigableSet<Integer> targets, int current, Direction dir) {
        if (dir == Direction.UP) return targets.higher(current);
        if (dir == Direction.DOWN) return targets.lower(current);
        return null;
    }

    private static Direction preferredDirection(NavigableSet<Integer> targets, int current) {
        Integer up = targets.higher(current);
        Integer down = targets.lower(current);
        if (up == null) return Direction.DOWN;
        if (down == null) return Direction.UP;
        int distUp = up - current;
        int distDown = current - down;
        return (distUp <= distDown) ? Direction.UP : Direction.DOWN;
    }

    public static final class StopResult {
        private final int floor;
        private final Direction served;
        private final boolean callCleared;
        private final Integer nextStop;

        StopResult(int floor, Direction served, boolean callCleared, Integer nextStop) {
            this.floor = floor;
            this.served = served;
            this.callCleared = callCleared;
            this.nextStop = nextStop;
        }

        public int floor() { return floor; }
        public Direction served() { return served; }
        public boolean callCleared() { return callCleared; }
        /** null, если лифт ушёл на отдых. */
        public Integer nextStop() { return nextStop; }
    }
}
