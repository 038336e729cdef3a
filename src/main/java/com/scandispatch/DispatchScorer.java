package com.scandispatch;

import java.util.Objects;

/**
 * Оценка лифтов для внешнего вызова. Чем больше, тем лучше; оценка {@code <= 0} значит «не кандидат».
 *
 * <ul>
 *   <li>Свободный лифт: {@code base - weight * distance}, плюс бонус, если вызов в его зоне.
 *   <li>Лифт в движении: только если едет в сторону вызова, вызов лежит между кабиной и ближайшей
 *       целью и остановка на нём экономит путь; {@code base - weight * distance} с поправкой на загрузку.
 *   <li>Полный лифт: никогда.
 * </ul>
 *
 * Чистая функция от снимка, ничего не меняет.
 */
public final class DispatchScorer {

    private final DispatchPolicy policy;

    public DispatchScorer(DispatchPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public double score(CarSnapshot s, int callFloor, Direction callDirection) {
        if (s.isFull()) return 0.0;

        int distance = Math.abs(s.currentFloor() - callFloor);
        if (s.status() == CarStatus.RESTING) {
            return affinity(s, callFloor);
        }
        if (s.status() == CarStatus.SCANNING) {
            if (!isOnTheWay(s, callFloor, callDirection) || benefit(s, callFloor) <= 0) return 0.0;
            double score = policy.scanningBaseScore() - policy.scanningDistanceWeight() * distance;
            double ratio = Math.min(1.0, (double) s.load() / (double) s.capacity());
            return score * (1.0 - policy.loadPenalty() * ratio);
        }
        return 0.0;
    }

    /**
     * Оценка этажа «как для свободного лифта», независимо от статуса: штраф за расстояние плюс бонус
     * зоны. Используется и когда освободившийся лифт сам выбирает себе ожидающий вызов.
     */
    public double affinity(CarSnapshot s, int floor) {
        int distance = Math.abs(s.currentFloor() - floor);
        double score = policy.restingBaseScore() - policy.restingDistanceWeight() * distance;
        if (s.zone().contains(floor)) {
            score += policy.zoneBonus();
        }
        return score;
    }

    public double score(CarSnapshot s, HallCall call) {
        return score(s, call.floor(), call.direction());
    }

    /**
     * Лифт в движении едет в сторону {@code callDirection}, а вызов лежит от текущего этажа
     * (включительно) до ближайшей цели (включительно). Выигрыш проверяется отдельно, см. {@link #benefit}.
     */
    public boolean isOnTheWay(CarSnapshot s, int callFloor, Direction callDirection) {
        if (s.status() != CarStatus.SCANNING) return false;
        if (s.direction() != callDirection) return false;
        Integer primary = s.primaryTarget();
        if (primary == null) return false;

        if (callDirection == Direction.UP) {
            return s.currentFloor() <= callFloor && callFloor <= primary;
        }
        if (callDirection == Direction.DOWN) {
            return s.currentFloor() >= callFloor && callFloor >= primary;
        }
        return false;
    }

    /** Сколько этажей экономит остановка на вызове перед ближайшей целью. Имеет смысл только «по пути». */
    public int benefit(CarSnapshot s, int callFloor) {
        Integer primary = s.primaryTarget();
        if (primary == null) return 0;
        return Math.abs(s.currentFloor() - primary) - Math.abs(s.currentFloor() - callFloor);
    }

    /** Почему лифт может или не может взять вызов сейчас. */
    public CallRejectReason eligibility(CarSnapshot s, HallCall call) {
        if (s.isFull()) return CallRejectReason.FULL_CAPACITY;
        if (s.status() == CarStatus.LOADING) return CallRejectReason.NOT_AVAILABLE;

        if (s.status() == CarStatus.SCANNING) {
            if (s.direction() != call.direction()) return CallRejectReason.WRONG_DIRECTION;
            if (!s.hasPrimaryTarget()) return CallRejectReason.NO_ROUTE_AHEAD;
            if (!isOnTheWay(s, call.floor(), call.direction()) || benefit(s, call.floor()) <= 0) {
                return CallRejectReason.OUT_OF_ROUTE;
            }
        }
        return score(s, call) > 0.0 ? CallRejectReason.ACCEPTED : CallRejectReason.NOT_AVAILABLE;
    }

    /** Побеждает большая оценка; при равенстве выигрывает меньший номер лифта. */
    public static boolean isBetter(double score, int carId, double bestScore, int bestCarId) {
        if (score > bestScore) return true;
        return score == bestScore && carId < bestCarId;
    }
}
