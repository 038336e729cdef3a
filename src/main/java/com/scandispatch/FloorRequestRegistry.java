package com.scandispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Ожидающие внешние вызовы: по флагу «вверх» и «вниз» на каждый этаж.
 * Этажи вне {@code [0, maxFloor]} отклоняются через {@link InvalidFloorException}.
 */
public final class FloorRequestRegistry {

    private final int maxFloor;
    private final boolean[] upCalls;
    private final boolean[] downCalls;
    private int pending;

    public FloorRequestRegistry(int maxFloor) {
        if (maxFloor < 0) {
            throw new ConfigurationException("maxFloor must not be negative: " + maxFloor);
        }
        this.maxFloor = maxFloor;
        this.upCalls = new boolean[maxFloor + 1];
        this.downCalls = new boolean[maxFloor + 1];
    }

    public int maxFloor() {
        return maxFloor;
    }

    /** Ставит флаг. true, если вызова до этого не было. */
    public boolean addCall(int floor, Direction direction) {
        boolean[] flags = flagsFor(floor, direction);
        if (flags[floor]) return false;
        flags[floor] = true;
        pending++;
        return true;
    }

    /** Снимает флаг. true, если вызов был. */
    public boolean clearCall(int floor, Direction direction) {
        boolean[] flags = flagsFor(floor, direction);
        if (!flags[floor]) return false;
        flags[floor] = false;
        pending--;
        return true;
    }

    public boolean hasCall(int floor, Direction direction) {
        return flagsFor(floor, direction)[floor];
    }

    public boolean hasAny() {
        return pending > 0;
    }

    public int size() {
        return pending;
    }

    /** Этажи с вызовом вверх или вниз, по возрастанию. */
    public NavigableSet<Integer> pendingFloors() {
        NavigableSet<Integer> out = new TreeSet<>();
        if (pending == 0) return out;
        for (int f = 0; f <= maxFloor; f++) {
            if (upCalls[f] || downCalls[f]) out.add(f);
        }
        return out;
    }

    /** Все ожидающие вызовы по этажам, на этаже сначала UP, потом DOWN. */
    public List<HallCall> pendingCalls() {
        List<HallCall> out = new ArrayList<>(pending);
        if (pending == 0) return out;
        for (int f = 0; f <= maxFloor; f++) {
            if (upCalls[f]) out.add(new HallCall(f, Direction.UP));
            if (downCalls[f]) out.add(new HallCall(f, Direction.DOWN));
        }
        return out;
    }

    private boolean[] flagsFor(int floor, Direction direction) {
        InvalidFloorException.check(floor, maxFloor);
        if (direction == Direction.UP) return upCalls;
        if (direction == Direction.DOWN) return downCalls;
        throw new IllegalArgumentException("Hall call needs UP or DOWN, got " + direction);
    }

    @Override
    public String toString() {
        List<Integer> up = new ArrayList<>();
        List<Integer> down = new ArrayList<>();
        for (int f = 0; f <= maxFloor; f++) {
            if (upCalls[f]) up.add(f);
            if (downCalls[f]) down.add(f);
        }
        return "up=" + up + ", down=" + down;
    }
}
