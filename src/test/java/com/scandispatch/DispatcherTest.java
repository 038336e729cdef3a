package com.scandispatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DispatcherTest {

    private static final DispatchPolicy QUIET = DispatchPolicy.builder().verbose(false).build();

    private CommandSink sink;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        sink = mock(CommandSink.class);
        dispatcher = new Dispatcher(QUIET, sink, s -> {});
    }

    @Test
    void initFleet_placesCarsAtHomeImmediately() {
        List<MoveCommand> out = dispatcher.initFleet(2, 10);

        assertEquals(List.of(new MoveCommand(0, 2, true), new MoveCommand(1, 7, true)), out);
        verify(sink).moveCommand(new MoveCommand(0, 2, true));
        verify(sink).moveCommand(new MoveCommand(1, 7, true));
        assertEquals(new Zone(0, 4), dispatcher.snapshot(0).zone());
        assertEquals(new Zone(5, 9), dispatcher.snapshot(1).zone());
        assertEquals(CarStatus.RESTING, dispatcher.snapshot(0).status());
    }

    @Test
    void initFleet_singleCar_ownsWholeBuilding() {
        List<MoveCommand> out = dispatcher.initFleet(1, 10);

        assertEquals(List.of(new MoveCommand(0, 4, true)), out);
        CarSnapshot s = dispatcher.snapshot(0);
        assertEquals(4, s.homeFloor());
        assertEquals(new Zone(0, 9), s.zone());
        assertEquals(9, dispatcher.maxFloor());
    }

    @Test
    void onCall_bothCarsResting_zoneOwnerWins() {
        dispatcher.initFleet(2, 10);

        List<MoveCommand> out = dispatcher.onCall(5, Direction.UP);

        assertEquals(List.of(new MoveCommand(1, 5, false)), out);
        verify(sink).moveCommand(new MoveCommand(1, 5, false));
        CarSnapshot car1 = dispatcher.snapshot(1);
        assertEquals(CarStatus.SCANNING, car1.status());
        // едет вниз от дома к вызову вверх
        assertEquals(Direction.DOWN, car1.direction());
        assertEquals(Set.of(5), car1.targetFloors());
        assertEquals(Integer.valueOf(1), dispatcher.assigneeOf(5, Direction.UP));
        assertEquals(CarStatus.RESTING, dispatcher.snapshot(0).status());
    }

    @Test
    void onCall_repeated_isNotReassigned() {
        dispatcher.initFleet(2, 10);
        dispatcher.onCall(5, Direction.UP);

        List<MoveCommand> again = dispatcher.onCall(5, Direction.UP);

        assertTrue(again.isEmpty());
        verify(sink, times(1)).moveCommand(new MoveCommand(1, 5, false));
        assertEquals(Integer.valueOf(1), dispatcher.assigneeOf(5, Direction.UP));
        assertEquals(CarStatus.RESTING, dispatcher.snapshot(0).status());
    }

    @Test
    void onCall_scanningCarWithCallOnTheWay_redirectsWithoutTurning() {
        dispatcher.initFleet(1, 10);
        dispatcher.onCall(3, Direction.UP);
        dispatcher.onStopped(0, 3);
        dispatcher.onBoard(0, 1, 6);
        dispatcher.onBoard(0, 2, 8);
        assertEquals(Direction.UP, dispatcher.snapshot(0).direction());
        assertEquals(Set.of(6, 8), dispatcher.snapshot(0).targetFloors());

        List<MoveCommand> out = dispatcher.onCall(5, Direction.UP);

        assertEquals(List.of(new MoveCommand(0, 5, false)), out);
        CarSnapshot s = dispatcher.snapshot(0);
        assertEquals(Direction.UP, s.direction());
        assertEquals(Set.of(5, 6, 8), s.targetFloors());
        assertEquals(Integer.valueOf(5), s.primaryTarget());
    }

    @Test
    void onCall_upCallAtScanningCarsFloor_goesToThatCar() {
        dispatcher.initFleet(2, 10);
        dispatcher.onBoard(0, 1, 6);
        dispatcher.onBoard(0, 2, 8);
        dispatcher.onPassing(0, 3);

        List<MoveCommand> out = dispatcher.onCall(3, Direction.UP);

        assertEquals(List.of(new MoveCommand(0, 3, false)), out);
        assertEquals(Integer.valueOf(0), dispatcher.assigneeOf(3, Direction.UP));
        assertEquals(Set.of(3, 6, 8), dispatcher.snapshot(0).targetFloors());
        assertEquals(Direction.UP, dispatcher.snapshot(0).direction());
        assertEquals(CarStatus.RESTING, dispatcher.snapshot(1).status());
    }

    @Test
    void onCall_callAtPrimaryTarget_isNotTakenOnTheWay() {
        dispatcher.initFleet(2, 10);
        dispatcher.onBoard(0, 1, 6);
        dispatcher.onBoard(0, 2, 8);
        dispatcher.onPassing(0, 3);

        List<MoveCommand> out = dispatcher.onCall(6, Direction.UP);

        assertEquals(List.of(new MoveCommand(1, 6, false)), out);
        assertEquals(Integer.valueOf(1), dispatcher.assigneeOf(6, Direction.UP));
        assertEquals(Set.of(6, 8), dispatcher.snapshot(0).targetFloors());
    }

    @Test
    void onCall_callBehindScanningCar_waitsAndIsPickedUpAfterStop() {
        dispatcher.initFleet(1, 10);
        dispatcher.onBoard(0, 1, 9);
        verify(sink).moveCommand(new MoveCommand(0, 9, false));

        assertTrue(dispatcher.onCall(2, Direction.UP).isEmpty());
        assertNull(dispatcher.assigneeOf(2, Direction.UP));
        assertTrue(dispatcher.hasPendingRequests());

        List<MoveCommand> out = dispatcher.onStopped(0, 9);

        assertEquals(List.of(new MoveCommand(0, 2, false)), out);
        assertEquals(Integer.valueOf(0), dispatcher.assigneeOf(2, Direction.UP));
        assertEquals(Direction.DOWN, dispatcher.snapshot(0).direction());
    }

    @Test
    void onCall_equalScores_lowestIdWins() {
        DispatchPolicy noBonus = QUIET.toBuilder().zoneBonus(0).build();
        Dispatcher d = new Dispatcher(noBonus, sink, s -> {});
        // дома на 2 и 8, оба в шести этажах от 5
        d.initFleet(2, 11);

        assertEquals(List.of(new MoveCommand(0, 5, false)), d.onCall(5, Direction.DOWN));
    }

    @Test
    void onCall_noPositiveScore_nearestRestingCarIsWokenAnyway() {
        DispatchPolicy flat = QUIET.toBuilder().restingBaseScore(1).zoneBonus(0).build();
        Dispatcher d = new Dispatcher(flat, sink, s -> {});
        d.initFleet(2, 10);

        assertEquals(List.of(new MoveCommand(0, 0, false)), d.onCall(0, Direction.UP));
        assertEquals(Integer.valueOf(0), d.assigneeOf(0, Direction.UP));
    }

    @Test
    void onStopped_servesAssignedCallAndRests() {
        dispatcher.initFleet(2, 10);
        dispatcher.onCall(5, Direction.UP);

        List<MoveCommand> out = dispatcher.onStopped(1, 5);

        assertTrue(out.isEmpty());
        assertFalse(dispatcher.hasPendingRequests());
        CarSnapshot s = dispatcher.snapshot(1);
        assertEquals(CarStatus.RESTING, s.status());
        assertEquals(Direction.NONE, s.direction());
        assertEquals(5, s.currentFloor());
        assertNull(dispatcher.assigneeOf(5, Direction.UP));
    }

    @Test
    void onStopped_otherCarServesFirst_callIsDroppedFromAssignee() {
        dispatcher.initFleet(2, 10);
        dispatcher.onCall(5, Direction.UP);
        dispatcher.onBoard(0, 1, 5);

        dispatcher.onStopped(0, 5);

        assertFalse(dispatcher.hasPendingRequests());
        assertNull(dispatcher.assigneeOf(5, Direction.UP));
        CarSnapshot car1 = dispatcher.snapshot(1);
        assertTrue(car1.targetFloors().isEmpty());
        assertEquals(CarStatus.RESTING, car1.status());
    }

    @Test
    void onBoard_restingCar_isActivated() {
        dispatcher.initFleet(1, 10);

        List<MoveCommand> out = dispatcher.onBoard(0, 7, 9);

        assertEquals(List.of(new MoveCommand(0, 9, false)), out);
        CarSnapshot s = dispatcher.snapshot(0);
        assertEquals(CarStatus.SCANNING, s.status());
        assertEquals(Direction.UP, s.direction());
        assertEquals(1, s.load());
    }

    @Test
    void onBoard_destinationIsCurrentFloor_recordedButNoTarget() {
        dispatcher.initFleet(1, 10);

        assertTrue(dispatcher.onBoard(0, 7, 4).isEmpty());

        CarSnapshot s = dispatcher.snapshot(0);
        assertEquals(1, s.load());
        assertTrue(s.targetFloors().isEmpty());
        assertEquals(CarStatus.RESTING, s.status());
    }

    @Test
    void onBoard_secondDestinationBehindNextStop_sendsNoNewCommand() {
        dispatcher.initFleet(1, 10);
        dispatcher.onBoard(0, 1, 6);

        assertTrue(dispatcher.onBoard(0, 2, 8).isEmpty());
        verify(sink, never()).moveCommand(new MoveCommand(0, 8, false));
    }

    @Test
    void onBoard_carFull_throws() {
        Dispatcher d = new Dispatcher(QUIET.toBuilder().carCapacity(1).build(), sink, s -> {});
        d.initFleet(1, 10);
        d.onBoard(0, 1, 6);

        CapacityExceededException ex = assertThrows(CapacityExceededException.class, () -> d.onBoard(0, 2, 7));
        assertEquals(1, d.snapshot(0).load());
        assertNotNull(ex.getMessage());
    }

    @Test
    void onAlight_keepsTargetsUntilStop() {
        dispatcher.initFleet(1, 10);
        dispatcher.onBoard(0, 1, 6);
        dispatcher.onBoard(0, 2, 8);

        assertTrue(dispatcher.onAlight(0, 1, 6).isEmpty());

        CarSnapshot s = dispatcher.snapshot(0);
        assertEquals(1, s.load());
        assertEquals(6, s.currentFloor());
        assertTrue(s.targetFloors().contains(6));
    }

    @Test
    void onAlight_freedCapacity_takesWaitingCall() {
        Dispatcher d = new Dispatcher(QUIET.toBuilder().carCapacity(1).build(), sink, s -> {});
        d.initFleet(1, 10);
        d.onBoard(0, 1, 9);
        d.onCall(5, Direction.UP);
        d.onStopped(0, 9);
        assertNull(d.assigneeOf(5, Direction.UP));

        List<MoveCommand> out = d.onAlight(0, 1, 9);

        assertEquals(List.of(new MoveCommand(0, 5, false)), out);
        assertEquals(Integer.valueOf(0), d.assigneeOf(5, Direction.UP));
    }

    @Test
    void onIdle_repeated_changesNothing() {
        dispatcher.initFleet(1, 10);
        dispatcher.onCall(3, Direction.UP);
        dispatcher.onStopped(0, 3);
        dispatcher.onBoard(0, 1, 6);
        CarSnapshot before = dispatcher.snapshot(0);

        List<MoveCommand> first = dispatcher.onIdle(0);
        CarSnapshot afterFirst = dispatcher.snapshot(0);
        List<MoveCommand> second = dispatcher.onIdle(0);
        CarSnapshot afterSecond = dispatcher.snapshot(0);

        assertTrue(first.size() + second.size() <= 1);
        assertTrue(second.isEmpty());
        for (CarSnapshot s : List.of(afterFirst, afterSecond)) {
            assertEquals(before.status(), s.status());
            assertEquals(before.direction(), s.direction());
            assertEquals(before.targetFloors(), s.targetFloors());
            assertEquals(before.load(), s.load());
        }
    }

    @Test
    void onIdle_displacedRestingCar_driftsHomeOnce() {
        dispatcher.initFleet(1, 10);
        dispatcher.onCall(8, Direction.DOWN);
        dispatcher.onStopped(0, 8);

        List<MoveCommand> first = dispatcher.onIdle(0);
        List<MoveCommand> second = dispatcher.onIdle(0);

        assertEquals(List.of(new MoveCommand(0, 4, false)), first);
        assertTrue(second.isEmpty());
        assertEquals(CarStatus.RESTING, dispatcher.snapshot(0).status());
    }

    @Test
    void onIdle_nearHome_staysPut() {
        dispatcher.initFleet(1, 10);
        dispatcher.onCall(6, Direction.DOWN);
        dispatcher.onStopped(0, 6);

        assertTrue(dispatcher.onIdle(0).isEmpty());
        assertEquals(6, dispatcher.snapshot(0).currentFloor());
    }

    @Test
    void onPassing_updatesFloorAndEnergyOnly() {
        dispatcher.initFleet(2, 10);
        dispatcher.onCall(5, Direction.UP);

        EnergyMeter before = dispatcher.energy();
        assertTrue(dispatcher.onPassing(1, 6).isEmpty());

        assertEquals(6, dispatcher.snapshot(1).currentFloor());
        assertEquals(1, dispatcher.energy().floorsTravelled(1));
        assertEquals(0, before.floorsTravelled(1));
        assertEquals(Integer.valueOf(1), dispatcher.assigneeOf(5, Direction.UP));
    }

    @Test
    void handleTick_processesEventsInOrder() {
        List<String> logs = new ArrayList<>();
        Dispatcher d = new Dispatcher(DispatchPolicy.defaults(), sink, logs::add);
        d.initFleet(2, 10);

        List<MoveCommand> out = d.handleTick(1, List.of(
                DispatchEvent.call(5, Direction.UP),
                DispatchEvent.passing(1, 6),
                DispatchEvent.stopped(1, 5)));

        assertEquals(List.of(new MoveCommand(1, 5, false)), out);
        assertFalse(d.hasPendingRequests());
        assertEquals(2, d.energy().floorsTravelled(1));
        assertEquals(2, d.energy().movesCommanded(1));
        assertTrue(logs.stream().anyMatch(l -> l.contains("[Dispatcher][TICK] Tick 1: 3 events")));
        assertTrue(logs.stream().anyMatch(l -> l.contains("Car-1[") && l.contains("[TICK]")));
    }

    @Test
    void handle_passengerCall_usesOriginAndDirection() {
        dispatcher.initFleet(2, 10);

        dispatcher.handle(DispatchEvent.call(new Passenger(3, 8, 1)));

        assertEquals(List.of(new HallCall(8, Direction.DOWN)), dispatcher.pendingCalls());
        assertEquals(Integer.valueOf(1), dispatcher.assigneeOf(8, Direction.DOWN));
    }

    @Test
    void noCarAvailable_isLoggedOncePerCooldown() {
        List<String> logs = new ArrayList<>();
        DispatchPolicy policy = DispatchPolicy.builder().carCapacity(1).noCarLogCooldownMs(60_000).build();
        Dispatcher d = new Dispatcher(policy, sink, logs::add);
        d.initFleet(1, 10);
        d.onBoard(0, 1, 9);

        d.onCall(5, Direction.UP);
        d.onCall(5, Direction.UP);

        long noCar = logs.stream().filter(l -> l.contains("NO_CAR")).count();
        assertEquals(1, noCar);
        assertTrue(logs.stream().anyMatch(l -> l.contains("full=1")));
    }

    @Test
    void quietPolicy_logsNothing() {
        List<String> logs = new ArrayList<>();
        Dispatcher d = new Dispatcher(QUIET, sink, logs::add);
        d.initFleet(2, 10);
        d.onCall(5, Direction.UP);

        assertTrue(logs.isEmpty());
    }

    @Test
    void invalidFloor_isRejected() {
        dispatcher.initFleet(2, 10);

        InvalidFloorException ex = assertThrows(InvalidFloorException.class,
                () -> dispatcher.onCall(10, Direction.UP));
        assertEquals(10, ex.floor());
        assertThrows(InvalidFloorException.class, () -> dispatcher.onStopped(0, -1));
        assertThrows(InvalidFloorException.class, () -> dispatcher.onBoard(0, 1, 12));
        assertFalse(dispatcher.hasPendingRequests());
    }

    @Test
    void callWithoutDirection_isRejected() {
        dispatcher.initFleet(2, 10);

        assertThrows(IllegalArgumentException.class, () -> dispatcher.onCall(3, Direction.NONE));
    }

    @Test
    void unknownCar_isConfigurationError() {
        dispatcher.initFleet(2, 10);

        assertThrows(ConfigurationException.class, () -> dispatcher.onStopped(2, 3));
        assertThrows(ConfigurationException.class, () -> dispatcher.onIdle(-1));
    }

    @Test
    void eventsBeforeInit_areRejected() {
        assertFalse(dispatcher.isInitialized());
        assertThrows(IllegalStateException.class, () -> dispatcher.onCall(3, Direction.UP));
        assertThrows(IllegalStateException.class, () -> dispatcher.onIdle(0));
    }

    @Test
    void initFleet_twice_isRejected() {
        dispatcher.initFleet(2, 10);

        assertThrows(IllegalStateException.class, () -> dispatcher.initFleet(3, 10));
    }

    @Test
    void initFleet_emptyFleetOrBuilding_isConfigurationError() {
        assertThrows(ConfigurationException.class, () -> dispatcher.initFleet(0, 10));
        assertThrows(ConfigurationException.class, () -> new Dispatcher(QUIET, sink, s -> {}).initFleet(2, 0));
        assertFalse(dispatcher.isInitialized());
    }
}
