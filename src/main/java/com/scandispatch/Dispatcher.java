package com.scandispatch;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Групповой диспетчер: владеет парком лифтов и реестром внешних вызовов, реагирует на события движка
 * и выдаёт команды движения.
 *
 * Каждая публичная операция выполняется целиком под одной блокировкой, поэтому оценка лифтов не видит
 * наполовину обновлённый парк, даже если события приходят из нескольких потоков. Команды возвращаются
 * вызывающему и одновременно уходят в {@link CommandSink}.
 */
public class Dispatcher {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final DispatchPolicy policy;
    private final CommandSink sink;
    private final Consumer<String> logger;
    private final DispatchScorer scorer;
    private final ScanPlanner planner = new ScanPlanner();

    private final ReentrantLock lock = new ReentrantLock();

    // задаются один раз в initFleet
    private Fleet fleet;
    private FloorRequestRegistry registry;
    private EnergyMeter energy;

    // Чтобы не заспамить логами "NO_CAR", по каждому вызову пишем не чаще раза в cooldown.
    private final Map<HallCall, Long> lastNoCarLogMs = new HashMap<>();

    public Dispatcher(DispatchPolicy policy, CommandSink sink, Consumer<String> logger) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = (sink != null) ? sink : CommandSink.NONE;
        this.logger = (logger != null) ? logger : s -> {};
        this.scorer = new DispatchScorer(policy);
    }

    public Dispatcher(DispatchPolicy policy, CommandSink sink) {
        this(policy, sink, System.out::println);
    }

    public Dispatcher() {
        this(DispatchPolicy.defaults(), CommandSink.NONE);
    }

    /**
     * Создаёт парк и ставит каждый лифт на его домашний этаж.
     *
     * @throws ConfigurationException если лифтов или этажей ноль
     * @throws IllegalStateException если парк уже создан
     */
    public List<MoveCommand> initFleet(int cars, int floors) {
        lock.lock();
        try {
            if (fleet != null) {
                throw new IllegalStateException("Fleet already initialised");
            }
            Fleet f = Fleet.create(cars, floors, policy);
            this.fleet = f;
            this.registry = new FloorRequestRegistry(f.maxFloor());
            this.energy = new EnergyMeter(f.size(), policy);

            log("SYSTEM", "Fleet of " + cars + " cars, floors 0.." + f.maxFloor() + ", " + policy);

            List<MoveCommand> out = new ArrayList<>();
            for (Car car : f.cars()) {
                out.add(new MoveCommand(car.id(), car.homeFloor(), true));
                energy.recordCommand(car.id());
                log("INIT", "Car-" + car.id() + " home F" + car.homeFloor() + ", zone " + car.zone());
            }
            publish(out);
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Пассажир нажал кнопку вызова. Сначала ищем лифт, которому вызов «по пути», затем будим лучший
     * свободный; иначе вызов ждёт следующей остановки или освобождения лифта.
     */
    public List<MoveCommand> onCall(int floor, Direction direction) {
        lock.lock();
        try {
            requireFleet();
            boolean fresh = registry.addCall(floor, direction);
            HallCall call = new HallCall(floor, direction);
            log("CALL", call + (fresh ? "" : " (already pending)") + " | pending " + registry);

            Set<Car> touched = new LinkedHashSet<>();
            Car holder = fleet.assigneeOf(call);
            if (holder != null) {
                log("ASSIGN", call + " already held by Car-" + holder.id());
            } else {
                tryAssign(call, touched);
            }
            return finish(touched, new ArrayList<>());
        } finally {
            lock.unlock();
        }
    }

    public List<MoveCommand> onCall(Passenger passenger) {
        Objects.requireNonNull(passenger, "passenger");
        log("REQUEST", passenger + " waiting at F" + passenger.originFloor() + " dir=" + passenger.direction());
        return onCall(passenger.originFloor(), passenger.direction());
    }

    /** Лифт остановился на {@code floor}: обслуживаем вызов на этаже и планируем следующую остановку. */
    public List<MoveCommand> onStopped(int carId, int floor) {
        lock.lock();
        try {
            requireFleet();
            Car car = fleet.car(carId);
            InvalidFloorException.check(floor, fleet.maxFloor());
            energy.recordTravel(carId, car.currentFloor(), floor);

            ScanPlanner.StopResult r = planner.onStop(car, floor, registry);
            log("STOP", "Car-" + carId + " at F" + floor
                    + ", serving " + r.served() + (r.callCleared() ? " (call cleared)" : "")
                    + ", targets " + car.targetFloors()
                    + ", next " + (r.nextStop() == null ? "-" : "F" + r.nextStop()));

            Set<Car> touched = new LinkedHashSet<>();
            if (r.callCleared()) {
                HallCall served = new HallCall(floor, r.served());
                lastNoCarLogMs.remove(served);
                releaseFromOthers(car, served, touched);
            }

            if (r.nextStop() != null) {
                touched.add(car);
            } else if (!selfDispatch(car, touched)) {
                log("REST", "Car-" + carId + " resting at F" + floor);
            }

            dispatchPendingCalls(touched);
            return finish(touched, new ArrayList<>());
        } finally {
            lock.unlock();
        }
    }

    /** Пассажир вошёл; его этаж назначения становится целью лифта. */
    public List<MoveCommand> onBoard(int carId, int passengerId, int destination) {
        lock.lock();
        try {
            requireFleet();
            Car car = fleet.car(carId);
            InvalidFloorException.check(destination, fleet.maxFloor());

            car.board(passengerId, destination);
            log("BOARD", "P" + passengerId + " on Car-" + carId + " (F" + car.currentFloor() + " -> F" + destination
                    + "), load=" + car.load() + "/" + car.capacity());

            Set<Car> touched = new LinkedHashSet<>();
            if (destination != car.currentFloor()) {
                car.mutableTargets().add(destination);
                if (car.status() != CarStatus.SCANNING) {
                    car.setStatus(CarStatus.SCANNING);
                    log("WAKE", "Car-" + carId + " activated by boarding");
                }
                touched.add(car);
            }
            return finish(touched, new ArrayList<>());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Пассажир вышел. Меняется только список пассажиров: цели снимаются при остановке, а не здесь.
     */
    public List<MoveCommand> onAlight(int carId, int passengerId, int floor) {
        lock.lock();
        try {
            requireFleet();
            Car car = fleet.car(carId);
            InvalidFloorException.check(floor, fleet.maxFloor());

            if (car.currentFloor() != floor) {
                energy.recordTravel(carId, car.currentFloor(), floor);
                car.setCurrentFloor(floor);
            }
            Integer destination = car.alight(passengerId);
            if (destination == null) {
                log("ALIGHT", "P" + passengerId + " was not recorded on Car-" + carId);
            } else {
                log("ALIGHT", "P" + passengerId + " off Car-" + carId + " at F" + floor
                        + ", load=" + car.load() + "/" + car.capacity());
            }

            // освободилось место: ожидающие вызовы могут влезть
            Set<Car> touched = new LinkedHashSet<>();
            dispatchPendingCalls(touched);
            return finish(touched, new ArrayList<>());
        } finally {
            lock.unlock();
        }
    }

    /**
     * У лифта закончились команды. Устаревшие цели от вызовов сбрасываются; дальше лифт везёт своих
     * пассажиров, сам берёт ожидающий вызов или отдыхает и возвращается домой.
     * Повтор события без промежуточных изменений ничего не меняет и новых команд не даёт.
     */
    public List<MoveCommand> onIdle(int carId) {
        lock.lock();
        try {
            requireFleet();
            Car car = fleet.car(carId);
            car.resetTargetsToOnboard();
            log("IDLE", "Car-" + carId + " idle at F" + car.currentFloor() + ", load=" + car.load());

            Set<Car> touched = new LinkedHashSet<>();
            if (!car.mutableTargets().isEmpty()) {
                car.setStatus(CarStatus.SCANNING);
                // направление фиксируем до того, как с ним сравнят другие вызовы
                planner.nextStop(car);
                touched.add(car);
            } else if (!selfDispatch(car, touched)) {
                planner.rest(car);
            }

            dispatchPendingCalls(touched);

            List<MoveCommand> out = new ArrayList<>();
            if (car.status() == CarStatus.RESTING) {
                driftHome(car, out);
            }
            return finish(touched, out);
        } finally {
            lock.unlock();
        }
    }

    /** Лифт проехал {@code floor} без остановки. Только учёт позиции и энергии. */
    public List<MoveCommand> onPassing(int carId, int floor) {
        lock.lock();
        try {
            requireFleet();
            Car car = fleet.car(carId);
            InvalidFloorException.check(floor, fleet.maxFloor());
            energy.recordTravel(carId, car.currentFloor(), floor);
            car.setCurrentFloor(floor);
            return List.of();
        } finally {
            lock.unlock();
        }
    }

    public List<MoveCommand> handle(DispatchEvent event) {
        Objects.requireNonNull(event, "event");
        return switch (event.type()) {
            case CALL -> onCall(event.floor(), event.direction());
            case STOPPED -> onStopped(event.carId(), event.floor());
            case BOARD -> onBoard(event.carId(), event.passengerId(), event.destination());
            case ALIGHT -> onAlight(event.carId(), event.passengerId(), event.floor());
            case IDLE -> onIdle(event.carId());
            case PASSING -> onPassing(event.carId(), event.floor());
        };
    }

    /** Обрабатывает события одного тика движка в порядке поступления. */
    public List<MoveCommand> handleTick(long tick, List<DispatchEvent> events) {
        lock.lock();
        try {
            requireFleet();
            if (!events.isEmpty() && policy.verbose()) {
                List<DispatchEvent.Type> types = new ArrayList<>(events.size());
                for (DispatchEvent e : events) types.add(e.type());
                log("TICK", "Tick " + tick + ": " + events.size() + " events " + types);
                for (String line : describeFleet()) {
                    log("TICK", line);
                }
            }
            List<MoveCommand> out = new ArrayList<>();
            for (DispatchEvent e : events) {
                out.addAll(handle(e));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    // --- запросы ---

    public boolean isInitialized() {
        lock.lock();
        try {
            return fleet != null;
        } finally {
            lock.unlock();
        }
    }

    public int maxFloor() {
        lock.lock();
        try {
            requireFleet();
            return fleet.maxFloor();
        } finally {
            lock.unlock();
        }
    }

    public List<CarSnapshot> snapshot() {
        lock.lock();
        try {
            requireFleet();
            return fleet.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public CarSnapshot snapshot(int carId) {
        lock.lock();
        try {
            requireFleet();
            return fleet.car(carId).snapshot();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPendingRequests() {
        lock.lock();
        try {
            requireFleet();
            return registry.hasAny();
        } finally {
            lock.unlock();
        }
    }

    public List<HallCall> pendingCalls() {
        lock.lock();
        try {
            requireFleet();
            return registry.pendingCalls();
        } finally {
            lock.unlock();
        }
    }

    /** Лифт, за которым сейчас закреплён вызов, либо null. */
    public Integer assigneeOf(int floor, Direction direction) {
        lock.lock();
        try {
            requireFleet();
            Car c = fleet.assigneeOf(new HallCall(floor, direction));
            return (c == null) ? null : c.id();
        } finally {
            lock.unlock();
        }
    }

    /** Снимок счётчиков энергии; дальнейшие события его не меняют. */
    public EnergyMeter energy() {
        lock.lock();
        try {
            requireFleet();
            return energy.copy();
        } finally {
            lock.unlock();
        }
    }

    /** Строка состояния на каждый лифт, например {@code Car-0[UP|SCANNING] at F3 targets=[5, 6] load=1/8}. */
    public List<String> describeFleet() {
        lock.lock();
        try {
            requireFleet();
            List<String> out = new ArrayList<>(fleet.size());
            for (Car c : fleet.cars()) {
                out.add(c.toString());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    // --- назначение ---

    /** Заново предлагает парку все ожидающие вызовы без назначения. */
    private void dispatchPendingCalls(Set<Car> touched) {
        if (!registry.hasAny()) return;
        for (HallCall call : registry.pendingCalls()) {
            if (fleet.assigneeOf(call) != null) continue;
            tryAssign(call, touched);
        }
    }

    private boolean tryAssign(HallCall call, Set<Car> touched) {
        Car best = null;
        double bestScore = 0.0;

        int full = 0;
        int wrongDir = 0;
        int outOfRoute = 0;
        int noRoute = 0;
        int unavailable = 0;

        // ПРОХОД 1: лифты в движении, которым вызов по пути
        for (Car car : fleet.cars()) {
            if (car.status() != CarStatus.SCANNING) continue;
            CarSnapshot s = car.snapshot();
            CallRejectReason reason = scorer.eligibility(s, call);
            switch (reason) {
                case ACCEPTED -> {
                    double score = scorer.score(s, call);
                    if (best == null || DispatchScorer.isBetter(score, car.id(), bestScore, best.id())) {
                        best = car;
                        bestScore = score;
                    }
                }
                case FULL_CAPACITY -> full++;
                case WRONG_DIRECTION -> wrongDir++;
                case OUT_OF_ROUTE -> outOfRoute++;
                case NO_ROUTE_AHEAD -> noRoute++;
                default -> unavailable++;
            }
        }

        if (best != null) {
            CarSnapshot s = best.snapshot();
            assign(best, call);
            touched.add(best);
            lastNoCarLogMs.remove(call);
            log("ASSIGN", call + " -> Car-" + s.id()
                    + " (at F" + s.currentFloor()
                    + ", going " + s.direction()
                    + ", load=" + s.load() + "/" + s.capacity()
                    + ", benefit=" + scorer.benefit(s, call.floor())
                    + ", score=" + String.format("%.1f", bestScore)
                    + ", pick=ON_THE_WAY)");
            return true;
        }

        // ПРОХОД 2: будим свободный лифт
        Car resting = bestRestingCar(call);
        if (resting != null) {
            CarSnapshot s = resting.snapshot();
            double score = scorer.score(s, call);
            wake(resting, call);
            touched.add(resting);
            lastNoCarLogMs.remove(call);
            log("ASSIGN", call + " -> Car-" + s.id()
                    + " (at F" + s.currentFloor()
                    + ", zone " + s.zone()
                    + ", score=" + String.format("%.1f", score)
                    + ", pick=WAKE)");
            return true;
        }

        logNoCar(call, "(full=" + full + ", wrongDir=" + wrongDir + ", outOfRoute=" + outOfRoute
                + ", noRouteAhead=" + noRoute + ", unavailable=" + unavailable + ")");
        return false;
    }

    /**
     * Свободный лифт с лучшей оценкой. Если у всех оценка {@code <= 0} (очень высокое здание),
     * берём ближайший: вызов не должен висеть, пока лифт простаивает.
     */
    private Car bestRestingCar(HallCall call) {
        Car best = null;
        double bestScore = 0.0;
        Car nearest = null;
        int nearestDistance = Integer.MAX_VALUE;

        for (Car car : fleet.cars()) {
            if (car.status() != CarStatus.RESTING || car.isFull()) continue;
            CarSnapshot s = car.snapshot();
            double score = scorer.score(s, call);
            if (score > 0.0 && (best == null || DispatchScorer.isBetter(score, car.id(), bestScore, best.id()))) {
                best = car;
                bestScore = score;
            }
            int distance = Math.abs(car.currentFloor() - call.floor());
            if (distance < nearestDistance) {
                nearest = car;
                nearestDistance = distance;
            }
        }
        return (best != null) ? best : nearest;
    }

    /** Освободившийся лифт сам берёт ожидающий вызов с лучшей для него оценкой. */
    private boolean selfDispatch(Car car, Set<Car> touched) {
        if (car.isFull() || !registry.hasAny()) return false;

        CarSnapshot s = car.snapshot();
        HallCall best = null;
        double bestScore = 0.0;
        // этажи по возрастанию: при равной оценке выигрывает нижний
        for (HallCall call : registry.pendingCalls()) {
            if (fleet.assigneeOf(call) != null) continue;
            double score = scorer.affinity(s, call.floor());
            if (best == null || score > bestScore) {
                best = call;
                bestScore = score;
            }
        }
        if (best == null) return false;

        wake(car, best);
        touched.add(car);
        lastNoCarLogMs.remove(best);
        log("ASSIGN", best + " -> Car-" + car.id()
                + " (at F" + car.currentFloor()
                + ", score=" + String.format("%.1f", bestScore)
                + ", pick=SELF)");
        return true;
    }

    private void wake(Car car, HallCall call) {
        Direction toward = Direction.toward(car.currentFloor(), call.floor());
        car.setDirection(toward == Direction.NONE ? call.direction() : toward);
        car.setStatus(CarStatus.SCANNING);
        assign(car, call);
    }

    private static void assign(Car car, HallCall call) {
        car.mutableAssignedCalls().add(call);
        car.mutableTargets().add(call.floor());
    }

    /**
     * Кто первый приехал, тот и обслужил: другой лифт, ехавший на этот вызов, снимает его, а заодно
     * и этаж, если тот ему больше не нужен.
     */
    private void releaseFromOthers(Car server, HallCall call, Set<Car> touched) {
        for (Car other : fleet.cars()) {
            if (other == server) continue;
            if (!other.mutableAssignedCalls().remove(call)) continue;

            boolean stillNeeded = other.onboard().containsValue(call.floor());
            for (HallCall c : other.mutableAssignedCalls()) {
                if (c.floor() == call.floor()) {
                    stillNeeded = true;
                    break;
                }
            }
            if (!stillNeeded) {
                other.mutableTargets().remove(call.floor());
            }
            touched.add(other);
            log("CANCEL", call + " served by Car-" + server.id() + ", dropped from Car-" + other.id());
        }
    }

    // --- команды ---

    /** Перепланирует затронутые лифты и выдаёт изменившиеся команды. */
    private List<MoveCommand> finish(Set<Car> touched, List<MoveCommand> out) {
        for (Car car : touched) {
            if (car.status() == CarStatus.RESTING) continue;
            Integer next = planner.nextStop(car);
            if (next == null) {
                planner.rest(car);
                log("REST", "Car-" + car.id() + " has nothing left, resting at F" + car.currentFloor());
                continue;
            }
            command(car, next, out);
        }
        publish(out);
        return out;
    }

    private void driftHome(Car car, List<MoveCommand> out) {
        int home = car.homeFloor();
        if (Math.abs(car.currentFloor() - home) <= policy.restDriftThreshold()) return;
        if (car.commandedFloor() != home) {
            log("DRIFT", "Car-" + car.id() + " F" + car.currentFloor() + " -> home F" + home);
        }
        command(car, home, out);
    }

    /** Выдаёт команду движения, если такая же ещё не выдана. */
    private void command(Car car, int floor, List<MoveCommand> out) {
        if (car.commandedFloor() == floor) return;
        car.setCommandedFloor(floor);
        out.add(new MoveCommand(car.id(), floor, false));
        energy.recordCommand(car.id());
        log("MOVE", "Car-" + car.id() + " -> F" + floor + " (" + car.direction() + ", targets " + car.targetFloors() + ")");
    }

    private void publish(List<MoveCommand> commands) {
        for (MoveCommand c : commands) {
            sink.moveCommand(c);
        }
    }

    private void requireFleet() {
        if (fleet == null) {
            throw new IllegalStateException("initFleet has not been called");
        }
    }

    private void logNoCar(HallCall call, String summary) {
        long now = System.currentTimeMillis();
        Long last = lastNoCarLogMs.get(call);
        if (last == null || (now - last) >= policy.noCarLogCooldownMs()) {
            lastNoCarLogMs.put(call, now);
            log("ASSIGN", call + " - NO_CAR " + summary + ", waiting for the next stop or idle car");
        }
    }

    private void log(String tag, String msg) {
        if (!policy.verbose()) return;
        String time = LocalTime.now().format(TS);
        logger.accept(String.format("[%s][Dispatcher][%s] %s", time, tag, msg));
    }
}
