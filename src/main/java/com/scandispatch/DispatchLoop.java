package com.scandispatch;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Единственный потребитель событий движка. Отправлять ({@link #submit}) можно из любого потока;
 * цикл передаёт события {@link Dispatcher} по одному, в порядке поступления, а диспетчер отдаёт
 * команды в свой sink. Запускается в отдельном потоке.
 */
public class DispatchLoop implements Runnable {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Dispatcher dispatcher;
    private final Consumer<String> logger;
    private final BlockingQueue<DispatchEvent> events = new LinkedBlockingQueue<>();

    private final AtomicInteger handled = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    // принятые, но ещё не обработанные события (в очереди + в работе)
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile boolean running = true;

    public DispatchLoop(Dispatcher dispatcher, Consumer<String> logger) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.logger = (logger != null) ? logger : s -> {};
    }

    public DispatchLoop(Dispatcher dispatcher) {
        this(dispatcher, System.out::println);
    }

    /** Ставит событие в очередь. После shutdown возвращает false. */
    public boolean submit(DispatchEvent event) {
        Objects.requireNonNull(event, "event");
        if (!running) return false;
        inFlight.incrementAndGet();
        if (!events.offer(event)) {
            inFlight.decrementAndGet();
            return false;
        }
        return true;
    }

    /** Перестаёт принимать события; уже поставленные в очередь обрабатываются до выхода из {@link #run}. */
    public void shutdown() {
        running = false;
    }

    /**
     * Все принятые события обработаны: очередь пуста и ничего не в работе. Событие считается принятым
     * уже в {@link #submit}, до постановки в очередь, поэтому промежутка между poll и обработкой нет.
     */
    public boolean isIdle() {
        return inFlight.get() == 0;
    }

    public int handledCount() {
        return handled.get();
    }

    public int failedCount() {
        return failed.get();
    }

    @Override
    public void run() {
        log("SYSTEM", "Dispatch loop started");

        while (running || !events.isEmpty()) {
            try {
                DispatchEvent ev = events.poll(100, TimeUnit.MILLISECONDS);
                if (ev == null) continue;
                process(ev);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        log("SYSTEM", "Dispatch loop stopped (" + handled.get() + " events, " + failed.get() + " rejected)");
    }

    private void process(DispatchEvent ev) {
        try {
            List<MoveCommand> commands = dispatcher.handle(ev);
            handled.incrementAndGet();
            if (!commands.isEmpty()) {
                log("EVENT", ev + " -> " + commands);
            }
        } catch (DispatchException | IllegalArgumentException | IllegalStateException e) {
            // битое событие от движка не должно ронять цикл
            failed.incrementAndGet();
            log("REJECTED", ev + ": " + e.getMessage());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void log(String tag, String msg) {
        String time = LocalTime.now().format(TS);
        logger.accept(String.format("[%s][DispatchLoop][%s] %s", time, tag, msg));
    }
}
