package com.scandispatch;

/**
 * Настройки диспетчеризации по умолчанию. Из них собирается {@link DispatchPolicy#defaults()};
 * переопределить для конкретного парка можно через {@link DispatchPolicy#builder()}.
 */
public class Config {

    public static final int CAR_CAPACITY = 8;

    // Оценка свободного лифта: BASE - расстояние * WEIGHT (+ бонус внутри своей зоны)
    public static final double RESTING_BASE_SCORE = 100.0;
    public static final double RESTING_DISTANCE_WEIGHT = 2.0;
    public static final double ZONE_BONUS = 50.0;

    // Оценка лифта в движении, которому вызов «по пути»
    public static final double SCANNING_BASE_SCORE = 80.0;
    public static final double SCANNING_DISTANCE_WEIGHT = 1.0;

    /** Полностью загруженный лифт сохраняет (1 - LOAD_PENALTY) своей оценки. */
    public static final double LOAD_PENALTY = 0.5;

    /**
     * Расширение зоны в долях сегмента. При 0 зоны не пересекаются,
     * при 0.1 каждая зона шире примерно на 10% сегмента с обеих сторон.
     */
    public static final double ZONE_OVERLAP_FRACTION = 0.0;

    /** Свободный лифт дальше этого от домашнего этажа отправляется домой. */
    public static final int REST_DRIFT_THRESHOLD = 2;

    /** Единиц энергии на этаж пути, если для лифта не задано своё значение. */
    public static final int ENERGY_PER_FLOOR = 1;

    public static final long NO_CAR_LOG_COOLDOWN_MS = 1500;

    public static final boolean VERBOSE = true;
}
