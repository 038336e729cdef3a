package com.scandispatch;

public enum CallRejectReason {
    ACCEPTED,
    FULL_CAPACITY,
    /** Едет в другую сторону. */
    WRONG_DIRECTION,
    /** Направление совпадает, но вызов позади, дальше ближайшей цели или ничего не экономит. */
    OUT_OF_ROUTE,
    /** Впереди целей нет, лифт вот-вот развернётся. */
    NO_ROUTE_AHEAD,
    /** Двери открыты (LOADING) или оценка не положительная. */
    NOT_AVAILABLE
}
