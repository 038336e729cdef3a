package com.scandispatch;

public enum CarStatus {
    /** Нет обязательных остановок и нет команды движения. */
    RESTING,
    /** Есть хотя бы одна цель; едет к следующей остановке. */
    SCANNING,
    /** Двери открыты; до конца обработки остановки переходит в SCANNING или RESTING. */
    LOADING
}
