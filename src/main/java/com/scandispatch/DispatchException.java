package com.scandispatch;

/** Базовое исключение диспетчерского ядра. */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }
}
