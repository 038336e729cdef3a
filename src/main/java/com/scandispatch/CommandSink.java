package com.scandispatch;

/**
 * Получатель команд движения, обычно транспорт к движку симуляции.
 * Вызывается под блокировкой диспетчера: реализация должна передать команду дальше и сразу вернуться.
 */
@FunctionalInterface
public interface CommandSink {

    CommandSink NONE = command -> {};

    void moveCommand(MoveCommand command);
}
