package com.scandispatch;

/**
 * Неверная конфигурация: ноль лифтов или этажей, номер лифта вне парка,
 * недопустимое значение настройки.
 */
public class ConfigurationException extends DispatchException {

    public ConfigurationException(String message) {
        super(message);
    }
}
