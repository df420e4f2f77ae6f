package org.terrasim.core.model.config;

/**
 * Ошибка конфигурации: неизвестный алгоритм, параметр вне диапазона,
 * нечитаемый источник. Никогда не подменяется значением по умолчанию.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
